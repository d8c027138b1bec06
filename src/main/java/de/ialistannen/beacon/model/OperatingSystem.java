package de.ialistannen.beacon.model;

public record OperatingSystem(String name, String version) {

}
