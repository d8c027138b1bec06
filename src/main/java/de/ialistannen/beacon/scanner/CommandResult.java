package de.ialistannen.beacon.scanner;

public record CommandResult(int exitCode, String stdout, String stderr) {

}
