package de.ialistannen.beacon.orchestrator;

/**
 * @param comprehensive whether to run vulnerability scanners in addition to the SBOM generator
 * @param updateExisting whether to rescan and replace images that are already stored
 */
public record ScanOptions(boolean comprehensive, boolean updateExisting) {

}
