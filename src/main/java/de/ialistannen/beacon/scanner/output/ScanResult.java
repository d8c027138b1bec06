package de.ialistannen.beacon.scanner.output;

/**
 * The decoded output of one external tool. Each tool has its own variant and schema, mapping them to the common
 * model happens during normalization.
 */
public sealed interface ScanResult permits SyftOutput, TrivyOutput, GrypeOutput, InspectOutput {

  String toolName();

  String toolVersion();
}
