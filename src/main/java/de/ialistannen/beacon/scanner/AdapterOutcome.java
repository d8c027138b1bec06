package de.ialistannen.beacon.scanner;

import de.ialistannen.beacon.scanner.output.ScanResult;

/**
 * The outcome of running one {@link ScannerAdapter}: either a decoded result or one of the
 * {@link AdapterFailure failure kinds}.
 */
public sealed interface AdapterOutcome permits AdapterOutcome.Success, AdapterFailure {

  String toolName();

  record Success(ScanResult result) implements AdapterOutcome {

    @Override
    public String toolName() {
      return result.toolName();
    }
  }
}
