package de.ialistannen.beacon.scanner;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.ialistannen.beacon.model.ImageReference;
import de.ialistannen.beacon.scanner.output.GrypeOutput;
import de.ialistannen.beacon.scanner.output.MalformedOutputException;
import de.ialistannen.beacon.scanner.output.ScanResult;
import java.util.List;

/**
 * Scans for vulnerabilities with <a href="https://github.com/anchore/grype">grype</a>.
 */
public class GrypeAdapter extends SubprocessScannerAdapter {

  private final ObjectMapper objectMapper;

  public GrypeAdapter(CommandRunner commandRunner, String executable, ObjectMapper objectMapper) {
    super(commandRunner, executable);
    this.objectMapper = objectMapper;
  }

  @Override
  public String toolName() {
    return GrypeOutput.TOOL_NAME;
  }

  @Override
  public Kind kind() {
    return Kind.VULNERABILITY;
  }

  @Override
  protected List<String> command(ImageReference reference) {
    return List.of(executable, reference.fullName(), "-o", "json");
  }

  @Override
  protected ScanResult parse(String stdout) throws MalformedOutputException {
    return GrypeOutput.parse(objectMapper, stdout);
  }
}
