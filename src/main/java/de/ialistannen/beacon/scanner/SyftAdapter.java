package de.ialistannen.beacon.scanner;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.ialistannen.beacon.model.ImageReference;
import de.ialistannen.beacon.scanner.output.MalformedOutputException;
import de.ialistannen.beacon.scanner.output.ScanResult;
import de.ialistannen.beacon.scanner.output.SyftOutput;
import java.util.List;

/**
 * Generates an SBOM with <a href="https://github.com/anchore/syft">syft</a>.
 */
public class SyftAdapter extends SubprocessScannerAdapter {

  private final ObjectMapper objectMapper;

  public SyftAdapter(CommandRunner commandRunner, String executable, ObjectMapper objectMapper) {
    super(commandRunner, executable);
    this.objectMapper = objectMapper;
  }

  @Override
  public String toolName() {
    return SyftOutput.TOOL_NAME;
  }

  @Override
  public Kind kind() {
    return Kind.SBOM;
  }

  @Override
  protected List<String> command(ImageReference reference) {
    return List.of(executable, reference.fullName(), "-o", "json");
  }

  @Override
  protected ScanResult parse(String stdout) throws MalformedOutputException {
    return SyftOutput.parse(objectMapper, stdout);
  }
}
