package de.ialistannen.beacon.scanner;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.ialistannen.beacon.model.ImageReference;
import de.ialistannen.beacon.scanner.output.MalformedOutputException;
import de.ialistannen.beacon.scanner.output.ScanResult;
import de.ialistannen.beacon.scanner.output.TrivyOutput;
import java.util.List;

/**
 * Scans for vulnerabilities with <a href="https://trivy.dev">trivy</a>. All packages are listed as well, so trivy
 * also contributes to the package inventory.
 */
public class TrivyAdapter extends SubprocessScannerAdapter {

  private final ObjectMapper objectMapper;
  private final ToolVersionProbe versionProbe;

  public TrivyAdapter(
    CommandRunner commandRunner,
    String executable,
    ObjectMapper objectMapper,
    ToolVersionProbe versionProbe
  ) {
    super(commandRunner, executable);
    this.objectMapper = objectMapper;
    this.versionProbe = versionProbe;
  }

  @Override
  public String toolName() {
    return TrivyOutput.TOOL_NAME;
  }

  @Override
  public Kind kind() {
    return Kind.VULNERABILITY;
  }

  @Override
  protected List<String> command(ImageReference reference) {
    return List.of(
      executable, "image",
      "--format", "json",
      "--scanners", "vuln",
      "--list-all-pkgs",
      "--quiet",
      reference.fullName()
    );
  }

  @Override
  protected ScanResult parse(String stdout) throws MalformedOutputException {
    return TrivyOutput.parse(objectMapper, stdout, versionProbe.versionOf(executable));
  }
}
