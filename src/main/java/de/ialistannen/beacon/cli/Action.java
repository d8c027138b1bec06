package de.ialistannen.beacon.cli;

import java.util.Arrays;
import java.util.stream.Collectors;

public enum Action {
  SCAN_IMAGE("scan-image"),
  SCAN_REPOSITORY("scan-repo"),
  SCAN_CONFIG("scan-config"),
  RECOMMEND("recommend"),
  RECOMMEND_LIKE("recommend-like"),
  LIST("list"),
  STATS("stats"),
  TOP_PER_LANGUAGE("top-per-language"),
  EXPORT("export");

  private final String command;

  Action(String command) {
    this.command = command;
  }

  public String command() {
    return command;
  }

  public boolean isScan() {
    return this == SCAN_IMAGE || this == SCAN_REPOSITORY || this == SCAN_CONFIG;
  }

  /**
   * @param command the command name as typed by the user
   * @return the action
   * @throws IllegalArgumentException if no action has that name
   */
  public static Action fromCommand(String command) {
    return Arrays.stream(values())
      .filter(it -> it.command.equalsIgnoreCase(command.strip()))
      .findFirst()
      .orElseThrow(() -> new IllegalArgumentException(
        "Unknown action '" + command + "', expected one of "
          + Arrays.stream(values()).map(Action::command).collect(Collectors.joining(", "))
      ));
  }
}
