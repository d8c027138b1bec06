package de.ialistannen.beacon.scanner.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Helpers shared by the tool output validators.
 */
final class OutputSchema {

  private OutputSchema() {
    throw new UnsupportedOperationException("No instantiation");
  }

  static <T> T decode(ObjectMapper mapper, String toolName, String json, Class<T> type)
    throws MalformedOutputException {
    if (json == null || json.isBlank()) {
      throw new MalformedOutputException(toolName + " produced no output");
    }
    try {
      T result = mapper.readValue(json, type);
      if (result == null) {
        throw new MalformedOutputException(toolName + " produced a null document");
      }
      return result;
    } catch (JsonProcessingException e) {
      throw new MalformedOutputException(toolName + " produced invalid JSON: " + e.getOriginalMessage(), e);
    }
  }

  static void require(boolean condition, String toolName, String message) throws MalformedOutputException {
    if (!condition) {
      throw new MalformedOutputException(toolName + " output " + message);
    }
  }

  static boolean isPresent(String value) {
    return value != null && !value.isBlank();
  }
}
