package de.ialistannen.beacon.model;

import java.util.Collection;

public record VulnerabilityCounts(int critical, int high, int medium, int low, int unknown) {

  public int total() {
    return critical + high + medium + low + unknown;
  }

  public static VulnerabilityCounts of(Collection<Vulnerability> vulnerabilities) {
    int critical = 0;
    int high = 0;
    int medium = 0;
    int low = 0;
    int unknown = 0;
    for (Vulnerability vulnerability : vulnerabilities) {
      switch (vulnerability.severity()) {
        case CRITICAL -> critical++;
        case HIGH -> high++;
        case MEDIUM -> medium++;
        case LOW -> low++;
        case UNKNOWN -> unknown++;
      }
    }
    return new VulnerabilityCounts(critical, high, medium, low, unknown);
  }
}
