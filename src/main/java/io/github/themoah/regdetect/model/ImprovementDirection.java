package io.github.themoah.regdetect.model;

/**
 * Which way a metric moves when performance gets better.
 */
public enum ImprovementDirection {
  UP("up"),
  DOWN("down"),
  UNKNOWN("unknown");

  private final String value;

  ImprovementDirection(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }

  /**
   * Parses a direction name, case-insensitively. Null, blank or unrecognized
   * names map to {@link #UNKNOWN}.
   */
  public static ImprovementDirection fromString(String value) {
    if (value == null || value.isBlank()) {
      return UNKNOWN;
    }
    for (ImprovementDirection direction : values()) {
      if (direction.value.equalsIgnoreCase(value.trim())) {
        return direction;
      }
    }
    return UNKNOWN;
  }

  /**
   * Whether a move from {@code before} to {@code after} is an improvement.
   * A flat move counts as an improvement only for metrics where lower is better.
   */
  public boolean isImprovement(double before, double after) {
    return switch (this) {
      case UP -> before < after;
      case DOWN -> before >= after;
      case UNKNOWN -> false;
    };
  }
}
