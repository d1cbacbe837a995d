package ca.gc.cra.premis.validation;

/**
 * Numeric validation helpers for configuration values.
 *
 * @since 0.1.0
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Parses an integer and validates that it falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics
   * @param raw textual value
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return parsed value
   * @throws IllegalArgumentException if {@code raw} is not an integer or lies outside {@code [min, max]}
   */
  public static int parseInRange(String name, String raw, int min, int max) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    int value;
    try {
      value = Integer.parseInt(Strings.requireNonBlank(label, raw));
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label + " must be an integer (was " + raw + ")", ex);
    }
    return (int) requireRange(label, value, min, max);
  }

  /**
   * Validates that a numeric value falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics; defaults to {@code "value"} when blank
   * @param value candidate value
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value for fluent call sites
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          (name == null || name.isBlank() ? "value" : name)
              + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }
}
