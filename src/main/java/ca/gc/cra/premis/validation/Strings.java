package ca.gc.cra.premis.validation;

import java.util.Objects;

/**
 * <strong>What:</strong> Validation utilities for strings used by record values and configuration.
 * <p><strong>Why:</strong> Keeps identifiers and configuration keys free of blank or control-character input before
 * they reach registries or document adapters.</p>
 * <p><strong>Role:</strong> Domain support utilities invoked by record constructors and the config layer.</p>
 * <p><strong>Thread-safety:</strong> Immutable stateless utilities; safe for concurrent access.</p>
 * <p><strong>Performance:</strong> O(n) character scans with minimal allocations.</p>
 * <p><strong>Observability:</strong> No metrics or logs; validation failures raise {@link IllegalArgumentException}.</p>
 *
 * @since 0.1.0
 * @see Numbers
 * @see Paths
 */
public final class Strings {

  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free, returning it trimmed.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Ensures a candidate string is non-null and not blank, returning it unchanged.
   *
   * <p>Unlike {@link #requireNonBlank(String, String)} the value is not trimmed; identifier components are compared
   * exactly as supplied.</p>
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate text; must not be {@code null}
   * @return {@code value} as given
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if {@code value} is blank
   */
  public static String requireText(String name, String value) {
    Objects.requireNonNull(value, name == null ? "value" : name);
    if (value.isBlank()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return value;
  }

  /**
   * Ensures a value is one of the allowed tokens, ignoring case.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate value
   * @param allowed accepted tokens
   * @return the trimmed value
   * @throws IllegalArgumentException if the value is blank or not among {@code allowed}
   */
  public static String requireOneOf(String name, String value, String... allowed) {
    String sanitized = requireNonBlank(name, value);
    for (String candidate : allowed) {
      if (candidate.equalsIgnoreCase(sanitized)) {
        return sanitized;
      }
    }
    throw new IllegalArgumentException(
        message(name, "must be one of " + String.join(", ", allowed) + " (was " + sanitized + ")"));
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
