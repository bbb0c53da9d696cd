package ca.gc.cra.logmerge.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * String validation helpers for CLI and YAML values.
 *
 * @since 0.1.0
 */
public final class Strings {
  private Strings() {
    // Utility
  }

  /**
   * Trims {@code value} and rejects blanks and control characters.
   *
   * @param name field name used in error messages
   * @param value raw value
   * @return trimmed value
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the value is blank or contains control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, label(name));
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(label(name) + " must not be blank");
    }
    if (containsControl(trimmed)) {
      throw new IllegalArgumentException(label(name) + " must not contain control characters");
    }
    return trimmed;
  }

  /**
   * Validates a printable-ASCII value of bounded length.
   *
   * @throws IllegalArgumentException if the value is blank, too long, or not printable ASCII
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    String sanitized = requireNonBlank(name, value);
    if (sanitized.length() > maxLength) {
      throw new IllegalArgumentException(label(name) + " length must be <= " + maxLength);
    }
    for (int i = 0; i < sanitized.length(); i++) {
      char c = sanitized.charAt(i);
      if (c < 0x20 || c > 0x7E) {
        throw new IllegalArgumentException(label(name) + " must contain printable ASCII characters");
      }
    }
    return sanitized;
  }

  /**
   * Splits a comma-separated list, trimming entries and dropping empty ones.
   *
   * @param name field name used in error messages
   * @param value raw list
   * @return non-empty list of entries
   * @throws IllegalArgumentException if no entry remains
   */
  public static List<String> requireList(String name, String value) {
    String raw = requireNonBlank(name, value);
    List<String> entries = new ArrayList<>();
    for (String token : raw.split(",")) {
      String trimmed = token.trim();
      if (!trimmed.isEmpty()) {
        entries.add(trimmed);
      }
    }
    if (entries.isEmpty()) {
      throw new IllegalArgumentException(label(name) + " must list at least one entry");
    }
    return List.copyOf(entries);
  }

  /**
   * Compiles a regular expression.
   *
   * @throws IllegalArgumentException if the expression is blank or invalid
   */
  public static Pattern requirePattern(String name, String value) {
    String regex = requireNonBlank(name, value);
    try {
      return Pattern.compile(regex);
    } catch (PatternSyntaxException ex) {
      throw new IllegalArgumentException(label(name) + " is not a valid regular expression: " + ex.getDescription(), ex);
    }
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
