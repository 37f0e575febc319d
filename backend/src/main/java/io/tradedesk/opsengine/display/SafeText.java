package io.tradedesk.opsengine.display;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;

/**
 * Human-readable text assembled from a constant template and {@link DisplayField} arguments only.
 * Longer results are cut at {@value #MAX_LENGTH} characters with an ellipsis.
 */
public final class SafeText {

  static final int MAX_LENGTH = 200;

  private final String value;

  private SafeText(String value) {
    this.value = value;
  }

  /**
   * Formats {@code template} with {@link String#formatted} semantics. Placeholders must be {@code
   * %s}; counts go through {@link #formatCounts}.
   */
  public static SafeText format(String template, DisplayField... fields) {
    Object[] args = Arrays.stream(fields).map(DisplayField::text).toArray();
    return new SafeText(bound(template.formatted(args)));
  }

  /** Formats a template whose trailing placeholders are counts ({@code %d}). */
  public static SafeText formatCounts(String template, DisplayField[] fields, long... counts) {
    Object[] args = new Object[fields.length + counts.length];
    for (int i = 0; i < fields.length; i++) {
      args[i] = fields[i].text();
    }
    for (int i = 0; i < counts.length; i++) {
      args[fields.length + i] = counts[i];
    }
    return new SafeText(bound(template.formatted(args)));
  }

  /** Wraps a constant label containing no record data. */
  public static SafeText constant(String label) {
    return new SafeText(bound(label));
  }

  private static String bound(String text) {
    if (text.length() <= MAX_LENGTH) {
      return text;
    }
    return text.substring(0, MAX_LENGTH - 1) + "…";
  }

  @JsonValue
  public String value() {
    return value;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof SafeText other && value.equals(other.value);
  }

  @Override
  public int hashCode() {
    return value.hashCode();
  }

  @Override
  public String toString() {
    return value;
  }
}
