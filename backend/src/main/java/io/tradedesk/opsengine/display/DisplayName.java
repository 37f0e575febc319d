package io.tradedesk.opsengine.display;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Free text from a source record (client name, engineer name, job title). Any UUID-shaped token
 * inside it is cut down to an 8-character prefix.
 */
public final class DisplayName implements DisplayField {

  static final Pattern UUID_PATTERN =
      Pattern.compile(
          "[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}");

  private final String text;

  private DisplayName(String text) {
    this.text = text;
  }

  /** Returns the scrubbed name, or {@code fallback} when the value is null or blank. */
  public static DisplayName of(String value, String fallback) {
    if (value == null || value.isBlank()) {
      return new DisplayName(fallback);
    }
    return new DisplayName(scrub(value.strip()));
  }

  /** Returns the first non-blank candidate, scrubbed, or {@code fallback}. */
  public static DisplayName firstOf(String first, String second, String fallback) {
    if (first != null && !first.isBlank()) {
      return of(first, fallback);
    }
    return of(second, fallback);
  }

  static String scrub(String value) {
    Matcher matcher = UUID_PATTERN.matcher(value);
    if (!matcher.find()) {
      return value;
    }
    var sb = new StringBuilder();
    matcher.reset();
    while (matcher.find()) {
      matcher.appendReplacement(sb, matcher.group().substring(0, DisplayRef.PREFIX_LENGTH));
    }
    matcher.appendTail(sb);
    return sb.toString();
  }

  @Override
  public String text() {
    return text;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof DisplayName other && text.equals(other.text);
  }

  @Override
  public int hashCode() {
    return text.hashCode();
  }

  @Override
  public String toString() {
    return text;
  }
}
