package io.tradedesk.opsengine.display;

import java.util.Objects;
import java.util.UUID;

/**
 * Human-facing reference to an entity: its business number ("INV-0042", "J-1007") when one exists,
 * otherwise the first {@value #PREFIX_LENGTH} characters of its identifier.
 */
public final class DisplayRef implements DisplayField {

  static final int PREFIX_LENGTH = 8;

  private final String text;

  private DisplayRef(String text) {
    this.text = text;
  }

  /**
   * @param humanNumber the entity's business number, may be null or blank
   * @param id the entity identifier, used only as a truncated fallback
   */
  public static DisplayRef of(String humanNumber, UUID id) {
    if (humanNumber != null && !humanNumber.isBlank()) {
      return new DisplayRef(DisplayName.scrub(humanNumber.strip()));
    }
    Objects.requireNonNull(id, "id");
    return new DisplayRef(id.toString().substring(0, PREFIX_LENGTH));
  }

  @Override
  public String text() {
    return text;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof DisplayRef other && text.equals(other.text);
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
