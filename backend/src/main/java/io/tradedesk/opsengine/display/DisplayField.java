package io.tradedesk.opsengine.display;

/**
 * A value that is already safe to show to a human. The only way into {@link SafeText}; raw
 * identifiers have no path to a message or title.
 */
public sealed interface DisplayField permits DisplayRef, DisplayName {

  String text();
}
