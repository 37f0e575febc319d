package io.tradedesk.opsengine.attention;

import io.tradedesk.opsengine.display.SafeText;

/** Actionable finding as served to the dashboard. */
public record AttentionItem(
    String id,
    AttentionType type,
    AttentionIcon icon,
    SafeText message,
    String age,
    int urgency,
    String ctaLabel,
    String ctaHref) {}
