package io.tradedesk.opsengine.attention;

import java.time.Instant;

/**
 * Inputs shared by every detector fetch of one computation.
 *
 * @param now the single evaluation instant of the computation
 */
public record AttentionQuery(String tenantId, Instant now, int rowCap, int countingRowCap) {}
