package io.tradedesk.opsengine.attention.detector;

import io.tradedesk.opsengine.attention.AttentionFinding;
import io.tradedesk.opsengine.attention.AttentionQuery;
import io.tradedesk.opsengine.attention.AttentionType;
import java.time.Instant;
import java.util.List;

/**
 * One attention condition. {@link #fetch} reads the candidate records for a tenant and runs on a
 * fan-out worker; {@link #detect} is a pure function of those records and the evaluation instant.
 *
 * @param <T> record shape returned by the detector's source
 */
public interface AttentionDetector<T> {

  AttentionType type();

  List<T> fetch(AttentionQuery query);

  List<AttentionFinding> detect(List<T> records, Instant now);
}
