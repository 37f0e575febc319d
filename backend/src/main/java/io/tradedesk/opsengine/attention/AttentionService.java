package io.tradedesk.opsengine.attention;

import io.tradedesk.opsengine.aggregation.AggregationPhase;
import io.tradedesk.opsengine.aggregation.FanOutResult;
import io.tradedesk.opsengine.aggregation.Rendered;
import io.tradedesk.opsengine.aggregation.SourceFanOut;
import io.tradedesk.opsengine.aggregation.SourceHandle;
import io.tradedesk.opsengine.aggregation.ViewKey;
import io.tradedesk.opsengine.aggregation.ViewRenderer;
import io.tradedesk.opsengine.attention.detector.AttentionDetector;
import io.tradedesk.opsengine.attention.detector.DetectorCatalogue;
import io.tradedesk.opsengine.attention.dto.AttentionResponse;
import io.tradedesk.opsengine.security.RoleNamespace;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Builds the dashboard attention view: every detector's source is fetched concurrently, every
 * detector runs over what arrived, and the merged findings are ranked and capped.
 */
@Service
public class AttentionService {

  private static final Logger log = LoggerFactory.getLogger(AttentionService.class);

  static final String VIEW = "attention";

  private final DetectorCatalogue catalogue;
  private final SourceFanOut sourceFanOut;
  private final ViewRenderer viewRenderer;
  private final AttentionProperties properties;
  private final Clock clock;

  public AttentionService(
      DetectorCatalogue catalogue,
      SourceFanOut sourceFanOut,
      ViewRenderer viewRenderer,
      AttentionProperties properties,
      Clock clock) {
    this.catalogue = catalogue;
    this.sourceFanOut = sourceFanOut;
    this.viewRenderer = viewRenderer;
    this.properties = properties;
    this.clock = clock;
  }

  public AttentionResponse getAttention(String tenantId, RoleNamespace namespace) {
    return viewRenderer.render(
        ViewKey.of(tenantId, VIEW, namespace),
        AttentionResponse.class,
        () -> compute(tenantId, namespace));
  }

  Rendered<AttentionResponse> compute(String tenantId, RoleNamespace namespace) {
    Instant now = clock.instant();
    var query =
        new AttentionQuery(tenantId, now, sourceFanOut.rowCap(), sourceFanOut.countingRowCap());

    var fanOut = sourceFanOut.begin(VIEW, tenantId);
    var pending = new ArrayList<PendingDetection<?>>();
    for (AttentionDetector<?> detector : catalogue.detectors()) {
      pending.add(PendingDetection.submit(fanOut, detector, query));
    }
    FanOutResult result = fanOut.awaitAll().requireAvailable();

    var findings = new ArrayList<AttentionFinding>();
    for (PendingDetection<?> detection : pending) {
      findings.addAll(detection.detect(result, now));
    }
    log.debug(
        "Attention phase: tenant={}, phase={}, findings={}",
        tenantId,
        AggregationPhase.RANKING,
        findings.size());

    List<AttentionItem> items =
        AttentionRanker.rank(findings, properties.cap()).stream()
            .map(finding -> AttentionNormalizer.toItem(finding, namespace))
            .toList();
    log.debug(
        "Attention phase: tenant={}, phase={}, items={}, partial={}",
        tenantId,
        AggregationPhase.DONE,
        items.size(),
        result.isPartial());
    return Rendered.of(AttentionResponse.of(items), result);
  }

  private record PendingDetection<T>(AttentionDetector<T> detector, SourceHandle<T> handle) {

    static <T> PendingDetection<T> submit(
        SourceFanOut.FanOut fanOut, AttentionDetector<T> detector, AttentionQuery query) {
      return new PendingDetection<>(
          detector, fanOut.submit(detector.type().key(), () -> detector.fetch(query)));
    }

    List<AttentionFinding> detect(FanOutResult result, Instant now) {
      return detector.detect(result.records(handle), now);
    }
  }
}
