package io.tradedesk.opsengine.attention.detector;

import io.tradedesk.opsengine.attention.AttentionType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * The registered detectors, one per {@link AttentionType}. Fails application startup when a type
 * has no detector or more than one.
 */
@Component
public class DetectorCatalogue {

  private static final Logger log = LoggerFactory.getLogger(DetectorCatalogue.class);

  private final List<AttentionDetector<?>> detectors;

  public DetectorCatalogue(List<AttentionDetector<?>> registered) {
    Map<AttentionType, AttentionDetector<?>> byType = new EnumMap<>(AttentionType.class);
    for (AttentionDetector<?> detector : registered) {
      AttentionDetector<?> previous = byType.put(detector.type(), detector);
      if (previous != null) {
        throw new IllegalStateException(
            "Attention type %s has two detectors: %s and %s"
                .formatted(
                    detector.type(),
                    previous.getClass().getSimpleName(),
                    detector.getClass().getSimpleName()));
      }
    }
    var missing = new ArrayList<AttentionType>();
    for (AttentionType type : AttentionType.values()) {
      if (!byType.containsKey(type)) {
        missing.add(type);
      }
    }
    if (!missing.isEmpty()) {
      throw new IllegalStateException("Attention types without a detector: " + missing);
    }
    this.detectors = Collections.unmodifiableList(new ArrayList<>(byType.values()));
    log.info("Registered {} attention detectors", detectors.size());
  }

  /** Detectors in {@link AttentionType} declaration order. */
  public List<AttentionDetector<?>> detectors() {
    return detectors;
  }
}
