package io.tradedesk.opsengine.attention.detector;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.tradedesk.opsengine.attention.AttentionProperties;
import io.tradedesk.opsengine.attention.AttentionType;
import io.tradedesk.opsengine.attention.UrgencyPolicy;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class DetectorCatalogueTest {

  private final AttentionProperties properties = AttentionProperties.defaults();
  private final UrgencyPolicy urgencyPolicy = new UrgencyPolicy(properties);

  private List<AttentionDetector<?>> allDetectors() {
    return new ArrayList<>(
        List.of(
            new QuoteNoJobDetector(null, urgencyPolicy, properties),
            new OpenSnagsDetector(null, urgencyPolicy),
            new CertNotIssuedDetector(null, urgencyPolicy, properties),
            new MissingTimesheetDetector(null, urgencyPolicy, properties),
            new JobNoInvoiceDetector(null, urgencyPolicy, properties),
            new InvoiceOverdueDetector(null, urgencyPolicy)));
  }

  @Test
  void detectorsAreReturnedInTypeOrder() {
    var catalogue = new DetectorCatalogue(allDetectors());

    assertThat(catalogue.detectors())
        .extracting(AttentionDetector::type)
        .containsExactly(AttentionType.values());
  }

  @Test
  void missingDetectorFailsStartup() {
    var detectors = allDetectors();
    detectors.remove(0);

    assertThatThrownBy(() -> new DetectorCatalogue(detectors))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("QUOTE_NO_JOB");
  }

  @Test
  void duplicateDetectorFailsStartup() {
    var detectors = allDetectors();
    detectors.add(new OpenSnagsDetector(null, urgencyPolicy));

    assertThatThrownBy(() -> new DetectorCatalogue(detectors))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("two detectors");
  }
}
