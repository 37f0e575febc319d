package io.tradedesk.opsengine.attention.detector;

import io.tradedesk.opsengine.attention.AttentionFinding;
import io.tradedesk.opsengine.attention.AttentionProperties;
import io.tradedesk.opsengine.attention.AttentionQuery;
import io.tradedesk.opsengine.attention.AttentionType;
import io.tradedesk.opsengine.attention.UrgencyPolicy;
import io.tradedesk.opsengine.display.AgeText;
import io.tradedesk.opsengine.display.DisplayRef;
import io.tradedesk.opsengine.display.SafeText;
import io.tradedesk.opsengine.quote.AcceptedQuoteRecord;
import io.tradedesk.opsengine.quote.QuoteSource;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class QuoteNoJobDetector implements AttentionDetector<AcceptedQuoteRecord> {

  private final QuoteSource quoteSource;
  private final UrgencyPolicy urgencyPolicy;
  private final AttentionProperties properties;

  public QuoteNoJobDetector(
      QuoteSource quoteSource, UrgencyPolicy urgencyPolicy, AttentionProperties properties) {
    this.quoteSource = quoteSource;
    this.urgencyPolicy = urgencyPolicy;
    this.properties = properties;
  }

  @Override
  public AttentionType type() {
    return AttentionType.QUOTE_NO_JOB;
  }

  @Override
  public List<AcceptedQuoteRecord> fetch(AttentionQuery query) {
    return quoteSource.acceptedWithoutJob(
        query.tenantId(), query.now().minus(properties.quoteNoJobAfter()), query.rowCap());
  }

  @Override
  public List<AttentionFinding> detect(List<AcceptedQuoteRecord> records, Instant now) {
    Instant cutoff = now.minus(properties.quoteNoJobAfter());
    var findings = new ArrayList<AttentionFinding>();
    for (AcceptedQuoteRecord quote : records) {
      if (quote.acceptedAt() == null || quote.acceptedAt().isAfter(cutoff)) {
        continue;
      }
      long days = AgeText.daysBetween(quote.acceptedAt(), now);
      findings.add(
          new AttentionFinding(
              type(),
              quote.id(),
              SafeText.format(
                  "Quote #%s accepted, no job created",
                  DisplayRef.of(quote.quoteNumber(), quote.id())),
              AgeText.ago(days),
              urgencyPolicy.score(type(), days, 0),
              quote.acceptedAt()));
    }
    return findings;
  }
}
