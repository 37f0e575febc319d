package io.tradedesk.opsengine.quote;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class QuoteSource {

  private final QuoteRepository quoteRepository;

  public QuoteSource(QuoteRepository quoteRepository) {
    this.quoteRepository = quoteRepository;
  }

  @Transactional(readOnly = true)
  public List<AcceptedQuoteRecord> acceptedWithoutJob(
      String tenantId, Instant acceptedBy, int rowCap) {
    return quoteRepository.findAcceptedWithoutJob(
        tenantId, acceptedBy, PageRequest.of(0, rowCap));
  }

  @Transactional(readOnly = true)
  public List<QuoteRecord> quotesForClient(String tenantId, UUID clientId, int rowCap) {
    return quoteRepository.findRecordsForClient(tenantId, clientId, PageRequest.of(0, rowCap));
  }

  @Transactional(readOnly = true)
  public List<QuoteRecord> quotesSharedWithClient(String tenantId, UUID clientId, int rowCap) {
    return quoteRepository.findSharedWithClient(tenantId, clientId, PageRequest.of(0, rowCap));
  }

  @Transactional(readOnly = true)
  public List<QuoteRecord> recentlyUpdated(String tenantId, int rowCap) {
    return quoteRepository.findRecentlyUpdated(tenantId, PageRequest.of(0, rowCap));
  }

  @Transactional(readOnly = true)
  public List<QuotePinRecord> openQuotePins(String tenantId, int rowCap) {
    return quoteRepository.findOpenPins(tenantId, PageRequest.of(0, rowCap));
  }

  @Transactional(readOnly = true)
  public List<QuoteStatusTotal> totalsByStatus(String tenantId) {
    return quoteRepository.totalByStatus(tenantId);
  }
}
