package io.tradedesk.opsengine.quote;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.Repository;
import org.springframework.data.repository.query.Param;

public interface QuoteRepository extends Repository<Quote, UUID> {

  @Query(
      """
      SELECT new io.tradedesk.opsengine.quote.AcceptedQuoteRecord(q.id, q.quoteNumber, q.acceptedAt)
      FROM Quote q
      WHERE q.tenantId = :tenantId
        AND q.deletedAt IS NULL
        AND q.status = 'accepted'
        AND q.acceptedAt IS NOT NULL
        AND q.acceptedAt <= :acceptedBy
        AND NOT EXISTS (
          SELECT j.id FROM Job j
          WHERE j.quoteId = q.id AND j.tenantId = :tenantId AND j.deletedAt IS NULL)
      ORDER BY q.acceptedAt ASC, q.id ASC
      """)
  List<AcceptedQuoteRecord> findAcceptedWithoutJob(
      @Param("tenantId") String tenantId,
      @Param("acceptedBy") Instant acceptedBy,
      Pageable pageable);

  @Query(
      """
      SELECT new io.tradedesk.opsengine.quote.QuoteRecord(
          q.id, q.quoteNumber, q.clientName, q.status, q.total, q.currency, q.token,
          q.createdAt, q.acceptedAt)
      FROM Quote q
      WHERE q.tenantId = :tenantId AND q.clientId = :clientId AND q.deletedAt IS NULL
      ORDER BY q.createdAt DESC, q.id ASC
      """)
  List<QuoteRecord> findRecordsForClient(
      @Param("tenantId") String tenantId, @Param("clientId") UUID clientId, Pageable pageable);

  /** Quotes the client has actually been shown. */
  @Query(
      """
      SELECT new io.tradedesk.opsengine.quote.QuoteRecord(
          q.id, q.quoteNumber, q.clientName, q.status, q.total, q.currency, q.token,
          q.createdAt, q.acceptedAt)
      FROM Quote q
      WHERE q.tenantId = :tenantId
        AND q.clientId = :clientId
        AND q.deletedAt IS NULL
        AND q.status IN ('sent', 'accepted')
      ORDER BY q.createdAt DESC, q.id ASC
      """)
  List<QuoteRecord> findSharedWithClient(
      @Param("tenantId") String tenantId, @Param("clientId") UUID clientId, Pageable pageable);

  @Query(
      """
      SELECT new io.tradedesk.opsengine.quote.QuoteRecord(
          q.id, q.quoteNumber, q.clientName, q.status, q.total, q.currency, q.token,
          q.createdAt, q.acceptedAt)
      FROM Quote q
      WHERE q.tenantId = :tenantId AND q.deletedAt IS NULL
      ORDER BY q.updatedAt DESC, q.id ASC
      """)
  List<QuoteRecord> findRecentlyUpdated(@Param("tenantId") String tenantId, Pageable pageable);

  @Query(
      """
      SELECT new io.tradedesk.opsengine.quote.QuotePinRecord(
          q.id, q.quoteNumber, q.clientName, q.status, s.latitude, s.longitude)
      FROM Quote q JOIN Site s ON s.id = q.siteId
      WHERE q.tenantId = :tenantId
        AND s.tenantId = :tenantId
        AND q.deletedAt IS NULL
        AND q.status IN ('sent', 'accepted')
        AND s.latitude IS NOT NULL
        AND s.longitude IS NOT NULL
      ORDER BY q.createdAt DESC, q.id ASC
      """)
  List<QuotePinRecord> findOpenPins(@Param("tenantId") String tenantId, Pageable pageable);

  @Query(
      """
      SELECT new io.tradedesk.opsengine.quote.QuoteStatusTotal(q.status, COUNT(q), SUM(q.total))
      FROM Quote q
      WHERE q.tenantId = :tenantId AND q.deletedAt IS NULL
      GROUP BY q.status
      ORDER BY q.status ASC
      """)
  List<QuoteStatusTotal> totalByStatus(@Param("tenantId") String tenantId);
}
