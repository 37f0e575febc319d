package io.tradedesk.opsengine.invoice;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.Repository;
import org.springframework.data.repository.query.Param;

public interface InvoiceRepository extends Repository<Invoice, UUID> {

  /** Unpaid invoices in a chaseable status whose due date has passed. */
  @Query(
      """
      SELECT new io.tradedesk.opsengine.invoice.OverdueInvoiceRecord(
          i.id, i.invoiceNumber, i.clientName, i.status, i.dueAt)
      FROM Invoice i
      WHERE i.tenantId = :tenantId
        AND i.deletedAt IS NULL
        AND i.status IN ('sent', 'overdue', 'part_paid')
        AND i.paidAt IS NULL
        AND i.dueAt IS NOT NULL
        AND i.dueAt < :now
      ORDER BY i.dueAt ASC, i.id ASC
      """)
  List<OverdueInvoiceRecord> findOverdue(
      @Param("tenantId") String tenantId, @Param("now") Instant now, Pageable pageable);

  @Query(
      """
      SELECT new io.tradedesk.opsengine.invoice.InvoiceRecord(
          i.id, i.invoiceNumber, i.clientName, i.status, i.total, i.currency, i.token,
          i.issuedAt, i.createdAt, i.paidAt)
      FROM Invoice i
      WHERE i.tenantId = :tenantId AND i.jobId = :jobId AND i.deletedAt IS NULL
      ORDER BY i.createdAt DESC, i.id ASC
      """)
  List<InvoiceRecord> findRecordsForJob(
      @Param("tenantId") String tenantId, @Param("jobId") UUID jobId, Pageable pageable);

  @Query(
      """
      SELECT new io.tradedesk.opsengine.invoice.InvoiceRecord(
          i.id, i.invoiceNumber, i.clientName, i.status, i.total, i.currency, i.token,
          i.issuedAt, i.createdAt, i.paidAt)
      FROM Invoice i
      WHERE i.tenantId = :tenantId AND i.clientId = :clientId AND i.deletedAt IS NULL
      ORDER BY i.createdAt DESC, i.id ASC
      """)
  List<InvoiceRecord> findRecordsForClient(
      @Param("tenantId") String tenantId, @Param("clientId") UUID clientId, Pageable pageable);

  /** Client-visible invoices: drafts stay internal. */
  @Query(
      """
      SELECT new io.tradedesk.opsengine.invoice.InvoiceRecord(
          i.id, i.invoiceNumber, i.clientName, i.status, i.total, i.currency, i.token,
          i.issuedAt, i.createdAt, i.paidAt)
      FROM Invoice i
      WHERE i.tenantId = :tenantId
        AND i.clientId = :clientId
        AND i.deletedAt IS NULL
        AND i.status <> 'draft'
      ORDER BY i.createdAt DESC, i.id ASC
      """)
  List<InvoiceRecord> findIssuedForClient(
      @Param("tenantId") String tenantId, @Param("clientId") UUID clientId, Pageable pageable);

  @Query(
      """
      SELECT new io.tradedesk.opsengine.invoice.InvoiceRecord(
          i.id, i.invoiceNumber, i.clientName, i.status, i.total, i.currency, i.token,
          i.issuedAt, i.createdAt, i.paidAt)
      FROM Invoice i
      WHERE i.tenantId = :tenantId AND i.deletedAt IS NULL
      ORDER BY i.updatedAt DESC, i.id ASC
      """)
  List<InvoiceRecord> findRecentlyUpdated(@Param("tenantId") String tenantId, Pageable pageable);

  @Query(
      """
      SELECT DISTINCT i.jobId FROM Invoice i
      WHERE i.tenantId = :tenantId
        AND i.deletedAt IS NULL
        AND i.jobId IN :jobIds
      """)
  List<UUID> findInvoicedJobIds(
      @Param("tenantId") String tenantId, @Param("jobIds") Collection<UUID> jobIds);

  @Query(
      """
      SELECT new io.tradedesk.opsengine.invoice.UnpaidInvoiceTotals(
          COUNT(i),
          COUNT(CASE WHEN i.status <> 'draft' AND i.dueAt < :now THEN 1 END),
          COALESCE(SUM(i.total), 0))
      FROM Invoice i
      WHERE i.tenantId = :tenantId
        AND i.deletedAt IS NULL
        AND i.paidAt IS NULL
        AND i.status IN ('draft', 'sent', 'overdue', 'part_paid')
      """)
  UnpaidInvoiceTotals findUnpaidTotals(
      @Param("tenantId") String tenantId, @Param("now") Instant now);

  @Query(
      """
      SELECT COALESCE(SUM(i.total), 0) FROM Invoice i
      WHERE i.tenantId = :tenantId
        AND i.deletedAt IS NULL
        AND i.paidAt >= :from
        AND i.paidAt < :to
      """)
  BigDecimal sumPaidBetween(
      @Param("tenantId") String tenantId, @Param("from") Instant from, @Param("to") Instant to);

  @Query(
      """
      SELECT new io.tradedesk.opsengine.invoice.PaidInvoiceAmount(i.total, i.paidAt)
      FROM Invoice i
      WHERE i.tenantId = :tenantId
        AND i.deletedAt IS NULL
        AND i.paidAt >= :from
        AND i.paidAt < :to
      ORDER BY i.paidAt ASC, i.id ASC
      """)
  List<PaidInvoiceAmount> findPaidBetween(
      @Param("tenantId") String tenantId,
      @Param("from") Instant from,
      @Param("to") Instant to,
      Pageable pageable);
}
