package io.tradedesk.opsengine.invoice;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class InvoiceSource {

  private final InvoiceRepository invoiceRepository;

  public InvoiceSource(InvoiceRepository invoiceRepository) {
    this.invoiceRepository = invoiceRepository;
  }

  @Transactional(readOnly = true)
  public List<OverdueInvoiceRecord> overdue(String tenantId, Instant now, int rowCap) {
    return invoiceRepository.findOverdue(tenantId, now, PageRequest.of(0, rowCap));
  }

  @Transactional(readOnly = true)
  public List<InvoiceRecord> invoicesForJob(String tenantId, UUID jobId, int rowCap) {
    return invoiceRepository.findRecordsForJob(tenantId, jobId, PageRequest.of(0, rowCap));
  }

  @Transactional(readOnly = true)
  public List<InvoiceRecord> invoicesForClient(String tenantId, UUID clientId, int rowCap) {
    return invoiceRepository.findRecordsForClient(tenantId, clientId, PageRequest.of(0, rowCap));
  }

  @Transactional(readOnly = true)
  public List<InvoiceRecord> issuedInvoicesForClient(String tenantId, UUID clientId, int rowCap) {
    return invoiceRepository.findIssuedForClient(tenantId, clientId, PageRequest.of(0, rowCap));
  }

  @Transactional(readOnly = true)
  public List<InvoiceRecord> recentlyUpdated(String tenantId, int rowCap) {
    return invoiceRepository.findRecentlyUpdated(tenantId, PageRequest.of(0, rowCap));
  }

  /** Those of {@code jobIds} that have at least one live invoice. */
  @Transactional(readOnly = true)
  public List<UUID> invoicedJobIds(String tenantId, Collection<UUID> jobIds) {
    if (jobIds.isEmpty()) {
      return List.of();
    }
    return invoiceRepository.findInvoicedJobIds(tenantId, jobIds);
  }

  @Transactional(readOnly = true)
  public UnpaidInvoiceTotals unpaidTotals(String tenantId, Instant now) {
    return invoiceRepository.findUnpaidTotals(tenantId, now);
  }

  /** Sum of invoices paid in {@code [from, to)}; zero when none were. */
  @Transactional(readOnly = true)
  public BigDecimal paidTotal(String tenantId, Instant from, Instant to) {
    return invoiceRepository.sumPaidBetween(tenantId, from, to);
  }

  @Transactional(readOnly = true)
  public List<PaidInvoiceAmount> paidBetween(String tenantId, Instant from, Instant to, int rowCap) {
    return invoiceRepository.findPaidBetween(tenantId, from, to, PageRequest.of(0, rowCap));
  }
}
