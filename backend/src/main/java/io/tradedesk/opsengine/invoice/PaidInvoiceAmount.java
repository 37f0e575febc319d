package io.tradedesk.opsengine.invoice;

import java.math.BigDecimal;
import java.time.Instant;

public record PaidInvoiceAmount(BigDecimal amount, Instant paidAt) {}
