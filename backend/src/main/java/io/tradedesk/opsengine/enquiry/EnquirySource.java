package io.tradedesk.opsengine.enquiry;

import java.util.List;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class EnquirySource {

  private final EnquiryRepository enquiryRepository;

  public EnquirySource(EnquiryRepository enquiryRepository) {
    this.enquiryRepository = enquiryRepository;
  }

  @Transactional(readOnly = true)
  public List<EnquiryRecord> recent(String tenantId, int rowCap) {
    return enquiryRepository.findRecent(tenantId, PageRequest.of(0, rowCap));
  }

  /** Enquiries neither won nor lost. */
  @Transactional(readOnly = true)
  public long openCount(String tenantId) {
    return enquiryRepository.countOpen(tenantId);
  }
}
