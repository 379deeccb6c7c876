package com.flamingo.ai.pagereader.service.quota;

import com.flamingo.ai.pagereader.domain.entity.UsageLedger;
import com.flamingo.ai.pagereader.domain.repository.UsageLedgerRepository;
import java.time.Clock;
import java.time.LocalDate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

/** Monthly token ledger. Rows are keyed by owner and the first day of the UTC month. */
@Service
@RequiredArgsConstructor
@Slf4j
public class UsageLedgerService {

  private final UsageLedgerRepository usageLedgerRepository;
  private final Clock clock;

  public LocalDate currentPeriodStart() {
    return LocalDate.now(clock).withDayOfMonth(1);
  }

  /** Loads this month's row, creating it on first use. */
  public UsageLedger getOrCreateCurrent(String ownerId) {
    LocalDate periodStart = currentPeriodStart();
    return usageLedgerRepository
        .findByOwnerIdAndPeriodStart(ownerId, periodStart)
        .orElseGet(() -> create(ownerId, periodStart));
  }

  /**
   * Adds one request and its token counts to this month's row.
   *
   * @return the row after the increment
   */
  public UsageLedger recordUsage(String ownerId, long tokensIn, long tokensOut) {
    LocalDate periodStart = currentPeriodStart();
    int updated = usageLedgerRepository.increment(ownerId, periodStart, tokensIn, tokensOut);
    if (updated == 0) {
      create(ownerId, periodStart);
      usageLedgerRepository.increment(ownerId, periodStart, tokensIn, tokensOut);
    }
    return usageLedgerRepository
        .findByOwnerIdAndPeriodStart(ownerId, periodStart)
        .orElseThrow(
            () -> new IllegalStateException("Usage row vanished for owner " + ownerId));
  }

  /** Inserts an empty row; a concurrent insert of the same row is read back instead. */
  private UsageLedger create(String ownerId, LocalDate periodStart) {
    try {
      return usageLedgerRepository.saveAndFlush(
          UsageLedger.builder().ownerId(ownerId).periodStart(periodStart).build());
    } catch (DataIntegrityViolationException e) {
      log.debug("Usage row for {} {} created concurrently", ownerId, periodStart);
      return usageLedgerRepository
          .findByOwnerIdAndPeriodStart(ownerId, periodStart)
          .orElseThrow(() -> e);
    }
  }
}
