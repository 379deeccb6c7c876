package com.flamingo.ai.pagereader.service.quota;

import com.flamingo.ai.pagereader.config.ReaderConfig;
import com.flamingo.ai.pagereader.domain.entity.UsageLedger;
import com.flamingo.ai.pagereader.exception.QuotaExhaustedException;
import com.flamingo.ai.pagereader.exception.UpgradeRequiredException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Gate in front of the reading assistant.
 *
 * <p>The quota check reads the ledger before the model call and the ledger is incremented after
 * it, so concurrent turns of one owner can each pass and together overshoot the budget by at most
 * one call per turn.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EntitlementService {

  private final SubscriptionPlanResolver planResolver;
  private final UsageLedgerService usageLedgerService;
  private final ReaderConfig readerConfig;

  /**
   * Verifies that the owner's plan includes the assistant.
   *
   * @return the resolved plan
   * @throws UpgradeRequiredException if it does not
   */
  public String ensureEntitled(String ownerId) {
    String plan = planResolver.resolvePlan(ownerId);
    if (!readerConfig.getAssistant().getPlans().contains(plan)) {
      log.debug("Owner {} on plan {} is not entitled to the assistant", ownerId, plan);
      throw new UpgradeRequiredException(ownerId, plan);
    }
    return plan;
  }

  /**
   * Verifies entitlement and that the owner has tokens left this month.
   *
   * @throws UpgradeRequiredException if the plan has no assistant or no budget
   * @throws QuotaExhaustedException if the month's budget is used up
   */
  public QuotaSnapshot ensureWithinQuota(String ownerId) {
    String plan = ensureEntitled(ownerId);
    Long budget = readerConfig.getAssistant().getMonthlyTokenBudgets().get(plan);
    if (budget == null || budget <= 0) {
      log.warn("Plan {} has the assistant but no token budget", plan);
      throw new UpgradeRequiredException(ownerId, plan);
    }

    UsageLedger ledger = usageLedgerService.getOrCreateCurrent(ownerId);
    long used = ledger.totalTokens();
    if (used >= budget) {
      throw new QuotaExhaustedException(ownerId, budget, used);
    }
    return new QuotaSnapshot(plan, budget, used);
  }
}
