package com.flamingo.ai.pagereader.service.quota;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.pagereader.config.ReaderConfig;
import com.flamingo.ai.pagereader.domain.entity.UsageLedger;
import com.flamingo.ai.pagereader.exception.QuotaExhaustedException;
import com.flamingo.ai.pagereader.exception.UpgradeRequiredException;
import java.time.LocalDate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("EntitlementService Tests")
class EntitlementServiceTest {

  private static final String OWNER = "owner-1";

  @Mock private SubscriptionPlanResolver planResolver;
  @Mock private UsageLedgerService usageLedgerService;

  private ReaderConfig readerConfig;
  private EntitlementService entitlementService;

  @BeforeEach
  void setUp() {
    readerConfig = new ReaderConfig();
    entitlementService = new EntitlementService(planResolver, usageLedgerService, readerConfig);
  }

  @Test
  void shouldRejectFreePlan() {
    // Given
    when(planResolver.resolvePlan(OWNER)).thenReturn(SubscriptionPlanResolver.FREE_PLAN);

    // When / Then
    assertThatThrownBy(() -> entitlementService.ensureWithinQuota(OWNER))
        .isInstanceOf(UpgradeRequiredException.class)
        .satisfies(e -> assertThat(((UpgradeRequiredException) e).getPlan()).isEqualTo("free"));
    verify(usageLedgerService, never()).getOrCreateCurrent(any());
  }

  @Test
  void shouldReturnSnapshotWhenBudgetRemains() {
    // Given
    when(planResolver.resolvePlan(OWNER)).thenReturn("pro_monthly");
    when(usageLedgerService.getOrCreateCurrent(OWNER)).thenReturn(ledger(1_000L, 500L));

    // When
    QuotaSnapshot snapshot = entitlementService.ensureWithinQuota(OWNER);

    // Then
    assertThat(snapshot.plan()).isEqualTo("pro_monthly");
    assertThat(snapshot.budget()).isEqualTo(2_000_000L);
    assertThat(snapshot.used()).isEqualTo(1_500L);
    assertThat(snapshot.remaining()).isEqualTo(1_998_500L);
  }

  @Test
  void shouldRejectWhenBudgetIsUsedUp() {
    // Given
    when(planResolver.resolvePlan(OWNER)).thenReturn("pro_yearly");
    when(usageLedgerService.getOrCreateCurrent(OWNER)).thenReturn(ledger(1_500_000L, 500_000L));

    // When / Then
    assertThatThrownBy(() -> entitlementService.ensureWithinQuota(OWNER))
        .isInstanceOf(QuotaExhaustedException.class);
  }

  @Test
  void shouldTreatPlanWithoutBudgetAsNotEntitled() {
    // Given
    readerConfig.getAssistant().getPlans().add("team");
    when(planResolver.resolvePlan(OWNER)).thenReturn("team");

    // When / Then
    assertThat(entitlementService.ensureEntitled(OWNER)).isEqualTo("team");
    assertThatThrownBy(() -> entitlementService.ensureWithinQuota(OWNER))
        .isInstanceOf(UpgradeRequiredException.class);
  }

  private static UsageLedger ledger(long tokensIn, long tokensOut) {
    return UsageLedger.builder()
        .ownerId(OWNER)
        .periodStart(LocalDate.of(2026, 3, 1))
        .tokensIn(tokensIn)
        .tokensOut(tokensOut)
        .build();
  }
}
