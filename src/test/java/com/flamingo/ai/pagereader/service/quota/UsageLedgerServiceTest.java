package com.flamingo.ai.pagereader.service.quota;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.pagereader.domain.entity.UsageLedger;
import com.flamingo.ai.pagereader.domain.repository.UsageLedgerRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.dao.DataIntegrityViolationException;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("UsageLedgerService Tests")
class UsageLedgerServiceTest {

  private static final String OWNER = "owner-1";
  private static final LocalDate MARCH = LocalDate.of(2026, 3, 1);

  @Mock private UsageLedgerRepository repository;

  private UsageLedgerService ledgerService;

  @BeforeEach
  void setUp() {
    Clock clock = Clock.fixed(Instant.parse("2026-03-17T23:30:00Z"), ZoneOffset.UTC);
    ledgerService = new UsageLedgerService(repository, clock);
  }

  @Test
  void shouldUseFirstDayOfUtcMonthAsPeriod() {
    assertThat(ledgerService.currentPeriodStart()).isEqualTo(MARCH);
  }

  @Test
  void shouldCreateRowOnFirstRead() {
    // Given
    when(repository.findByOwnerIdAndPeriodStart(OWNER, MARCH)).thenReturn(Optional.empty());
    when(repository.saveAndFlush(any(UsageLedger.class))).thenAnswer(inv -> inv.getArgument(0));

    // When
    UsageLedger ledger = ledgerService.getOrCreateCurrent(OWNER);

    // Then
    assertThat(ledger.getOwnerId()).isEqualTo(OWNER);
    assertThat(ledger.getPeriodStart()).isEqualTo(MARCH);
    assertThat(ledger.totalTokens()).isZero();
  }

  @Test
  void shouldIncrementExistingRow() {
    // Given
    UsageLedger stored =
        UsageLedger.builder().ownerId(OWNER).periodStart(MARCH).tokensIn(110).tokensOut(20).build();
    when(repository.increment(OWNER, MARCH, 10, 20)).thenReturn(1);
    when(repository.findByOwnerIdAndPeriodStart(OWNER, MARCH)).thenReturn(Optional.of(stored));

    // When
    UsageLedger result = ledgerService.recordUsage(OWNER, 10, 20);

    // Then
    assertThat(result).isSameAs(stored);
    verify(repository, never()).saveAndFlush(any());
  }

  @Test
  void shouldCreateRowThenIncrementWhenMonthHasNoRow() {
    // Given
    UsageLedger stored =
        UsageLedger.builder().ownerId(OWNER).periodStart(MARCH).tokensIn(10).tokensOut(20).build();
    when(repository.increment(OWNER, MARCH, 10, 20)).thenReturn(0, 1);
    when(repository.saveAndFlush(any(UsageLedger.class))).thenAnswer(inv -> inv.getArgument(0));
    when(repository.findByOwnerIdAndPeriodStart(OWNER, MARCH)).thenReturn(Optional.of(stored));

    // When
    UsageLedger result = ledgerService.recordUsage(OWNER, 10, 20);

    // Then
    assertThat(result.totalTokens()).isEqualTo(30);
    InOrder order = inOrder(repository);
    order.verify(repository).increment(OWNER, MARCH, 10, 20);
    ArgumentCaptor<UsageLedger> created = ArgumentCaptor.forClass(UsageLedger.class);
    order.verify(repository).saveAndFlush(created.capture());
    order.verify(repository).increment(OWNER, MARCH, 10, 20);
    assertThat(created.getValue().getPeriodStart()).isEqualTo(MARCH);
  }

  @Test
  void shouldReadBackRowCreatedConcurrently() {
    // Given
    UsageLedger concurrent = UsageLedger.builder().ownerId(OWNER).periodStart(MARCH).build();
    when(repository.findByOwnerIdAndPeriodStart(OWNER, MARCH))
        .thenReturn(Optional.empty(), Optional.of(concurrent));
    when(repository.saveAndFlush(any(UsageLedger.class)))
        .thenThrow(new DataIntegrityViolationException("uk_usage_ledger_owner_period"));

    // When
    UsageLedger ledger = ledgerService.getOrCreateCurrent(OWNER);

    // Then
    assertThat(ledger).isSameAs(concurrent);
  }
}
