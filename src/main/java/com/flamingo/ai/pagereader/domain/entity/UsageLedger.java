package com.flamingo.ai.pagereader.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Token usage of one owner in one calendar month. Counters are only changed through relative
 * increments in the repository, so they never decrease.
 */
@Entity
@Table(
    name = "usage_ledger",
    uniqueConstraints =
        @UniqueConstraint(
            name = "uk_usage_ledger_owner_period",
            columnNames = {"ownerId", "periodStart"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UsageLedger {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(nullable = false)
  private String ownerId;

  /** First day of the UTC month. */
  @Column(nullable = false)
  private LocalDate periodStart;

  @Builder.Default private long tokensIn = 0;

  @Builder.Default private long tokensOut = 0;

  @Builder.Default private long requestCount = 0;

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  @PrePersist
  protected void onCreate() {
    createdAt = LocalDateTime.now();
  }

  public long totalTokens() {
    return tokensIn + tokensOut;
  }
}
