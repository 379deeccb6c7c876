package com.flamingo.ai.pagereader.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Owner preferences maintained by the account service. Read-only here. */
@Entity
@Table(name = "user_preferences")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UserPreferences {

  @Id private String ownerId;

  @Column(name = "subscription_plan")
  private String subscriptionPlan;

  @Column(name = "account_disabled")
  private boolean accountDisabled;

  /** Explicit storage allowance overriding the plan default. */
  @Column(name = "storage_limit_bytes")
  private Long storageLimitBytes;
}
