package com.flamingo.ai.pagereader.service.quota;

import com.flamingo.ai.pagereader.domain.entity.UserPreferences;
import com.flamingo.ai.pagereader.domain.repository.UserPreferencesRepository;
import java.util.Locale;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Reads an owner's subscription plan from preferences. */
@Component
@RequiredArgsConstructor
public class SubscriptionPlanResolver {

  public static final String FREE_PLAN = "free";

  private final UserPreferencesRepository userPreferencesRepository;

  /** Returns the owner's plan, lowercase; owners without preferences are on the free plan. */
  public String resolvePlan(String ownerId) {
    return findPreferences(ownerId)
        .map(UserPreferences::getSubscriptionPlan)
        .filter(plan -> !plan.isBlank())
        .map(plan -> plan.strip().toLowerCase(Locale.ROOT))
        .orElse(FREE_PLAN);
  }

  public Optional<UserPreferences> findPreferences(String ownerId) {
    return userPreferencesRepository.findById(ownerId);
  }
}
