package com.flamingo.ai.pagereader.service.account;

import com.flamingo.ai.pagereader.config.ReaderConfig;
import com.flamingo.ai.pagereader.domain.entity.UserPreferences;
import com.flamingo.ai.pagereader.domain.repository.UserPreferencesRepository;
import java.time.Clock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Whether an owner's account is disabled, cached for {@code reader.account-status.ttl} so the
 * check can run on every request.
 */
@Service
@Slf4j
public class AccountStatusService {

  private final UserPreferencesRepository userPreferencesRepository;
  private final TtlCache<String, Boolean> cache;

  public AccountStatusService(
      UserPreferencesRepository userPreferencesRepository, ReaderConfig readerConfig, Clock clock) {
    this.userPreferencesRepository = userPreferencesRepository;
    this.cache = new TtlCache<>(clock, readerConfig.getAccountStatus().getTtl());
  }

  /** Owners without preferences are active. */
  public boolean isDisabled(String ownerId) {
    return cache.getOrRefresh(ownerId, this::loadDisabled);
  }

  private Boolean loadDisabled(String ownerId) {
    boolean disabled =
        userPreferencesRepository
            .findById(ownerId)
            .map(UserPreferences::isAccountDisabled)
            .orElse(false);
    log.debug("Loaded account status for {}: disabled={}", ownerId, disabled);
    return disabled;
  }
}
