package com.flamingo.ai.pagereader.service.quota;

import com.flamingo.ai.pagereader.config.ReaderConfig;
import com.flamingo.ai.pagereader.domain.entity.UserPreferences;
import com.flamingo.ai.pagereader.domain.repository.DocumentRepository;
import com.flamingo.ai.pagereader.exception.StorageLimitExceededException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Storage allowance per owner. An explicit limit from preferences wins. Otherwise paid plans (the
 * plans listed in {@code reader.assistant.plans}) get {@code reader.storage.paid-limit-bytes} and
 * everyone else gets {@code reader.storage.free-limit-bytes}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StorageQuotaService {

  private final SubscriptionPlanResolver planResolver;
  private final DocumentRepository documentRepository;
  private final ReaderConfig readerConfig;

  public long limitBytes(String ownerId) {
    Long explicit =
        planResolver
            .findPreferences(ownerId)
            .map(UserPreferences::getStorageLimitBytes)
            .filter(limit -> limit > 0)
            .orElse(null);
    if (explicit != null) {
      return explicit;
    }
    String plan = planResolver.resolvePlan(ownerId);
    return readerConfig.getAssistant().getPlans().contains(plan)
        ? readerConfig.getStorage().getPaidLimitBytes()
        : readerConfig.getStorage().getFreeLimitBytes();
  }

  /**
   * Verifies that storing {@code requestedBytes} more keeps the owner within the allowance.
   *
   * @throws StorageLimitExceededException if it would not
   */
  public void ensureCapacity(String ownerId, long requestedBytes) {
    long limit = limitBytes(ownerId);
    long used = documentRepository.sumOriginalSizeBytesByOwnerId(ownerId);
    if (used + requestedBytes > limit) {
      log.info(
          "Rejecting upload for owner {}: used={} requested={} limit={}",
          ownerId,
          used,
          requestedBytes,
          limit);
      throw new StorageLimitExceededException(limit, used, requestedBytes);
    }
  }
}
