package com.flamingo.ai.pagereader.domain.repository;

import com.flamingo.ai.pagereader.domain.entity.UsageLedger;
import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/** Repository for monthly usage rows. */
@Repository
public interface UsageLedgerRepository extends JpaRepository<UsageLedger, UUID> {

  Optional<UsageLedger> findByOwnerIdAndPeriodStart(String ownerId, LocalDate periodStart);

  /**
   * Adds to the counters of an existing row in a single statement.
   *
   * @return number of rows updated, 0 when the row does not exist yet
   */
  @Modifying
  @Transactional
  @Query(
      "UPDATE UsageLedger u SET u.tokensIn = u.tokensIn + :tokensIn, "
          + "u.tokensOut = u.tokensOut + :tokensOut, u.requestCount = u.requestCount + 1 "
          + "WHERE u.ownerId = :ownerId AND u.periodStart = :periodStart")
  int increment(
      @Param("ownerId") String ownerId,
      @Param("periodStart") LocalDate periodStart,
      @Param("tokensIn") long tokensIn,
      @Param("tokensOut") long tokensOut);
}
