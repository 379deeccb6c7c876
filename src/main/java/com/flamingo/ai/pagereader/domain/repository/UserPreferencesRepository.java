package com.flamingo.ai.pagereader.domain.repository;

import com.flamingo.ai.pagereader.domain.entity.UserPreferences;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Read access to owner preferences. */
@Repository
public interface UserPreferencesRepository extends JpaRepository<UserPreferences, String> {}
