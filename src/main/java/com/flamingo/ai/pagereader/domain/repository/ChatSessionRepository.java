package com.flamingo.ai.pagereader.domain.repository;

import com.flamingo.ai.pagereader.domain.entity.ChatSession;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for chat sessions. */
@Repository
public interface ChatSessionRepository extends JpaRepository<ChatSession, UUID> {}
