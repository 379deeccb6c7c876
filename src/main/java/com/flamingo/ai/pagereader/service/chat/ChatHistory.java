package com.flamingo.ai.pagereader.service.chat;

import com.flamingo.ai.pagereader.domain.entity.ChatMessage;
import com.flamingo.ai.pagereader.domain.entity.ChatSession;
import java.util.List;

/**
 * A session with its messages in creation order.
 *
 * @param session the session
 * @param messages messages, oldest first
 */
public record ChatHistory(ChatSession session, List<ChatMessage> messages) {}
