package com.flamingo.ai.pagereader.service.chat;

import com.flamingo.ai.pagereader.api.dto.request.AskRequest;
import com.flamingo.ai.pagereader.api.dto.response.AskResponse;
import java.util.UUID;

/** Document-grounded question answering. */
public interface AssistantChatService {

  /**
   * Answers a question about a document, continuing or starting a session.
   *
   * @param ownerId authenticated owner
   * @param request the question and where the reader is
   * @return the answer with its session and cited pages
   */
  AskResponse ask(String ownerId, AskRequest request);

  /** Loads a session of the caller with all its messages. */
  ChatHistory getChatHistory(String ownerId, UUID sessionId);
}
