package com.flamingo.ai.pagereader.api.dto.response;

import com.flamingo.ai.pagereader.service.chat.ChatHistory;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a session and its messages. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatHistoryResponse {

  private UUID sessionId;
  private UUID documentId;
  private String title;
  private LocalDateTime createdAt;
  private List<ChatMessageResponse> messages;

  public static ChatHistoryResponse from(ChatHistory history) {
    return ChatHistoryResponse.builder()
        .sessionId(history.session().getId())
        .documentId(history.session().getDocumentId())
        .title(history.session().getTitle())
        .createdAt(history.session().getCreatedAt())
        .messages(history.messages().stream().map(ChatMessageResponse::fromEntity).toList())
        .build();
  }
}
