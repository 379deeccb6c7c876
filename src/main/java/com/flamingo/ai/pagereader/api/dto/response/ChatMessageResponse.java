package com.flamingo.ai.pagereader.api.dto.response;

import com.flamingo.ai.pagereader.domain.entity.ChatMessage;
import com.flamingo.ai.pagereader.domain.enums.MessageRole;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a stored chat turn. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatMessageResponse {

  private UUID id;
  private MessageRole role;
  private String content;
  private List<Integer> citations;
  private Integer tokenCount;
  private LocalDateTime createdAt;

  public static ChatMessageResponse fromEntity(ChatMessage message) {
    return ChatMessageResponse.builder()
        .id(message.getId())
        .role(message.getRole())
        .content(message.getContent())
        .citations(message.getCitations())
        .tokenCount(message.getTokenCount())
        .createdAt(message.getCreatedAt())
        .build();
  }
}
