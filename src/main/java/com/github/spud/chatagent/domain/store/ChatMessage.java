package com.github.spud.chatagent.domain.store;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.github.spud.chatagent.domain.query.ImageAttachment;
import java.time.OffsetDateTime;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 持久化的一条聊天消息
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ChatMessage {

  private Long id;
  private String chatId;
  private MessageRole role;
  private String content;
  private OffsetDateTime timestamp;

  @JsonInclude(JsonInclude.Include.NON_EMPTY)
  private List<ImageAttachment> images;
}
