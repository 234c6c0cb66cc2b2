package com.github.spud.chatagent.domain.hub;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.github.spud.chatagent.domain.query.ImageAttachment;
import com.github.spud.chatagent.domain.store.ChatMessage;
import com.github.spud.chatagent.domain.store.ToolRecord;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * WebSocket 出站帧
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ChatFrame {

  public static final String CONNECTED = "connected";
  public static final String HISTORY = "history";
  public static final String TOOL_HISTORY = "tool_history";
  public static final String PROCESSING_STATE = "processing_state";
  public static final String USER_MESSAGE = "user_message";
  public static final String STREAM_START = "stream_start";
  public static final String TEXT_DELTA = "text_delta";
  public static final String STREAM_END = "stream_end";
  public static final String TOOL_USE = "tool_use";
  public static final String TOOL_RESULT = "tool_result";
  public static final String RESULT = "result";
  public static final String CANCELLED = "cancelled";
  public static final String ERROR = "error";
  public static final String HISTORY_CLEARED = "history_cleared";

  private String type;
  private String chatId;
  private Long queryId;

  private String message;
  private String error;

  // user_message / tool_result
  private String content;
  private List<ImageAttachment> images;

  // text_delta
  private String delta;

  // tool_use / tool_result
  private String toolName;
  private String toolId;
  private Map<String, Object> toolInput;
  private Boolean isError;

  // result
  private Boolean success;
  private Double cost;
  private Long duration;

  // history / tool_history
  private List<ChatMessage> messages;
  private List<ToolRecord> toolUses;

  // processing_state
  private Boolean isProcessing;
  private StreamingState streamingState;

  public static ChatFrame connected() {
    return ChatFrame.builder().type(CONNECTED).message("Connected to chat server").build();
  }

  public static ChatFrame error(String chatId, String error) {
    return ChatFrame.builder().type(ERROR).chatId(chatId).error(error).build();
  }

  public static ChatFrame historyCleared(String chatId) {
    return ChatFrame.builder().type(HISTORY_CLEARED).chatId(chatId).build();
  }

  public static ChatFrame history(String chatId, List<ChatMessage> messages) {
    return ChatFrame.builder().type(HISTORY).chatId(chatId).messages(messages).build();
  }

  public static ChatFrame toolHistory(String chatId, List<ToolRecord> toolUses) {
    return ChatFrame.builder().type(TOOL_HISTORY).chatId(chatId).toolUses(toolUses).build();
  }

  public static ChatFrame processingState(String chatId, long queryId, String partialText) {
    return ChatFrame.builder()
      .type(PROCESSING_STATE)
      .chatId(chatId)
      .queryId(queryId)
      .isProcessing(Boolean.TRUE)
      .streamingState(new StreamingState(!partialText.isEmpty(), partialText))
      .build();
  }

  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public static class StreamingState {

    private Boolean isStreaming;
    private String currentContent;
  }
}
