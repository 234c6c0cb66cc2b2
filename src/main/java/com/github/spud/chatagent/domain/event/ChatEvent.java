package com.github.spud.chatagent.domain.event;

import com.github.spud.chatagent.domain.query.QueryInput;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.With;

/**
 * 会话事件流中的一个事件
 * <p>
 * 所有事件都携带 conversationId 与 queryId；其余字段按类型填充。
 * {@code sequence} 由会话在写入事件流时分配，同一会话内从 1 递增。
 */
@Getter
@Builder
@ToString(exclude = "input")
public class ChatEvent {

  private final ChatEventType type;
  private final String conversationId;
  private final long queryId;
  @Builder.Default
  private final Instant timestamp = Instant.now();
  @With
  private final long sequence;

  // USER_MESSAGE
  private final QueryInput input;

  // TEXT_DELTA
  private final String text;

  // TOOL_INVOKED / TOOL_RESULT
  private final String toolUseId;
  private final String toolName;
  private final Map<String, Object> toolInput;
  private final String toolOutput;
  private final boolean toolError;

  // QUERY_RESULT
  private final boolean success;
  private final Double cost;
  private final Long durationMs;

  // QUERY_FAILED
  private final String reason;

  public static ChatEvent userMessage(String conversationId, long queryId, QueryInput input) {
    return ChatEvent.builder().type(ChatEventType.USER_MESSAGE)
      .conversationId(conversationId).queryId(queryId).input(input).build();
  }

  public static ChatEvent streamStarted(String conversationId, long queryId) {
    return of(ChatEventType.STREAM_STARTED, conversationId, queryId);
  }

  public static ChatEvent textDelta(String conversationId, long queryId, String text) {
    return ChatEvent.builder().type(ChatEventType.TEXT_DELTA)
      .conversationId(conversationId).queryId(queryId).text(text).build();
  }

  public static ChatEvent streamEnded(String conversationId, long queryId) {
    return of(ChatEventType.STREAM_ENDED, conversationId, queryId);
  }

  public static ChatEvent toolInvoked(String conversationId, long queryId, String toolUseId,
    String toolName, Map<String, Object> toolInput) {
    return ChatEvent.builder().type(ChatEventType.TOOL_INVOKED)
      .conversationId(conversationId).queryId(queryId)
      .toolUseId(toolUseId).toolName(toolName).toolInput(toolInput)
      .build();
  }

  public static ChatEvent toolResult(String conversationId, long queryId, String toolUseId,
    String output, boolean error) {
    return ChatEvent.builder().type(ChatEventType.TOOL_RESULT)
      .conversationId(conversationId).queryId(queryId)
      .toolUseId(toolUseId).toolOutput(output).toolError(error)
      .build();
  }

  public static ChatEvent queryResult(String conversationId, long queryId, boolean success,
    Double cost, Long durationMs) {
    return ChatEvent.builder().type(ChatEventType.QUERY_RESULT)
      .conversationId(conversationId).queryId(queryId)
      .success(success).cost(cost).durationMs(durationMs)
      .build();
  }

  public static ChatEvent queryCancelled(String conversationId, long queryId) {
    return of(ChatEventType.QUERY_CANCELLED, conversationId, queryId);
  }

  public static ChatEvent queryFailed(String conversationId, long queryId, String reason) {
    return ChatEvent.builder().type(ChatEventType.QUERY_FAILED)
      .conversationId(conversationId).queryId(queryId).reason(reason).build();
  }

  public static ChatEvent historyCleared(String conversationId, long queryId) {
    return of(ChatEventType.HISTORY_CLEARED, conversationId, queryId);
  }

  private static ChatEvent of(ChatEventType type, String conversationId, long queryId) {
    return ChatEvent.builder().type(type).conversationId(conversationId).queryId(queryId).build();
  }
}
