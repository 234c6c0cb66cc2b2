package com.github.spud.chatagent.domain.hub;

import com.github.spud.chatagent.domain.event.ChatEvent;
import org.springframework.stereotype.Component;

/**
 * Maps session events to outbound frames
 */
@Component
public class ChatFrameMapper {

  public ChatFrame toFrame(ChatEvent event) {
    ChatFrame.ChatFrameBuilder frame = ChatFrame.builder()
      .chatId(event.getConversationId())
      .queryId(event.getQueryId());

    switch (event.getType()) {
      case USER_MESSAGE -> frame.type(ChatFrame.USER_MESSAGE)
        .content(event.getInput().getContent())
        .images(event.getInput().hasImages() ? event.getInput().getImages() : null);
      case STREAM_STARTED -> frame.type(ChatFrame.STREAM_START);
      case TEXT_DELTA -> frame.type(ChatFrame.TEXT_DELTA).delta(event.getText());
      case STREAM_ENDED -> frame.type(ChatFrame.STREAM_END);
      case TOOL_INVOKED -> frame.type(ChatFrame.TOOL_USE)
        .toolName(event.getToolName())
        .toolId(event.getToolUseId())
        .toolInput(event.getToolInput());
      case TOOL_RESULT -> frame.type(ChatFrame.TOOL_RESULT)
        .toolId(event.getToolUseId())
        .content(event.getToolOutput())
        .isError(event.isToolError());
      case QUERY_RESULT -> frame.type(ChatFrame.RESULT)
        .success(event.isSuccess())
        .cost(event.getCost())
        .duration(event.getDurationMs());
      case QUERY_CANCELLED -> frame.type(ChatFrame.CANCELLED);
      case QUERY_FAILED -> frame.type(ChatFrame.ERROR).error(event.getReason());
      case HISTORY_CLEARED -> frame.type(ChatFrame.HISTORY_CLEARED);
      default -> throw new IllegalArgumentException("Unmapped event type: " + event.getType());
    }
    return frame.build();
  }
}
