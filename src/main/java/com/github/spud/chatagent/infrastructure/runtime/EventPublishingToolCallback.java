package com.github.spud.chatagent.infrastructure.runtime;

import com.github.spud.chatagent.domain.event.ChatEvent;
import com.github.spud.chatagent.util.JsonUtils;
import java.util.Map;
import java.util.UUID;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.model.ToolContext;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.definition.ToolDefinition;
import org.springframework.ai.tool.metadata.ToolMetadata;
import org.springframework.boot.json.JsonParseException;

/**
 * 包装 ToolCallback，在调用前后发布 TOOL_INVOKED / TOOL_RESULT 事件
 */
@Slf4j
public class EventPublishingToolCallback implements ToolCallback {

  private final ToolCallback delegate;
  private final String conversationId;
  private final long queryId;
  private final Consumer<ChatEvent> listener;

  public EventPublishingToolCallback(ToolCallback delegate, String conversationId, long queryId,
    Consumer<ChatEvent> listener) {
    this.delegate = delegate;
    this.conversationId = conversationId;
    this.queryId = queryId;
    this.listener = listener;
  }

  @Override
  public ToolDefinition getToolDefinition() {
    return delegate.getToolDefinition();
  }

  @Override
  public ToolMetadata getToolMetadata() {
    return delegate.getToolMetadata();
  }

  @Override
  public String call(String toolInput) {
    return call(toolInput, null);
  }

  @Override
  public String call(String toolInput, ToolContext toolContext) {
    String toolUseId = "toolu_" + UUID.randomUUID().toString().replace("-", "");
    String toolName = getToolDefinition().name();

    listener.accept(ChatEvent.toolInvoked(conversationId, queryId, toolUseId, toolName,
      parseInput(toolInput)));
    try {
      String result = delegate.call(toolInput, toolContext);
      listener.accept(ChatEvent.toolResult(conversationId, queryId, toolUseId, result, false));
      return result;
    } catch (RuntimeException e) {
      log.warn("Tool {} failed in conversation {}: {}", toolName, conversationId, e.getMessage());
      listener.accept(ChatEvent.toolResult(conversationId, queryId, toolUseId,
        e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), true));
      throw e;
    }
  }

  private static Map<String, Object> parseInput(String toolInput) {
    try {
      return JsonUtils.toMap(toolInput);
    } catch (JsonParseException e) {
      return Map.of("raw", toolInput);
    }
  }
}
