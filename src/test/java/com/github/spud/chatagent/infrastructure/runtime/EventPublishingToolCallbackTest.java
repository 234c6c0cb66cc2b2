package com.github.spud.chatagent.infrastructure.runtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.github.spud.chatagent.domain.event.ChatEvent;
import com.github.spud.chatagent.domain.event.ChatEventType;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.definition.DefaultToolDefinition;

class EventPublishingToolCallbackTest {

  private ToolCallback delegate;
  private List<ChatEvent> events;
  private EventPublishingToolCallback callback;

  @BeforeEach
  void setUp() {
    delegate = mock(ToolCallback.class);
    when(delegate.getToolDefinition())
      .thenReturn(new DefaultToolDefinition("lookup", "Look something up", "{}"));
    events = new CopyOnWriteArrayList<>();
    callback = new EventPublishingToolCallback(delegate, "chat-1", 3L, events::add);
  }

  @Test
  @DisplayName("A successful call is bracketed by TOOL_INVOKED and TOOL_RESULT")
  void shouldPublishInvocationAndResult() {
    when(delegate.call(any(), any())).thenReturn("found");

    assertThat(callback.call("{\"key\":\"a\"}")).isEqualTo("found");

    assertThat(events).extracting(ChatEvent::getType)
      .containsExactly(ChatEventType.TOOL_INVOKED, ChatEventType.TOOL_RESULT);
    ChatEvent invoked = events.get(0);
    ChatEvent result = events.get(1);
    assertThat(invoked.getToolName()).isEqualTo("lookup");
    assertThat(invoked.getToolInput()).isEqualTo(Map.of("key", "a"));
    assertThat(invoked.getQueryId()).isEqualTo(3L);
    assertThat(invoked.getToolUseId()).startsWith("toolu_");
    assertThat(result.getToolUseId()).isEqualTo(invoked.getToolUseId());
    assertThat(result.getToolOutput()).isEqualTo("found");
    assertThat(result.isToolError()).isFalse();
  }

  @Test
  @DisplayName("A failing tool publishes an error result and rethrows")
  void shouldPublishErrorResult() {
    when(delegate.call(any(), any())).thenThrow(new IllegalStateException("backend down"));

    assertThatThrownBy(() -> callback.call("{}"))
      .isInstanceOf(IllegalStateException.class);

    ChatEvent result = events.get(1);
    assertThat(result.getType()).isEqualTo(ChatEventType.TOOL_RESULT);
    assertThat(result.isToolError()).isTrue();
    assertThat(result.getToolOutput()).isEqualTo("backend down");
  }

  @Test
  @DisplayName("Non-JSON input is kept under the raw key")
  void shouldKeepRawInput() {
    when(delegate.call(any(), any())).thenReturn("ok");

    callback.call("plain text");

    assertThat(events.get(0).getToolInput()).isEqualTo(Map.of("raw", "plain text"));
  }
}
