package com.github.spud.chatagent.transport;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.github.spud.chatagent.application.ChatTransportService;
import com.github.spud.chatagent.application.ChatTransportService.ClientContext;
import com.github.spud.chatagent.application.config.SessionProperties;
import com.github.spud.chatagent.domain.event.ChatEvent;
import com.github.spud.chatagent.domain.hub.ChatFrame;
import com.github.spud.chatagent.domain.hub.ChatFrameMapper;
import com.github.spud.chatagent.domain.hub.ConnectionHub;
import com.github.spud.chatagent.domain.query.QueryInput;
import com.github.spud.chatagent.domain.recorder.ConversationTranscriptRecorder;
import com.github.spud.chatagent.domain.runtime.AgentRuntime;
import com.github.spud.chatagent.domain.session.AgentSessionCreatedEvent;
import com.github.spud.chatagent.domain.session.AgentSessionDestroyedEvent;
import com.github.spud.chatagent.domain.session.SessionRegistry;
import com.github.spud.chatagent.domain.store.Chat;
import com.github.spud.chatagent.domain.store.ChatStore;
import com.github.spud.chatagent.session.SessionTestSupport;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;

class ChatTransportServiceTest {

  private static final String CHAT_ID = "chat-1";

  private ChatStore chatStore;
  private AgentRuntime runtime;
  private SessionRegistry registry;
  private ConnectionHub hub;
  private ChatTransportService transportService;
  private List<ChatFrame> frames;
  private ClientContext client;

  @BeforeEach
  void setUp() {
    chatStore = mock(ChatStore.class);
    when(chatStore.getChat(anyString())).thenReturn(Optional.empty());
    when(chatStore.getChat(CHAT_ID)).thenReturn(Optional.of(Chat.builder().id(CHAT_ID)
      .title(Chat.DEFAULT_TITLE).build()));
    when(chatStore.getChat("chat-2")).thenReturn(Optional.of(Chat.builder().id("chat-2")
      .title(Chat.DEFAULT_TITLE).build()));

    runtime = mock(AgentRuntime.class);
    when(runtime.run(anyString(), anyLong(),
      any(QueryInput.class)))
      .thenAnswer(invocation -> {
        String chatId = invocation.getArgument(0);
        long queryId = invocation.getArgument(1);
        return Flux.just(ChatEvent.textDelta(chatId, queryId, "pong"),
          ChatEvent.queryResult(chatId, queryId, true, null, 1L));
      });

    SessionProperties properties = SessionTestSupport.properties(Duration.ofMillis(300),
      Duration.ofMillis(200));
    registry = new SessionRegistry(SessionTestSupport.factory(runtime, properties),
      this::route, properties);
    hub = new ConnectionHub(registry, chatStore, new ChatFrameMapper(),
      new ConversationTranscriptRecorder(chatStore), properties);
    transportService = new ChatTransportService(chatStore, registry, hub);

    frames = new CopyOnWriteArrayList<>();
    client = transportService.open("conn-1");
    client.getConnection().outbound().subscribe(frames::add);
  }

  @AfterEach
  void tearDown() {
    registry.closeAll();
  }

  @Test
  @DisplayName("Opening a connection sends the connected frame")
  void shouldGreet() {
    assertThat(frames).singleElement().satisfies(frame -> {
      assertThat(frame.getType()).isEqualTo(ChatFrame.CONNECTED);
      assertThat(frame.getMessage()).isEqualTo("Connected to chat server");
    });
  }

  @Test
  @DisplayName("Missing chat_id and unknown chats become error frames")
  void shouldRejectBadChatIds() {
    transportService.subscribe(client, null);
    transportService.subscribe(client, "missing");

    assertThat(errors()).containsExactly("chat_id is required", "Chat not found");
    assertThat(registry.size()).isZero();
  }

  @Test
  @DisplayName("Subscribing to another chat detaches from the previous one")
  void shouldSwitchSubscription() {
    transportService.subscribe(client, CHAT_ID);
    transportService.subscribe(client, "chat-2");

    assertThat(client.getChatId()).isEqualTo("chat-2");
    assertThat(registry.attachments(CHAT_ID)).isZero();
    assertThat(registry.attachments("chat-2")).isEqualTo(1);
    assertThat(types()).containsExactly(ChatFrame.CONNECTED, ChatFrame.HISTORY,
      ChatFrame.HISTORY);
  }

  @Test
  @DisplayName("A chat message auto-attaches and streams the answer back")
  void shouldSubmitWithAutoAttach() {
    transportService.submit(client, CHAT_ID, "ping", null);

    assertThat(client.getChatId()).isEqualTo(CHAT_ID);
    await().until(() -> types().contains(ChatFrame.RESULT));
    assertThat(types()).containsExactly(ChatFrame.CONNECTED, ChatFrame.HISTORY,
      ChatFrame.USER_MESSAGE, ChatFrame.TEXT_DELTA, ChatFrame.RESULT);
  }

  @Test
  @DisplayName("Empty chat input is rejected before reaching the session")
  void shouldRejectEmptyInput() {
    transportService.submit(client, CHAT_ID, "   ", List.of());

    assertThat(errors()).containsExactly("content or images is required");
    verify(runtime, never()).run(anyString(), anyLong(),
      any(QueryInput.class));
  }

  @Test
  @DisplayName("stop without a live session reports 'No active session'")
  void shouldReportNoActiveSession() {
    transportService.requestCancel(client, CHAT_ID);

    assertThat(errors()).containsExactly("No active session");
  }

  @Test
  @DisplayName("clear_history without a live session clears storage directly")
  void shouldClearStorageWithoutSession() {
    transportService.clearHistory(client, CHAT_ID);

    verify(chatStore).clearMessages(CHAT_ID);
    verify(chatStore).clearToolRecords(CHAT_ID);
    assertThat(types()).containsExactly(ChatFrame.CONNECTED, ChatFrame.HISTORY_CLEARED);
  }

  @Test
  @DisplayName("clear_history with a live session resets it and broadcasts history_cleared")
  void shouldResetLiveSession() {
    transportService.subscribe(client, CHAT_ID);

    transportService.clearHistory(client, CHAT_ID);

    verify(runtime).reset(CHAT_ID);
    await().until(() -> types().contains(ChatFrame.HISTORY_CLEARED));
  }

  @Test
  @DisplayName("Disconnect detaches and completes the outbound stream")
  void shouldDetachOnDisconnect() {
    transportService.subscribe(client, CHAT_ID);

    transportService.disconnect(client);

    assertThat(client.getChatId()).isNull();
    assertThat(client.getConnection().isClosed()).isTrue();
    assertThat(registry.attachments(CHAT_ID)).isZero();
    assertThat(hub.connectionCount(CHAT_ID)).isZero();
  }

  private void route(Object event) {
    if (event instanceof AgentSessionCreatedEvent) {
      hub.onSessionCreated((AgentSessionCreatedEvent) event);
    } else if (event instanceof AgentSessionDestroyedEvent) {
      hub.onSessionDestroyed((AgentSessionDestroyedEvent) event);
    }
  }

  private List<String> types() {
    return frames.stream().map(ChatFrame::getType).toList();
  }

  private List<String> errors() {
    return frames.stream()
      .filter(frame -> ChatFrame.ERROR.equals(frame.getType()))
      .map(ChatFrame::getError)
      .toList();
  }
}
