package com.github.spud.chatagent.hub;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.github.spud.chatagent.application.config.SessionProperties;
import com.github.spud.chatagent.domain.event.ChatEvent;
import com.github.spud.chatagent.domain.hub.ChatFrame;
import com.github.spud.chatagent.domain.hub.ChatFrameMapper;
import com.github.spud.chatagent.domain.hub.ConnectionHub;
import com.github.spud.chatagent.domain.hub.HubConnection;
import com.github.spud.chatagent.domain.query.QueryInput;
import com.github.spud.chatagent.domain.recorder.ConversationTranscriptRecorder;
import com.github.spud.chatagent.domain.session.AgentSession;
import com.github.spud.chatagent.domain.session.AgentSessionCreatedEvent;
import com.github.spud.chatagent.domain.session.AgentSessionDestroyedEvent;
import com.github.spud.chatagent.domain.session.SessionRegistry;
import com.github.spud.chatagent.domain.store.ChatMessage;
import com.github.spud.chatagent.domain.store.ChatStore;
import com.github.spud.chatagent.domain.store.MessageRole;
import com.github.spud.chatagent.domain.store.ToolRecord;
import com.github.spud.chatagent.session.SessionTestSupport;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ConnectionHubTest {

  private static final String CHAT_ID = "chat-1";

  private ControllableRuntime runtime;
  private ChatStore chatStore;
  private SessionRegistry registry;
  private ConversationTranscriptRecorder recorder;
  private ConnectionHub hub;

  @BeforeEach
  void setUp() {
    runtime = new ControllableRuntime();
    chatStore = mock(ChatStore.class);
    SessionProperties properties = SessionTestSupport.properties(Duration.ofMillis(300),
      Duration.ofMillis(200));
    properties.setSnapshotTimeout(Duration.ofSeconds(3));
    registry = new SessionRegistry(SessionTestSupport.factory(runtime, properties),
      this::route, properties);
    recorder = new ConversationTranscriptRecorder(chatStore);
    hub = new ConnectionHub(registry, chatStore, new ChatFrameMapper(), recorder, properties);
  }

  @AfterEach
  void tearDown() {
    registry.closeAll();
  }

  @Test
  @DisplayName("Attach delivers history first, then tool history when present")
  void shouldDeliverSnapshotOnAttach() {
    ToolRecord record = ToolRecord.builder().id("toolu_1").chatId(CHAT_ID)
      .toolName("echo").toolInput(Map.of("message", "hi")).resultContent("hi")
      .timestamp(OffsetDateTime.now()).build();
    when(chatStore.loadToolRecords(CHAT_ID)).thenReturn(List.of(record));

    List<ChatFrame> frames = new CopyOnWriteArrayList<>();
    HubConnection connection = connect("conn-a", frames);
    hub.attach(CHAT_ID, connection);

    assertThat(frames).extracting(ChatFrame::getType)
      .containsExactly(ChatFrame.HISTORY, ChatFrame.TOOL_HISTORY);
    assertThat(frames.get(1).getToolUses()).containsExactly(record);
    assertThat(registry.attachments(CHAT_ID)).isEqualTo(1);
  }

  @Test
  @DisplayName("A mid-stream attach resumes with the text already delivered to others")
  void shouldResumeMidStream() {
    List<ChatFrame> first = new CopyOnWriteArrayList<>();
    AgentSession session = hub.attach(CHAT_ID, connect("conn-a", first));

    long queryId = session.send(QueryInput.text("hello"));
    await().until(() -> runtime.started(queryId));
    runtime.emit(queryId, ChatEvent.streamStarted(CHAT_ID, queryId));
    runtime.emit(queryId, ChatEvent.textDelta(CHAT_ID, queryId, "Hel"));
    runtime.emit(queryId, ChatEvent.textDelta(CHAT_ID, queryId, "lo"));
    await().until(() -> deltas(first).equals("Hello"));

    List<ChatFrame> second = new CopyOnWriteArrayList<>();
    hub.attach(CHAT_ID, connect("conn-b", second));

    assertThat(second).extracting(ChatFrame::getType)
      .containsExactly(ChatFrame.HISTORY, ChatFrame.PROCESSING_STATE);
    ChatFrame resume = second.get(1);
    assertThat(resume.getQueryId()).isEqualTo(queryId);
    assertThat(resume.getIsProcessing()).isTrue();
    assertThat(resume.getStreamingState().getIsStreaming()).isTrue();
    assertThat(resume.getStreamingState().getCurrentContent()).isEqualTo(deltas(first));

    runtime.emit(queryId, ChatEvent.textDelta(CHAT_ID, queryId, "!"));
    runtime.emit(queryId, ChatEvent.queryResult(CHAT_ID, queryId, true, null, 5L));
    runtime.complete(queryId);
    await().until(() -> types(second).contains(ChatFrame.RESULT));
    await().until(() -> types(first).contains(ChatFrame.RESULT));

    assertThat(deltas(second)).isEqualTo("!");
    assertThat(tail(first, 2)).isEqualTo(tail(second, 2));
    assertThat(hub.isProcessing(CHAT_ID)).isFalse();
    assertThat(hub.partialText(CHAT_ID)).isEmpty();
  }

  @Test
  @DisplayName("Attaching right after a turn completes sees that turn even when storage lags")
  void shouldIncludeCompletedTurnWhileStorageLags() {
    List<ChatMessage> stored = slowStore(Duration.ofMillis(400));

    List<ChatFrame> first = new CopyOnWriteArrayList<>();
    AgentSession session = hub.attach(CHAT_ID, connect("conn-a", first));
    long queryId = session.send(QueryInput.text("hello"));
    await().until(() -> runtime.started(queryId));
    runtime.emit(queryId, ChatEvent.streamStarted(CHAT_ID, queryId));
    runtime.emit(queryId, ChatEvent.textDelta(CHAT_ID, queryId, "Hi there"));
    runtime.emit(queryId, ChatEvent.streamEnded(CHAT_ID, queryId));
    runtime.emit(queryId, ChatEvent.queryResult(CHAT_ID, queryId, true, null, 5L));
    runtime.complete(queryId);
    await().until(() -> types(first).contains(ChatFrame.RESULT));

    List<ChatFrame> second = new CopyOnWriteArrayList<>();
    hub.attach(CHAT_ID, connect("conn-b", second));

    assertThat(second).extracting(ChatFrame::getType).containsExactly(ChatFrame.HISTORY);
    assertThat(second.get(0).getMessages())
      .extracting(ChatMessage::getRole, ChatMessage::getContent)
      .containsExactly(tuple(MessageRole.USER, "hello"), tuple(MessageRole.ASSISTANT, "Hi there"));
    assertThat(stored).hasSize(2);
  }

  @Test
  @DisplayName("A mid-stream attach sees the in-flight user message even when storage lags")
  void shouldIncludeInFlightUserMessageWhileStorageLags() {
    slowStore(Duration.ofMillis(400));

    List<ChatFrame> first = new CopyOnWriteArrayList<>();
    AgentSession session = hub.attach(CHAT_ID, connect("conn-a", first));
    long queryId = session.send(QueryInput.text("hello"));
    await().until(() -> runtime.started(queryId));
    runtime.emit(queryId, ChatEvent.streamStarted(CHAT_ID, queryId));
    runtime.emit(queryId, ChatEvent.textDelta(CHAT_ID, queryId, "Hi"));
    await().until(() -> deltas(first).equals("Hi"));

    List<ChatFrame> second = new CopyOnWriteArrayList<>();
    hub.attach(CHAT_ID, connect("conn-b", second));

    assertThat(second).extracting(ChatFrame::getType)
      .containsExactly(ChatFrame.HISTORY, ChatFrame.PROCESSING_STATE);
    assertThat(second.get(0).getMessages())
      .extracting(ChatMessage::getRole, ChatMessage::getContent)
      .containsExactly(tuple(MessageRole.USER, "hello"));
    assertThat(second.get(1).getStreamingState().getCurrentContent()).isEqualTo("Hi");
  }

  @Test
  @DisplayName("Detaching one of two connections keeps the session attached")
  void shouldReleaseOnDetach() {
    HubConnection a = connect("conn-a", new CopyOnWriteArrayList<>());
    HubConnection b = connect("conn-b", new CopyOnWriteArrayList<>());
    hub.attach(CHAT_ID, a);
    hub.attach(CHAT_ID, b);
    assertThat(registry.attachments(CHAT_ID)).isEqualTo(2);

    hub.detach(CHAT_ID, a);
    hub.detach(CHAT_ID, a);
    assertThat(registry.attachments(CHAT_ID)).isEqualTo(1);
    assertThat(hub.connectionCount(CHAT_ID)).isEqualTo(1);

    hub.detach(CHAT_ID, b);
    await().until(() -> registry.find(CHAT_ID).isEmpty());
  }

  @Test
  @DisplayName("A closed connection is dropped on the next dispatch and its attachment released")
  void shouldDropDeadConnection() {
    HubConnection live = connect("conn-a", new CopyOnWriteArrayList<>());
    HubConnection dead = connect("conn-b", new CopyOnWriteArrayList<>());
    AgentSession session = hub.attach(CHAT_ID, live);
    hub.attach(CHAT_ID, dead);
    dead.close();

    session.send(QueryInput.text("hello"));

    await().until(() -> hub.connectionCount(CHAT_ID) == 1);
    await().until(() -> registry.attachments(CHAT_ID) == 1);
  }

  @Test
  @DisplayName("evict() removes every connection of the conversation")
  void shouldEvictAll() {
    hub.attach(CHAT_ID, connect("conn-a", new CopyOnWriteArrayList<>()));
    hub.attach(CHAT_ID, connect("conn-b", new CopyOnWriteArrayList<>()));

    assertThat(hub.evict(CHAT_ID)).isEqualTo(2);
    assertThat(hub.connectionCount(CHAT_ID)).isZero();
    assertThat(hub.evict(CHAT_ID)).isZero();
  }

  private List<ChatMessage> slowStore(Duration delay) {
    List<ChatMessage> stored = new CopyOnWriteArrayList<>();
    when(chatStore.appendMessage(eq(CHAT_ID), any(), any(), any())).thenAnswer(invocation -> {
      Thread.sleep(delay.toMillis());
      ChatMessage message = ChatMessage.builder().id((long) stored.size() + 1).chatId(CHAT_ID)
        .role(invocation.getArgument(1)).content(invocation.getArgument(2)).build();
      stored.add(message);
      return message;
    });
    when(chatStore.loadHistory(CHAT_ID)).thenAnswer(invocation -> List.copyOf(stored));
    return stored;
  }

  private void route(Object event) {
    if (event instanceof AgentSessionCreatedEvent) {
      recorder.onSessionCreated((AgentSessionCreatedEvent) event);
      hub.onSessionCreated((AgentSessionCreatedEvent) event);
    } else if (event instanceof AgentSessionDestroyedEvent) {
      hub.onSessionDestroyed((AgentSessionDestroyedEvent) event);
    }
  }

  private static HubConnection connect(String id, List<ChatFrame> sink) {
    HubConnection connection = new HubConnection(id);
    connection.outbound().subscribe(sink::add);
    return connection;
  }

  private static String deltas(List<ChatFrame> frames) {
    StringBuilder text = new StringBuilder();
    frames.stream()
      .filter(frame -> ChatFrame.TEXT_DELTA.equals(frame.getType()))
      .forEach(frame -> text.append(frame.getDelta()));
    return text.toString();
  }

  private static List<String> types(List<ChatFrame> frames) {
    return frames.stream().map(ChatFrame::getType).toList();
  }

  private static List<ChatFrame> tail(List<ChatFrame> frames, int n) {
    return List.copyOf(frames.subList(frames.size() - n, frames.size()));
  }
}
