package com.github.spud.chatagent.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

import com.github.spud.chatagent.application.config.SessionProperties;
import com.github.spud.chatagent.domain.query.QueryInput;
import com.github.spud.chatagent.domain.session.AgentSession;
import com.github.spud.chatagent.domain.session.AgentSessionCreatedEvent;
import com.github.spud.chatagent.domain.session.AgentSessionDestroyedEvent;
import com.github.spud.chatagent.domain.session.AgentSessionFactory;
import com.github.spud.chatagent.domain.session.SessionRegistry;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SessionRegistryTest {

  private static final Duration GRACE = Duration.ofMillis(200);

  private List<Object> published;
  private SessionRegistry registry;

  @BeforeEach
  void setUp() {
    SessionProperties properties = new SessionProperties();
    properties.setInterruptTimeout(Duration.ofMillis(200));
    properties.setIdleGracePeriod(GRACE);
    AgentSessionFactory factory = new AgentSessionFactory(new ScriptedAgentRuntime(),
      new RecordingStateMachineDriver(), properties);

    published = new CopyOnWriteArrayList<>();
    registry = new SessionRegistry(factory, published::add, properties);
  }

  @AfterEach
  void tearDown() {
    registry.closeAll();
  }

  @Test
  @DisplayName("Concurrent getOrCreate returns a single instance")
  void shouldCreateSingleSessionUnderContention() throws Exception {
    int threads = 16;
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Callable<AgentSession>> tasks = IntStream.range(0, threads)
        .<Callable<AgentSession>>mapToObj(i -> () -> {
          start.await();
          return i % 2 == 0 ? registry.getOrCreate("chat-1") : registry.retain("chat-1");
        })
        .toList();
      List<Future<AgentSession>> futures = tasks.stream().map(executor::submit).toList();
      start.countDown();

      Set<AgentSession> sessions = ConcurrentHashMap.newKeySet();
      for (Future<AgentSession> future : futures) {
        sessions.add(future.get());
      }
      assertThat(sessions).hasSize(1);
      assertThat(registry.size()).isEqualTo(1);
      assertThat(registry.attachments("chat-1")).isEqualTo(threads / 2);
      assertThat(published).filteredOn(AgentSessionCreatedEvent.class::isInstance).hasSize(1);
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  @DisplayName("No teardown while one of two connections stays attached")
  void shouldKeepSessionWhileAttached() throws InterruptedException {
    AgentSession session = registry.retain("chat-1");
    registry.retain("chat-1");

    registry.release("chat-1");
    Thread.sleep(GRACE.multipliedBy(3).toMillis());
    assertThat(registry.find("chat-1")).containsSame(session);
    assertThat(session.isClosed()).isFalse();

    registry.release("chat-1");
    await().until(() -> registry.find("chat-1").isEmpty());
    assertThat(session.isClosed()).isTrue();
    assertThat(published).filteredOn(AgentSessionDestroyedEvent.class::isInstance).hasSize(1);
  }

  @Test
  @DisplayName("Re-attaching within the grace period cancels the teardown")
  void shouldCancelTeardownOnReattach() throws InterruptedException {
    AgentSession session = registry.retain("chat-1");
    registry.release("chat-1");
    assertThat(registry.retain("chat-1")).isSameAs(session);

    Thread.sleep(GRACE.multipliedBy(3).toMillis());
    assertThat(registry.find("chat-1")).containsSame(session);
    assertThat(registry.attachments("chat-1")).isEqualTo(1);
  }

  @Test
  @DisplayName("A session created without attachment is torn down after the grace period")
  void shouldTearDownUnattachedSession() {
    AgentSession session = registry.getOrCreate("chat-1");

    await().atMost(Duration.ofSeconds(5)).until(() -> registry.find("chat-1").isEmpty());
    assertThat(session.isClosed()).isTrue();
  }

  @Test
  @DisplayName("remove() destroys the session immediately and a new one can be created")
  void shouldRemoveImmediately() {
    AgentSession session = registry.retain("chat-1");

    assertThat(registry.remove("chat-1")).isTrue();
    assertThat(session.isClosed()).isTrue();
    assertThat(registry.find("chat-1")).isEmpty();
    assertThat(registry.remove("chat-1")).isFalse();

    assertThat(registry.getOrCreate("chat-1")).isNotSameAs(session);
  }

  @Test
  @DisplayName("Closing a stuck session blocks neither other conversations nor the registry")
  void shouldCloseOutsideRegistryLock() throws Exception {
    ScriptedAgentRuntime stuck = new ScriptedAgentRuntime();
    stuck.ignoreInterrupt();
    SessionProperties properties = SessionTestSupport.properties(Duration.ofSeconds(2),
      Duration.ofSeconds(30));
    List<Object> events = new CopyOnWriteArrayList<>();
    SessionRegistry slowRegistry = new SessionRegistry(
      SessionTestSupport.factory(stuck, properties), events::add, properties);
    ExecutorService executor = Executors.newFixedThreadPool(2);
    try {
      AgentSession slow = slowRegistry.retain("slow");
      long queryId = slow.send(QueryInput.text("hello"));
      await().until(() -> stuck.started(queryId));

      Future<Boolean> removal = executor.submit(() -> slowRegistry.remove("slow"));
      await().until(() -> slowRegistry.find("slow").isEmpty());

      long begin = System.nanoTime();
      AgentSession other = slowRegistry.retain("unrelated");
      slowRegistry.release("unrelated");
      long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - begin);
      assertThat(elapsedMs).isLessThan(500);
      assertThat(other.isClosed()).isFalse();

      // 同一 id 的获取要等到旧会话关闭完成
      Future<AgentSession> recreated = executor.submit(() -> slowRegistry.getOrCreate("slow"));
      Thread.sleep(200);
      assertThat(removal.isDone()).isFalse();
      assertThat(recreated.isDone()).isFalse();

      assertThat(removal.get(5, TimeUnit.SECONDS)).isTrue();
      assertThat(slow.isClosed()).isTrue();
      assertThat(recreated.get(5, TimeUnit.SECONDS)).isNotSameAs(slow);
      assertThat(lifecycle(events, "slow")).containsExactly("created", "destroyed", "created");
    } finally {
      executor.shutdownNow();
      slowRegistry.closeAll();
    }
  }

  private static List<String> lifecycle(List<Object> events, String conversationId) {
    return events.stream()
      .map(event -> {
        if (event instanceof AgentSessionCreatedEvent && ((AgentSessionCreatedEvent) event)
          .getSession().getConversationId().equals(conversationId)) {
          return "created";
        }
        if (event instanceof AgentSessionDestroyedEvent && ((AgentSessionDestroyedEvent) event)
          .getConversationId().equals(conversationId)) {
          return "destroyed";
        }
        return null;
      })
      .filter(Objects::nonNull)
      .toList();
  }
}
