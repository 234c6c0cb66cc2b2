package com.github.spud.chatagent.domain.session;

import com.github.spud.chatagent.application.config.SessionProperties;
import jakarta.annotation.PreDestroy;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * 进程级 ConversationId → AgentSession 注册表
 * <p>
 * 所有对表的修改都在 {@code lock} 下完成，单飞创建保证同一会话最多只有一个 AgentSession。
 * 没有连接的会话在空闲宽限期之后销毁；宽限期内有新连接则取消销毁。
 * 会话的关闭（可能有界等待运行时退出）在锁外进行：条目先从表中移除并登记为关闭中，
 * 同一 id 的获取等待关闭完成后再创建新会话，其他会话不受影响。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionRegistry {

  private final AgentSessionFactory sessionFactory;
  private final ApplicationEventPublisher eventPublisher;
  private final SessionProperties sessionProperties;

  private final Object lock = new Object();

  // guarded by lock
  private final Map<String, Entry> entries = new HashMap<>();

  // guarded by lock
  private final Map<String, CompletableFuture<Void>> closing = new HashMap<>();

  /**
   * 获取或创建会话。创建时同步发布 {@link AgentSessionCreatedEvent}，
   * 没有连接的新会话同样进入空闲销毁计时。
   */
  public AgentSession getOrCreate(String conversationId) {
    return acquire(conversationId, false);
  }

  /**
   * 增加一个连接（必要时创建会话），并取消待执行的销毁
   */
  public AgentSession retain(String conversationId) {
    return acquire(conversationId, true);
  }

  /**
   * 减少一个连接；归零时在宽限期后销毁
   */
  public void release(String conversationId) {
    synchronized (lock) {
      Entry entry = entries.get(conversationId);
      if (entry == null) {
        return;
      }
      entry.attachments = Math.max(0, entry.attachments - 1);
      log.debug("Released conversation {}, attachments={}", conversationId, entry.attachments);
      if (entry.attachments == 0) {
        scheduleTeardown(conversationId, entry);
      }
    }
  }

  public Optional<AgentSession> find(String conversationId) {
    synchronized (lock) {
      Entry entry = entries.get(conversationId);
      return entry == null ? Optional.empty() : Optional.of(entry.session);
    }
  }

  public int attachments(String conversationId) {
    synchronized (lock) {
      Entry entry = entries.get(conversationId);
      return entry == null ? 0 : entry.attachments;
    }
  }

  public int size() {
    synchronized (lock) {
      return entries.size();
    }
  }

  /**
   * 立即销毁（聊天被删除时使用）
   *
   * @return 是否存在并销毁了会话
   */
  public boolean remove(String conversationId) {
    Entry entry;
    CompletableFuture<Void> closed;
    synchronized (lock) {
      entry = entries.remove(conversationId);
      if (entry == null) {
        return false;
      }
      closed = markClosing(conversationId, entry);
    }
    destroy(conversationId, entry, closed);
    return true;
  }

  @PreDestroy
  public void closeAll() {
    Map<String, Entry> removed;
    Map<String, CompletableFuture<Void>> futures = new HashMap<>();
    synchronized (lock) {
      log.info("Closing {} agent sessions", entries.size());
      removed = new HashMap<>(entries);
      entries.clear();
      removed.forEach((id, entry) -> futures.put(id, markClosing(id, entry)));
    }
    removed.forEach((id, entry) -> {
      try {
        destroy(id, entry, futures.get(id));
      } catch (RuntimeException e) {
        log.error("Failed to destroy agent session for conversation {}", id, e);
      }
    });
  }

  private AgentSession acquire(String conversationId, boolean attach) {
    while (true) {
      CompletableFuture<Void> pending;
      synchronized (lock) {
        pending = closing.get(conversationId);
        if (pending == null) {
          Entry entry = entryFor(conversationId);
          if (attach) {
            entry.attachments++;
            entry.cancelTeardown();
            log.debug("Retained conversation {}, attachments={}", conversationId,
              entry.attachments);
          }
          return entry.session;
        }
      }
      log.debug("Waiting for the previous session of conversation {} to close", conversationId);
      pending.join();
    }
  }

  private Entry entryFor(String conversationId) {
    Entry entry = entries.get(conversationId);
    if (entry != null) {
      return entry;
    }

    AgentSession session = sessionFactory.create(conversationId);
    entry = new Entry(session);
    entries.put(conversationId, entry);
    log.info("Created agent session for conversation {}", conversationId);

    // 读者必须在任何 Query 运行前订阅
    eventPublisher.publishEvent(new AgentSessionCreatedEvent(this, session));
    scheduleTeardown(conversationId, entry);
    return entry;
  }

  private void scheduleTeardown(String conversationId, Entry entry) {
    entry.cancelTeardown();
    entry.pendingTeardown = Mono
      .delay(sessionProperties.getIdleGracePeriod(), Schedulers.boundedElastic())
      .subscribe(
        tick -> teardownIfIdle(conversationId, entry),
        error -> log.error("Idle teardown failed for conversation {}", conversationId, error));
  }

  private void teardownIfIdle(String conversationId, Entry entry) {
    CompletableFuture<Void> closed;
    synchronized (lock) {
      if (entries.get(conversationId) != entry || entry.attachments > 0) {
        return;
      }
      entries.remove(conversationId);
      closed = markClosing(conversationId, entry);
    }
    log.info("Conversation {} idle for {}, tearing down", conversationId,
      sessionProperties.getIdleGracePeriod());
    destroy(conversationId, entry, closed);
  }

  // caller holds lock
  private CompletableFuture<Void> markClosing(String conversationId, Entry entry) {
    entry.cancelTeardown();
    CompletableFuture<Void> closed = new CompletableFuture<>();
    closing.put(conversationId, closed);
    return closed;
  }

  /**
   * 在注册表锁外关闭会话并发布销毁事件，完成后才允许同一 id 创建新会话
   */
  private void destroy(String conversationId, Entry entry, CompletableFuture<Void> closed) {
    try {
      entry.session.close();
    } catch (RuntimeException e) {
      log.error("Failed to close agent session for conversation {}", conversationId, e);
    }
    try {
      eventPublisher.publishEvent(new AgentSessionDestroyedEvent(this, conversationId));
    } finally {
      synchronized (lock) {
        closing.remove(conversationId, closed);
      }
      closed.complete(null);
    }
    log.info("Destroyed agent session for conversation {}", conversationId);
  }

  private static final class Entry {

    private final AgentSession session;

    private int attachments;

    private Disposable pendingTeardown;

    private Entry(AgentSession session) {
      this.session = session;
    }

    private void cancelTeardown() {
      if (pendingTeardown != null) {
        pendingTeardown.dispose();
        pendingTeardown = null;
      }
    }
  }
}
