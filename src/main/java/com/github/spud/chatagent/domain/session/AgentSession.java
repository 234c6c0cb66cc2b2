package com.github.spud.chatagent.domain.session;

import com.github.spud.chatagent.domain.event.ChatEvent;
import com.github.spud.chatagent.domain.query.InvalidQueryInputException;
import com.github.spud.chatagent.domain.query.Query;
import com.github.spud.chatagent.domain.query.QueryInput;
import com.github.spud.chatagent.domain.runtime.AgentRuntime;
import com.github.spud.chatagent.domain.state.QueryStateMachineDriver;
import com.github.spud.chatagent.domain.state.QueryTrigger;
import java.time.Duration;
import java.util.concurrent.locks.ReentrantLock;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;
import reactor.util.concurrent.Queues;

/**
 * 单个会话的 Query 生命周期控制器
 * <p>
 * 同一时刻最多只有一个活跃 Query。新消息取代正在进行的 Query，取消请求总是优先于旧输出。
 * <ul>
 *   <li>{@code operationLock}：send / cancel / reset / close 互斥，持有期间完成状态转换与有界等待</li>
 *   <li>{@code emitMonitor}：排水过滤与写入事件流是原子的，取消令牌的翻转也在这把锁下完成</li>
 * </ul>
 * 旧 Query 的迟到事件在排水时被丢弃，观察者永远看不到两个 Query 交错的输出。
 */
@Slf4j
public class AgentSession {

  @Getter
  private final String conversationId;

  private final AgentRuntime runtime;

  private final QueryStateMachineDriver stateMachineDriver;

  private final Duration interruptTimeout;

  private final ReentrantLock operationLock = new ReentrantLock();

  private final Object emitMonitor = new Object();

  private final Sinks.Many<ChatEvent> events =
    Sinks.many().multicast().onBackpressureBuffer(Queues.SMALL_BUFFER_SIZE, false);

  // guarded by operationLock
  private long lastQueryId;

  private volatile long activeQueryId;

  // guarded by emitMonitor
  private long sequence;

  private volatile Query runningQuery;

  private volatile boolean closed;

  public AgentSession(String conversationId, AgentRuntime runtime,
    QueryStateMachineDriver stateMachineDriver, Duration interruptTimeout) {
    this.conversationId = conversationId;
    this.runtime = runtime;
    this.stateMachineDriver = stateMachineDriver;
    this.interruptTimeout = interruptTimeout;
  }

  /**
   * 接收新的用户输入
   * <p>
   * 若上一个 Query 仍在运行，先将其取代并等待其退出（最多 interruptTimeout），然后才启动新 Query。
   *
   * @return 新分配的 QueryId
   * @throws InvalidQueryInputException 输入为空，不分配 QueryId
   * @throws SessionClosedException 会话已关闭
   */
  public long send(QueryInput input) {
    if (input == null || input.isEmpty()) {
      throw new InvalidQueryInputException("content or images is required");
    }

    operationLock.lock();
    try {
      ensureOpen();
      long queryId = ++lastQueryId;

      Query previous = runningQuery;
      if (previous != null && !previous.isDone()) {
        log.info("Query {} supersedes query {} in conversation {}", queryId,
          previous.getQueryId(), conversationId);
        stop(previous, QueryTrigger.SUPERSEDE, false);
      }

      Query query = new Query(queryId, input, stateMachineDriver.create(machineId(queryId)),
        stateMachineDriver);
      runningQuery = query;
      synchronized (emitMonitor) {
        activeQueryId = queryId;
        emit(ChatEvent.userMessage(conversationId, queryId, input));
      }
      launch(query);

      log.info("Accepted query {} in conversation {}", queryId, conversationId);
      return queryId;
    } finally {
      operationLock.unlock();
    }
  }

  /**
   * 取消当前 Query
   *
   * @return 没有运行中的 Query 时返回 false 且没有任何副作用；否则无论等待是否超时都返回 true
   */
  public boolean cancel() {
    operationLock.lock();
    try {
      Query query = runningQuery;
      if (closed || query == null || query.isDone()) {
        return false;
      }
      boolean stopped = stop(query, QueryTrigger.CANCEL, true);
      if (stopped) {
        log.info("Cancelled query {} in conversation {}", query.getQueryId(), conversationId);
      }
      return stopped;
    } finally {
      operationLock.unlock();
    }
  }

  /**
   * 停止运行中的 Query（不发送 QUERY_CANCELLED），清空运行时记忆，并发送 HISTORY_CLEARED
   */
  public void reset() {
    operationLock.lock();
    try {
      ensureOpen();
      Query query = runningQuery;
      if (query != null && !query.isDone()) {
        stop(query, QueryTrigger.CANCEL, false);
      }
      runtime.reset(conversationId);
      synchronized (emitMonitor) {
        emit(ChatEvent.historyCleared(conversationId, lastQueryId));
      }
      log.info("Reset conversation {}", conversationId);
    } finally {
      operationLock.unlock();
    }
  }

  /**
   * 停止运行中的 Query 并结束事件流，之后的 send 将失败
   */
  public void close() {
    operationLock.lock();
    try {
      if (closed) {
        return;
      }
      closed = true;
      Query query = runningQuery;
      if (query != null && !query.isDone()) {
        stop(query, QueryTrigger.CANCEL, false);
      }
      synchronized (emitMonitor) {
        events.tryEmitComplete();
      }
      log.info("Closed agent session for conversation {}", conversationId);
    } finally {
      operationLock.unlock();
    }
  }

  /**
   * 多读者事件流，按写入顺序投递
   */
  public Flux<ChatEvent> events() {
    return events.asFlux();
  }

  public boolean isProcessing() {
    Query query = runningQuery;
    return query != null && !query.isDone() && !query.getCancellationToken().isCancelled();
  }

  /**
   * @return 最近一次被接受的 QueryId，尚无 Query 时为 0
   */
  public long getActiveQueryId() {
    return activeQueryId;
  }

  public boolean isClosed() {
    return closed;
  }

  private void launch(Query query) {
    query.transition(QueryTrigger.START);

    Disposable subscription = Flux
      .defer(() -> runtime.run(conversationId, query.getQueryId(), query.getInput()))
      .subscribeOn(Schedulers.boundedElastic())
      .publishOn(Schedulers.boundedElastic())
      .doFinally(signal -> query.markDone())
      .subscribe(
        event -> drain(query, event),
        error -> fail(query, error),
        () -> complete(query));

    query.bind(subscription);
  }

  /**
   * Three-way filter: cancelled token, stale QueryId, otherwise append.
   */
  private void drain(Query query, ChatEvent event) {
    synchronized (emitMonitor) {
      if (query.getCancellationToken().isCancelled()) {
        log.debug("Discarding {} of cancelled query {} in conversation {}", event.getType(),
          query.getQueryId(), conversationId);
        return;
      }
      if (event.getQueryId() != activeQueryId) {
        log.debug("Discarding {} of stale query {} in conversation {}, active is {}",
          event.getType(), event.getQueryId(), conversationId, activeQueryId);
        return;
      }
      emit(event);
    }
  }

  private void complete(Query query) {
    synchronized (emitMonitor) {
      if (!query.getCancellationToken().isCancelled() && query.getQueryId() == activeQueryId) {
        query.transition(QueryTrigger.COMPLETE);
      }
    }
    log.debug("Query {} in conversation {} finished in state {}", query.getQueryId(),
      conversationId, query.getState());
  }

  private void fail(Query query, Throwable error) {
    synchronized (emitMonitor) {
      if (query.getCancellationToken().isCancelled() || query.getQueryId() != activeQueryId) {
        log.debug("Ignoring failure of stopped query {} in conversation {}: {}",
          query.getQueryId(), conversationId, error.toString());
        return;
      }
      log.error("Query {} in conversation {} failed", query.getQueryId(), conversationId, error);
      if (query.transition(QueryTrigger.FAIL)) {
        emit(ChatEvent.queryFailed(conversationId, query.getQueryId(), describe(error)));
      }
    }
  }

  /**
   * 取消令牌、转换状态、请求运行时中断，然后有界等待任务退出。超时不是错误：记录日志并放弃该任务。
   *
   * @return false 表示 Query 已经处于终态，没有做任何事
   */
  private boolean stop(Query query, QueryTrigger trigger, boolean announce) {
    synchronized (emitMonitor) {
      if (!query.transition(trigger)) {
        return false;
      }
      query.getCancellationToken().cancel();
      if (announce) {
        emit(ChatEvent.queryCancelled(conversationId, query.getQueryId()));
      }
    }

    try {
      runtime.interrupt(conversationId);
    } catch (RuntimeException e) {
      log.warn("Interrupt request failed for conversation {}", conversationId, e);
    }

    if (!query.awaitCompletion(interruptTimeout)) {
      log.warn("Query {} in conversation {} did not exit within {}, abandoning it",
        query.getQueryId(), conversationId, interruptTimeout);
      query.abandon();
    }
    return true;
  }

  private void emit(ChatEvent event) {
    Sinks.EmitResult result = events.tryEmitNext(event.withSequence(sequence + 1));
    if (result.isSuccess()) {
      sequence++;
    } else {
      log.warn("Dropped {} for conversation {}: {}", event.getType(), conversationId, result);
    }
  }

  private void ensureOpen() {
    if (closed) {
      throw new SessionClosedException(conversationId);
    }
  }

  private String machineId(long queryId) {
    return conversationId + ":" + queryId;
  }

  private static String describe(Throwable error) {
    return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
  }
}
