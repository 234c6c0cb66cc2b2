package com.github.spud.chatagent.domain.query;

import com.github.spud.chatagent.domain.state.QueryState;
import com.github.spud.chatagent.domain.state.QueryStateMachineDriver;
import com.github.spud.chatagent.domain.state.QueryTrigger;
import java.time.Duration;
import lombok.Getter;
import org.springframework.statemachine.StateMachine;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * 一次针对单条用户输入的 Agent 调用
 * <p>
 * 持有 QueryId、输入、取消令牌、状态机以及运行任务的句柄。
 */
public class Query {

  @Getter
  private final long queryId;

  @Getter
  private final QueryInput input;

  @Getter
  private final CancellationToken cancellationToken = new CancellationToken();

  private final StateMachine<QueryState, QueryTrigger> stateMachine;

  private final QueryStateMachineDriver driver;

  private final Sinks.Empty<Void> completion = Sinks.empty();

  private volatile boolean done;

  private volatile Disposable subscription;

  public Query(long queryId, QueryInput input, StateMachine<QueryState, QueryTrigger> stateMachine,
    QueryStateMachineDriver driver) {
    this.queryId = queryId;
    this.input = input;
    this.stateMachine = stateMachine;
    this.driver = driver;
  }

  /**
   * 状态转换，终态之后的事件被拒绝
   */
  public synchronized boolean transition(QueryTrigger trigger) {
    return driver.sendEvent(stateMachine, trigger);
  }

  public synchronized QueryState getState() {
    return driver.getCurrentState(stateMachine);
  }

  public void bind(Disposable subscription) {
    this.subscription = subscription;
  }

  /**
   * Called exactly when the task stops consuming the runtime stream, however it ends.
   */
  public void markDone() {
    done = true;
    completion.tryEmitEmpty();
  }

  public boolean isDone() {
    return done;
  }

  /**
   * Waits for the task to exit. A timeout is an ordinary {@code false} result.
   */
  public boolean awaitCompletion(Duration timeout) {
    Boolean exited = completion.asMono()
      .thenReturn(Boolean.TRUE)
      .timeout(timeout, Mono.just(Boolean.FALSE))
      .block();
    return Boolean.TRUE.equals(exited);
  }

  /**
   * Gives up on a task that did not exit in time: its subscription is disposed and it is
   * treated as finished.
   */
  public void abandon() {
    Disposable current = subscription;
    if (current != null) {
      current.dispose();
    }
    markDone();
  }
}
