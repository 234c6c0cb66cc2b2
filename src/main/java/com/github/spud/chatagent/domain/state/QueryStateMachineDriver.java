package com.github.spud.chatagent.domain.state;

import java.util.EnumSet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.statemachine.StateMachine;
import org.springframework.statemachine.StateMachineEventResult;
import org.springframework.statemachine.config.StateMachineBuilder;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * 状态机驱动器 - Query 与 StateMachine 的适配层
 * <pre>
 * 状态流转:
 *   PENDING --(START)--> STREAMING
 *   PENDING|STREAMING --(CANCEL)--> CANCELLED
 *   PENDING|STREAMING --(SUPERSEDE)--> SUPERSEDED
 *   PENDING|STREAMING --(FAIL)--> FAILED
 *   STREAMING --(COMPLETE)--> COMPLETED
 * </pre>
 * 终态没有出边，之后的事件一律被拒绝。
 */
@Slf4j
@Component
public class QueryStateMachineDriver {

  /**
   * 为新的 Query 创建并启动状态机实例
   */
  public StateMachine<QueryState, QueryTrigger> create(String machineId) {
    StateMachine<QueryState, QueryTrigger> sm = build(machineId);
    sm.startReactively().block();
    return sm;
  }

  /**
   * 获取当前状态
   */
  public QueryState getCurrentState(StateMachine<QueryState, QueryTrigger> sm) {
    return sm.getState().getId();
  }

  /**
   * 发送事件并等待状态转换完成
   */
  public boolean sendEvent(StateMachine<QueryState, QueryTrigger> sm, QueryTrigger trigger) {
    if (isInFinalState(sm)) {
      log.debug("Trigger {} ignored, machine {} already in final state {}", trigger, sm.getId(),
        getCurrentState(sm));
      return false;
    }

    StateMachineEventResult<QueryState, QueryTrigger> result = sm
      .sendEvent(Mono.just(MessageBuilder.withPayload(trigger).build()))
      .blockFirst();

    boolean accepted = result != null &&
      result.getResultType() == StateMachineEventResult.ResultType.ACCEPTED;

    if (accepted) {
      log.debug("Trigger {} accepted by {}, new state: {}", trigger, sm.getId(),
        getCurrentState(sm));
    } else {
      log.debug("Trigger {} rejected by {} in state {}", trigger, sm.getId(),
        getCurrentState(sm));
    }
    return accepted;
  }

  /**
   * 判断是否处于终态
   */
  public boolean isInFinalState(StateMachine<QueryState, QueryTrigger> sm) {
    return QueryState.isFinal(getCurrentState(sm));
  }

  private StateMachine<QueryState, QueryTrigger> build(String machineId) {
    try {
      StateMachineBuilder.Builder<QueryState, QueryTrigger> builder = StateMachineBuilder.builder();

      builder.configureConfiguration()
        .withConfiguration()
        .machineId(machineId)
        .autoStartup(false);

      builder.configureStates()
        .withStates()
        .initial(QueryState.PENDING)
        .states(EnumSet.allOf(QueryState.class))
        .end(QueryState.COMPLETED)
        .end(QueryState.CANCELLED)
        .end(QueryState.SUPERSEDED)
        .end(QueryState.FAILED);

      builder.configureTransitions()
        // PENDING -> STREAMING
        .withExternal()
        .source(QueryState.PENDING).target(QueryState.STREAMING)
        .event(QueryTrigger.START)
        .and()

        // PENDING 直接终止
        .withExternal()
        .source(QueryState.PENDING).target(QueryState.CANCELLED)
        .event(QueryTrigger.CANCEL)
        .and()
        .withExternal()
        .source(QueryState.PENDING).target(QueryState.SUPERSEDED)
        .event(QueryTrigger.SUPERSEDE)
        .and()
        .withExternal()
        .source(QueryState.PENDING).target(QueryState.FAILED)
        .event(QueryTrigger.FAIL)
        .and()

        // STREAMING 终止
        .withExternal()
        .source(QueryState.STREAMING).target(QueryState.COMPLETED)
        .event(QueryTrigger.COMPLETE)
        .and()
        .withExternal()
        .source(QueryState.STREAMING).target(QueryState.CANCELLED)
        .event(QueryTrigger.CANCEL)
        .and()
        .withExternal()
        .source(QueryState.STREAMING).target(QueryState.SUPERSEDED)
        .event(QueryTrigger.SUPERSEDE)
        .and()
        .withExternal()
        .source(QueryState.STREAMING).target(QueryState.FAILED)
        .event(QueryTrigger.FAIL);

      return builder.build();
    } catch (Exception e) {
      throw new IllegalStateException("Failed to build query state machine " + machineId, e);
    }
  }
}
