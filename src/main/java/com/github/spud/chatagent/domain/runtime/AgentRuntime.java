package com.github.spud.chatagent.domain.runtime;

import com.github.spud.chatagent.domain.event.ChatEvent;
import com.github.spud.chatagent.domain.query.QueryInput;
import reactor.core.publisher.Flux;

/**
 * 底层 Agent/模型运行时
 * <p>
 * 实现方为一次 Query 产出带类型的事件流。调用 {@link #interrupt(String)} 之后，返回的流应尽快完成；
 * 已经产出的事件仍可能被继续投递，由会话负责丢弃。
 */
public interface AgentRuntime {

  /**
   * 执行一次 Query，事件携带传入的 conversationId 与 queryId
   */
  Flux<ChatEvent> run(String conversationId, long queryId, QueryInput input);

  /**
   * 请求中断该会话当前正在进行的调用，尽力而为
   */
  void interrupt(String conversationId);

  /**
   * 清空运行时持有的会话记忆
   */
  void reset(String conversationId);
}
