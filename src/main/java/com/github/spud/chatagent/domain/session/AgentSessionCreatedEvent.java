package com.github.spud.chatagent.domain.session;

import lombok.Getter;
import org.springframework.context.ApplicationEvent;

/**
 * 会话创建后、第一次 send 之前同步发布，监听者借此订阅事件流
 */
@Getter
public class AgentSessionCreatedEvent extends ApplicationEvent {

  private final AgentSession session;

  public AgentSessionCreatedEvent(Object source, AgentSession session) {
    super(source);
    this.session = session;
  }
}
