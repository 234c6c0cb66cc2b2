package com.github.spud.chatagent.domain.session;

import lombok.Getter;
import org.springframework.context.ApplicationEvent;

@Getter
public class AgentSessionDestroyedEvent extends ApplicationEvent {

  private final String conversationId;

  public AgentSessionDestroyedEvent(Object source, String conversationId) {
    super(source);
    this.conversationId = conversationId;
  }
}
