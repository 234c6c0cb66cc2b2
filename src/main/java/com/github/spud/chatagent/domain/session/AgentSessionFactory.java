package com.github.spud.chatagent.domain.session;

import com.github.spud.chatagent.application.config.SessionProperties;
import com.github.spud.chatagent.domain.runtime.AgentRuntime;
import com.github.spud.chatagent.domain.state.QueryStateMachineDriver;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class AgentSessionFactory {

  private final AgentRuntime agentRuntime;
  private final QueryStateMachineDriver stateMachineDriver;
  private final SessionProperties sessionProperties;

  public AgentSession create(String conversationId) {
    return new AgentSession(conversationId, agentRuntime, stateMachineDriver,
      sessionProperties.getInterruptTimeout());
  }
}
