package com.github.spud.chatagent.session;

import com.github.spud.chatagent.application.config.SessionProperties;
import com.github.spud.chatagent.domain.runtime.AgentRuntime;
import com.github.spud.chatagent.domain.session.AgentSessionFactory;
import java.time.Duration;

/**
 * 供其他测试包构造会话工厂
 */
public final class SessionTestSupport {

  private SessionTestSupport() {
  }

  public static SessionProperties properties(Duration interruptTimeout, Duration grace) {
    SessionProperties properties = new SessionProperties();
    properties.setInterruptTimeout(interruptTimeout);
    properties.setIdleGracePeriod(grace);
    return properties;
  }

  public static AgentSessionFactory factory(AgentRuntime runtime, SessionProperties properties) {
    return new AgentSessionFactory(runtime, new RecordingStateMachineDriver(), properties);
  }
}
