package com.github.spud.chatagent.application.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration for agent session lifecycle
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "agent.session")
public class SessionProperties {

  /**
   * How long send/cancel wait for an interrupted query task to exit before abandoning it
   */
  private Duration interruptTimeout = Duration.ofSeconds(5);

  /**
   * How long a session with no attached connection is kept alive (covers page refresh)
   */
  private Duration idleGracePeriod = Duration.ofSeconds(30);

  /**
   * How long an attaching connection waits for the transcript to catch up with dispatched events
   */
  private Duration snapshotTimeout = Duration.ofSeconds(5);
}
