package com.github.spud.chatagent.application.config;

import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration for the Spring AI backed agent runtime
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "agent.runtime")
public class AgentRuntimeProperties {

  /**
   * System prompt sent with every query
   */
  private String systemPrompt = "You are a helpful assistant.";

  /**
   * Tool names exposed to the model. Empty means every registered tool
   */
  private List<String> allowedTools = new ArrayList<>();

  /**
   * Number of messages kept in the conversation memory window
   */
  private int memoryWindow = 20;
}
