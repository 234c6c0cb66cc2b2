package com.github.spud.chatagent.config;

import com.github.spud.chatagent.application.config.AgentRuntimeProperties;
import com.github.spud.chatagent.infrastructure.persistence.JpaChatMemoryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.client.advisor.MessageChatMemoryAdvisor;
import org.springframework.ai.chat.memory.ChatMemory;
import org.springframework.ai.chat.memory.MessageWindowChatMemory;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * 模型与对话记忆配置
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class ModelConfig {

  private final AgentRuntimeProperties runtimeProperties;

  @Value("${spring.ai.openai.chat.options.model:gpt-4o-mini}")
  private String modelName;

  /**
   * 基于 JPA 的窗口记忆，每个会话保留最近 memoryWindow 条消息
   */
  @Bean
  public ChatMemory chatMemory(JpaChatMemoryRepository chatMemoryRepository) {
    return MessageWindowChatMemory.builder()
      .chatMemoryRepository(chatMemoryRepository)
      .maxMessages(runtimeProperties.getMemoryWindow())
      .build();
  }

  /**
   * 主 ChatClient：默认系统提示词 + 记忆 advisor
   */
  @Bean
  @Primary
  public ChatClient chatClient(ChatModel chatModel, ChatMemory chatMemory) {
    log.info("Using {} as primary chat model, memory window={}", modelName,
      runtimeProperties.getMemoryWindow());

    return ChatClient.builder(chatModel)
      .defaultSystem(runtimeProperties.getSystemPrompt())
      .defaultAdvisors(MessageChatMemoryAdvisor.builder(chatMemory).build())
      .build();
  }
}
