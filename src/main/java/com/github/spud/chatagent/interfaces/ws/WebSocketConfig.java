package com.github.spud.chatagent.interfaces.ws;

import java.util.Map;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.HandlerMapping;
import org.springframework.web.reactive.handler.SimpleUrlHandlerMapping;

@Configuration
public class WebSocketConfig {

  public static final String CHAT_PATH = "/ws/chat";

  @Bean
  public HandlerMapping chatWebSocketMapping(ChatWebSocketHandler chatWebSocketHandler) {
    return new SimpleUrlHandlerMapping(Map.of(CHAT_PATH, chatWebSocketHandler), -1);
  }
}
