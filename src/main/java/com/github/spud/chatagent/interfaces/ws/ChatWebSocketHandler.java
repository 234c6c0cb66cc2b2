package com.github.spud.chatagent.interfaces.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.spud.chatagent.application.ChatTransportService;
import com.github.spud.chatagent.application.ChatTransportService.ClientContext;
import com.github.spud.chatagent.domain.hub.ChatFrame;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * /ws/chat 处理器
 * <p>
 * 同一连接的入站帧按顺序处理，阻塞的会话调用放在 boundedElastic 上；出站帧来自连接自己的无界队列。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChatWebSocketHandler implements WebSocketHandler {

  private final ChatTransportService transportService;
  private final ObjectMapper objectMapper;

  @Override
  public Mono<Void> handle(WebSocketSession session) {
    ClientContext client = transportService.open(session.getId());

    Mono<Void> input = session.receive()
      .filter(message -> message.getType() == WebSocketMessage.Type.TEXT)
      .map(WebSocketMessage::getPayloadAsText)
      .concatMap(payload -> Mono.fromRunnable(() -> handleFrame(client, payload))
        .subscribeOn(Schedulers.boundedElastic()))
      .doFinally(signal -> transportService.disconnect(client))
      .then();

    Mono<Void> output = session.send(client.getConnection().outbound()
      .map(frame -> session.textMessage(write(frame))));

    return Mono.when(input, output);
  }

  void handleFrame(ClientContext client, String payload) {
    InboundFrame frame;
    try {
      frame = objectMapper.readValue(payload, InboundFrame.class);
    } catch (JsonProcessingException e) {
      log.debug("Invalid frame from connection {}: {}", client.getConnection().getId(),
        e.getOriginalMessage());
      client.reply(ChatFrame.error(null, "Invalid JSON"));
      return;
    }

    String type = frame.getType() == null ? "" : frame.getType();
    try {
      switch (type) {
        case InboundFrame.SUBSCRIBE -> transportService.subscribe(client, frame.getChatId());
        case InboundFrame.CHAT -> transportService.submit(client, frame.getChatId(),
          frame.getContent(), frame.getImages());
        case InboundFrame.STOP -> transportService.requestCancel(client, frame.getChatId());
        case InboundFrame.CLEAR_HISTORY ->
          transportService.clearHistory(client, frame.getChatId());
        default -> client.reply(ChatFrame.error(frame.getChatId(), "Unknown message type: " + type));
      }
    } catch (RuntimeException e) {
      log.error("Failed to handle {} frame for chat {}", type, frame.getChatId(), e);
      client.reply(ChatFrame.error(frame.getChatId(), e.getMessage()));
    }
  }

  private String write(ChatFrame frame) {
    try {
      return objectMapper.writeValueAsString(frame);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize " + frame.getType() + " frame", e);
    }
  }
}
