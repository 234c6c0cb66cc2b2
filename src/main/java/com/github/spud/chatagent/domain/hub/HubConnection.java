package com.github.spud.chatagent.domain.hub;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * 一个传输连接在 Hub 中的代表
 * <p>
 * 每个连接有自己的无界出站队列，慢连接不会拖慢其他连接。
 */
@Slf4j
public class HubConnection {

  @Getter
  private final String id;

  private final Sinks.Many<ChatFrame> outbound = Sinks.many().unicast().onBackpressureBuffer();

  private boolean closed;

  public HubConnection(String id) {
    this.id = id;
  }

  /**
   * 入队一个帧；连接已关闭时返回 false
   */
  public synchronized boolean deliver(ChatFrame frame) {
    if (closed) {
      return false;
    }
    Sinks.EmitResult result = outbound.tryEmitNext(frame);
    if (result.isFailure()) {
      log.warn("Failed to enqueue {} frame on connection {}: {}", frame.getType(), id, result);
      return false;
    }
    return true;
  }

  public Flux<ChatFrame> outbound() {
    return outbound.asFlux();
  }

  public synchronized void close() {
    if (!closed) {
      closed = true;
      outbound.tryEmitComplete();
    }
  }

  public synchronized boolean isClosed() {
    return closed;
  }
}
