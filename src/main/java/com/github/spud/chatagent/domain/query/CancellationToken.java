package com.github.spud.chatagent.domain.query;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 每个 Query 独享的取消令牌，由排水循环在每个事件上检查
 */
public class CancellationToken {

  private final AtomicBoolean cancelled = new AtomicBoolean(false);

  /**
   * @return true if this call flipped the token
   */
  public boolean cancel() {
    return cancelled.compareAndSet(false, true);
  }

  public boolean isCancelled() {
    return cancelled.get();
  }
}
