package com.github.spud.chatagent.domain.event;

public enum ChatEventType {
  USER_MESSAGE,
  STREAM_STARTED,
  TEXT_DELTA,
  STREAM_ENDED,
  TOOL_INVOKED,
  TOOL_RESULT,
  QUERY_RESULT,
  QUERY_CANCELLED,
  QUERY_FAILED,
  HISTORY_CLEARED;

  /**
   * 标志一次 Query 对观察者而言已经结束
   */
  public boolean isTerminal() {
    return this == QUERY_RESULT || this == QUERY_CANCELLED || this == QUERY_FAILED;
  }
}
