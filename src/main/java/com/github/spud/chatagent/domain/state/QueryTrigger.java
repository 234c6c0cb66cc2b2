package com.github.spud.chatagent.domain.state;

/**
 * Query 状态机事件
 */
public enum QueryTrigger {
  /**
   * 任务启动
   */
  START,

  /**
   * 运行时事件流正常结束
   */
  COMPLETE,

  /**
   * 用户取消
   */
  CANCEL,

  /**
   * 新消息到达，旧 Query 被取代
   */
  SUPERSEDE,

  /**
   * 运行时报错
   */
  FAIL
}
