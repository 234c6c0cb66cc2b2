package com.github.spud.chatagent.domain.state;

/**
 * Query 生命周期状态
 * <pre>
 * PENDING → STREAMING → COMPLETED
 *                     → CANCELLED
 *                     → SUPERSEDED
 *                     → FAILED
 * </pre>
 * PENDING 可以直接进入除 COMPLETED 以外的任一终态。
 */
public enum QueryState {
  /**
   * 已分配 QueryId，任务尚未开始
   */
  PENDING,

  /**
   * 任务正在消费运行时事件流
   */
  STREAMING,

  /**
   * 正常结束（终态）
   */
  COMPLETED,

  /**
   * 被用户取消（终态）
   */
  CANCELLED,

  /**
   * 被新的 Query 取代（终态）
   */
  SUPERSEDED,

  /**
   * 运行时出错（终态）
   */
  FAILED;

  /**
   * 是否为终态
   */
  public static boolean isFinal(QueryState state) {
    return state == COMPLETED || state == CANCELLED || state == SUPERSEDED || state == FAILED;
  }
}
