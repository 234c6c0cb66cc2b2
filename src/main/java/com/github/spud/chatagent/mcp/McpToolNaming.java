package com.github.spud.chatagent.mcp;

import lombok.experimental.UtilityClass;

/**
 * MCP 工具命名：mcp__&lt;serverId&gt;__&lt;toolName&gt;
 * <p>
 * 模型侧工具名只允许字母、数字、'_' 和 '-'，其他字符替换为 '_'。
 */
@UtilityClass
public class McpToolNaming {

  private static final String MCP_PREFIX = "mcp";
  private static final String SEPARATOR = "__";

  public static String toModelToolName(String serverId, String toolName) {
    return serverPrefix(serverId) + normalize(toolName);
  }

  public static String serverPrefix(String serverId) {
    return MCP_PREFIX + SEPARATOR + normalize(serverId) + SEPARATOR;
  }

  private static String normalize(String name) {
    return name.replaceAll("[^A-Za-z0-9_-]", "_");
  }
}
