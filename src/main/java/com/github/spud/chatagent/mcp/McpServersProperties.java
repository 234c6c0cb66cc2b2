package com.github.spud.chatagent.mcp;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * MCP 服务器的工具授权配置
 * <p>
 * 连接本身由 {@code spring.ai.mcp.client.*} 配置（stdio / sse 连接，或 mcpServers 格式的 JSON 文件），
 * 这里按连接名声明每个服务器允许暴露给模型的工具。
 */
@Data
@Component
@ConfigurationProperties(prefix = "agent.mcp")
public class McpServersProperties {

  /**
   * 连接名 -> 服务器配置
   */
  private Map<String, McpServerConfig> servers = new LinkedHashMap<>();

  public McpServerConfig server(String serverId) {
    return servers.getOrDefault(serverId, McpServerConfig.DISABLED);
  }

  @Data
  public static class McpServerConfig {

    static final McpServerConfig DISABLED = new McpServerConfig(false);

    /**
     * 是否启用
     */
    private boolean enabled = true;

    /**
     * 允许的工具（服务器端原始名称）；未列出的工具不会注册
     */
    private List<String> allowedTools = new ArrayList<>();

    public McpServerConfig() {
    }

    McpServerConfig(boolean enabled) {
      this.enabled = enabled;
    }

    public boolean allows(String toolName) {
      return enabled && allowedTools.contains(toolName);
    }
  }
}
