package com.github.spud.chatagent.mcp;

import com.github.spud.chatagent.tools.ToolRegistry;
import com.github.spud.chatagent.util.JsonUtils;
import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.spec.McpSchema.Tool;
import jakarta.annotation.PostConstruct;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.tool.definition.DefaultToolDefinition;
import org.springframework.ai.tool.definition.ToolDefinition;
import org.springframework.boot.json.JsonParseException;
import org.springframework.stereotype.Component;

/**
 * MCP 工具同步器 从 MCP 服务器获取工具列表，把配置允许的工具注册到 ToolRegistry
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class McpToolSynchronizer {

  private static final String EMPTY_SCHEMA = "{\"type\":\"object\",\"properties\":{}}";

  private final McpClientManager clientManager;
  private final McpServersProperties serversProperties;
  private final ToolRegistry toolRegistry;

  /**
   * 同步指定服务器：先注销该服务器的旧工具，再注册当前允许的工具
   *
   * @return 注册的工具数
   */
  public int synchronize(String serverId) {
    McpSyncClient client = clientManager.getClient(serverId)
      .orElseThrow(() -> new IllegalArgumentException("MCP server not connected: " + serverId));
    McpServersProperties.McpServerConfig config = serversProperties.server(serverId);

    toolRegistry.unregisterByPrefix(McpToolNaming.serverPrefix(serverId));
    if (!config.isEnabled()) {
      log.info("MCP server {} is not enabled, no tools registered", serverId);
      return 0;
    }

    List<Tool> tools = client.listTools().tools();
    int registered = 0;
    for (Tool tool : tools) {
      if (!config.allows(tool.name())) {
        log.debug("MCP tool {} of server {} is not allowed", tool.name(), serverId);
        continue;
      }
      toolRegistry.registerApproved(new McpToolCallback(serverId, tool.name(),
        definition(serverId, tool), client));
      registered++;
    }

    log.info("Registered {} of {} tools from MCP server: {}", registered, tools.size(), serverId);
    return registered;
  }

  @PostConstruct
  public void initialize() {
    if (!clientManager.getConnectedServerIds().isEmpty()) {
      log.info("Synchronized {} MCP tools at startup", synchronizeAll());
    }
  }

  /**
   * 同步所有已连接服务器的工具，单个服务器失败不影响其他服务器
   */
  public int synchronizeAll() {
    int total = 0;
    for (String serverId : clientManager.getConnectedServerIds()) {
      try {
        total += synchronize(serverId);
      } catch (RuntimeException e) {
        log.error("Failed to synchronize tools from server: {}", serverId, e);
      }
    }
    return total;
  }

  private ToolDefinition definition(String serverId, Tool tool) {
    return DefaultToolDefinition.builder()
      .name(McpToolNaming.toModelToolName(serverId, tool.name()))
      .description(tool.description() != null ? tool.description() : "MCP tool: " + tool.name())
      .inputSchema(inputSchema(tool))
      .build();
  }

  private String inputSchema(Tool tool) {
    if (tool.inputSchema() == null) {
      return EMPTY_SCHEMA;
    }
    try {
      return JsonUtils.toJson(tool.inputSchema());
    } catch (JsonParseException e) {
      log.warn("Failed to convert input schema for tool: {}", tool.name(), e);
      return EMPTY_SCHEMA;
    }
  }
}
