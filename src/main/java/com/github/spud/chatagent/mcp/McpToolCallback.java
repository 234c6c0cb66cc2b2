package com.github.spud.chatagent.mcp;

import com.github.spud.chatagent.util.JsonUtils;
import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.spec.McpSchema.CallToolRequest;
import io.modelcontextprotocol.spec.McpSchema.CallToolResult;
import io.modelcontextprotocol.spec.McpSchema.TextContent;
import java.util.Map;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.definition.ToolDefinition;
import org.springframework.ai.tool.execution.ToolExecutionException;

/**
 * MCP 工具回调代理 将远程 MCP 工具包装为本地 ToolCallback
 * <p>
 * 远程返回 isError 时抛出 {@link ToolExecutionException}，错误文本交还给模型，工具事件标记为失败。
 */
@Slf4j
public class McpToolCallback implements ToolCallback {

  @Getter
  private final String serverId;
  @Getter
  private final String originalToolName;
  private final ToolDefinition toolDefinition;
  private final McpSyncClient client;

  public McpToolCallback(String serverId, String originalToolName, ToolDefinition toolDefinition,
    McpSyncClient client) {
    this.serverId = serverId;
    this.originalToolName = originalToolName;
    this.toolDefinition = toolDefinition;
    this.client = client;
  }

  @Override
  public ToolDefinition getToolDefinition() {
    return toolDefinition;
  }

  @Override
  public String call(String toolInput) {
    log.debug("Calling MCP tool: {} (server: {}) with input: {}", originalToolName, serverId,
      toolInput);

    Map<String, Object> params = JsonUtils.toMap(toolInput);
    CallToolResult result = client.callTool(new CallToolRequest(originalToolName, params));

    StringBuilder text = new StringBuilder();
    if (result.content() != null) {
      for (var content : result.content()) {
        if (content instanceof TextContent textContent) {
          text.append(textContent.text());
        } else {
          text.append(content);
        }
      }
    }

    if (Boolean.TRUE.equals(result.isError())) {
      throw new ToolExecutionException(toolDefinition, new IllegalStateException(text.toString()));
    }
    log.debug("MCP tool {} returned {} chars", originalToolName, text.length());
    return text.toString();
  }
}
