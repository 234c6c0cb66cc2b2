package com.github.spud.chatagent.tools;

import com.github.spud.chatagent.util.JsonUtils;
import jakarta.annotation.PostConstruct;
import java.time.OffsetDateTime;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.definition.DefaultToolDefinition;
import org.springframework.ai.tool.definition.ToolDefinition;
import org.springframework.boot.json.JsonParseException;
import org.springframework.context.annotation.Configuration;

/**
 * 本地工具配置 注册系统内置工具
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class LocalToolsConfig {

  public static final String CURRENT_TIME_TOOL = "get_current_time";
  public static final String ECHO_TOOL = "echo";

  private final ToolRegistry toolRegistry;

  @PostConstruct
  public void registerLocalTools() {
    toolRegistry.register(CURRENT_TIME_TOOL, timeTool());
    toolRegistry.register(ECHO_TOOL, echoTool());
    log.info("Local tools registered, total tools in registry={}", toolRegistry.size());
  }

  static ToolCallback timeTool() {
    ToolDefinition def = DefaultToolDefinition.builder()
      .name(CURRENT_TIME_TOOL)
      .description("Get the current date and time with the server's offset")
      .inputSchema("""
        {
            "type": "object",
            "properties": {}
        }
        """)
      .build();

    return new ToolCallback() {
      @Override
      public ToolDefinition getToolDefinition() {
        return def;
      }

      @Override
      public String call(String toolInput) {
        return OffsetDateTime.now().toString();
      }
    };
  }

  static ToolCallback echoTool() {
    ToolDefinition def = DefaultToolDefinition.builder()
      .name(ECHO_TOOL)
      .description("Echo back the input message. Useful for testing.")
      .inputSchema("""
        {
            "type": "object",
            "properties": {
                "message": {
                    "type": "string",
                    "description": "The message to echo back"
                }
            },
            "required": ["message"]
        }
        """)
      .build();

    return new ToolCallback() {
      @Override
      public ToolDefinition getToolDefinition() {
        return def;
      }

      @Override
      public String call(String toolInput) {
        try {
          return "Echo: " + JsonUtils.readTree(toolInput).path("message").asText();
        } catch (JsonParseException e) {
          log.debug("Echo input is not JSON, returning it verbatim");
          return "Echo: " + toolInput;
        }
      }
    };
  }
}
