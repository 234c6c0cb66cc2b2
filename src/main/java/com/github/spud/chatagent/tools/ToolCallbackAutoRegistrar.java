package com.github.spud.chatagent.tools;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.definition.ToolDefinition;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

/**
 * 工具回调自动注册器
 * <p>
 * 扫描 Spring 容器中所有的 ToolCallback beans，并注册到 ToolRegistry 中。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ToolCallbackAutoRegistrar {

  private final ObjectProvider<ToolCallback> toolCallbackProvider;
  private final ToolRegistry toolRegistry;

  @PostConstruct
  public void registerAllToolCallbacks() {
    int registered = 0;
    int skipped = 0;

    for (ToolCallback callback : toolCallbackProvider) {
      ToolDefinition def = callback.getToolDefinition();
      if (def == null || def.name() == null || def.name().isBlank()) {
        log.warn("Skipping ToolCallback with empty definition: {}", callback.getClass().getName());
        skipped++;
        continue;
      }
      if (toolRegistry.hasToolByName(def.name())) {
        log.debug("Tool {} already registered, will overwrite", def.name());
      }
      toolRegistry.register(callback);
      registered++;
    }

    log.info("Auto-registration complete: registered={}, skipped={}, total tools in registry={}",
      registered, skipped, toolRegistry.size());
  }
}
