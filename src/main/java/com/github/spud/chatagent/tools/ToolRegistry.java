package com.github.spud.chatagent.tools;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.definition.ToolDefinition;
import org.springframework.stereotype.Component;

/**
 * 统一工具注册中心
 */
@Slf4j
@Component
public class ToolRegistry {

  /**
   * 工具名 -> ToolCallback
   */
  private final Map<String, ToolCallback> callbackMap = new ConcurrentHashMap<>();

  /**
   * 已由来源（MCP 服务器配置）授权的工具，总是对模型可见
   */
  private final Set<String> approvedTools = ConcurrentHashMap.newKeySet();

  /**
   * 注册工具，同名工具被覆盖
   */
  public void register(String toolName, ToolCallback callback) {
    log.info("Registering tool: {}", toolName);
    callbackMap.put(toolName, callback);
  }

  /**
   * 注册工具（从 ToolCallback 提取名称）
   */
  public void register(ToolCallback callback) {
    ToolDefinition def = callback.getToolDefinition();
    if (def != null) {
      register(def.name(), callback);
    } else {
      log.warn("Cannot register tool without definition: {}", callback);
    }
  }

  /**
   * 注册并授权工具：即使运行时白名单不包含它，也对模型可见
   */
  public void registerApproved(ToolCallback callback) {
    register(callback);
    approvedTools.add(callback.getToolDefinition().name());
  }

  /**
   * 注销指定前缀的所有工具（重新同步 MCP 服务器之前使用）
   */
  public void unregisterByPrefix(String prefix) {
    log.info("Unregistering tools with prefix: {}", prefix);
    callbackMap.keySet().removeIf(name -> name.startsWith(prefix));
    approvedTools.removeIf(name -> name.startsWith(prefix));
  }

  public Optional<ToolCallback> getCallback(String toolName) {
    return Optional.ofNullable(callbackMap.get(toolName));
  }

  public Collection<ToolCallback> getAllCallbacks() {
    return callbackMap.values();
  }

  /**
   * 按白名单解析工具；白名单为空时返回全部已注册工具，否则返回白名单加上已授权的工具。
   * 未注册的名字被忽略
   */
  public List<ToolCallback> resolve(List<String> allowedTools) {
    if (allowedTools == null || allowedTools.isEmpty()) {
      return List.copyOf(callbackMap.values());
    }
    Set<String> names = new LinkedHashSet<>(allowedTools);
    names.addAll(approvedTools);
    return names.stream()
      .map(name -> {
        ToolCallback callback = callbackMap.get(name);
        if (callback == null) {
          log.warn("Allowed tool {} is not registered", name);
        }
        return callback;
      })
      .filter(Objects::nonNull)
      .toList();
  }

  public boolean hasToolByName(String toolName) {
    return callbackMap.containsKey(toolName);
  }

  public int size() {
    return callbackMap.size();
  }
}
