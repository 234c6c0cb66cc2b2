package com.github.spud.chatagent.mcp;

import io.modelcontextprotocol.client.McpSyncClient;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

/**
 * MCP 客户端管理器，按连接名索引 Spring AI 创建的客户端
 */
@Slf4j
@Component
public class McpClientManager {

  // Spring AI 的客户端名为 "<spring.ai.mcp.client.name> - <连接名>"
  private static final String CONNECTION_SEPARATOR = " - ";

  private final List<McpSyncClient> clients;

  // 连接名 -> client
  private final Map<String, McpSyncClient> clientMap = new ConcurrentHashMap<>();

  public McpClientManager(ObjectProvider<List<McpSyncClient>> clientsProvider) {
    this.clients = clientsProvider.getIfAvailable(List::of);
  }

  @PostConstruct
  public void initialize() {
    for (McpSyncClient client : clients) {
      String serverId = connectionName(client);
      clientMap.put(serverId, client);
      log.info("MCP server {} available, initialized={}", serverId, client.isInitialized());
    }
  }

  public Optional<McpSyncClient> getClient(String serverId) {
    return Optional.ofNullable(clientMap.get(serverId));
  }

  public Collection<String> getConnectedServerIds() {
    return clientMap.keySet();
  }

  public boolean isConnected(String serverId) {
    McpSyncClient client = clientMap.get(serverId);
    return client != null && client.isInitialized();
  }

  @PreDestroy
  public void shutdown() {
    log.info("Shutting down MCP client manager");
    for (McpSyncClient client : clientMap.values()) {
      client.closeGracefully();
    }
  }

  static String connectionName(McpSyncClient client) {
    String name = client.getClientInfo().name();
    int index = name.lastIndexOf(CONNECTION_SEPARATOR);
    return index >= 0 ? name.substring(index + CONNECTION_SEPARATOR.length()) : name;
  }
}
