package com.github.spud.chatagent.application;

import com.github.spud.chatagent.domain.hub.ChatFrame;
import com.github.spud.chatagent.domain.hub.ConnectionHub;
import com.github.spud.chatagent.domain.hub.HubConnection;
import com.github.spud.chatagent.domain.query.ImageAttachment;
import com.github.spud.chatagent.domain.query.InvalidQueryInputException;
import com.github.spud.chatagent.domain.query.QueryInput;
import com.github.spud.chatagent.domain.session.AgentSession;
import com.github.spud.chatagent.domain.session.SessionClosedException;
import com.github.spud.chatagent.domain.session.SessionRegistry;
import com.github.spud.chatagent.domain.store.ChatStore;
import java.util.List;
import java.util.Optional;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 传输层与会话之间的边界
 * <p>
 * 所有方法都可能阻塞（等待旧 Query 退出、读写存储），调用方需在 boundedElastic 上执行。
 * 错误不抛出，而是以 error 帧投递给发起请求的连接。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChatTransportService {

  static final String CHAT_ID_REQUIRED = "chat_id is required";
  static final String CHAT_NOT_FOUND = "Chat not found";
  static final String NO_ACTIVE_SESSION = "No active session";

  private final ChatStore chatStore;
  private final SessionRegistry sessionRegistry;
  private final ConnectionHub connectionHub;

  /**
   * 打开一个客户端连接并发送 connected 帧
   */
  public ClientContext open(String connectionId) {
    HubConnection connection = new HubConnection(connectionId);
    connection.deliver(ChatFrame.connected());
    log.info("Client connection {} opened", connectionId);
    return new ClientContext(connection);
  }

  /**
   * 订阅一个聊天；先脱离之前订阅的聊天
   */
  public void subscribe(ClientContext client, String chatId) {
    if (!checkChat(client, chatId)) {
      return;
    }
    attach(client, chatId);
  }

  /**
   * 提交一条用户输入；未订阅该聊天时自动订阅
   */
  public void submit(ClientContext client, String chatId, String content,
    List<ImageAttachment> images) {
    if (!checkChat(client, chatId)) {
      return;
    }
    QueryInput input = QueryInput.of(content, images);
    if (input.isEmpty()) {
      client.reply(ChatFrame.error(chatId, "content or images is required"));
      return;
    }
    if (!chatId.equals(client.getChatId())) {
      attach(client, chatId);
    }

    try {
      sessionRegistry.getOrCreate(chatId).send(input);
    } catch (InvalidQueryInputException e) {
      client.reply(ChatFrame.error(chatId, e.getMessage()));
    } catch (SessionClosedException e) {
      log.warn("Session of conversation {} closed while submitting, retrying once", chatId);
      try {
        sessionRegistry.getOrCreate(chatId).send(input);
      } catch (SessionClosedException retryFailure) {
        client.reply(ChatFrame.error(chatId, retryFailure.getMessage()));
      }
    }
  }

  /**
   * 取消聊天当前的 Query
   */
  public void requestCancel(ClientContext client, String chatId) {
    if (chatId == null || chatId.isBlank()) {
      client.reply(ChatFrame.error(null, CHAT_ID_REQUIRED));
      return;
    }
    Optional<AgentSession> session = sessionRegistry.find(chatId);
    if (session.isEmpty()) {
      client.reply(ChatFrame.error(chatId, NO_ACTIVE_SESSION));
      return;
    }
    if (!session.get().cancel()) {
      log.debug("Stop requested for conversation {} with nothing running", chatId);
    }
  }

  /**
   * 清空历史。有活跃会话时重置会话（存储由记录器按事件顺序清理），否则直接清理存储
   */
  public void clearHistory(ClientContext client, String chatId) {
    if (!checkChat(client, chatId)) {
      return;
    }
    Optional<AgentSession> session = sessionRegistry.find(chatId);
    if (session.isPresent()) {
      try {
        session.get().reset();
        return;
      } catch (SessionClosedException e) {
        log.debug("Session of conversation {} closed before reset, clearing storage", chatId);
      }
    }
    int messages = chatStore.clearMessages(chatId);
    int toolRecords = chatStore.clearToolRecords(chatId);
    log.info("Cleared {} messages and {} tool records of conversation {}", messages, toolRecords,
      chatId);
    client.reply(ChatFrame.historyCleared(chatId));
  }

  /**
   * 连接关闭：脱离订阅的聊天并结束出站流
   */
  public void disconnect(ClientContext client) {
    String chatId = client.getChatId();
    if (chatId != null) {
      connectionHub.detach(chatId, client.getConnection());
      client.chatId = null;
    }
    client.getConnection().close();
    log.info("Client connection {} closed", client.getConnection().getId());
  }

  private boolean checkChat(ClientContext client, String chatId) {
    if (chatId == null || chatId.isBlank()) {
      client.reply(ChatFrame.error(null, CHAT_ID_REQUIRED));
      return false;
    }
    if (chatStore.getChat(chatId).isEmpty()) {
      client.reply(ChatFrame.error(chatId, CHAT_NOT_FOUND));
      return false;
    }
    return true;
  }

  private void attach(ClientContext client, String chatId) {
    String previous = client.getChatId();
    if (previous != null) {
      connectionHub.detach(previous, client.getConnection());
      client.chatId = null;
    }
    connectionHub.attach(chatId, client.getConnection());
    client.chatId = chatId;
  }

  /**
   * 单个客户端连接的状态，由传输层按顺序处理其入站帧
   */
  public static class ClientContext {

    @Getter
    private final HubConnection connection;

    @Getter
    private volatile String chatId;

    ClientContext(HubConnection connection) {
      this.connection = connection;
    }

    public void reply(ChatFrame frame) {
      if (!connection.deliver(frame)) {
        log.debug("Dropped {} frame for closed connection {}", frame.getType(),
          connection.getId());
      }
    }
  }
}
