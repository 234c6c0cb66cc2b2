package com.github.spud.chatagent.application;

import com.github.spud.chatagent.domain.hub.ConnectionHub;
import com.github.spud.chatagent.domain.session.AgentSession;
import com.github.spud.chatagent.domain.session.SessionClosedException;
import com.github.spud.chatagent.domain.session.SessionRegistry;
import com.github.spud.chatagent.domain.store.Chat;
import com.github.spud.chatagent.domain.store.ChatMessage;
import com.github.spud.chatagent.domain.store.ChatNotFoundException;
import com.github.spud.chatagent.domain.store.ChatStore;
import com.github.spud.chatagent.domain.store.SearchHit;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 聊天管理（REST 接口使用）
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChatService {

  private final ChatStore chatStore;
  private final SessionRegistry sessionRegistry;
  private final ConnectionHub connectionHub;

  public List<Chat> listChats() {
    return chatStore.listChats();
  }

  public Chat createChat(String title) {
    return chatStore.createChat(title);
  }

  public Chat getChat(String chatId) {
    return chatStore.getChat(chatId).orElseThrow(() -> new ChatNotFoundException(chatId));
  }

  public Chat renameChat(String chatId, String title) {
    if (title == null || title.isBlank()) {
      throw new IllegalArgumentException("title is required");
    }
    return chatStore.renameChat(chatId, title.strip())
      .orElseThrow(() -> new ChatNotFoundException(chatId));
  }

  /**
   * 删除聊天：先断开所有连接并销毁会话，再删除存储
   */
  public void deleteChat(String chatId) {
    getChat(chatId);
    int evicted = connectionHub.evict(chatId);
    boolean destroyed = sessionRegistry.remove(chatId);
    chatStore.deleteChat(chatId);
    log.info("Deleted chat {}, evicted={}, sessionDestroyed={}", chatId, evicted, destroyed);
  }

  public List<ChatMessage> loadHistory(String chatId) {
    getChat(chatId);
    return chatStore.loadHistory(chatId);
  }

  public List<SearchHit> search(String query) {
    if (query == null || query.isBlank()) {
      throw new IllegalArgumentException("q is required");
    }
    return chatStore.search(query.strip(), ChatStore.DEFAULT_SEARCH_LIMIT);
  }

  public SessionStatus sessionStatus(String chatId) {
    getChat(chatId);
    Optional<AgentSession> session = sessionRegistry.find(chatId);
    return new SessionStatus(chatId,
      session.isPresent(),
      session.map(AgentSession::isProcessing).orElse(false),
      session.map(AgentSession::getActiveQueryId).orElse(0L));
  }

  /**
   * 重置活跃会话；没有活跃会话（或会话恰好已被销毁）时什么也不做
   *
   * @return 是否存在被重置的会话
   */
  public boolean resetSession(String chatId) {
    getChat(chatId);
    Optional<AgentSession> session = sessionRegistry.find(chatId);
    if (session.isEmpty()) {
      return false;
    }
    try {
      session.get().reset();
      return true;
    } catch (SessionClosedException e) {
      log.debug("Session of conversation {} closed before reset", chatId);
      return false;
    }
  }
}
