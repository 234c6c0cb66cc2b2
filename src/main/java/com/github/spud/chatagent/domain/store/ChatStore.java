package com.github.spud.chatagent.domain.store;

import com.github.spud.chatagent.domain.query.ImageAttachment;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 聊天、消息与工具调用记录的持久化
 */
public interface ChatStore {

  int DEFAULT_SEARCH_LIMIT = 20;

  Chat createChat(String title);

  Optional<Chat> getChat(String chatId);

  /**
   * 按更新时间倒序
   */
  List<Chat> listChats();

  Optional<Chat> renameChat(String chatId, String title);

  /**
   * 删除聊天及其消息、图片与工具调用记录
   */
  boolean deleteChat(String chatId);

  /**
   * 追加消息。标题仍为 "New Chat" 的聊天在第一条用户消息时自动改名
   */
  ChatMessage appendMessage(String chatId, MessageRole role, String content,
    List<ImageAttachment> images);

  List<ChatMessage> loadHistory(String chatId);

  void appendToolRecord(String chatId, String toolUseId, String toolName,
    Map<String, Object> toolInput);

  void updateToolResult(String toolUseId, String resultContent, boolean error);

  List<ToolRecord> loadToolRecords(String chatId);

  int clearMessages(String chatId);

  int clearToolRecords(String chatId);

  /**
   * 在消息内容中搜索，命中片段带前后各 30 个字符的上下文
   */
  List<SearchHit> search(String query, int limit);
}
