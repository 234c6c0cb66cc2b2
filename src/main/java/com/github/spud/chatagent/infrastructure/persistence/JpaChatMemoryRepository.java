package com.github.spud.chatagent.infrastructure.persistence;

import com.github.spud.chatagent.infrastructure.persistence.entity.ChatMemoryEntry;
import com.github.spud.chatagent.infrastructure.persistence.repository.ChatMemoryEntryRepository;
import java.util.List;
import java.util.Objects;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.memory.ChatMemoryRepository;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.MessageType;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * JPA 版 Spring AI ChatMemoryRepository
 * <p>
 * 只保存 USER / ASSISTANT / SYSTEM 消息的文本，工具消息不进入记忆窗口。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JpaChatMemoryRepository implements ChatMemoryRepository {

  private final ChatMemoryEntryRepository entryRepository;
  private final TransactionTemplate transactionTemplate;

  @Override
  public List<String> findConversationIds() {
    return entryRepository.findConversationIds();
  }

  @Override
  public List<Message> findByConversationId(String conversationId) {
    return entryRepository.findAllByConversationIdOrderByIdAsc(conversationId).stream()
      .map(this::toMessage)
      .filter(Objects::nonNull)
      .toList();
  }

  /**
   * 用给定消息整体替换该会话的记忆
   */
  @Override
  public void saveAll(String conversationId, List<Message> messages) {
    transactionTemplate.executeWithoutResult(status -> {
      entryRepository.deleteByConversationId(conversationId);
      List<ChatMemoryEntry> entries = messages.stream()
        .filter(message -> message.getMessageType() != MessageType.TOOL)
        .map(message -> toEntry(conversationId, message))
        .toList();
      entryRepository.saveAll(entries);
    });
  }

  @Override
  public void deleteByConversationId(String conversationId) {
    transactionTemplate.executeWithoutResult(status -> {
      int deleted = entryRepository.deleteByConversationId(conversationId);
      log.debug("Deleted {} memory entries of conversation {}", deleted, conversationId);
    });
  }

  private ChatMemoryEntry toEntry(String conversationId, Message message) {
    ChatMemoryEntry entry = new ChatMemoryEntry();
    entry.setConversationId(conversationId);
    entry.setMessageType(message.getMessageType().name());
    entry.setContent(message.getText());
    return entry;
  }

  private Message toMessage(ChatMemoryEntry entry) {
    String text = entry.getContent() == null ? "" : entry.getContent();
    MessageType type;
    try {
      type = MessageType.valueOf(entry.getMessageType());
    } catch (IllegalArgumentException e) {
      log.warn("Skipping memory entry {} with unknown type {}", entry.getId(),
        entry.getMessageType());
      return null;
    }
    return switch (type) {
      case USER -> new UserMessage(text);
      case ASSISTANT -> new AssistantMessage(text);
      case SYSTEM -> new SystemMessage(text);
      case TOOL -> null;
    };
  }
}
