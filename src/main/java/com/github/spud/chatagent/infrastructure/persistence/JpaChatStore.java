package com.github.spud.chatagent.infrastructure.persistence;

import com.github.spud.chatagent.domain.query.ImageAttachment;
import com.github.spud.chatagent.domain.store.Chat;
import com.github.spud.chatagent.domain.store.ChatMessage;
import com.github.spud.chatagent.domain.store.ChatNotFoundException;
import com.github.spud.chatagent.domain.store.ChatStore;
import com.github.spud.chatagent.domain.store.MessageRole;
import com.github.spud.chatagent.domain.store.SearchHit;
import com.github.spud.chatagent.domain.store.ToolRecord;
import com.github.spud.chatagent.infrastructure.persistence.entity.ChatEntity;
import com.github.spud.chatagent.infrastructure.persistence.entity.ChatMessageEntity;
import com.github.spud.chatagent.infrastructure.persistence.entity.MessageImageEntity;
import com.github.spud.chatagent.infrastructure.persistence.entity.ToolUseEntity;
import com.github.spud.chatagent.infrastructure.persistence.repository.ChatMessageRepository;
import com.github.spud.chatagent.infrastructure.persistence.repository.ChatRepository;
import com.github.spud.chatagent.infrastructure.persistence.repository.ToolUseRepository;
import com.github.spud.chatagent.util.JsonUtils;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.StringUtils;

/**
 * ChatStore 的 JPA 实现
 * <p>
 * 使用 TransactionTemplate 而非 @Transactional，调用方大多运行在 boundedElastic 线程上。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JpaChatStore implements ChatStore {

  static final int TITLE_MAX_LENGTH = 50;
  static final int SEARCH_CONTEXT = 30;
  static final int SEARCH_FALLBACK_LENGTH = 60;

  private final ChatRepository chatRepository;
  private final ChatMessageRepository messageRepository;
  private final ToolUseRepository toolUseRepository;
  private final TransactionTemplate transactionTemplate;

  @Override
  public Chat createChat(String title) {
    ChatEntity entity = new ChatEntity();
    entity.setId(UUID.randomUUID().toString());
    entity.setTitle(StringUtils.hasText(title) ? title.strip() : Chat.DEFAULT_TITLE);
    OffsetDateTime now = OffsetDateTime.now();
    entity.setCreatedAt(now);
    entity.setUpdatedAt(now);
    ChatEntity saved = chatRepository.save(entity);
    log.info("Created chat {} titled '{}'", saved.getId(), saved.getTitle());
    return toDomain(saved);
  }

  @Override
  public Optional<Chat> getChat(String chatId) {
    return chatRepository.findById(chatId).map(this::toDomain);
  }

  @Override
  public List<Chat> listChats() {
    return chatRepository.findAllByOrderByUpdatedAtDesc().stream().map(this::toDomain).toList();
  }

  @Override
  public Optional<Chat> renameChat(String chatId, String title) {
    return transactionTemplate.execute(status -> chatRepository.findById(chatId)
      .map(entity -> {
        entity.setTitle(title.strip());
        entity.setUpdatedAt(OffsetDateTime.now());
        return toDomain(entity);
      }));
  }

  @Override
  public boolean deleteChat(String chatId) {
    Boolean deleted = transactionTemplate.execute(status -> {
      if (!chatRepository.existsById(chatId)) {
        return false;
      }
      int tools = toolUseRepository.deleteByChatId(chatId);
      int messages = messageRepository.deleteAllOfChat(chatId);
      chatRepository.deleteById(chatId);
      log.info("Deleted chat {} with {} messages and {} tool records", chatId, messages, tools);
      return true;
    });
    return Boolean.TRUE.equals(deleted);
  }

  @Override
  public ChatMessage appendMessage(String chatId, MessageRole role, String content,
    List<ImageAttachment> images) {
    return transactionTemplate.execute(status -> {
      ChatEntity chat = chatRepository.findById(chatId)
        .orElseThrow(() -> new ChatNotFoundException(chatId));

      ChatMessageEntity message = new ChatMessageEntity();
      message.setChatId(chatId);
      message.setRole(role);
      message.setContent(content == null ? "" : content);
      if (images != null) {
        for (ImageAttachment image : images) {
          MessageImageEntity imageEntity = new MessageImageEntity();
          imageEntity.setImageId(image.getId());
          imageEntity.setBase64(image.getBase64() == null ? "" : image.getBase64());
          imageEntity.setMimeType(image.resolvedMimeType());
          message.addImage(imageEntity);
        }
      }
      ChatMessageEntity saved = messageRepository.save(message);

      chat.setUpdatedAt(OffsetDateTime.now());
      if (role == MessageRole.USER && Chat.DEFAULT_TITLE.equals(chat.getTitle())) {
        chat.setTitle(titleFrom(message.getContent()));
        log.debug("Chat {} retitled from first user message", chatId);
      }
      return toDomain(saved);
    });
  }

  @Override
  public List<ChatMessage> loadHistory(String chatId) {
    return transactionTemplate.execute(status ->
      messageRepository.findAllByChatIdOrderByIdAsc(chatId).stream()
        .map(this::toDomain)
        .toList());
  }

  @Override
  public void appendToolRecord(String chatId, String toolUseId, String toolName,
    Map<String, Object> toolInput) {
    transactionTemplate.executeWithoutResult(status -> {
      ToolUseEntity entity = new ToolUseEntity();
      entity.setId(toolUseId);
      entity.setChatId(chatId);
      entity.setToolName(toolName);
      entity.setToolInput(JsonUtils.toJson(toolInput == null ? Map.of() : toolInput));
      toolUseRepository.save(entity);
    });
  }

  @Override
  public void updateToolResult(String toolUseId, String resultContent, boolean error) {
    transactionTemplate.executeWithoutResult(status -> toolUseRepository.findById(toolUseId)
      .ifPresentOrElse(entity -> {
        entity.setResultContent(resultContent);
        entity.setError(error);
      }, () -> log.warn("No tool record {} to attach a result to", toolUseId)));
  }

  @Override
  public List<ToolRecord> loadToolRecords(String chatId) {
    return toolUseRepository.findAllByChatIdOrderByCreatedAtAsc(chatId).stream()
      .map(this::toDomain)
      .toList();
  }

  @Override
  public int clearMessages(String chatId) {
    Integer deleted = transactionTemplate.execute(status -> {
      int count = messageRepository.deleteAllOfChat(chatId);
      chatRepository.findById(chatId).ifPresent(chat -> chat.setUpdatedAt(OffsetDateTime.now()));
      return count;
    });
    return deleted == null ? 0 : deleted;
  }

  @Override
  public int clearToolRecords(String chatId) {
    Integer deleted = transactionTemplate.execute(
      status -> toolUseRepository.deleteByChatId(chatId));
    return deleted == null ? 0 : deleted;
  }

  @Override
  public List<SearchHit> search(String query, int limit) {
    if (!StringUtils.hasText(query)) {
      return List.of();
    }
    String q = query.strip();
    return messageRepository.searchByContent(q, PageRequest.of(0, Math.max(1, limit))).stream()
      .map(m -> new SearchHit(m.getChatId(), m.getId(), snippet(m.getContent(), q)))
      .toList();
  }

  static String titleFrom(String content) {
    if (content.length() <= TITLE_MAX_LENGTH) {
      return content;
    }
    return content.substring(0, TITLE_MAX_LENGTH) + "...";
  }

  /**
   * 命中位置前后各 30 个字符，被截断的一侧补 "..."
   */
  static String snippet(String content, String query) {
    int idx = content.toLowerCase(Locale.ROOT).indexOf(query.toLowerCase(Locale.ROOT));
    if (idx < 0) {
      return content.length() > SEARCH_FALLBACK_LENGTH
        ? content.substring(0, SEARCH_FALLBACK_LENGTH) + "..." : content;
    }
    int start = Math.max(0, idx - SEARCH_CONTEXT);
    int end = Math.min(content.length(), idx + query.length() + SEARCH_CONTEXT);
    StringBuilder sb = new StringBuilder();
    if (start > 0) {
      sb.append("...");
    }
    sb.append(content, start, end);
    if (end < content.length()) {
      sb.append("...");
    }
    return sb.toString();
  }

  private Chat toDomain(ChatEntity entity) {
    return Chat.builder()
      .id(entity.getId())
      .title(entity.getTitle())
      .createdAt(entity.getCreatedAt())
      .updatedAt(entity.getUpdatedAt())
      .build();
  }

  private ChatMessage toDomain(ChatMessageEntity entity) {
    List<ImageAttachment> images = entity.getImages().stream()
      .map(image -> ImageAttachment.builder()
        .id(image.getImageId())
        .base64(image.getBase64())
        .mimeType(image.getMimeType())
        .build())
      .toList();
    return ChatMessage.builder()
      .id(entity.getId())
      .chatId(entity.getChatId())
      .role(entity.getRole())
      .content(entity.getContent())
      .timestamp(entity.getCreatedAt())
      .images(images.isEmpty() ? null : images)
      .build();
  }

  private ToolRecord toDomain(ToolUseEntity entity) {
    return ToolRecord.builder()
      .id(entity.getId())
      .chatId(entity.getChatId())
      .toolName(entity.getToolName())
      .toolInput(JsonUtils.toMap(entity.getToolInput()))
      .resultContent(entity.getResultContent())
      .error(entity.isError())
      .timestamp(entity.getCreatedAt())
      .build();
  }
}
