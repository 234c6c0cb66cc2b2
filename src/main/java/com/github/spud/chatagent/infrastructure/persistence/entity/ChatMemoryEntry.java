package com.github.spud.chatagent.infrastructure.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.OffsetDateTime;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;

/**
 * Spring AI 对话记忆的一条消息
 */
@Getter
@Setter
@Entity
@Table(name = "chat_memory",
  indexes = @Index(name = "idx_chat_memory_conversation_id", columnList = "conversation_id"))
public class ChatMemoryEntry {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  @Column(name = "id", nullable = false)
  private Long id;

  @Size(max = 255)
  @NotNull
  @Column(name = "conversation_id", nullable = false)
  private String conversationId;

  @Size(max = 50)
  @NotNull
  @Column(name = "message_type", nullable = false, length = 50)
  private String messageType;

  @Column(name = "content", length = Integer.MAX_VALUE)
  private String content;

  @CreationTimestamp
  @Column(name = "created_at")
  private OffsetDateTime createdAt;
}
