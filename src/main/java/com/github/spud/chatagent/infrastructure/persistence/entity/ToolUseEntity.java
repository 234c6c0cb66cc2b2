package com.github.spud.chatagent.infrastructure.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.validation.constraints.NotNull;
import java.time.OffsetDateTime;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;

@Getter
@Setter
@Entity
@Table(name = "tool_use", indexes = @Index(name = "idx_tool_use_chat_id", columnList = "chat_id"))
public class ToolUseEntity {

  /**
   * Tool call id assigned by the model
   */
  @Id
  @Column(name = "id", nullable = false)
  private String id;

  @NotNull
  @Column(name = "chat_id", nullable = false, length = 64)
  private String chatId;

  @NotNull
  @Column(name = "tool_name", nullable = false)
  private String toolName;

  /**
   * JSON text
   */
  @Column(name = "tool_input", length = Integer.MAX_VALUE)
  private String toolInput;

  @Column(name = "result_content", length = Integer.MAX_VALUE)
  private String resultContent;

  @Column(name = "is_error", nullable = false)
  private boolean error;

  @CreationTimestamp
  @Column(name = "created_at")
  private OffsetDateTime createdAt;
}
