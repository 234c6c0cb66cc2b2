package com.github.spud.chatagent.infrastructure.persistence.entity;

import com.github.spud.chatagent.domain.store.MessageRole;
import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OrderBy;
import jakarta.persistence.Table;
import jakarta.validation.constraints.NotNull;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;

@Getter
@Setter
@Entity
@Table(name = "chat_message", indexes = @Index(name = "idx_chat_message_chat_id", columnList = "chat_id"))
public class ChatMessageEntity {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  @Column(name = "id", nullable = false)
  private Long id;

  @NotNull
  @Column(name = "chat_id", nullable = false, length = 64)
  private String chatId;

  @NotNull
  @Column(name = "role", nullable = false, length = 20)
  @Enumerated(EnumType.STRING)
  private MessageRole role;

  @NotNull
  @Column(name = "content", nullable = false, length = Integer.MAX_VALUE)
  private String content;

  @CreationTimestamp
  @Column(name = "created_at")
  private OffsetDateTime createdAt;

  @OneToMany(mappedBy = "message", cascade = CascadeType.ALL, orphanRemoval = true,
    fetch = FetchType.LAZY)
  @OrderBy("id asc")
  private List<MessageImageEntity> images = new ArrayList<>();

  public void addImage(MessageImageEntity image) {
    image.setMessage(this);
    images.add(image);
  }
}
