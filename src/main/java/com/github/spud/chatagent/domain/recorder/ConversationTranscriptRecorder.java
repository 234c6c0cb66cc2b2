package com.github.spud.chatagent.domain.recorder;

import com.github.spud.chatagent.domain.event.ChatEvent;
import com.github.spud.chatagent.domain.query.ImageAttachment;
import com.github.spud.chatagent.domain.query.QueryInput;
import com.github.spud.chatagent.domain.session.AgentSession;
import com.github.spud.chatagent.domain.session.AgentSessionCreatedEvent;
import com.github.spud.chatagent.domain.store.ChatStore;
import com.github.spud.chatagent.domain.store.MessageRole;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import reactor.core.scheduler.Schedulers;

/**
 * 会话事件流的第二个读者，把对话写入 ChatStore
 * <p>
 * 写入与实时投递互不影响：存储失败只记录日志，不会取消或失败正在进行的 Query。
 * 每个事件处理完（无论成功与否）都推进该会话的已持久化序号，新连接据此等待历史追上已分发的事件。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConversationTranscriptRecorder {

  static final String IMAGE_PLACEHOLDER = "[image]";

  private final ChatStore chatStore;

  private final Map<String, Transcript> transcripts = new ConcurrentHashMap<>();

  @EventListener
  public void onSessionCreated(AgentSessionCreatedEvent event) {
    AgentSession session = event.getSession();
    Transcript transcript = new Transcript(session.getConversationId());
    transcripts.put(transcript.conversationId, transcript);

    session.events()
      .onBackpressureBuffer()
      .publishOn(Schedulers.boundedElastic())
      .subscribe(
        transcript::record,
        error -> {
          log.error("Transcript of conversation {} stopped", transcript.conversationId, error);
          transcripts.remove(transcript.conversationId, transcript);
        },
        () -> transcripts.remove(transcript.conversationId, transcript));
  }

  /**
   * 等待当前会话中序号不大于 {@code sequence} 的事件全部处理完
   *
   * @return false 表示超时或线程被中断
   */
  public boolean awaitPersisted(String conversationId, long sequence, Duration timeout) {
    Transcript transcript = transcripts.get(conversationId);
    return transcript == null || transcript.awaitPersisted(sequence, timeout);
  }

  private final class Transcript {

    private final String conversationId;

    private final StringBuilder assistantText = new StringBuilder();

    // guarded by this
    private long persisted;

    private Transcript(String conversationId) {
      this.conversationId = conversationId;
    }

    private void record(ChatEvent event) {
      try {
        apply(event);
      } catch (RuntimeException e) {
        log.error("Failed to persist {} of query {} in conversation {}", event.getType(),
          event.getQueryId(), conversationId, e);
      } finally {
        advance(event.getSequence());
      }
    }

    private synchronized void advance(long sequence) {
      persisted = Math.max(persisted, sequence);
      notifyAll();
    }

    private synchronized boolean awaitPersisted(long sequence, Duration timeout) {
      long deadline = System.nanoTime() + timeout.toNanos();
      while (persisted < sequence) {
        long remaining = deadline - System.nanoTime();
        if (remaining <= 0) {
          return false;
        }
        try {
          TimeUnit.NANOSECONDS.timedWait(this, remaining);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          return false;
        }
      }
      return true;
    }

    private void apply(ChatEvent event) {
      switch (event.getType()) {
        case USER_MESSAGE -> {
          assistantText.setLength(0);
          QueryInput input = event.getInput();
          String content = input.getContent().isEmpty() ? IMAGE_PLACEHOLDER : input.getContent();
          chatStore.appendMessage(conversationId, MessageRole.USER, content,
            withIds(input.getImages()));
        }
        case STREAM_STARTED -> assistantText.setLength(0);
        case TEXT_DELTA -> {
          if (event.getText() != null) {
            assistantText.append(event.getText());
          }
        }
        case STREAM_ENDED -> {
          if (assistantText.length() > 0) {
            String text = assistantText.toString();
            assistantText.setLength(0);
            chatStore.appendMessage(conversationId, MessageRole.ASSISTANT, text, List.of());
          }
        }
        case TOOL_INVOKED -> chatStore.appendToolRecord(conversationId, event.getToolUseId(),
          event.getToolName(), event.getToolInput());
        case TOOL_RESULT -> chatStore.updateToolResult(event.getToolUseId(),
          event.getToolOutput(), event.isToolError());
        case QUERY_CANCELLED, QUERY_FAILED -> assistantText.setLength(0);
        case HISTORY_CLEARED -> {
          assistantText.setLength(0);
          int messages = chatStore.clearMessages(conversationId);
          int tools = chatStore.clearToolRecords(conversationId);
          log.info("Cleared {} messages and {} tool records of conversation {}", messages,
            tools, conversationId);
        }
        default -> log.debug("Nothing to persist for {} in conversation {}", event.getType(),
          conversationId);
      }
    }

    private List<ImageAttachment> withIds(List<ImageAttachment> images) {
      return images.stream()
        .map(image -> ImageAttachment.builder()
          .id(image.getId() != null && !image.getId().isBlank()
            ? image.getId() : UUID.randomUUID().toString())
          .base64(image.getBase64())
          .mimeType(image.resolvedMimeType())
          .build())
        .toList();
    }
  }
}
