package com.github.spud.chatagent.infrastructure.runtime;

import com.github.spud.chatagent.application.config.AgentRuntimeProperties;
import com.github.spud.chatagent.domain.event.ChatEvent;
import com.github.spud.chatagent.domain.query.ImageAttachment;
import com.github.spud.chatagent.domain.query.QueryInput;
import com.github.spud.chatagent.domain.runtime.AgentRuntime;
import com.github.spud.chatagent.tools.ToolRegistry;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.memory.ChatMemory;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.content.Media;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.stereotype.Component;
import org.springframework.util.MimeTypeUtils;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;

/**
 * 基于 Spring AI ChatClient 流式调用的 AgentRuntime
 * <p>
 * 每段连续文本被 STREAM_STARTED / STREAM_ENDED 包围；工具调用会先结束当前文本段。
 * 上游正常结束时追加 QUERY_RESULT；被中断时直接完成，不发送 QUERY_RESULT。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SpringAiAgentRuntime implements AgentRuntime {

  static final String IMAGE_ONLY_PROMPT = "Please look at the attached image.";

  private final ChatClient chatClient;
  private final ChatMemory chatMemory;
  private final ToolRegistry toolRegistry;
  private final AgentRuntimeProperties properties;

  /**
   * conversationId -> 正在进行的调用
   */
  private final Map<String, ActiveStream> activeStreams = new ConcurrentHashMap<>();

  @Override
  public Flux<ChatEvent> run(String conversationId, long queryId, QueryInput input) {
    return Flux.create(sink -> {
      long startedAt = System.currentTimeMillis();
      Segment segment = new Segment(sink, conversationId, queryId);

      List<ToolCallback> tools = toolRegistry.resolve(properties.getAllowedTools()).stream()
        .map(tool -> (ToolCallback) new EventPublishingToolCallback(tool, conversationId,
          queryId, segment::interleave))
        .toList();

      log.debug("Starting query {} of conversation {} with {} tools", queryId, conversationId,
        tools.size());

      Disposable upstream = chatClient.prompt()
        .user(user -> {
          user.text(input.getContent().isEmpty() ? IMAGE_ONLY_PROMPT : input.getContent());
          if (input.hasImages()) {
            user.media(input.getImages().stream().map(SpringAiAgentRuntime::toMedia)
              .toArray(Media[]::new));
          }
        })
        .toolCallbacks(tools)
        .advisors(advisor -> advisor.param(ChatMemory.CONVERSATION_ID, conversationId))
        .stream()
        .chatResponse()
        .subscribe(
          segment::text,
          sink::error,
          () -> {
            segment.close();
            sink.next(ChatEvent.queryResult(conversationId, queryId, true, null,
              System.currentTimeMillis() - startedAt));
            sink.complete();
          });

      ActiveStream active = new ActiveStream(upstream, sink);
      activeStreams.put(conversationId, active);
      sink.onDispose(() -> {
        upstream.dispose();
        activeStreams.remove(conversationId, active);
      });
    });
  }

  @Override
  public void interrupt(String conversationId) {
    ActiveStream active = activeStreams.remove(conversationId);
    if (active == null) {
      log.debug("No active stream to interrupt in conversation {}", conversationId);
      return;
    }
    log.info("Interrupting model stream of conversation {}", conversationId);
    active.upstream().dispose();
    active.sink().complete();
  }

  @Override
  public void reset(String conversationId) {
    chatMemory.clear(conversationId);
    log.info("Cleared chat memory of conversation {}", conversationId);
  }

  static Media toMedia(ImageAttachment image) {
    String data = image.getBase64() == null ? "" : image.getBase64();
    int comma = data.indexOf(',');
    if (data.startsWith("data:") && comma > 0) {
      data = data.substring(comma + 1);
    }
    return new Media(MimeTypeUtils.parseMimeType(image.resolvedMimeType()),
      new ByteArrayResource(Base64.getDecoder().decode(data)));
  }

  private record ActiveStream(Disposable upstream, FluxSink<ChatEvent> sink) {

  }

  /**
   * 跟踪当前是否处于一个打开的文本段
   */
  private static final class Segment {

    private final FluxSink<ChatEvent> sink;
    private final String conversationId;
    private final long queryId;
    private boolean open;

    private Segment(FluxSink<ChatEvent> sink, String conversationId, long queryId) {
      this.sink = sink;
      this.conversationId = conversationId;
      this.queryId = queryId;
    }

    synchronized void text(ChatResponse response) {
      if (response == null || response.getResult() == null
        || response.getResult().getOutput() == null) {
        return;
      }
      String text = response.getResult().getOutput().getText();
      if (text == null || text.isEmpty()) {
        return;
      }
      if (!open) {
        open = true;
        sink.next(ChatEvent.streamStarted(conversationId, queryId));
      }
      sink.next(ChatEvent.textDelta(conversationId, queryId, text));
    }

    synchronized void interleave(ChatEvent toolEvent) {
      close();
      sink.next(toolEvent);
    }

    synchronized void close() {
      if (open) {
        open = false;
        sink.next(ChatEvent.streamEnded(conversationId, queryId));
      }
    }
  }
}
