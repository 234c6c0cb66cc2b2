package com.github.spud.chatagent.domain.hub;

import com.github.spud.chatagent.application.config.SessionProperties;
import com.github.spud.chatagent.domain.event.ChatEvent;
import com.github.spud.chatagent.domain.recorder.ConversationTranscriptRecorder;
import com.github.spud.chatagent.domain.session.AgentSession;
import com.github.spud.chatagent.domain.session.AgentSessionCreatedEvent;
import com.github.spud.chatagent.domain.session.AgentSessionDestroyedEvent;
import com.github.spud.chatagent.domain.session.SessionRegistry;
import com.github.spud.chatagent.domain.store.ChatMessage;
import com.github.spud.chatagent.domain.store.ChatStore;
import com.github.spud.chatagent.domain.store.ToolRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import reactor.core.scheduler.Schedulers;

/**
 * 连接中心：把一个 AgentSession 的事件流扇出到所有挂载的连接
 * <p>
 * 新连接挂载时收到历史、工具历史，以及（若正在处理）当前 Query 已投递文本的拼接，
 * 不需要逐条重放已经发给别人的增量。历史在记录器追上已分发的事件之后才读取，
 * 已经分发但尚未落库的轮次不会从快照中丢失。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConnectionHub {

  private final SessionRegistry sessionRegistry;
  private final ChatStore chatStore;
  private final ChatFrameMapper frameMapper;
  private final ConversationTranscriptRecorder transcriptRecorder;
  private final SessionProperties sessionProperties;

  private final Map<String, ConversationChannel> channels = new ConcurrentHashMap<>();

  @EventListener
  public void onSessionCreated(AgentSessionCreatedEvent event) {
    AgentSession session = event.getSession();
    String conversationId = session.getConversationId();
    ConversationChannel channel = channels.computeIfAbsent(conversationId,
      ConversationChannel::new);

    channel.bind(session.events().subscribe(
      chatEvent -> dispatch(channel, chatEvent),
      error -> log.error("Event stream of conversation {} failed", conversationId, error),
      () -> log.debug("Event stream of conversation {} completed", conversationId)));
    log.debug("Channel bound to new session of conversation {}", conversationId);
  }

  @EventListener
  public void onSessionDestroyed(AgentSessionDestroyedEvent event) {
    channels.computeIfPresent(event.getConversationId(), (id, channel) -> {
      channel.unbind();
      return channel.isEmpty() ? null : channel;
    });
  }

  /**
   * 挂载连接并投递恢复快照
   *
   * @return 挂载的会话
   */
  public AgentSession attach(String conversationId, HubConnection connection) {
    AgentSession session = sessionRegistry.retain(conversationId);

    ConversationChannel channel = channels.computeIfAbsent(conversationId,
      ConversationChannel::new);
    try {
      channel.attach(connection, lastSequence -> snapshot(conversationId, lastSequence));
    } catch (RuntimeException e) {
      sessionRegistry.release(conversationId);
      throw e;
    }

    log.info("Connection {} attached to conversation {}, connections={}", connection.getId(),
      conversationId, channel.size());
    return session;
  }

  public void detach(String conversationId, HubConnection connection) {
    ConversationChannel channel = channels.get(conversationId);
    if (channel != null && channel.detach(connection)) {
      sessionRegistry.release(conversationId);
      log.info("Connection {} detached from conversation {}, connections={}",
        connection.getId(), conversationId, channel.size());
    }
  }

  /**
   * 移除会话的全部连接（聊天被删除时）
   */
  public int evict(String conversationId) {
    ConversationChannel channel = channels.remove(conversationId);
    if (channel == null) {
      return 0;
    }
    int evicted = channel.evictAll().size();
    log.info("Evicted {} connections from conversation {}", evicted, conversationId);
    return evicted;
  }

  public int connectionCount(String conversationId) {
    ConversationChannel channel = channels.get(conversationId);
    return channel == null ? 0 : channel.size();
  }

  public boolean isProcessing(String conversationId) {
    ConversationChannel channel = channels.get(conversationId);
    return channel != null && channel.isProcessing();
  }

  public String partialText(String conversationId) {
    ConversationChannel channel = channels.get(conversationId);
    return channel == null ? "" : channel.partialText();
  }

  private List<ChatFrame> snapshot(String conversationId, long lastSequence) {
    if (!transcriptRecorder.awaitPersisted(conversationId, lastSequence,
      sessionProperties.getSnapshotTimeout())) {
      log.warn("Transcript of conversation {} did not reach event {} within {}, history may lag",
        conversationId, lastSequence, sessionProperties.getSnapshotTimeout());
    }

    List<ChatFrame> snapshot = new ArrayList<>();
    List<ChatMessage> history = chatStore.loadHistory(conversationId);
    snapshot.add(ChatFrame.history(conversationId, history));
    List<ToolRecord> toolRecords = chatStore.loadToolRecords(conversationId);
    if (!toolRecords.isEmpty()) {
      snapshot.add(ChatFrame.toolHistory(conversationId, toolRecords));
    }
    return snapshot;
  }

  private void dispatch(ConversationChannel channel, ChatEvent event) {
    try {
      List<HubConnection> dropped = channel.dispatch(event, frameMapper.toFrame(event));
      // 分发线程持有会话的发送锁，不能在这里进入注册表锁
      dropped.forEach(connection -> Schedulers.boundedElastic()
        .schedule(() -> sessionRegistry.release(channel.getConversationId())));
    } catch (RuntimeException e) {
      log.error("Failed to dispatch {} to conversation {}", event.getType(),
        channel.getConversationId(), e);
    }
  }
}
