package com.github.spud.chatagent.domain.hub;

import com.github.spud.chatagent.domain.event.ChatEvent;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.LongFunction;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;

/**
 * 单个会话的连接集合与流式状态缓存
 * <p>
 * 分发与新连接的快照都在实例监视器下进行，新连接不会漏掉或重复收到事件。
 */
@Slf4j
class ConversationChannel {

  @Getter
  private final String conversationId;

  private final Set<HubConnection> connections = new LinkedHashSet<>();

  private final StringBuilder partialText = new StringBuilder();

  private boolean processing;

  private long processingQueryId;

  // 最后一个已分发事件的序号
  private long lastSequence;

  private Disposable subscription;

  ConversationChannel(String conversationId) {
    this.conversationId = conversationId;
  }

  synchronized void bind(Disposable subscription) {
    unbind();
    this.subscription = subscription;
    lastSequence = 0;
    resetCache();
  }

  synchronized void unbind() {
    if (subscription != null) {
      subscription.dispose();
      subscription = null;
    }
  }

  /**
   * 更新缓存后按相同顺序投递给每个连接，失败的连接被移除
   *
   * @return 被移除的连接
   */
  synchronized List<HubConnection> dispatch(ChatEvent event, ChatFrame frame) {
    lastSequence = event.getSequence();
    updateCache(event);

    List<HubConnection> dropped = new ArrayList<>();
    Iterator<HubConnection> it = connections.iterator();
    while (it.hasNext()) {
      HubConnection connection = it.next();
      if (!connection.deliver(frame)) {
        log.warn("Dropping dead connection {} from conversation {}", connection.getId(),
          conversationId);
        it.remove();
        dropped.add(connection);
      }
    }
    return dropped;
  }

  /**
   * 先投递快照，再把连接加入集合
   * <p>
   * 快照在监视器内加载，加载期间不会有新事件分发；{@code snapshotLoader} 收到最后一个已分发事件的序号。
   */
  synchronized void attach(HubConnection connection,
    LongFunction<List<ChatFrame>> snapshotLoader) {
    List<ChatFrame> snapshot = snapshotLoader.apply(lastSequence);
    snapshot.forEach(connection::deliver);
    if (processing) {
      connection.deliver(
        ChatFrame.processingState(conversationId, processingQueryId, partialText.toString()));
    }
    connections.add(connection);
  }

  synchronized boolean detach(HubConnection connection) {
    return connections.remove(connection);
  }

  synchronized List<HubConnection> evictAll() {
    List<HubConnection> evicted = new ArrayList<>(connections);
    connections.clear();
    unbind();
    return evicted;
  }

  synchronized boolean isEmpty() {
    return connections.isEmpty();
  }

  synchronized int size() {
    return connections.size();
  }

  synchronized boolean isProcessing() {
    return processing;
  }

  synchronized String partialText() {
    return partialText.toString();
  }

  private void updateCache(ChatEvent event) {
    switch (event.getType()) {
      case USER_MESSAGE -> {
        processing = true;
        processingQueryId = event.getQueryId();
        partialText.setLength(0);
      }
      case TEXT_DELTA -> {
        if (event.getText() != null) {
          partialText.append(event.getText());
        }
      }
      case QUERY_RESULT, QUERY_CANCELLED, QUERY_FAILED, HISTORY_CLEARED -> resetCache();
      default -> {
      }
    }
  }

  private void resetCache() {
    processing = false;
    partialText.setLength(0);
  }
}
