package com.github.spud.chatagent.it.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.jetbrains.annotations.NotNull;

/**
 * OpenAI API MockWebServer for deterministic streamed LLM responses
 * Each queued response is replayed as a server-sent event stream of completion chunks
 */
@Slf4j
public class OpenAiMockSupport {

  private static final MockWebServer MOCK_SERVER;
  private static final ObjectMapper JSON = new ObjectMapper();

  // Queue of responses (thread-safe via synchronized access)
  private static final List<MockResponse> RESPONSE_QUEUE = new ArrayList<>();

  static {
    MOCK_SERVER = new MockWebServer();
    MOCK_SERVER.setDispatcher(new OpenAiDispatcher());

    try {
      MOCK_SERVER.start();
      log.info("MockWebServer started at {}", MOCK_SERVER.url("/"));
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to start MockWebServer", e);
    }
  }

  public static synchronized void enqueueResponse(MockResponse response) {
    RESPONSE_QUEUE.add(response);
    log.debug("Enqueued mock response (total queued: {})", RESPONSE_QUEUE.size());
  }

  /**
   * Clear response queue (call before each test to ensure isolation)
   */
  public static synchronized void clearQueue() {
    RESPONSE_QUEUE.clear();
  }

  public static MockWebServer getServer() {
    return MOCK_SERVER;
  }

  /**
   * Builder for streamed chat completion responses
   */
  public static class StreamBuilder {

    private final List<String> chunks = new ArrayList<>();
    private String model = "gpt-4o-test";

    public StreamBuilder withChunk(String content) {
      chunks.add(content);
      return this;
    }

    public StreamBuilder withModel(String model) {
      this.model = model;
      return this;
    }

    public MockResponse build() {
      String id = "chatcmpl-test-" + System.nanoTime();
      StringBuilder body = new StringBuilder();
      for (int i = 0; i < chunks.size(); i++) {
        Map<String, Object> delta = new HashMap<>();
        if (i == 0) {
          delta.put("role", "assistant");
        }
        delta.put("content", chunks.get(i));
        body.append(event(id, delta, null));
      }
      body.append(event(id, Map.of(), "stop"));
      body.append("data: [DONE]\n\n");

      return new MockResponse()
        .setResponseCode(200)
        .setBody(body.toString())
        .addHeader("Content-Type", "text/event-stream");
    }

    private String event(String id, Map<String, Object> delta, String finishReason) {
      Map<String, Object> choice = new HashMap<>();
      choice.put("index", 0);
      choice.put("delta", delta);
      choice.put("finish_reason", finishReason);

      Map<String, Object> chunk = new HashMap<>();
      chunk.put("id", id);
      chunk.put("object", "chat.completion.chunk");
      chunk.put("created", System.currentTimeMillis() / 1000);
      chunk.put("model", model);
      chunk.put("choices", List.of(choice));
      try {
        return "data: " + JSON.writeValueAsString(chunk) + "\n\n";
      } catch (IOException e) {
        throw new UncheckedIOException("Failed to build mock chunk", e);
      }
    }
  }

  /**
   * Dispatcher that validates requests and returns queued responses
   */
  private static class OpenAiDispatcher extends Dispatcher {

    @NotNull
    @Override
    public MockResponse dispatch(@NotNull RecordedRequest request) {
      String path = request.getPath();
      log.info("Mock OpenAI request: {} {}", request.getMethod(), path);

      if (path == null || !path.contains("/chat/completions")) {
        return new MockResponse()
          .setResponseCode(404)
          .setBody("{\"error\": {\"message\": \"Invalid path: " + path + "\"}}");
      }
      if (!"POST".equals(request.getMethod())) {
        return new MockResponse()
          .setResponseCode(405)
          .setBody("{\"error\": {\"message\": \"Method not allowed\"}}");
      }

      synchronized (OpenAiMockSupport.class) {
        if (RESPONSE_QUEUE.isEmpty()) {
          log.error("No mock responses queued for this request!");
          return new MockResponse()
            .setResponseCode(500)
            .setBody("{\"error\": {\"message\": \"No mock response configured\"}}");
        }
        return RESPONSE_QUEUE.remove(0);
      }
    }
  }
}
