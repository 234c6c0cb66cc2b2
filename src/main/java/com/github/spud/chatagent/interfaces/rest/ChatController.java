package com.github.spud.chatagent.interfaces.rest;

import com.github.spud.chatagent.application.ChatService;
import com.github.spud.chatagent.application.SessionStatus;
import com.github.spud.chatagent.domain.store.Chat;
import com.github.spud.chatagent.domain.store.ChatMessage;
import com.github.spud.chatagent.domain.store.SearchHit;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.List;
import java.util.Map;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * 聊天管理 Api
 */
@Slf4j
@RestController
@RequestMapping("/api/chats")
@RequiredArgsConstructor
public class ChatController {

  private final ChatService chatService;

  @GetMapping
  public Mono<List<Chat>> listChats() {
    return Mono.fromCallable(chatService::listChats)
      .subscribeOn(Schedulers.boundedElastic());
  }

  /**
   * 新建聊天，标题可选
   */
  @PostMapping
  public Mono<ResponseEntity<Chat>> createChat(
    @Valid @RequestBody(required = false) Mono<CreateChatRequest> request
  ) {
    return request.defaultIfEmpty(new CreateChatRequest())
      .publishOn(Schedulers.boundedElastic())
      .map(body -> ResponseEntity.status(HttpStatus.CREATED)
        .body(chatService.createChat(body.getTitle())));
  }

  @GetMapping("/search")
  public Mono<List<SearchHit>> search(@RequestParam(name = "q", required = false) String q) {
    return Mono.fromCallable(() -> chatService.search(q))
      .subscribeOn(Schedulers.boundedElastic());
  }

  @GetMapping("/{chatId}")
  public Mono<Chat> getChat(@PathVariable String chatId) {
    return Mono.fromCallable(() -> chatService.getChat(chatId))
      .subscribeOn(Schedulers.boundedElastic());
  }

  @PatchMapping("/{chatId}")
  public Mono<Chat> renameChat(
    @PathVariable String chatId,
    @Valid @RequestBody Mono<RenameChatRequest> request
  ) {
    return request
      .publishOn(Schedulers.boundedElastic())
      .map(body -> {
        log.info("Renaming chat {}", chatId);
        return chatService.renameChat(chatId, body.getTitle());
      });
  }

  /**
   * 删除聊天、历史与会话
   */
  @DeleteMapping("/{chatId}")
  public Mono<Map<String, Boolean>> deleteChat(@PathVariable String chatId) {
    return Mono.fromCallable(() -> {
        chatService.deleteChat(chatId);
        return Map.of("success", true);
      })
      .subscribeOn(Schedulers.boundedElastic());
  }

  @GetMapping("/{chatId}/messages")
  public Mono<List<ChatMessage>> loadHistory(@PathVariable String chatId) {
    return Mono.fromCallable(() -> chatService.loadHistory(chatId))
      .subscribeOn(Schedulers.boundedElastic());
  }

  @GetMapping("/{chatId}/session")
  public Mono<SessionStatus> sessionStatus(@PathVariable String chatId) {
    return Mono.fromCallable(() -> chatService.sessionStatus(chatId))
      .subscribeOn(Schedulers.boundedElastic());
  }

  @PostMapping("/{chatId}/session/reset")
  public Mono<Map<String, Boolean>> resetSession(@PathVariable String chatId) {
    return Mono.fromCallable(() -> Map.of("reset", chatService.resetSession(chatId)))
      .subscribeOn(Schedulers.boundedElastic());
  }

  @Data
  public static class CreateChatRequest {

    @Size(max = 512)
    private String title;
  }

  @Data
  public static class RenameChatRequest {

    @NotBlank
    @Size(max = 512)
    private String title;
  }
}
