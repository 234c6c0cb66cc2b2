package com.github.spud.chatagent.domain.store;

public class ChatNotFoundException extends RuntimeException {

  public ChatNotFoundException(String chatId) {
    super("Chat not found: " + chatId);
  }
}
