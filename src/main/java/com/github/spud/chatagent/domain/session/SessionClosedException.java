package com.github.spud.chatagent.domain.session;

public class SessionClosedException extends RuntimeException {

  public SessionClosedException(String conversationId) {
    super("Agent session is closed: " + conversationId);
  }
}
