package com.github.spud.chatagent.domain.store;

import com.fasterxml.jackson.annotation.JsonValue;

public enum MessageRole {
  USER("user"),
  ASSISTANT("assistant");

  private final String value;

  MessageRole(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }
}
