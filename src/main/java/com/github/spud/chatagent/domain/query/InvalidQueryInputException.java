package com.github.spud.chatagent.domain.query;

public class InvalidQueryInputException extends RuntimeException {

  public InvalidQueryInputException(String message) {
    super(message);
  }
}
