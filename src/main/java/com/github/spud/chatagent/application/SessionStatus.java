package com.github.spud.chatagent.application;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SessionStatus {

  private String chatId;
  private Boolean isActive;
  private Boolean isProcessing;
  private long activeQueryId;
}
