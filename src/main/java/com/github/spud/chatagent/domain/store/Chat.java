package com.github.spud.chatagent.domain.store;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.OffsetDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Chat {

  public static final String DEFAULT_TITLE = "New Chat";

  private String id;
  private String title;
  private OffsetDateTime createdAt;
  private OffsetDateTime updatedAt;
}
