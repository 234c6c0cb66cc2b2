package com.github.spud.chatagent.domain.store;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.OffsetDateTime;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 工具调用记录，结果在工具返回后回填
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ToolRecord {

  private String id;
  private String chatId;
  private String toolName;
  private Map<String, Object> toolInput;
  private String resultContent;

  @JsonProperty("is_error")
  private boolean error;

  private OffsetDateTime timestamp;
}
