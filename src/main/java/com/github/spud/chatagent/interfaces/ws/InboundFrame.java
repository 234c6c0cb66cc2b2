package com.github.spud.chatagent.interfaces.ws;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.github.spud.chatagent.domain.query.ImageAttachment;
import java.util.List;
import lombok.Data;

/**
 * WebSocket 入站帧
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class InboundFrame {

  public static final String SUBSCRIBE = "subscribe";
  public static final String CHAT = "chat";
  public static final String STOP = "stop";
  public static final String CLEAR_HISTORY = "clear_history";

  private String type;
  private String chatId;
  private String content;
  private List<ImageAttachment> images;
}
