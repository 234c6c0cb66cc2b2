package com.github.spud.chatagent.domain.query;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 用户消息中的图片附件
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImageAttachment {

  public static final String DEFAULT_MIME_TYPE = "image/png";

  private String id;

  private String base64;

  @JsonAlias({"media_type", "mime_type"})
  private String mimeType;

  public String resolvedMimeType() {
    return mimeType == null || mimeType.isBlank() ? DEFAULT_MIME_TYPE : mimeType;
  }
}
