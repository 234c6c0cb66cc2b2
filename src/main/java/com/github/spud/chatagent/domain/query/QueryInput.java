package com.github.spud.chatagent.domain.query;

import java.util.List;
import lombok.Getter;

/**
 * One user input: text plus optional image attachments.
 */
@Getter
public class QueryInput {

  private final String content;

  private final List<ImageAttachment> images;

  private QueryInput(String content, List<ImageAttachment> images) {
    this.content = content == null ? "" : content.strip();
    this.images = images == null ? List.of() : List.copyOf(images);
  }

  public static QueryInput of(String content, List<ImageAttachment> images) {
    return new QueryInput(content, images);
  }

  public static QueryInput text(String content) {
    return new QueryInput(content, null);
  }

  public boolean hasImages() {
    return !images.isEmpty();
  }

  /**
   * Blank text and no attachments.
   */
  public boolean isEmpty() {
    return content.isEmpty() && images.isEmpty();
  }
}
