package io.openproposal.composer.block;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Rich text paragraph. {@code content} is HTML produced by the editor. */
public record TextBlock(String id, BlockVisibility visibility, String content, Alignment alignment)
    implements Block, TextBearing {

  @Override
  public BlockType type() {
    return BlockType.TEXT;
  }

  @Override
  public TextBlock withContent(String content) {
    return new TextBlock(id, visibility, content, alignment);
  }

  public enum Alignment {
    LEFT,
    CENTER,
    RIGHT,
    JUSTIFY;

    @JsonValue
    public String value() {
      return name().toLowerCase(Locale.ROOT);
    }
  }
}
