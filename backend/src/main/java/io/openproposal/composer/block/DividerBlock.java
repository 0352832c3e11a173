package io.openproposal.composer.block;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public record DividerBlock(String id, BlockVisibility visibility, Style style, String color)
    implements Block {

  @Override
  public BlockType type() {
    return BlockType.DIVIDER;
  }

  public enum Style {
    SOLID,
    DASHED,
    DOTTED;

    @JsonValue
    public String value() {
      return name().toLowerCase(Locale.ROOT);
    }
  }
}
