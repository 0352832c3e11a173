package io.openproposal.composer.block;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public record VideoBlock(String id, BlockVisibility visibility, String url, Provider provider)
    implements Block {

  @Override
  public BlockType type() {
    return BlockType.VIDEO;
  }

  public enum Provider {
    YOUTUBE,
    LOOM,
    VIMEO,
    OTHER;

    @JsonValue
    public String value() {
      return name().toLowerCase(Locale.ROOT);
    }
  }
}
