package io.openproposal.composer.block;

/** Vertical whitespace of {@code height} pixels. */
public record SpacerBlock(String id, BlockVisibility visibility, int height) implements Block {

  @Override
  public BlockType type() {
    return BlockType.SPACER;
  }
}
