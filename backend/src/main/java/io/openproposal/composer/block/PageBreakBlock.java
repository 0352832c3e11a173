package io.openproposal.composer.block;

public record PageBreakBlock(String id, BlockVisibility visibility) implements Block {

  @Override
  public BlockType type() {
    return BlockType.PAGE_BREAK;
  }
}
