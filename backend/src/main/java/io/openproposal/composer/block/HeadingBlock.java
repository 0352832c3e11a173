package io.openproposal.composer.block;

public record HeadingBlock(String id, BlockVisibility visibility, String content, int level)
    implements Block, TextBearing {

  @Override
  public BlockType type() {
    return BlockType.HEADING;
  }

  @Override
  public HeadingBlock withContent(String content) {
    return new HeadingBlock(id, visibility, content, level);
  }
}
