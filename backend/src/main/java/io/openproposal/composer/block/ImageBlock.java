package io.openproposal.composer.block;

/**
 * Image with alt text and optional caption.
 *
 * @param width rendered width as a percentage of the page (1-100); null for natural width
 */
public record ImageBlock(
    String id, BlockVisibility visibility, String src, String alt, String caption, Integer width)
    implements Block {

  @Override
  public BlockType type() {
    return BlockType.IMAGE;
  }
}
