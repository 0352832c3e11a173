package io.openproposal.composer.block;

/** Date field filled in by a recipient; {@code value} is the entered date as text. */
public record DateBlock(
    String id,
    BlockVisibility visibility,
    String label,
    boolean required,
    String value,
    String format)
    implements Block {

  @Override
  public BlockType type() {
    return BlockType.DATE;
  }
}
