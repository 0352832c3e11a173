package io.openproposal.composer.block;

public record TextInputBlock(
    String id,
    BlockVisibility visibility,
    String label,
    String placeholder,
    boolean required,
    String value,
    boolean multiline)
    implements Block {

  @Override
  public BlockType type() {
    return BlockType.TEXT_INPUT;
  }
}
