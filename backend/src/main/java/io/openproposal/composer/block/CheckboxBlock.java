package io.openproposal.composer.block;

public record CheckboxBlock(
    String id, BlockVisibility visibility, String label, boolean required, boolean checked)
    implements Block {

  @Override
  public BlockType type() {
    return BlockType.CHECKBOX;
  }
}
