package io.openproposal.composer.diff;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.openproposal.composer.block.Block;
import java.util.List;

/**
 * Change to a single block between two snapshots. {@code oldBlock} is null for added blocks,
 * {@code newBlock} for removed ones, and {@code textDiff} is only present for modified blocks.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BlockDiff(
    BlockChangeType type, Block oldBlock, Block newBlock, List<DiffLine> textDiff) {

  public BlockDiff {
    textDiff = textDiff != null ? List.copyOf(textDiff) : null;
  }

  static BlockDiff added(Block block) {
    return new BlockDiff(BlockChangeType.ADDED, null, block, null);
  }

  static BlockDiff removed(Block block) {
    return new BlockDiff(BlockChangeType.REMOVED, block, null, null);
  }

  static BlockDiff modified(Block oldBlock, Block newBlock, List<DiffLine> textDiff) {
    return new BlockDiff(BlockChangeType.MODIFIED, oldBlock, newBlock, textDiff);
  }

  static BlockDiff unchanged(Block oldBlock, Block newBlock) {
    return new BlockDiff(BlockChangeType.UNCHANGED, oldBlock, newBlock, null);
  }

  /** The block to show for this entry: the new version unless it was removed. */
  public Block block() {
    return newBlock != null ? newBlock : oldBlock;
  }
}
