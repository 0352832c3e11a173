package io.openproposal.composer.builder;

import io.openproposal.composer.block.Block;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot of the document builder. Every reducer step returns a new instance.
 *
 * <p>{@code persistedTitle} and {@code persistedBlocks} hold what was last loaded or saved; {@link
 * #isDirty()} compares against them, so undoing back to the saved content clears the flag.
 *
 * @param locked whether the document is locked by a signature; content mutations are refused
 * @param saving true while an external save is in flight
 */
public record BuilderState(
    String documentId,
    String title,
    List<Block> blocks,
    String selectedBlockId,
    boolean locked,
    boolean saving,
    Instant lastSavedAt,
    BlockHistory history,
    String persistedTitle,
    List<Block> persistedBlocks) {

  public static final String UNTITLED = "Untitled Document";

  public BuilderState {
    blocks = List.copyOf(blocks);
    persistedBlocks = List.copyOf(persistedBlocks);
    history = history != null ? history : BlockHistory.empty();
  }

  public static BuilderState initial() {
    return new BuilderState(
        "",
        UNTITLED,
        List.of(),
        null,
        false,
        false,
        null,
        BlockHistory.empty(),
        UNTITLED,
        List.of());
  }

  public boolean isDirty() {
    return !Objects.equals(title, persistedTitle) || !blocks.equals(persistedBlocks);
  }

  public boolean canUndo() {
    return history.canUndo();
  }

  public boolean canRedo() {
    return history.canRedo();
  }

  public Optional<Block> selectedBlock() {
    return findBlock(selectedBlockId);
  }

  public Optional<Block> findBlock(String blockId) {
    if (blockId == null) {
      return Optional.empty();
    }
    return blocks.stream().filter(b -> blockId.equals(b.id())).findFirst();
  }

  int indexOf(String blockId) {
    for (int i = 0; i < blocks.size(); i++) {
      if (Objects.equals(blocks.get(i).id(), blockId)) {
        return i;
      }
    }
    return -1;
  }
}
