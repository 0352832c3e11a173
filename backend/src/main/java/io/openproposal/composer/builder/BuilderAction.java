package io.openproposal.composer.builder;

import io.openproposal.composer.block.Block;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/** Everything the builder reducer can be asked to do. */
public sealed interface BuilderAction {

  /** Whether the action changes the block sequence, which a locked document refuses. */
  default boolean mutatesContent() {
    return false;
  }

  /** Fresh load of a document; resets history and the dirty baseline. */
  record SetDocument(String documentId, String title, List<Block> blocks, boolean locked)
      implements BuilderAction {}

  record SetTitle(String title) implements BuilderAction {}

  /** Propagates a lock taken by the surrounding application, e.g. on the first signature. */
  record SetLocked(boolean locked) implements BuilderAction {}

  /**
   * @param index insertion position, clamped to the sequence bounds; null appends
   */
  record AddBlock(Block block, Integer index) implements BuilderAction {
    @Override
    public boolean mutatesContent() {
      return true;
    }
  }

  record RemoveBlock(String blockId) implements BuilderAction {
    @Override
    public boolean mutatesContent() {
      return true;
    }
  }

  /**
   * @param changes top-level payload properties to overwrite; {@code id} and {@code type} are fixed
   */
  record UpdateBlock(String blockId, Map<String, Object> changes) implements BuilderAction {
    @Override
    public boolean mutatesContent() {
      return true;
    }
  }

  /** Moves {@code activeId} to the position currently held by {@code overId}. */
  record MoveBlock(String activeId, String overId) implements BuilderAction {
    @Override
    public boolean mutatesContent() {
      return true;
    }
  }

  record SelectBlock(String blockId) implements BuilderAction {}

  record SetSaving(boolean saving) implements BuilderAction {}

  record SetSaved(Instant savedAt) implements BuilderAction {}

  record Undo() implements BuilderAction {
    @Override
    public boolean mutatesContent() {
      return true;
    }
  }

  record Redo() implements BuilderAction {
    @Override
    public boolean mutatesContent() {
      return true;
    }
  }

  record ClearHistory() implements BuilderAction {}
}
