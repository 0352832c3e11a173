package io.openproposal.composer.builder;

import io.openproposal.composer.block.Block;
import java.util.ArrayList;
import java.util.List;

/**
 * Undo/redo stacks of block snapshots, most recent last. Blocks are immutable values, so a copied
 * list is an independent snapshot.
 */
public record BlockHistory(List<List<Block>> past, List<List<Block>> future) {

  private static final BlockHistory EMPTY = new BlockHistory(List.of(), List.of());

  public BlockHistory {
    past = past.stream().map(List::copyOf).toList();
    future = future.stream().map(List::copyOf).toList();
  }

  public static BlockHistory empty() {
    return EMPTY;
  }

  public boolean canUndo() {
    return !past.isEmpty();
  }

  public boolean canRedo() {
    return !future.isEmpty();
  }

  /** Records a snapshot before an edit: evicts the oldest beyond {@code limit}, drops redo. */
  BlockHistory record(List<Block> snapshot, int limit) {
    return new BlockHistory(pushBounded(past, snapshot, limit), List.of());
  }

  List<Block> previous() {
    return past.get(past.size() - 1);
  }

  List<Block> next() {
    return future.get(future.size() - 1);
  }

  /** Pops the latest past snapshot and parks {@code current} for redo. */
  BlockHistory undo(List<Block> current, int limit) {
    return new BlockHistory(
        past.subList(0, past.size() - 1), pushBounded(future, current, limit));
  }

  /** Pops the latest future snapshot and parks {@code current} for undo. */
  BlockHistory redo(List<Block> current, int limit) {
    return new BlockHistory(
        pushBounded(past, current, limit), future.subList(0, future.size() - 1));
  }

  private static List<List<Block>> pushBounded(
      List<List<Block>> stack, List<Block> snapshot, int limit) {
    var next = new ArrayList<>(stack);
    next.add(snapshot);
    while (next.size() > limit) {
      next.remove(0);
    }
    return next;
  }
}
