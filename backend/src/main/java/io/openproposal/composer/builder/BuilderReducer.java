package io.openproposal.composer.builder;

import io.openproposal.composer.block.Block;
import io.openproposal.composer.block.BlockJsonCodec;
import io.openproposal.composer.builder.BuilderAction.AddBlock;
import io.openproposal.composer.builder.BuilderAction.ClearHistory;
import io.openproposal.composer.builder.BuilderAction.MoveBlock;
import io.openproposal.composer.builder.BuilderAction.Redo;
import io.openproposal.composer.builder.BuilderAction.RemoveBlock;
import io.openproposal.composer.builder.BuilderAction.SelectBlock;
import io.openproposal.composer.builder.BuilderAction.SetDocument;
import io.openproposal.composer.builder.BuilderAction.SetLocked;
import io.openproposal.composer.builder.BuilderAction.SetSaved;
import io.openproposal.composer.builder.BuilderAction.SetSaving;
import io.openproposal.composer.builder.BuilderAction.SetTitle;
import io.openproposal.composer.builder.BuilderAction.Undo;
import io.openproposal.composer.builder.BuilderAction.UpdateBlock;
import io.openproposal.composer.config.ComposerProperties;
import io.openproposal.composer.exception.ContentValidationException;
import io.openproposal.composer.exception.LockedDocumentException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Pure state transition function of the document builder. Given a state and an action it returns
 * the next state and never modifies its input.
 *
 * <p>Content edits (add, remove, update, move) first record the current blocks in the undo
 * history, evicting the oldest snapshot beyond the configured limit, and drop any redo entries.
 * Edits that would not change anything (unknown ids, moving a block onto itself) are no-ops and
 * leave the history alone. On a locked document every content edit, undo and redo is refused with
 * {@link LockedDocumentException}; title edits are refused too unless the title policy allows
 * them.
 */
@Component
public class BuilderReducer {

  private static final Logger log = LoggerFactory.getLogger(BuilderReducer.class);

  private final BlockJsonCodec codec;
  private final int historyLimit;
  private final boolean titleEditableWhenLocked;

  public BuilderReducer(BlockJsonCodec codec, ComposerProperties properties) {
    this.codec = codec;
    this.historyLimit = properties.builder().historyLimit();
    this.titleEditableWhenLocked = properties.builder().titleEditableWhenLocked();
  }

  /**
   * Applies one action.
   *
   * @throws LockedDocumentException if the action mutates a locked document
   * @throws ContentValidationException if a loaded document or an added block repeats an id, or an
   *     update patch is rejected
   */
  public BuilderState reduce(BuilderState state, BuilderAction action) {
    Objects.requireNonNull(action, "action must not be null");
    requireUnlocked(state, action);
    log.debug(
        "Reducing builder action: documentId={}, action={}",
        state.documentId(),
        action.getClass().getSimpleName());

    if (action instanceof SetDocument a) {
      String title = a.title() != null ? a.title() : BuilderState.UNTITLED;
      List<Block> blocks = a.blocks() != null ? a.blocks() : List.of();
      requireUniqueIds(blocks);
      return new BuilderState(
          a.documentId(),
          title,
          blocks,
          null,
          a.locked(),
          false,
          null,
          BlockHistory.empty(),
          title,
          blocks);
    }
    if (action instanceof SetTitle a) {
      return withTitle(state, a.title());
    }
    if (action instanceof SetLocked a) {
      return withLocked(state, a.locked());
    }
    if (action instanceof AddBlock a) {
      return addBlock(state, a);
    }
    if (action instanceof RemoveBlock a) {
      return removeBlock(state, a.blockId());
    }
    if (action instanceof UpdateBlock a) {
      return updateBlock(state, a);
    }
    if (action instanceof MoveBlock a) {
      return moveBlock(state, a.activeId(), a.overId());
    }
    if (action instanceof SelectBlock a) {
      if (a.blockId() != null && state.indexOf(a.blockId()) < 0) {
        return state;
      }
      return withSelection(state, a.blockId());
    }
    if (action instanceof SetSaving a) {
      return withSaving(state, a.saving());
    }
    if (action instanceof SetSaved a) {
      return new BuilderState(
          state.documentId(),
          state.title(),
          state.blocks(),
          state.selectedBlockId(),
          state.locked(),
          false,
          a.savedAt(),
          state.history(),
          state.title(),
          state.blocks());
    }
    if (action instanceof Undo) {
      if (!state.canUndo()) {
        return state;
      }
      var history = state.history();
      return withBlocks(state, history.previous(), history.undo(state.blocks(), historyLimit));
    }
    if (action instanceof Redo) {
      if (!state.canRedo()) {
        return state;
      }
      var history = state.history();
      return withBlocks(state, history.next(), history.redo(state.blocks(), historyLimit));
    }
    if (action instanceof ClearHistory) {
      return withBlocks(state, state.blocks(), BlockHistory.empty());
    }
    throw new IllegalArgumentException("Unsupported builder action: " + action);
  }

  private void requireUnlocked(BuilderState state, BuilderAction action) {
    if (!state.locked()) {
      return;
    }
    boolean refused =
        action.mutatesContent() || (action instanceof SetTitle && !titleEditableWhenLocked);
    if (refused) {
      String actionName = action.getClass().getSimpleName();
      log.warn(
          "Rejected mutation of locked document: documentId={}, action={}",
          state.documentId(),
          actionName);
      throw new LockedDocumentException(state.documentId(), actionName);
    }
  }

  private static void requireUniqueIds(List<Block> blocks) {
    var ids = new HashSet<String>();
    for (int i = 0; i < blocks.size(); i++) {
      Block block = blocks.get(i);
      if (block == null) {
        throw ContentValidationException.of("blocks[" + i + "]", "block must not be null");
      }
      if (!ids.add(block.id())) {
        throw ContentValidationException.of(
            "blocks[" + i + "].id", "duplicate block id: " + block.id());
      }
    }
  }

  private BuilderState addBlock(BuilderState state, AddBlock action) {
    Block block = action.block();
    if (block == null) {
      throw ContentValidationException.of("block", "must not be null");
    }
    if (state.indexOf(block.id()) >= 0) {
      throw ContentValidationException.of("id", "duplicate block id: " + block.id());
    }
    var blocks = new ArrayList<>(state.blocks());
    int index = blocks.size();
    if (action.index() != null) {
      index = Math.max(0, Math.min(action.index(), blocks.size()));
    }
    blocks.add(index, block);
    return edit(state, blocks, block.id());
  }

  private BuilderState removeBlock(BuilderState state, String blockId) {
    int index = state.indexOf(blockId);
    if (index < 0) {
      return state;
    }
    var blocks = new ArrayList<>(state.blocks());
    blocks.remove(index);
    String selected =
        Objects.equals(state.selectedBlockId(), blockId) ? null : state.selectedBlockId();
    return edit(state, blocks, selected);
  }

  private BuilderState updateBlock(BuilderState state, UpdateBlock action) {
    int index = state.indexOf(action.blockId());
    if (index < 0 || action.changes() == null || action.changes().isEmpty()) {
      return state;
    }
    Block updated = codec.applyPatch(state.blocks().get(index), action.changes());
    var blocks = new ArrayList<>(state.blocks());
    blocks.set(index, updated);
    return edit(state, blocks, state.selectedBlockId());
  }

  private BuilderState moveBlock(BuilderState state, String activeId, String overId) {
    int from = state.indexOf(activeId);
    int to = state.indexOf(overId);
    if (from < 0 || to < 0 || from == to) {
      return state;
    }
    var blocks = new ArrayList<>(state.blocks());
    blocks.add(to, blocks.remove(from));
    return edit(state, blocks, state.selectedBlockId());
  }

  /** Commits a content edit: snapshot the old blocks, then install the new ones. */
  private BuilderState edit(BuilderState state, List<Block> blocks, String selectedBlockId) {
    var history = state.history().record(state.blocks(), historyLimit);
    return new BuilderState(
        state.documentId(),
        state.title(),
        blocks,
        selectedBlockId,
        state.locked(),
        state.saving(),
        state.lastSavedAt(),
        history,
        state.persistedTitle(),
        state.persistedBlocks());
  }

  private BuilderState withBlocks(BuilderState state, List<Block> blocks, BlockHistory history) {
    String selected =
        state.selectedBlockId() != null
                && blocks.stream().anyMatch(b -> state.selectedBlockId().equals(b.id()))
            ? state.selectedBlockId()
            : null;
    return new BuilderState(
        state.documentId(),
        state.title(),
        blocks,
        selected,
        state.locked(),
        state.saving(),
        state.lastSavedAt(),
        history,
        state.persistedTitle(),
        state.persistedBlocks());
  }

  private BuilderState withTitle(BuilderState state, String title) {
    return new BuilderState(
        state.documentId(),
        title,
        state.blocks(),
        state.selectedBlockId(),
        state.locked(),
        state.saving(),
        state.lastSavedAt(),
        state.history(),
        state.persistedTitle(),
        state.persistedBlocks());
  }

  private BuilderState withLocked(BuilderState state, boolean locked) {
    return new BuilderState(
        state.documentId(),
        state.title(),
        state.blocks(),
        state.selectedBlockId(),
        locked,
        state.saving(),
        state.lastSavedAt(),
        state.history(),
        state.persistedTitle(),
        state.persistedBlocks());
  }

  private BuilderState withSelection(BuilderState state, String selectedBlockId) {
    return new BuilderState(
        state.documentId(),
        state.title(),
        state.blocks(),
        selectedBlockId,
        state.locked(),
        state.saving(),
        state.lastSavedAt(),
        state.history(),
        state.persistedTitle(),
        state.persistedBlocks());
  }

  private BuilderState withSaving(BuilderState state, boolean saving) {
    return new BuilderState(
        state.documentId(),
        state.title(),
        state.blocks(),
        state.selectedBlockId(),
        state.locked(),
        saving,
        state.lastSavedAt(),
        state.history(),
        state.persistedTitle(),
        state.persistedBlocks());
  }
}
