package io.openproposal.composer.builder;

import io.openproposal.composer.block.Block;
import io.openproposal.composer.block.BlockJsonCodec;
import io.openproposal.composer.block.BlockRegistry;
import io.openproposal.composer.block.BlockType;
import io.openproposal.composer.builder.BuilderAction.AddBlock;
import io.openproposal.composer.builder.BuilderAction.MoveBlock;
import io.openproposal.composer.builder.BuilderAction.Redo;
import io.openproposal.composer.builder.BuilderAction.RemoveBlock;
import io.openproposal.composer.builder.BuilderAction.SelectBlock;
import io.openproposal.composer.builder.BuilderAction.SetLocked;
import io.openproposal.composer.builder.BuilderAction.SetSaved;
import io.openproposal.composer.builder.BuilderAction.SetSaving;
import io.openproposal.composer.builder.BuilderAction.SetTitle;
import io.openproposal.composer.builder.BuilderAction.Undo;
import io.openproposal.composer.builder.BuilderAction.UpdateBlock;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One editing session over a single document. Holds the current {@link BuilderState} and advances
 * it through the {@link BuilderReducer}. A failed action leaves the state untouched.
 *
 * <p>Not thread-safe: a session has a single writer.
 */
public class BuilderSession {

  private static final Logger log = LoggerFactory.getLogger(BuilderSession.class);

  private final BuilderReducer reducer;
  private final BlockRegistry registry;
  private final BlockJsonCodec codec;
  private final Clock clock;
  private BuilderState state;

  BuilderSession(
      BuilderReducer reducer,
      BlockRegistry registry,
      BlockJsonCodec codec,
      Clock clock,
      BuilderState initial) {
    this.reducer = reducer;
    this.registry = registry;
    this.codec = codec;
    this.clock = clock;
    this.state = initial;
  }

  public BuilderState state() {
    return state;
  }

  public BuilderState dispatch(BuilderAction action) {
    state = reducer.reduce(state, action);
    return state;
  }

  /** Inserts a default block of the given type and selects it. */
  public Block addBlock(BlockType type, Integer index) {
    Block block = registry.createDefault(type);
    dispatch(new AddBlock(block, index));
    return block;
  }

  public BuilderState removeBlock(String blockId) {
    return dispatch(new RemoveBlock(blockId));
  }

  public BuilderState updateBlock(String blockId, Map<String, Object> changes) {
    return dispatch(new UpdateBlock(blockId, changes));
  }

  public BuilderState moveBlock(String activeId, String overId) {
    return dispatch(new MoveBlock(activeId, overId));
  }

  public BuilderState selectBlock(String blockId) {
    return dispatch(new SelectBlock(blockId));
  }

  public BuilderState setTitle(String title) {
    return dispatch(new SetTitle(title));
  }

  public BuilderState lock() {
    return dispatch(new SetLocked(true));
  }

  public BuilderState undo() {
    return dispatch(new Undo());
  }

  public BuilderState redo() {
    return dispatch(new Redo());
  }

  public boolean canUndo() {
    return state.canUndo();
  }

  public boolean canRedo() {
    return state.canRedo();
  }

  public boolean isDirty() {
    return state.isDirty();
  }

  public Optional<Block> selectedBlock() {
    return state.selectedBlock();
  }

  /**
   * Validates the current blocks and hands them to {@code saver}. On success the current content
   * becomes the clean baseline; on failure the session stays dirty and the exception propagates.
   */
  public BuilderState save(DocumentSaver saver) {
    registry.requireValidAll(state.blocks());
    String contentJson = codec.encode(state.blocks());

    dispatch(new SetSaving(true));
    try {
      saver.save(state.documentId(), state.title(), contentJson);
    } catch (RuntimeException e) {
      dispatch(new SetSaving(false));
      log.warn("Failed to save document: documentId={}", state.documentId(), e);
      throw e;
    }
    dispatch(new SetSaved(clock.instant()));
    log.info(
        "Saved document: documentId={}, blocks={}", state.documentId(), state.blocks().size());
    return state;
  }
}
