package io.openproposal.composer.builder;

import static io.openproposal.composer.block.TestBlocks.text;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.openproposal.composer.block.Block;
import io.openproposal.composer.block.BlockJsonCodec;
import io.openproposal.composer.block.TextBlock;
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
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import tools.jackson.databind.json.JsonMapper;

class BuilderReducerTest {

  private BuilderReducer reducer;

  @BeforeEach
  void setUp() {
    reducer =
        new BuilderReducer(
            new BlockJsonCodec(JsonMapper.builder().build()), ComposerProperties.defaults());
  }

  @Test
  void setDocument_loadsCleanStateWithEmptyHistory() {
    var state = load(false, text("a", "A"), text("b", "B"));

    assertThat(state.documentId()).isEqualTo("doc-1");
    assertThat(state.blocks()).extracting(Block::id).containsExactly("a", "b");
    assertThat(state.isDirty()).isFalse();
    assertThat(state.canUndo()).isFalse();
    assertThat(state.canRedo()).isFalse();
    assertThat(state.selectedBlockId()).isNull();
  }

  @Test
  void setDocument_repeatedBlockId_throwsContentValidation() {
    var load =
        new SetDocument("doc-1", "Proposal", List.of(text("a", "A"), text("a", "A2")), false);

    assertThatThrownBy(() -> reducer.reduce(BuilderState.initial(), load))
        .isInstanceOfSatisfying(
            ContentValidationException.class,
            e ->
                assertThat(e.getViolations())
                    .containsExactly(
                        new ContentValidationException.Violation(
                            "blocks[1].id", "duplicate block id: a")));
  }

  @Test
  void setDocument_nullTitle_fallsBackToUntitled() {
    var state =
        reducer.reduce(BuilderState.initial(), new SetDocument("doc-1", null, null, false));

    assertThat(state.title()).isEqualTo(BuilderState.UNTITLED);
    assertThat(state.blocks()).isEmpty();
  }

  @Test
  void addBlock_withoutIndex_appendsSelectsAndRecordsHistory() {
    var state = load(false, text("a", "A"));

    var next = reducer.reduce(state, new AddBlock(text("b", "B"), null));

    assertThat(next.blocks()).extracting(Block::id).containsExactly("a", "b");
    assertThat(next.selectedBlockId()).isEqualTo("b");
    assertThat(next.isDirty()).isTrue();
    assertThat(next.history().past()).containsExactly(List.of(text("a", "A")));
    assertThat(state.blocks()).extracting(Block::id).containsExactly("a");
  }

  @Test
  void addBlock_indexOutOfRange_isClamped() {
    var state = load(false, text("a", "A"), text("b", "B"));

    var front = reducer.reduce(state, new AddBlock(text("x", "X"), -3));
    var back = reducer.reduce(state, new AddBlock(text("y", "Y"), 42));
    var middle = reducer.reduce(state, new AddBlock(text("z", "Z"), 1));

    assertThat(front.blocks()).extracting(Block::id).containsExactly("x", "a", "b");
    assertThat(back.blocks()).extracting(Block::id).containsExactly("a", "b", "y");
    assertThat(middle.blocks()).extracting(Block::id).containsExactly("a", "z", "b");
  }

  @Test
  void addBlock_duplicateId_throwsContentValidation() {
    var state = load(false, text("a", "A"));

    assertThatThrownBy(() -> reducer.reduce(state, new AddBlock(text("a", "again"), null)))
        .isInstanceOf(ContentValidationException.class);
  }

  @Test
  void removeBlock_selectedBlock_clearsSelection() {
    var state = reducer.reduce(load(false, text("a", "A"), text("b", "B")), new SelectBlock("b"));

    var next = reducer.reduce(state, new RemoveBlock("b"));

    assertThat(next.blocks()).extracting(Block::id).containsExactly("a");
    assertThat(next.selectedBlockId()).isNull();
    assertThat(next.canUndo()).isTrue();
  }

  @Test
  void removeBlock_unknownId_isNoOpWithoutHistory() {
    var state = load(false, text("a", "A"));

    assertThat(reducer.reduce(state, new RemoveBlock("missing"))).isSameAs(state);
  }

  @Test
  void updateBlock_patchesPayloadInPlace() {
    var state = load(false, text("a", "A"), text("b", "B"));

    var next = reducer.reduce(state, new UpdateBlock("b", Map.of("content", "Bee")));

    assertThat(next.blocks().get(1)).isEqualTo(text("b", "Bee"));
    assertThat(next.blocks().get(0)).isSameAs(state.blocks().get(0));
    assertThat(next.canUndo()).isTrue();
  }

  @Test
  void updateBlock_changingId_throwsAndLeavesStateUsable() {
    var state = load(false, text("a", "A"));

    assertThatThrownBy(() -> reducer.reduce(state, new UpdateBlock("a", Map.of("id", "z"))))
        .isInstanceOf(ContentValidationException.class);
    assertThat(state.blocks()).containsExactly(text("a", "A"));
  }

  @Test
  void moveBlock_forward_movesToTargetPosition() {
    var state = load(false, text("a", "A"), text("b", "B"), text("c", "C"), text("d", "D"));

    var next = reducer.reduce(state, new MoveBlock("a", "c"));

    assertThat(next.blocks()).extracting(Block::id).containsExactly("b", "c", "a", "d");
  }

  @Test
  void moveBlock_backward_movesToTargetPosition() {
    var state = load(false, text("a", "A"), text("b", "B"), text("c", "C"), text("d", "D"));

    var next = reducer.reduce(state, new MoveBlock("d", "b"));

    assertThat(next.blocks()).extracting(Block::id).containsExactly("a", "d", "b", "c");
  }

  @Test
  void moveBlock_thenBack_restoresOriginalOrder() {
    var state = load(false, text("a", "A"), text("b", "B"), text("c", "C"), text("d", "D"));

    var moved = reducer.reduce(state, new MoveBlock("b", "d"));
    var back = reducer.reduce(moved, new MoveBlock("b", "a"));

    assertThat(moved.blocks()).extracting(Block::id).containsExactly("a", "c", "d", "b");
    assertThat(back.blocks()).isEqualTo(state.blocks());
  }

  @Test
  void moveBlock_ontoItselfOrUnknown_isNoOp() {
    var state = load(false, text("a", "A"), text("b", "B"));

    assertThat(reducer.reduce(state, new MoveBlock("a", "a"))).isSameAs(state);
    assertThat(reducer.reduce(state, new MoveBlock("a", "zz"))).isSameAs(state);
  }

  @Test
  void undo_restoresPreviousBlocks_andRedoReappliesEdit() {
    var loaded = load(false, text("a", "A"));
    var edited = reducer.reduce(loaded, new UpdateBlock("a", Map.of("content", "A2")));

    var undone = reducer.reduce(edited, new Undo());
    var redone = reducer.reduce(undone, new Redo());

    assertThat(undone.blocks()).isEqualTo(loaded.blocks());
    assertThat(undone.canRedo()).isTrue();
    assertThat(redone.blocks()).isEqualTo(edited.blocks());
    assertThat(redone.canRedo()).isFalse();
  }

  @Test
  void undoThenRedo_roundTripsExactly() {
    var state = load(false, text("a", "A"));
    state = reducer.reduce(state, new AddBlock(text("b", "B"), null));
    state = reducer.reduce(state, new MoveBlock("b", "a"));

    var roundTrip = reducer.reduce(reducer.reduce(state, new Undo()), new Redo());

    assertThat(roundTrip.blocks()).isEqualTo(state.blocks());
  }

  @Test
  void mixedEdits_undoneOneByOne_restoreLoadedBlocks() {
    var loaded = load(false, text("a", "A"), text("b", "B"), text("c", "C"));
    var state = reducer.reduce(loaded, new AddBlock(text("d", "D"), 1));
    state = reducer.reduce(state, new RemoveBlock("b"));
    state = reducer.reduce(state, new UpdateBlock("c", Map.of("content", "Sea")));
    state = reducer.reduce(state, new MoveBlock("c", "a"));
    assertThat(state.blocks()).extracting(Block::id).containsExactly("c", "a", "d");

    for (int i = 0; i < 4; i++) {
      state = reducer.reduce(state, new Undo());
    }

    assertThat(state.blocks()).isEqualTo(loaded.blocks());
    assertThat(state.canUndo()).isFalse();
    assertThat(state.isDirty()).isFalse();
  }

  @Test
  void newEditAfterUndo_clearsRedo() {
    var state = load(false, text("a", "A"));
    state = reducer.reduce(state, new AddBlock(text("b", "B"), null));
    state = reducer.reduce(state, new Undo());

    var next = reducer.reduce(state, new AddBlock(text("c", "C"), null));

    assertThat(next.canRedo()).isFalse();
    assertThat(next.history().future()).isEmpty();
  }

  @Test
  void undoAndRedo_withoutHistory_areSilentNoOps() {
    var state = load(false, text("a", "A"));

    assertThat(reducer.reduce(state, new Undo())).isSameAs(state);
    assertThat(reducer.reduce(state, new Redo())).isSameAs(state);
  }

  @Test
  void history_isCappedAtConfiguredLimit() {
    var state = load(false);
    for (int i = 0; i < 60; i++) {
      state = reducer.reduce(state, new AddBlock(text("b" + i, "Block " + i), null));
    }

    assertThat(state.history().past()).hasSize(ComposerProperties.DEFAULT_HISTORY_LIMIT);

    for (int i = 0; i < ComposerProperties.DEFAULT_HISTORY_LIMIT; i++) {
      state = reducer.reduce(state, new Undo());
    }
    assertThat(state.canUndo()).isFalse();
    assertThat(state.blocks()).hasSize(10);
  }

  @Test
  void history_smallerLimit_evictsOldestSnapshot() {
    var properties =
        new ComposerProperties(
            new ComposerProperties.Builder(2, false), ComposerProperties.defaults().variables());
    var limited = new BuilderReducer(new BlockJsonCodec(JsonMapper.builder().build()), properties);
    var state = load(false);
    for (String id : List.of("a", "b", "c")) {
      state = limited.reduce(state, new AddBlock(text(id, id), null));
    }

    assertThat(state.history().past()).extracting(List::size).containsExactly(1, 2);
  }

  @Test
  void snapshots_areIndependentOfLaterEdits() {
    var state = load(false, text("a", "A"));
    state = reducer.reduce(state, new UpdateBlock("a", Map.of("content", "A2")));
    state = reducer.reduce(state, new UpdateBlock("a", Map.of("content", "A3")));

    assertThat(state.history().past())
        .containsExactly(List.of(text("a", "A")), List.of(text("a", "A2")));
  }

  @Test
  void isDirty_undoBackToSavedContent_isClean() {
    var state = load(false, text("a", "A"));
    state = reducer.reduce(state, new UpdateBlock("a", Map.of("content", "changed")));
    assertThat(state.isDirty()).isTrue();

    state = reducer.reduce(state, new Undo());

    assertThat(state.isDirty()).isFalse();
  }

  @Test
  void setSaved_makesCurrentContentTheCleanBaseline() {
    var savedAt = Instant.parse("2026-02-01T12:00:00Z");
    var state = load(false, text("a", "A"));
    state = reducer.reduce(state, new SetTitle("Renamed"));
    state = reducer.reduce(state, new AddBlock(text("b", "B"), null));
    state = reducer.reduce(state, new SetSaving(true));

    var saved = reducer.reduce(state, new SetSaved(savedAt));

    assertThat(saved.isDirty()).isFalse();
    assertThat(saved.saving()).isFalse();
    assertThat(saved.lastSavedAt()).isEqualTo(savedAt);
    assertThat(saved.canUndo()).isTrue();
  }

  @Test
  void setTitle_marksDirty() {
    var state = reducer.reduce(load(false), new SetTitle("Q3 Proposal"));

    assertThat(state.title()).isEqualTo("Q3 Proposal");
    assertThat(state.isDirty()).isTrue();
  }

  @Test
  void selectBlock_unknownId_isIgnored() {
    var state = load(false, text("a", "A"));

    assertThat(reducer.reduce(state, new SelectBlock("zz"))).isSameAs(state);
    assertThat(reducer.reduce(state, new SelectBlock("a")).selectedBlock())
        .contains(text("a", "A"));
  }

  @Test
  void clearHistory_dropsUndoAndRedo() {
    var state = load(false, text("a", "A"));
    state = reducer.reduce(state, new AddBlock(text("b", "B"), null));
    state = reducer.reduce(state, new AddBlock(text("c", "C"), null));
    state = reducer.reduce(state, new Undo());

    var cleared = reducer.reduce(state, new ClearHistory());

    assertThat(cleared.canUndo()).isFalse();
    assertThat(cleared.canRedo()).isFalse();
    assertThat(cleared.blocks()).isEqualTo(state.blocks());
  }

  static Stream<BuilderAction> contentMutations() {
    return Stream.of(
        new AddBlock(text("z", "Z"), null),
        new RemoveBlock("a"),
        new UpdateBlock("a", Map.of("content", "x")),
        new MoveBlock("a", "b"),
        new Undo(),
        new Redo());
  }

  @ParameterizedTest
  @MethodSource("contentMutations")
  void lockedDocument_contentMutation_isRejected(BuilderAction action) {
    var state = load(true, text("a", "A"), text("b", "B"));

    assertThatThrownBy(() -> reducer.reduce(state, action))
        .isInstanceOfSatisfying(
            LockedDocumentException.class,
            e -> {
              assertThat(e.getDocumentId()).isEqualTo("doc-1");
              assertThat(e.getAction()).isEqualTo(action.getClass().getSimpleName());
              assertThat(e.getStatusCode().value()).isEqualTo(423);
            });
    assertThat(state.blocks()).extracting(Block::id).containsExactly("a", "b");
  }

  @Test
  void lockedDocument_titleEdit_isRejectedByDefault() {
    var state = load(true, text("a", "A"));

    assertThatThrownBy(() -> reducer.reduce(state, new SetTitle("New")))
        .isInstanceOf(LockedDocumentException.class);
  }

  @Test
  void lockedDocument_titleEdit_allowedWhenPolicyPermits() {
    var properties =
        new ComposerProperties(
            new ComposerProperties.Builder(50, true), ComposerProperties.defaults().variables());
    var permissive =
        new BuilderReducer(new BlockJsonCodec(JsonMapper.builder().build()), properties);
    var state = load(true, text("a", "A"));

    assertThat(permissive.reduce(state, new SetTitle("New")).title()).isEqualTo("New");
  }

  @Test
  void lockedDocument_nonMutatingActions_areAccepted() {
    var state = load(true, text("a", "A"));

    state = reducer.reduce(state, new SelectBlock("a"));
    state = reducer.reduce(state, new SetSaving(true));
    state = reducer.reduce(state, new SetSaved(Instant.EPOCH));
    state = reducer.reduce(state, new ClearHistory());

    assertThat(state.selectedBlockId()).isEqualTo("a");
    assertThat(state.locked()).isTrue();
  }

  @Test
  void setLocked_midSession_blocksFurtherEdits() {
    var state = load(false, text("a", "A"));
    state = reducer.reduce(state, new SetLocked(true));
    var locked = state;

    assertThatThrownBy(() -> reducer.reduce(locked, new RemoveBlock("a")))
        .isInstanceOf(LockedDocumentException.class);
  }

  @Test
  void blocks_areImmutableValues() {
    var state = load(false, text("a", "A"));

    assertThatThrownBy(() -> state.blocks().add(new TextBlock("x", null, "", null)))
        .isInstanceOf(UnsupportedOperationException.class);
  }

  private BuilderState load(boolean locked, Block... blocks) {
    return reducer.reduce(
        BuilderState.initial(), new SetDocument("doc-1", "Proposal", List.of(blocks), locked));
  }
}
