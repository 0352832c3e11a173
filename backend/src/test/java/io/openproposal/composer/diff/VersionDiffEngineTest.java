package io.openproposal.composer.diff;

import static io.openproposal.composer.block.TestBlocks.checkbox;
import static io.openproposal.composer.block.TestBlocks.heading;
import static io.openproposal.composer.block.TestBlocks.item;
import static io.openproposal.composer.block.TestBlocks.pricing;
import static io.openproposal.composer.block.TestBlocks.signed;
import static io.openproposal.composer.block.TestBlocks.text;
import static io.openproposal.composer.block.TestBlocks.unsigned;
import static org.assertj.core.api.Assertions.assertThat;

import io.openproposal.composer.block.Block;
import io.openproposal.composer.block.BlockVisibility;
import io.openproposal.composer.block.TextBlock;
import io.openproposal.composer.condition.ConditionGroup;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class VersionDiffEngineTest {

  private final VersionDiffEngine engine = new VersionDiffEngine(new BlockTextProjector());

  @Test
  void computeBlockDiff_identicalSnapshots_yieldsOnlyUnchanged() {
    List<Block> blocks = List.of(heading("h1", "Scope"), text("t1", "Body"), unsigned("s1"));

    var diffs = engine.computeBlockDiff(blocks, blocks);

    assertThat(diffs)
        .extracting(BlockDiff::type)
        .containsOnly(BlockChangeType.UNCHANGED)
        .hasSize(3);
    assertThat(DiffSummary.of(diffs).hasChanges()).isFalse();
  }

  @Test
  void computeBlockDiff_fromEmpty_yieldsAllAdded() {
    List<Block> blocks = List.of(text("t1", "a"), text("t2", "b"));

    var diffs = engine.computeBlockDiff(List.of(), blocks);

    assertThat(diffs).extracting(BlockDiff::type).containsOnly(BlockChangeType.ADDED);
    assertThat(diffs).extracting(BlockDiff::newBlock).containsExactlyElementsOf(blocks);
    assertThat(diffs).allSatisfy(diff -> assertThat(diff.oldBlock()).isNull());
  }

  @Test
  void computeBlockDiff_toEmpty_yieldsAllRemoved() {
    List<Block> blocks = List.of(text("t1", "a"), text("t2", "b"));

    var diffs = engine.computeBlockDiff(blocks, List.of());

    assertThat(diffs).extracting(BlockDiff::type).containsOnly(BlockChangeType.REMOVED);
    assertThat(diffs).extracting(BlockDiff::oldBlock).containsExactlyElementsOf(blocks);
  }

  @Test
  void computeBlockDiff_nullInputs_areTreatedAsEmpty() {
    assertThat(engine.computeBlockDiff(null, null)).isEmpty();
    assertThat(engine.computeBlockDiff(null, List.of(text("t1", "a"))))
        .extracting(BlockDiff::type)
        .containsExactly(BlockChangeType.ADDED);
  }

  @Test
  void computeBlockDiff_ordersOldSnapshotEntriesThenAddedInNewOrder() {
    List<Block> before = List.of(text("a", "one"), text("b", "two"), text("c", "three"));
    List<Block> after =
        List.of(text("x", "new first"), text("c", "three!"), text("a", "one"), text("y", "new"));

    var diffs = engine.computeBlockDiff(before, after);

    assertThat(diffs)
        .extracting(diff -> diff.block().id() + ":" + diff.type().value())
        .containsExactly("a:unchanged", "b:removed", "c:modified", "x:added", "y:added");
    assertThat(DiffSummary.of(diffs)).isEqualTo(new DiffSummary(2, 1, 1, 1));
  }

  @Test
  void computeBlockDiff_modifiedBlock_carriesLineDiff() {
    var diffs =
        engine.computeBlockDiff(
            List.of(text("t1", "Intro\nPrice: 100\nThanks")),
            List.of(text("t1", "Intro\nPrice: 120\nThanks")));

    var diff = diffs.get(0);
    assertThat(diff.type()).isEqualTo(BlockChangeType.MODIFIED);
    assertThat(diff.textDiff())
        .containsExactly(
            new DiffLine(LineChangeType.UNCHANGED, "Intro", 1),
            new DiffLine(LineChangeType.REMOVED, "Price: 100", null),
            new DiffLine(LineChangeType.ADDED, "Price: 120", 2),
            new DiffLine(LineChangeType.UNCHANGED, "Thanks", 3));
  }

  @Test
  void computeBlockDiff_changeInvisibleToProjection_isUnchanged() {
    var before = text("t1", "Same");
    var after =
        new TextBlock(
            "t1", BlockVisibility.when(ConditionGroup.and()), "Same", TextBlock.Alignment.CENTER);

    var diffs = engine.computeBlockDiff(List.of(before), List.of(after));

    assertThat(diffs.get(0).type()).isEqualTo(BlockChangeType.UNCHANGED);
    assertThat(diffs.get(0).textDiff()).isNull();
  }

  @Test
  void computeBlockDiff_signingABlock_isModified() {
    var diffs =
        engine.computeBlockDiff(
            List.of(unsigned("s1")), List.of(signed("s1", Instant.parse("2026-01-01T00:00:00Z"))));

    assertThat(diffs.get(0).type()).isEqualTo(BlockChangeType.MODIFIED);
    assertThat(diffs.get(0).textDiff())
        .extracting(DiffLine::content)
        .containsExactly("[Signature: Sign here]", "[Signed]");
  }

  @Test
  void computeBlockDiff_pricingItemCountChange_isModified() {
    var diffs =
        engine.computeBlockDiff(
            List.of(pricing("p1", item("a", 1, "10"))),
            List.of(pricing("p1", item("a", 1, "10"), item("b", 1, "20"))));

    assertThat(diffs.get(0).type()).isEqualTo(BlockChangeType.MODIFIED);
  }

  @Test
  void computeBlockDiff_isDeterministic() {
    List<Block> before = List.of(text("a", "1"), checkbox("c", "Agree", false));
    List<Block> after = List.of(checkbox("c", "Agree", true), text("d", "2"));

    assertThat(engine.computeBlockDiff(before, after))
        .isEqualTo(engine.computeBlockDiff(new ArrayList<>(before), new ArrayList<>(after)));
  }

  @Test
  void computeTextDiff_linesAreNumberedByPositionInNewText() {
    var lines = engine.computeTextDiff("a\nb\nc", "a\nc\nd");

    assertThat(lines)
        .containsExactly(
            new DiffLine(LineChangeType.UNCHANGED, "a", 1),
            new DiffLine(LineChangeType.REMOVED, "b", null),
            new DiffLine(LineChangeType.UNCHANGED, "c", 2),
            new DiffLine(LineChangeType.ADDED, "d", 3));
  }

  @Test
  void computeTextDiff_keepsLongestCommonSubsequence() {
    var lines = engine.computeTextDiff("x\na\nb\nc", "a\nb\ny\nc");

    assertThat(lines)
        .filteredOn(line -> line.type() == LineChangeType.UNCHANGED)
        .extracting(DiffLine::content)
        .containsExactly("a", "b", "c");
    assertThat(lines)
        .filteredOn(line -> line.type() != LineChangeType.UNCHANGED)
        .extracting(DiffLine::content)
        .containsExactly("x", "y");
  }

  @Test
  void computeTextDiff_emptyOld_yieldsRemovedBlankThenAdded() {
    var lines = engine.computeTextDiff("", "hello");

    assertThat(lines)
        .containsExactly(
            new DiffLine(LineChangeType.REMOVED, "", null),
            new DiffLine(LineChangeType.ADDED, "hello", 1));
  }

  @Test
  void computeTextDiff_trailingNewline_isItsOwnLine() {
    var lines = engine.computeTextDiff("a", "a\n");

    assertThat(lines)
        .containsExactly(
            new DiffLine(LineChangeType.UNCHANGED, "a", 1),
            new DiffLine(LineChangeType.ADDED, "", 2));
  }

  @Test
  void computeTextDiff_nullTexts_areEmpty() {
    assertThat(engine.computeTextDiff(null, null))
        .containsExactly(new DiffLine(LineChangeType.UNCHANGED, "", 1));
  }
}
