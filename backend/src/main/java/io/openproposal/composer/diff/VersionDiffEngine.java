package io.openproposal.composer.diff;

import io.openproposal.composer.block.Block;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Compares two block snapshots. Blocks are matched by id; a matched pair counts as modified when
 * their text projections differ, in which case a line diff of the projections is attached.
 *
 * <p>Both operations are deterministic and never throw: null or empty input is treated as an empty
 * snapshot or an empty text.
 */
@Component
public class VersionDiffEngine {

  private final BlockTextProjector projector;

  public VersionDiffEngine(BlockTextProjector projector) {
    this.projector = projector;
  }

  /**
   * Returns one entry per block: removed, modified and unchanged blocks in the old order, then
   * added blocks in the new order.
   */
  public List<BlockDiff> computeBlockDiff(List<Block> oldBlocks, List<Block> newBlocks) {
    List<Block> before = nonNull(oldBlocks);
    List<Block> after = nonNull(newBlocks);

    Map<String, Block> newById = new LinkedHashMap<>();
    for (var block : after) {
      newById.putIfAbsent(block.id(), block);
    }
    Set<String> oldIds = new HashSet<>();

    var diffs = new ArrayList<BlockDiff>();
    for (var oldBlock : before) {
      oldIds.add(oldBlock.id());
      Block newBlock = newById.get(oldBlock.id());
      if (newBlock == null) {
        diffs.add(BlockDiff.removed(oldBlock));
        continue;
      }
      String oldText = projector.project(oldBlock);
      String newText = projector.project(newBlock);
      if (oldText.equals(newText)) {
        diffs.add(BlockDiff.unchanged(oldBlock, newBlock));
      } else {
        diffs.add(BlockDiff.modified(oldBlock, newBlock, computeTextDiff(oldText, newText)));
      }
    }
    for (var newBlock : after) {
      if (!oldIds.contains(newBlock.id())) {
        diffs.add(BlockDiff.added(newBlock));
      }
    }
    return diffs;
  }

  /**
   * Line diff of two texts via their longest common subsequence of lines. Where either side could
   * be emitted next, the removal goes first.
   */
  public List<DiffLine> computeTextDiff(String oldText, String newText) {
    String[] a = Objects.requireNonNullElse(oldText, "").split("\n", -1);
    String[] b = Objects.requireNonNullElse(newText, "").split("\n", -1);

    // lcs[i][j] = length of the LCS of a[i..] and b[j..]
    int[][] lcs = new int[a.length + 1][b.length + 1];
    for (int i = a.length - 1; i >= 0; i--) {
      for (int j = b.length - 1; j >= 0; j--) {
        lcs[i][j] =
            a[i].equals(b[j]) ? lcs[i + 1][j + 1] + 1 : Math.max(lcs[i + 1][j], lcs[i][j + 1]);
      }
    }

    var lines = new ArrayList<DiffLine>();
    int i = 0;
    int j = 0;
    while (i < a.length && j < b.length) {
      if (a[i].equals(b[j])) {
        lines.add(DiffLine.unchanged(b[j], j + 1));
        i++;
        j++;
      } else if (lcs[i + 1][j] >= lcs[i][j + 1]) {
        lines.add(DiffLine.removed(a[i]));
        i++;
      } else {
        lines.add(DiffLine.added(b[j], j + 1));
        j++;
      }
    }
    for (; i < a.length; i++) {
      lines.add(DiffLine.removed(a[i]));
    }
    for (; j < b.length; j++) {
      lines.add(DiffLine.added(b[j], j + 1));
    }
    return lines;
  }

  private static List<Block> nonNull(List<Block> blocks) {
    if (blocks == null) {
      return List.of();
    }
    return blocks.stream().filter(Objects::nonNull).toList();
  }
}
