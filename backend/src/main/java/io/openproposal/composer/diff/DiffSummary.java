package io.openproposal.composer.diff;

import java.util.List;

/** Per-type counts of a block diff, for version history headers. */
public record DiffSummary(int added, int removed, int modified, int unchanged) {

  public static DiffSummary of(List<BlockDiff> diffs) {
    int added = 0;
    int removed = 0;
    int modified = 0;
    int unchanged = 0;
    for (var diff : diffs) {
      switch (diff.type()) {
        case ADDED -> added++;
        case REMOVED -> removed++;
        case MODIFIED -> modified++;
        case UNCHANGED -> unchanged++;
      }
    }
    return new DiffSummary(added, removed, modified, unchanged);
  }

  public boolean hasChanges() {
    return added + removed + modified > 0;
  }
}
