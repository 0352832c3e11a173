package io.openproposal.composer.version;

import io.openproposal.composer.diff.BlockDiff;
import io.openproposal.composer.diff.DiffSummary;
import java.util.List;
import java.util.Objects;

public record VersionComparison(
    DocumentVersion from, DocumentVersion to, List<BlockDiff> diffs, DiffSummary summary) {

  public VersionComparison {
    diffs = List.copyOf(diffs);
  }

  public boolean titleChanged() {
    return !Objects.equals(from.title(), to.title());
  }
}
