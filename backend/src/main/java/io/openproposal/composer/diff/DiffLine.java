package io.openproposal.composer.diff;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One line of a text diff.
 *
 * @param lineNumber 1-based position in the new text; null for removed lines
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DiffLine(LineChangeType type, String content, Integer lineNumber) {

  static DiffLine added(String content, int lineNumber) {
    return new DiffLine(LineChangeType.ADDED, content, lineNumber);
  }

  static DiffLine removed(String content) {
    return new DiffLine(LineChangeType.REMOVED, content, null);
  }

  static DiffLine unchanged(String content, int lineNumber) {
    return new DiffLine(LineChangeType.UNCHANGED, content, lineNumber);
  }
}
