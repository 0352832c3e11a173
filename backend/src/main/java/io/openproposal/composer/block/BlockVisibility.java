package io.openproposal.composer.block;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.openproposal.composer.condition.ConditionGroup;

/**
 * Visibility settings of a block.
 *
 * @param condition rule tree deciding whether the block renders; null means always visible
 * @param showInEditor whether editors still see the block when the condition fails; defaults to
 *     true when absent
 */
public record BlockVisibility(ConditionGroup condition, Boolean showInEditor) {

  public static BlockVisibility when(ConditionGroup condition) {
    return new BlockVisibility(condition, true);
  }

  @JsonIgnore
  public boolean isShownInEditor() {
    return showInEditor == null || showInEditor;
  }
}
