package io.openproposal.composer.condition;

import io.openproposal.composer.block.Block;
import io.openproposal.composer.block.BlockVisibility;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Evaluates visibility rule trees against a flattened map of runtime field values. Evaluation is a
 * total function: absent or mistyped data makes a rule false instead of raising.
 */
@Component
public class ConditionEvaluator {

  /**
   * Evaluates a rule tree. AND stops at the first false child and OR at the first true one; an
   * empty AND is true and an empty OR is false. A null group is treated as no condition.
   *
   * @param group the rule tree
   * @param fieldValues runtime values keyed by dotted path
   * @return whether the tree is satisfied
   */
  public boolean evaluate(ConditionGroup group, Map<String, ?> fieldValues) {
    if (group == null) {
      return true;
    }
    Map<String, ?> values = fieldValues != null ? fieldValues : Map.of();
    return evaluateGroup(group, values);
  }

  /**
   * Returns true when the block has no condition, when its condition holds, or when rendering in
   * the editor and the block asks to stay visible there.
   */
  public boolean shouldRender(Block block, Map<String, ?> fieldValues, boolean isEditorContext) {
    BlockVisibility visibility = block.visibility();
    if (visibility == null || visibility.condition() == null) {
      return true;
    }
    if (isEditorContext && visibility.isShownInEditor()) {
      return true;
    }
    return evaluate(visibility.condition(), fieldValues);
  }

  /** Keeps the blocks that {@link #shouldRender} accepts, preserving order. */
  public List<Block> filterVisible(
      List<Block> blocks, Map<String, ?> fieldValues, boolean isEditorContext) {
    return blocks.stream()
        .filter(block -> shouldRender(block, fieldValues, isEditorContext))
        .toList();
  }

  private boolean evaluateGroup(ConditionGroup group, Map<String, ?> values) {
    if (group.logic() == ConditionLogic.OR) {
      for (var node : group.rules()) {
        if (evaluateNode(node, values)) {
          return true;
        }
      }
      return false;
    }
    // A missing logic operator is read as AND
    for (var node : group.rules()) {
      if (!evaluateNode(node, values)) {
        return false;
      }
    }
    return true;
  }

  private boolean evaluateNode(ConditionNode node, Map<String, ?> values) {
    if (node instanceof ConditionGroup group) {
      return evaluateGroup(group, values);
    }
    if (node instanceof ConditionRule rule) {
      return evaluateRule(rule, values);
    }
    return false;
  }

  private boolean evaluateRule(ConditionRule rule, Map<String, ?> values) {
    Object actual = rule.field() != null ? values.get(rule.field()) : null;
    if (actual == null) {
      // Absence never satisfies a comparison, but it is "not equal" to anything
      return rule.operator() == ConditionOperator.NE;
    }
    return ScalarComparison.test(actual, rule.operator(), rule.value());
  }
}
