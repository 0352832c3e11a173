package io.openproposal.composer.condition;

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java.util.List;

/**
 * AND/OR combination of rules and nested groups. Always built fresh, so it cannot cycle. Where a
 * group is expected directly (a block's visibility) it is read without deduction.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NONE)
public record ConditionGroup(ConditionLogic logic, List<ConditionNode> rules)
    implements ConditionNode {

  public ConditionGroup {
    rules = rules != null ? List.copyOf(rules) : List.of();
  }

  public static ConditionGroup and(ConditionNode... rules) {
    return new ConditionGroup(ConditionLogic.AND, List.of(rules));
  }

  public static ConditionGroup or(ConditionNode... rules) {
    return new ConditionGroup(ConditionLogic.OR, List.of(rules));
  }
}
