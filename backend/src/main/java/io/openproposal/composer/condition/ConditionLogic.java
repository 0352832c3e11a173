package io.openproposal.composer.condition;

/** How the children of a {@link ConditionGroup} combine. */
public enum ConditionLogic {
  AND,
  OR
}
