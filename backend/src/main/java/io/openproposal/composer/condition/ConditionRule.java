package io.openproposal.composer.condition;

/**
 * Leaf comparison of one runtime field against a scalar.
 *
 * @param field dotted path into the flattened field map, e.g. {@code pricing.total}
 * @param value a string, number or boolean
 */
public record ConditionRule(String field, ConditionOperator operator, Object value)
    implements ConditionNode {

  public static ConditionRule of(String field, ConditionOperator operator, Object value) {
    return new ConditionRule(field, operator, value);
  }
}
