package io.openproposal.composer.condition;

import com.fasterxml.jackson.annotation.JsonValue;

/** Comparison operator of a {@link ConditionRule}, persisted as its symbol. */
public enum ConditionOperator {
  EQ("=="),
  NE("!="),
  GT(">"),
  LT("<"),
  GTE(">="),
  LTE("<=");

  private final String symbol;

  ConditionOperator(String symbol) {
    this.symbol = symbol;
  }

  @JsonValue
  public String getSymbol() {
    return symbol;
  }

  public boolean isOrdering() {
    return this != EQ && this != NE;
  }

  /** Applies this operator to the result of a {@code compareTo} call. */
  boolean test(int comparison) {
    return switch (this) {
      case EQ -> comparison == 0;
      case NE -> comparison != 0;
      case GT -> comparison > 0;
      case LT -> comparison < 0;
      case GTE -> comparison >= 0;
      case LTE -> comparison <= 0;
    };
  }
}
