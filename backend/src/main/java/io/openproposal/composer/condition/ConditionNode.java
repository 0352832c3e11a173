package io.openproposal.composer.condition;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Node of a visibility rule tree: either a leaf {@link ConditionRule} or a nested {@link
 * ConditionGroup}. Persisted without a discriminator; the variant is deduced from its properties.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.DEDUCTION)
@JsonSubTypes({@JsonSubTypes.Type(ConditionRule.class), @JsonSubTypes.Type(ConditionGroup.class)})
public sealed interface ConditionNode permits ConditionRule, ConditionGroup {}
