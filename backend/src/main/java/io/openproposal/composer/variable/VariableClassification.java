package io.openproposal.composer.variable;

import java.util.List;

/** Variable names split by whether the built-in catalogue resolves them. */
public record VariableClassification(List<String> builtIn, List<String> custom) {

  public VariableClassification {
    builtIn = List.copyOf(builtIn);
    custom = List.copyOf(custom);
  }
}
