package io.openproposal.composer.block;

import io.openproposal.composer.exception.ContentValidationException.Violation;
import java.util.List;

/** Outcome of validating one block or a whole block sequence. */
public record BlockValidationResult(List<Violation> violations) {

  public BlockValidationResult {
    violations = List.copyOf(violations);
  }

  public boolean isValid() {
    return violations.isEmpty();
  }
}
