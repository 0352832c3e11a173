package io.openproposal.composer.exception;

import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Thrown when block or variable content fails its invariants. Content is reported back as-is and
 * never corrected. Results in HTTP 422 Unprocessable Entity with the individual violations.
 */
public class ContentValidationException extends ErrorResponseException {

  private final List<Violation> violations;

  public ContentValidationException(List<Violation> violations) {
    super(HttpStatus.UNPROCESSABLE_ENTITY, createProblem(violations), null);
    this.violations = List.copyOf(violations);
  }

  public static ContentValidationException of(String path, String message) {
    return new ContentValidationException(List.of(new Violation(path, message)));
  }

  public List<Violation> getViolations() {
    return violations;
  }

  private static ProblemDetail createProblem(List<Violation> violations) {
    var problem = ProblemDetail.forStatus(HttpStatus.UNPROCESSABLE_ENTITY);
    problem.setTitle("Content validation failed");
    problem.setDetail(
        violations.size() == 1
            ? violations.get(0).path() + ": " + violations.get(0).message()
            : violations.size() + " content violations");
    problem.setProperty("violations", violations);
    return problem;
  }

  /** A single failed invariant, located by a dotted path such as {@code items[0].unitPrice}. */
  public record Violation(String path, String message) {}
}
