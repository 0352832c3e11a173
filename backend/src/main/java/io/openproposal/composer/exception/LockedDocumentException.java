package io.openproposal.composer.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Thrown when a content mutation is dispatched against a document that has been locked by its
 * first signature. The builder state is left untouched. Results in HTTP 423 Locked.
 */
public class LockedDocumentException extends ErrorResponseException {

  private final String documentId;
  private final String action;

  public LockedDocumentException(String documentId, String action) {
    super(HttpStatus.LOCKED, createProblem(documentId, action), null);
    this.documentId = documentId;
    this.action = action;
  }

  public String getDocumentId() {
    return documentId;
  }

  public String getAction() {
    return action;
  }

  private static ProblemDetail createProblem(String documentId, String action) {
    var problem = ProblemDetail.forStatus(HttpStatus.LOCKED);
    problem.setTitle("Document locked");
    problem.setDetail(
        "Cannot apply " + action + " to document " + documentId + " after it has been signed");
    problem.setProperty("documentId", documentId);
    problem.setProperty("action", action);
    return problem;
  }
}
