package io.openproposal.composer.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Thrown when a lifecycle transition or an edit is not allowed in the document's current status.
 * The problem body carries the document id, the status and the refused action.
 */
public class InvalidStateException extends ErrorResponseException {

  private final String documentId;
  private final String status;
  private final String action;

  public InvalidStateException(String documentId, String status, String action) {
    super(HttpStatus.BAD_REQUEST, createProblem(documentId, status, action), null);
    this.documentId = documentId;
    this.status = status;
    this.action = action;
  }

  public String getDocumentId() {
    return documentId;
  }

  public String getStatus() {
    return status;
  }

  public String getAction() {
    return action;
  }

  private static ProblemDetail createProblem(String documentId, String status, String action) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Invalid document state");
    problem.setDetail("Cannot " + action + " document in status " + status);
    problem.setProperty("documentId", documentId);
    problem.setProperty("status", status);
    problem.setProperty("action", action);
    return problem;
  }
}
