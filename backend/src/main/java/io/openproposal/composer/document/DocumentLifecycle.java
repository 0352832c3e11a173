package io.openproposal.composer.document;

import io.openproposal.composer.exception.InvalidStateException;
import io.openproposal.composer.exception.LockedDocumentException;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Set;

/**
 * Status transitions of a single document and the editing guards derived from them. The content
 * lock is taken by the first signature and never released.
 */
public class DocumentLifecycle {

  private static final Set<DocumentStatus> CLOSED_STATUSES =
      Set.of(DocumentStatus.COMPLETED, DocumentStatus.DECLINED);

  private final String documentId;
  private final Clock clock;

  private DocumentStatus status;
  private Instant sentAt;
  private Instant viewedAt;
  private Instant completedAt;
  private Instant declinedAt;
  private String declineReason;
  private Instant lockedAt;
  private String lockedBy;

  public DocumentLifecycle(String documentId, Clock clock) {
    this(documentId, DocumentStatus.DRAFT, null, null, clock);
  }

  /** Restores the lifecycle of a stored document. */
  public DocumentLifecycle(
      String documentId, DocumentStatus status, Instant lockedAt, String lockedBy, Clock clock) {
    this.documentId = Objects.requireNonNull(documentId, "documentId must not be null");
    this.status = Objects.requireNonNull(status, "status must not be null");
    this.lockedAt = lockedAt;
    this.lockedBy = lockedBy;
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
  }

  // --- Lifecycle methods ---

  /** Marks the document as sent to its recipients. Only valid from DRAFT. */
  public void markSent() {
    requireStatus(Set.of(DocumentStatus.DRAFT), "send");
    this.status = DocumentStatus.SENT;
    this.sentAt = clock.instant();
  }

  /** Records that a recipient opened the document. Repeat views keep the first timestamp. */
  public void markViewed() {
    requireStatus(Set.of(DocumentStatus.SENT, DocumentStatus.VIEWED), "mark as viewed");
    this.status = DocumentStatus.VIEWED;
    if (viewedAt == null) {
      this.viewedAt = clock.instant();
    }
  }

  /** Records a signature. The first one locks the content. */
  public void markSigned(String signerId) {
    requireStatus(
        Set.of(DocumentStatus.SENT, DocumentStatus.VIEWED, DocumentStatus.SIGNED), "sign");
    Objects.requireNonNull(signerId, "signerId must not be null");
    this.status = DocumentStatus.SIGNED;
    if (lockedAt == null) {
      this.lockedAt = clock.instant();
      this.lockedBy = signerId;
    }
  }

  /** Marks the document as completed once every signer has signed. Only valid from SIGNED. */
  public void markCompleted() {
    requireStatus(Set.of(DocumentStatus.SIGNED), "complete");
    this.status = DocumentStatus.COMPLETED;
    this.completedAt = clock.instant();
  }

  public void markDeclined(String reason) {
    requireStatus(Set.of(DocumentStatus.VIEWED, DocumentStatus.SIGNED), "decline");
    this.status = DocumentStatus.DECLINED;
    this.declineReason = reason;
    this.declinedAt = clock.instant();
  }

  public void markExpired() {
    requireStatus(Set.of(DocumentStatus.SENT, DocumentStatus.VIEWED), "expire");
    this.status = DocumentStatus.EXPIRED;
  }

  // --- Guards ---

  public boolean isLocked() {
    return lockedAt != null;
  }

  /** Content and title may change unless the document is locked, completed or declined. */
  public boolean isEditable() {
    return !isLocked() && !CLOSED_STATUSES.contains(status);
  }

  /** Edits to a document that recipients may already have seen are snapshotted first. */
  public boolean requiresVersionSnapshot() {
    return status == DocumentStatus.SENT || status == DocumentStatus.VIEWED;
  }

  /**
   * @throws LockedDocumentException if a signature has locked the document
   * @throws InvalidStateException if the document is completed or declined
   */
  public void requireEditable() {
    if (isLocked()) {
      throw new LockedDocumentException(documentId, "edit");
    }
    if (CLOSED_STATUSES.contains(status)) {
      throw new InvalidStateException(documentId, status.name(), "edit");
    }
  }

  // --- Getters ---

  public String getDocumentId() {
    return documentId;
  }

  public DocumentStatus getStatus() {
    return status;
  }

  public Instant getSentAt() {
    return sentAt;
  }

  public Instant getViewedAt() {
    return viewedAt;
  }

  public Instant getCompletedAt() {
    return completedAt;
  }

  public Instant getDeclinedAt() {
    return declinedAt;
  }

  public String getDeclineReason() {
    return declineReason;
  }

  public Instant getLockedAt() {
    return lockedAt;
  }

  public String getLockedBy() {
    return lockedBy;
  }

  // --- Private helpers ---

  private void requireStatus(Set<DocumentStatus> allowedStatuses, String action) {
    if (!allowedStatuses.contains(status)) {
      throw new InvalidStateException(documentId, status.name(), action);
    }
  }
}
