package io.openproposal.composer.version;

import io.openproposal.composer.diff.DiffSummary;
import io.openproposal.composer.diff.VersionDiffEngine;
import io.openproposal.composer.document.DocumentLifecycle;
import io.openproposal.composer.exception.ResourceNotFoundException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Reads and compares the version history of a document. The live content is never stored as a
 * version; it is presented as a synthesised {@link ChangeType#CURRENT} entry at the document's
 * current version number.
 */
@Service
public class VersionHistoryService {

  private static final Logger log = LoggerFactory.getLogger(VersionHistoryService.class);

  static final String EDITED_AFTER_SENDING = "Document edited after sending";

  private final DocumentVersionStore versionStore;
  private final VersionDiffEngine diffEngine;
  private final Clock clock;

  public VersionHistoryService(
      DocumentVersionStore versionStore, VersionDiffEngine diffEngine, Clock clock) {
    this.versionStore = versionStore;
    this.diffEngine = diffEngine;
    this.clock = clock;
  }

  /** Returns the current entry followed by every stored version, newest first. */
  public List<DocumentVersion> history(CurrentDocument document) {
    var versions = new ArrayList<DocumentVersion>();
    versions.add(currentEntry(document));
    versions.addAll(versionStore.findByDocumentId(document.id()));
    versions.sort(Comparator.comparingInt(DocumentVersion::versionNumber).reversed());
    return versions;
  }

  /**
   * Diffs two versions of a document. Either number may be the current version.
   *
   * @throws ResourceNotFoundException if a version number is neither current nor stored
   */
  public VersionComparison compare(CurrentDocument document, int fromVersion, int toVersion) {
    var from = resolve(document, fromVersion);
    var to = resolve(document, toVersion);
    var diffs = diffEngine.computeBlockDiff(from.content(), to.content());
    return new VersionComparison(from, to, diffs, DiffSummary.of(diffs));
  }

  /** Builds the snapshot of the live content under its current version number. */
  public DocumentVersion snapshotOf(
      CurrentDocument document, String createdBy, ChangeType changeType, String description) {
    return new DocumentVersion(
        document.id(),
        document.currentVersion(),
        document.title(),
        document.content(),
        document.variables(),
        changeType,
        description,
        createdBy,
        clock.instant());
  }

  /**
   * Stores a snapshot of the live content before it is edited, if the document has already been
   * sent. The caller bumps the document to the next version number when one is returned.
   */
  public Optional<DocumentVersion> snapshotBeforeEdit(
      CurrentDocument document, DocumentLifecycle lifecycle, String editedBy) {
    lifecycle.requireEditable();
    if (!lifecycle.requiresVersionSnapshot()) {
      return Optional.empty();
    }
    var snapshot = snapshotOf(document, editedBy, ChangeType.EDITED, EDITED_AFTER_SENDING);
    versionStore.save(snapshot);
    log.info(
        "Stored version snapshot before edit: documentId={}, versionNumber={}",
        document.id(),
        snapshot.versionNumber());
    return Optional.of(snapshot);
  }

  private DocumentVersion resolve(CurrentDocument document, int versionNumber) {
    if (versionNumber == document.currentVersion()) {
      return currentEntry(document);
    }
    return versionStore
        .findByDocumentIdAndVersionNumber(document.id(), versionNumber)
        .orElseThrow(
            () ->
                new ResourceNotFoundException(
                    "DocumentVersion", document.id() + "@" + versionNumber));
  }

  private static DocumentVersion currentEntry(CurrentDocument document) {
    return new DocumentVersion(
        document.id(),
        document.currentVersion(),
        document.title(),
        document.content(),
        document.variables(),
        ChangeType.CURRENT,
        null,
        null,
        document.updatedAt());
  }
}
