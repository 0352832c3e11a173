package io.openproposal.composer.version;

import java.util.List;
import java.util.Optional;

/** Persistence of version snapshots, provided by the surrounding application. */
public interface DocumentVersionStore {

  List<DocumentVersion> findByDocumentId(String documentId);

  Optional<DocumentVersion> findByDocumentIdAndVersionNumber(String documentId, int versionNumber);

  void save(DocumentVersion version);
}
