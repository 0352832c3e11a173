package io.openproposal.composer.version;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Process-local version store. Versions are lost on restart; set {@code composer.versions.store}
 * to anything else and provide a {@link DocumentVersionStore} bean to persist them.
 */
@Component
@ConditionalOnProperty(
    name = "composer.versions.store",
    havingValue = "memory",
    matchIfMissing = true)
public class InMemoryDocumentVersionStore implements DocumentVersionStore {

  private final Map<String, List<DocumentVersion>> versions = new ConcurrentHashMap<>();

  @Override
  public List<DocumentVersion> findByDocumentId(String documentId) {
    return new ArrayList<>(versions.getOrDefault(documentId, List.of()));
  }

  @Override
  public Optional<DocumentVersion> findByDocumentIdAndVersionNumber(
      String documentId, int versionNumber) {
    return versions.getOrDefault(documentId, List.of()).stream()
        .filter(v -> v.versionNumber() == versionNumber)
        .findFirst();
  }

  @Override
  public void save(DocumentVersion version) {
    versions.computeIfAbsent(version.documentId(), id -> new CopyOnWriteArrayList<>()).add(version);
  }
}
