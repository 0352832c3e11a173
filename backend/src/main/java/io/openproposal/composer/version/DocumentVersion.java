package io.openproposal.composer.version;

import io.openproposal.composer.block.Block;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Immutable snapshot of a document at one version number. */
public record DocumentVersion(
    String documentId,
    int versionNumber,
    String title,
    List<Block> content,
    Map<String, String> variables,
    ChangeType changeType,
    String changeDescription,
    String createdBy,
    Instant createdAt) {

  public DocumentVersion {
    content = content != null ? List.copyOf(content) : List.of();
    variables =
        variables != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(variables))
            : Map.of();
  }
}
