package io.openproposal.composer.version;

import io.openproposal.composer.block.Block;
import io.openproposal.composer.document.DocumentStatus;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The live state of a document as read from storage.
 *
 * @param currentVersion version number the live content will be stored under when it is next
 *     snapshotted
 */
public record CurrentDocument(
    String id,
    String title,
    List<Block> content,
    Map<String, String> variables,
    int currentVersion,
    DocumentStatus status,
    Instant updatedAt) {

  public CurrentDocument {
    content = content != null ? List.copyOf(content) : List.of();
    variables =
        variables != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(variables))
            : Map.of();
  }
}
