package io.openproposal.composer.builder;

/** Persistence hook the builder hands its content to on save. */
@FunctionalInterface
public interface DocumentSaver {

  /**
   * Stores the document. Any runtime exception aborts the save and leaves the builder dirty.
   *
   * @param contentJson the block sequence encoded as a JSON array
   */
  void save(String documentId, String title, String contentJson);
}
