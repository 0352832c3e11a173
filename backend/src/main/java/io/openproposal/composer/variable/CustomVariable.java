package io.openproposal.composer.variable;

/**
 * Author-defined merge field stored with the document.
 *
 * @param name letters, digits and underscores; unique per document ignoring case
 * @param defaultValue value used when the sender does not supply one
 */
public record CustomVariable(String name, String defaultValue, String description) {}
