package io.openproposal.composer.block;

/**
 * A block whose payload is free text that may contain {@code {{variable}}} merge fields. Merge
 * field passes work against this interface, never against concrete variants.
 */
public interface TextBearing {

  String content();

  /** Returns a copy of this block with its text replaced; every other field is unchanged. */
  Block withContent(String content);
}
