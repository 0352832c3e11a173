package io.openproposal.composer.variable;

import java.time.Instant;

/**
 * Values for the built-in merge fields, grouped by namespace. Any part may be null; fields that
 * cannot be resolved render as a visible placeholder.
 */
public record VariableContext(Recipient recipient, Sender sender, DocumentInfo document) {

  public static VariableContext empty() {
    return new VariableContext(null, null, null);
  }

  public record Recipient(String name, String email) {}

  public record Sender(String name, String email, String company) {}

  public record DocumentInfo(String title, Instant expiresAt) {}
}
