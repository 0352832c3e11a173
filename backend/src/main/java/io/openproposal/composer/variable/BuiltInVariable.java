package io.openproposal.composer.variable;

import java.util.Arrays;
import java.util.Optional;

/** Fixed catalogue of merge fields resolved from a {@link VariableContext}. */
public enum BuiltInVariable {
  RECIPIENT_NAME("recipient.name", "Recipient name", "Recipient"),
  RECIPIENT_EMAIL("recipient.email", "Recipient email", "Recipient"),
  SENDER_NAME("sender.name", "Your name", "Sender"),
  SENDER_EMAIL("sender.email", "Your email", "Sender"),
  SENDER_COMPANY("sender.company", "Your company name", "Sender"),
  DOCUMENT_TITLE("document.title", "Document title", "Document"),
  DATE_TODAY("date.today", "Today's date", "Date"),
  DATE_EXPIRY("date.expiry", "Document expiry date", "Date");

  private final String key;
  private final String description;
  private final String category;

  BuiltInVariable(String key, String description, String category) {
    this.key = key;
    this.description = description;
    this.category = category;
  }

  public String getKey() {
    return key;
  }

  public String getDescription() {
    return description;
  }

  public String getCategory() {
    return category;
  }

  public static Optional<BuiltInVariable> fromKey(String key) {
    return Arrays.stream(values()).filter(v -> v.key.equals(key)).findFirst();
  }

  public static boolean isBuiltIn(String key) {
    return fromKey(key).isPresent();
  }
}
