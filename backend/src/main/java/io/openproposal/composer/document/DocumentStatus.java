package io.openproposal.composer.document;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Lifecycle status of a document. */
public enum DocumentStatus {
  /** Initial state; content is being authored. */
  DRAFT,

  /** Sent to its recipients. */
  SENT,

  /** Opened by at least one recipient. */
  VIEWED,

  /** Signed by at least one signer; the content is locked from here on. */
  SIGNED,

  /** Every signer has signed. */
  COMPLETED,

  /** A recipient declined the document. */
  DECLINED,

  /** Passed its expiry date before being signed. */
  EXPIRED;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
