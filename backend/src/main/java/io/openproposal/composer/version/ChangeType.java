package io.openproposal.composer.version;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Why a version was recorded. {@link #CURRENT} only appears on the synthesised live entry. */
public enum ChangeType {
  CREATED,
  EDITED,
  SENT,
  RESENT,
  CURRENT;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
