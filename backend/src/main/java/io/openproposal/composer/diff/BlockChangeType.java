package io.openproposal.composer.diff;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum BlockChangeType {
  ADDED,
  REMOVED,
  MODIFIED,
  UNCHANGED;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
