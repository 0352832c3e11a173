package io.openproposal.composer.block;

import java.util.Arrays;
import java.util.Optional;

/** Discriminant of the {@link Block} union, carrying the tag used in persisted content. */
public enum BlockType {
  TEXT("text"),
  HEADING("heading"),
  IMAGE("image"),
  DIVIDER("divider"),
  SPACER("spacer"),
  SIGNATURE("signature"),
  PRICING_TABLE("pricing-table"),
  VIDEO("video"),
  DATA_URI("data-uri"),
  TABLE("table"),
  PAYMENT("payment"),
  DATE("date"),
  CHECKBOX("checkbox"),
  TEXT_INPUT("text-input"),
  PAGE_BREAK("page-break");

  private final String tag;

  BlockType(String tag) {
    this.tag = tag;
  }

  public String getTag() {
    return tag;
  }

  public static Optional<BlockType> fromTag(String tag) {
    return Arrays.stream(values()).filter(t -> t.tag.equals(tag)).findFirst();
  }
}
