package io.openproposal.composer.block;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Atomic content unit of a document. The model is flat: no variant holds another block, and a
 * block's position in the owning sequence is its only ordering.
 *
 * <p>Consumers that need per-variant behaviour switch over {@link #type()} without a default
 * branch, so adding a variant fails compilation until every consumer handles it.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
  @JsonSubTypes.Type(value = TextBlock.class, name = "text"),
  @JsonSubTypes.Type(value = HeadingBlock.class, name = "heading"),
  @JsonSubTypes.Type(value = ImageBlock.class, name = "image"),
  @JsonSubTypes.Type(value = DividerBlock.class, name = "divider"),
  @JsonSubTypes.Type(value = SpacerBlock.class, name = "spacer"),
  @JsonSubTypes.Type(value = SignatureBlock.class, name = "signature"),
  @JsonSubTypes.Type(value = PricingTableBlock.class, name = "pricing-table"),
  @JsonSubTypes.Type(value = VideoBlock.class, name = "video"),
  @JsonSubTypes.Type(value = DataUriBlock.class, name = "data-uri"),
  @JsonSubTypes.Type(value = TableBlock.class, name = "table"),
  @JsonSubTypes.Type(value = PaymentBlock.class, name = "payment"),
  @JsonSubTypes.Type(value = DateBlock.class, name = "date"),
  @JsonSubTypes.Type(value = CheckboxBlock.class, name = "checkbox"),
  @JsonSubTypes.Type(value = TextInputBlock.class, name = "text-input"),
  @JsonSubTypes.Type(value = PageBreakBlock.class, name = "page-break")
})
public sealed interface Block
    permits TextBlock,
        HeadingBlock,
        ImageBlock,
        DividerBlock,
        SpacerBlock,
        SignatureBlock,
        PricingTableBlock,
        VideoBlock,
        DataUriBlock,
        TableBlock,
        PaymentBlock,
        DateBlock,
        CheckboxBlock,
        TextInputBlock,
        PageBreakBlock {

  /** Identifier, unique within a document and fixed for the block's lifetime. */
  String id();

  BlockType type();

  /** Conditional visibility settings; null when the block is always shown. */
  BlockVisibility visibility();
}
