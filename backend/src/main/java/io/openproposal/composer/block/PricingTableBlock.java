package io.openproposal.composer.block;

import com.fasterxml.jackson.annotation.JsonValue;
import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;

/**
 * Priced line items with an optional discount and tax.
 *
 * @param discountType how {@code discountValue} applies; null when there is no discount
 * @param taxRate tax percentage applied after the discount
 */
public record PricingTableBlock(
    String id,
    BlockVisibility visibility,
    String title,
    List<PricingItem> items,
    String currency,
    boolean showDescription,
    DiscountType discountType,
    BigDecimal discountValue,
    BigDecimal taxRate,
    String taxLabel)
    implements Block {

  public PricingTableBlock {
    items = items != null ? List.copyOf(items) : List.of();
  }

  @Override
  public BlockType type() {
    return BlockType.PRICING_TABLE;
  }

  public enum DiscountType {
    PERCENTAGE,
    FIXED;

    @JsonValue
    public String value() {
      return name().toLowerCase(Locale.ROOT);
    }
  }
}
