package io.openproposal.composer.block;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;

/**
 * Line item of a pricing table. Optional items only count towards totals when the recipient
 * selects them.
 */
public record PricingItem(
    String id,
    String name,
    String description,
    int quantity,
    BigDecimal unitPrice,
    @JsonProperty("isOptional") boolean optional,
    @JsonProperty("isSelected") boolean selected) {

  /** Mandatory items are always selected; optional ones only when chosen. */
  @JsonIgnore
  public boolean isIncluded() {
    return !optional || selected;
  }

  public BigDecimal lineTotal() {
    var price = unitPrice != null ? unitPrice : BigDecimal.ZERO;
    return price.multiply(BigDecimal.valueOf(quantity));
  }
}
