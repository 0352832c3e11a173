package io.openproposal.composer.pricing;

import io.openproposal.composer.block.Block;
import io.openproposal.composer.block.PricingItem;
import io.openproposal.composer.block.PricingTableBlock;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Totals for pricing tables. Only included items (mandatory ones plus selected optional ones) count
 * towards the subtotal. The discount is taken off first, capped at the subtotal, and tax applies to
 * what remains.
 */
@Component
public class PricingCalculator {

  private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

  public PricingSummary summarize(PricingTableBlock table) {
    var subtotal =
        table.items().stream()
            .filter(PricingItem::isIncluded)
            .map(PricingItem::lineTotal)
            .reduce(BigDecimal.ZERO, BigDecimal::add);

    var discount = discountOf(table, subtotal);
    var afterDiscount = subtotal.subtract(discount);
    var tax = BigDecimal.ZERO;
    if (positive(table.taxRate())) {
      tax = afterDiscount.multiply(table.taxRate()).divide(HUNDRED);
    }

    return new PricingSummary(
        money(subtotal), money(discount), money(tax), money(afterDiscount.add(tax)));
  }

  /** Sums the totals of every pricing table in a document, in document order. */
  public PricingSummary summarizeDocument(List<Block> blocks) {
    return blocks.stream()
        .filter(PricingTableBlock.class::isInstance)
        .map(PricingTableBlock.class::cast)
        .map(this::summarize)
        .reduce(PricingSummary.ZERO, PricingSummary::plus);
  }

  private BigDecimal discountOf(PricingTableBlock table, BigDecimal subtotal) {
    if (table.discountType() == null || !positive(table.discountValue())) {
      return BigDecimal.ZERO;
    }
    var discount =
        switch (table.discountType()) {
          case PERCENTAGE -> subtotal.multiply(table.discountValue()).divide(HUNDRED);
          case FIXED -> table.discountValue();
        };
    return discount.min(subtotal);
  }

  private static boolean positive(BigDecimal value) {
    return value != null && value.signum() > 0;
  }

  static BigDecimal money(BigDecimal value) {
    return value.setScale(2, RoundingMode.HALF_UP);
  }
}
