package io.openproposal.composer.pricing;

import java.math.BigDecimal;

/**
 * Computed totals of one pricing table, or of all tables in a document. Amounts are rounded to two
 * decimal places.
 */
public record PricingSummary(
    BigDecimal subtotal, BigDecimal discount, BigDecimal tax, BigDecimal total) {

  public static final PricingSummary ZERO =
      new PricingSummary(
          PricingCalculator.money(BigDecimal.ZERO),
          PricingCalculator.money(BigDecimal.ZERO),
          PricingCalculator.money(BigDecimal.ZERO),
          PricingCalculator.money(BigDecimal.ZERO));

  public PricingSummary plus(PricingSummary other) {
    return new PricingSummary(
        subtotal.add(other.subtotal),
        discount.add(other.discount),
        tax.add(other.tax),
        total.add(other.total));
  }
}
