package io.openproposal.composer.pricing;

import io.openproposal.composer.block.Block;
import io.openproposal.composer.block.PaymentBlock;
import java.math.BigDecimal;
import java.util.List;
import org.springframework.stereotype.Component;

/** Works out how much a payment block asks the recipient to pay now. */
@Component
public class PaymentAmountCalculator {

  private final PricingCalculator pricingCalculator;

  public PaymentAmountCalculator(PricingCalculator pricingCalculator) {
    this.pricingCalculator = pricingCalculator;
  }

  /**
   * Returns the amount due for the payment block: the document's pricing total when the block
   * follows the pricing tables, otherwise its fixed amount, scaled down to the down payment share
   * when one is set.
   *
   * @param payment the payment block
   * @param document every block of the document, used for the pricing total
   * @return the amount due now, rounded to two decimal places
   */
  public BigDecimal amountDue(PaymentBlock payment, List<Block> document) {
    BigDecimal base =
        payment.usePricingTableTotal()
            ? pricingCalculator.summarizeDocument(document).total()
            : payment.amount() != null ? payment.amount() : BigDecimal.ZERO;

    int percent = payment.downPaymentPercent();
    if (percent > 0 && percent < 100) {
      base = base.multiply(BigDecimal.valueOf(percent)).divide(BigDecimal.valueOf(100));
    }
    return PricingCalculator.money(base);
  }
}
