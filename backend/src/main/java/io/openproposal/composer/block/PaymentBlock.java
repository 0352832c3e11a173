package io.openproposal.composer.block;

import com.fasterxml.jackson.annotation.JsonValue;
import java.math.BigDecimal;
import java.util.Locale;

/**
 * Payment request collected during signing.
 *
 * @param usePricingTableTotal charge the document's pricing total instead of {@code amount}
 * @param downPaymentPercent share of the amount due now; 0 means the full amount
 */
public record PaymentBlock(
    String id,
    BlockVisibility visibility,
    BigDecimal amount,
    String currency,
    String description,
    Timing timing,
    boolean usePricingTableTotal,
    int downPaymentPercent,
    boolean required)
    implements Block {

  @Override
  public BlockType type() {
    return BlockType.PAYMENT;
  }

  public enum Timing {
    DUE_NOW,
    NET_30,
    NET_60;

    @JsonValue
    public String value() {
      return name().toLowerCase(Locale.ROOT);
    }
  }
}
