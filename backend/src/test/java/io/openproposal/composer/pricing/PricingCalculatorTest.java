package io.openproposal.composer.pricing;

import static io.openproposal.composer.block.TestBlocks.item;
import static io.openproposal.composer.block.TestBlocks.optionalItem;
import static io.openproposal.composer.block.TestBlocks.pricing;
import static io.openproposal.composer.block.TestBlocks.text;
import static org.assertj.core.api.Assertions.assertThat;

import io.openproposal.composer.block.Block;
import io.openproposal.composer.block.PricingTableBlock.DiscountType;
import java.util.List;
import org.junit.jupiter.api.Test;

class PricingCalculatorTest {

  private final PricingCalculator calculator = new PricingCalculator();

  @Test
  void summarize_countsMandatoryAndSelectedOptionalItemsOnly() {
    var table =
        pricing(
            "p1",
            item("a", 2, "100"),
            optionalItem("b", 1, "50", false),
            optionalItem("c", 1, "25", true));

    var summary = calculator.summarize(table);

    assertThat(summary.subtotal()).isEqualByComparingTo("225.00");
    assertThat(summary.total()).isEqualByComparingTo("225.00");
  }

  @Test
  void summarize_percentageDiscountThenTaxOnDiscountedAmount() {
    var table =
        pricing(
            "p1",
            DiscountType.PERCENTAGE,
            "10",
            "20",
            item("a", 2, "100"),
            optionalItem("c", 1, "25", true));

    var summary = calculator.summarize(table);

    assertThat(summary.subtotal()).isEqualByComparingTo("225.00");
    assertThat(summary.discount()).isEqualByComparingTo("22.50");
    assertThat(summary.tax()).isEqualByComparingTo("40.50");
    assertThat(summary.total()).isEqualByComparingTo("243.00");
    assertThat(summary.total().scale()).isEqualTo(2);
  }

  @Test
  void summarize_fixedDiscountLargerThanSubtotal_isCapped() {
    var table = pricing("p1", DiscountType.FIXED, "500", "10", item("a", 1, "120"));

    var summary = calculator.summarize(table);

    assertThat(summary.discount()).isEqualByComparingTo("120.00");
    assertThat(summary.tax()).isEqualByComparingTo("0.00");
    assertThat(summary.total()).isEqualByComparingTo("0.00");
  }

  @Test
  void summarize_roundsHalfUp() {
    var table = pricing("p1", null, null, "7.5", item("a", 1, "0.10"));

    var summary = calculator.summarize(table);

    // 0.10 * 7.5% = 0.0075
    assertThat(summary.tax()).isEqualByComparingTo("0.01");
    assertThat(summary.total()).isEqualByComparingTo("0.11");
  }

  @Test
  void summarizeDocument_sumsEveryPricingTable() {
    List<Block> blocks =
        List.of(
            pricing("p1", item("a", 1, "100")),
            text("t1", "between"),
            pricing("p2", DiscountType.FIXED, "10", null, item("b", 3, "20")));

    var summary = calculator.summarizeDocument(blocks);

    assertThat(summary.subtotal()).isEqualByComparingTo("160.00");
    assertThat(summary.discount()).isEqualByComparingTo("10.00");
    assertThat(summary.total()).isEqualByComparingTo("150.00");
  }

  @Test
  void summarizeDocument_noPricingTables_isZero() {
    var summary = calculator.summarizeDocument(List.of(text("t1", "x")));

    assertThat(summary).isEqualTo(PricingSummary.ZERO);
  }
}
