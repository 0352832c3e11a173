package io.openproposal.composer.diff;

import io.openproposal.composer.block.Block;
import io.openproposal.composer.block.CheckboxBlock;
import io.openproposal.composer.block.DataUriBlock;
import io.openproposal.composer.block.DateBlock;
import io.openproposal.composer.block.HeadingBlock;
import io.openproposal.composer.block.ImageBlock;
import io.openproposal.composer.block.PaymentBlock;
import io.openproposal.composer.block.PricingTableBlock;
import io.openproposal.composer.block.SignatureBlock;
import io.openproposal.composer.block.TableBlock;
import io.openproposal.composer.block.TextBlock;
import io.openproposal.composer.block.TextInputBlock;
import io.openproposal.composer.block.VideoBlock;
import org.springframework.stereotype.Component;

/**
 * Plain-text rendering of a block used for change detection. Only stable enough to tell two
 * versions of a block apart; not meant for display.
 */
@Component
public class BlockTextProjector {

  public String project(Block block) {
    if (block == null || block.type() == null) {
      return "";
    }
    return switch (block.type()) {
      case TEXT -> orEmpty(((TextBlock) block).content());
      case HEADING -> "# " + orEmpty(((HeadingBlock) block).content());
      case SIGNATURE -> ((SignatureBlock) block).isSigned() ? "[Signed]" : "[Signature: Sign here]";
      case IMAGE -> "[Image: " + orDefault(((ImageBlock) block).alt(), "Image") + "]";
      case DIVIDER -> "---";
      case SPACER -> "";
      case TABLE -> "[Table: " + ((TableBlock) block).rows() + " rows]";
      case PRICING_TABLE ->
          "[Pricing Table: " + ((PricingTableBlock) block).items().size() + " items]";
      case PAYMENT -> {
        var payment = (PaymentBlock) block;
        String amount = payment.amount() != null ? payment.amount().toPlainString() : "0";
        yield "[Payment: " + amount + " " + orDefault(payment.currency(), "USD") + "]";
      }
      case DATE -> orDefault(((DateBlock) block).value(), "[Date field]");
      case CHECKBOX -> {
        var checkbox = (CheckboxBlock) block;
        yield (checkbox.checked() ? "[x] " : "[ ] ") + orEmpty(checkbox.label());
      }
      case TEXT_INPUT -> {
        var input = (TextInputBlock) block;
        yield orDefault(input.value(), "[Input: " + orDefault(input.label(), "Text field") + "]");
      }
      case PAGE_BREAK -> "--- Page Break ---";
      case VIDEO -> "[Video: " + orEmpty(((VideoBlock) block).url()) + "]";
      case DATA_URI -> {
        var dataUri = (DataUriBlock) block;
        yield "[Data URI: " + orDefault(dataUri.label(), orEmpty(dataUri.network())) + "]";
      }
    };
  }

  private static String orEmpty(String value) {
    return value != null ? value : "";
  }

  private static String orDefault(String value, String fallback) {
    return value != null && !value.isEmpty() ? value : fallback;
  }
}
