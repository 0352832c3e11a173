package io.openproposal.composer.block;

import io.openproposal.composer.condition.ConditionGroup;
import io.openproposal.composer.condition.ConditionNode;
import io.openproposal.composer.condition.ConditionRule;
import io.openproposal.composer.exception.ContentValidationException;
import io.openproposal.composer.exception.ContentValidationException.Violation;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.UUID;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Per-variant defaults and invariants of the block union. New blocks get a random UUID
 * identifier. Validation reports every violation it finds and never corrects the block.
 */
@Component
public class BlockRegistry {

  private static final Pattern CURRENCY_PATTERN = Pattern.compile("[A-Z]{3}");

  /** Returns a fully populated, valid block of the given variant with a fresh identifier. */
  public Block createDefault(BlockType type) {
    String id = newId();
    return switch (type) {
      case TEXT -> new TextBlock(id, null, "", TextBlock.Alignment.LEFT);
      case HEADING -> new HeadingBlock(id, null, "", 2);
      case IMAGE -> new ImageBlock(id, null, "", "", "", 100);
      case DIVIDER -> new DividerBlock(id, null, DividerBlock.Style.SOLID, "#e5e7eb");
      case SPACER -> new SpacerBlock(id, null, 32);
      case SIGNATURE -> new SignatureBlock(id, null, "Client", true, null, null);
      case PRICING_TABLE ->
          new PricingTableBlock(
              id,
              null,
              "Pricing",
              List.of(new PricingItem(newId(), "Item 1", "", 1, BigDecimal.ZERO, false, true)),
              "USD",
              true,
              null,
              BigDecimal.ZERO,
              BigDecimal.ZERO,
              "Tax");
      case VIDEO -> new VideoBlock(id, null, "", null);
      case DATA_URI -> new DataUriBlock(id, null, "", "base", "");
      case TABLE ->
          new TableBlock(
              id,
              null,
              2,
              3,
              List.of("Column 1", "Column 2", "Column 3"),
              List.of(List.of("", "", ""), List.of("", "", "")));
      case PAYMENT ->
          new PaymentBlock(
              id,
              null,
              BigDecimal.ZERO,
              "USD",
              "Payment required",
              PaymentBlock.Timing.DUE_NOW,
              true,
              0,
              true);
      case DATE -> new DateBlock(id, null, "Date", false, null, "yyyy-MM-dd");
      case CHECKBOX -> new CheckboxBlock(id, null, "I agree", false, false);
      case TEXT_INPUT -> new TextInputBlock(id, null, "", "", false, null, false);
      case PAGE_BREAK -> new PageBreakBlock(id, null);
    };
  }

  /** Checks the variant-specific invariants of a single block. */
  public BlockValidationResult validate(Block block) {
    var checks = new Checks();
    checkBlock(block, "", checks);
    return new BlockValidationResult(checks.violations);
  }

  /** Validates every block and that identifiers are unique across the sequence. */
  public BlockValidationResult validateAll(List<Block> blocks) {
    var checks = new Checks();
    var ids = new HashSet<String>();
    for (int i = 0; i < blocks.size(); i++) {
      var block = blocks.get(i);
      String prefix = "blocks[" + i + "].";
      checkBlock(block, prefix, checks);
      checks.require(
          block.id() == null || ids.add(block.id()), prefix + "id", "duplicate block id");
    }
    return new BlockValidationResult(checks.violations);
  }

  /**
   * @throws ContentValidationException with every violation when the block is invalid
   */
  public void requireValid(Block block) {
    throwIfInvalid(validate(block));
  }

  /**
   * @throws ContentValidationException with every violation when any block is invalid
   */
  public void requireValidAll(List<Block> blocks) {
    throwIfInvalid(validateAll(blocks));
  }

  private static void throwIfInvalid(BlockValidationResult result) {
    if (!result.isValid()) {
      throw new ContentValidationException(result.violations());
    }
  }

  private void checkBlock(Block block, String prefix, Checks checks) {
    checks.require(block.id() != null && !block.id().isBlank(), prefix + "id", "must not be blank");
    if (block.visibility() != null && block.visibility().condition() != null) {
      checkCondition(block.visibility().condition(), prefix + "visibility.condition", checks);
    }

    switch (block.type()) {
      case TEXT -> {
        var text = (TextBlock) block;
        checks.require(text.content() != null, prefix + "content", "must not be null");
      }
      case HEADING -> {
        var heading = (HeadingBlock) block;
        checks.require(heading.content() != null, prefix + "content", "must not be null");
        checks.require(
            heading.level() >= 1 && heading.level() <= 6, prefix + "level", "must be 1-6");
      }
      case IMAGE -> {
        var image = (ImageBlock) block;
        checks.require(image.src() != null, prefix + "src", "must not be null");
        checks.require(
            image.width() == null || (image.width() >= 1 && image.width() <= 100),
            prefix + "width",
            "must be a percentage between 1 and 100");
      }
      case DIVIDER ->
          checks.require(
              ((DividerBlock) block).style() != null, prefix + "style", "must not be null");
      case SPACER ->
          checks.require(((SpacerBlock) block).height() >= 0, prefix + "height", "must be >= 0");
      case SIGNATURE -> {
        var signature = (SignatureBlock) block;
        checks.require(
            signature.signerRole() != null && !signature.signerRole().isBlank(),
            prefix + "signerRole",
            "must not be blank");
        checks.require(
            signature.signedAt() == null || signature.isSigned(),
            prefix + "signedAt",
            "set without signature data");
      }
      case PRICING_TABLE -> checkPricingTable((PricingTableBlock) block, prefix, checks);
      case VIDEO -> {
        var video = (VideoBlock) block;
        checks.require(
            video.url() != null
                && (video.url().isEmpty()
                    || video.url().startsWith("https://")
                    || video.url().startsWith("http://")),
            prefix + "url",
            "must be empty or an http(s) URL");
      }
      case DATA_URI -> {
        var dataUri = (DataUriBlock) block;
        checks.require(dataUri.payload() != null, prefix + "payload", "must not be null");
        checks.require(
            DataUriBlock.NETWORKS.contains(dataUri.network()),
            prefix + "network",
            "must be one of " + DataUriBlock.NETWORKS);
      }
      case TABLE -> checkTable((TableBlock) block, prefix, checks);
      case PAYMENT -> {
        var payment = (PaymentBlock) block;
        checks.require(
            payment.amount() != null && payment.amount().signum() >= 0,
            prefix + "amount",
            "must be >= 0");
        checkCurrency(payment.currency(), prefix, checks);
        checks.require(payment.timing() != null, prefix + "timing", "must not be null");
        checks.require(
            payment.downPaymentPercent() >= 0 && payment.downPaymentPercent() <= 100,
            prefix + "downPaymentPercent",
            "must be 0-100");
      }
      case CHECKBOX -> {
        var checkbox = (CheckboxBlock) block;
        checks.require(
            checkbox.label() != null && !checkbox.label().isBlank(),
            prefix + "label",
            "must not be blank");
      }
      case DATE, TEXT_INPUT, PAGE_BREAK -> {
        // no payload invariants
      }
    }
  }

  private void checkPricingTable(PricingTableBlock table, String prefix, Checks checks) {
    checkCurrency(table.currency(), prefix, checks);
    checks.require(
        table.discountValue() == null || table.discountValue().signum() >= 0,
        prefix + "discountValue",
        "must be >= 0");
    checks.require(
        table.discountType() != PricingTableBlock.DiscountType.PERCENTAGE
            || table.discountValue() == null
            || table.discountValue().compareTo(BigDecimal.valueOf(100)) <= 0,
        prefix + "discountValue",
        "percentage discount must be <= 100");
    checks.require(
        table.taxRate() == null || table.taxRate().signum() >= 0,
        prefix + "taxRate",
        "must be >= 0");

    var itemIds = new HashSet<String>();
    for (int i = 0; i < table.items().size(); i++) {
      var item = table.items().get(i);
      String itemPrefix = prefix + "items[" + i + "].";
      checks.require(
          item.id() != null && itemIds.add(item.id()),
          itemPrefix + "id",
          "must be present and unique within the table");
      checks.require(item.name() != null, itemPrefix + "name", "must not be null");
      checks.require(item.quantity() >= 0, itemPrefix + "quantity", "must be >= 0");
      checks.require(
          item.unitPrice() != null && item.unitPrice().signum() >= 0,
          itemPrefix + "unitPrice",
          "must be >= 0");
    }
  }

  private void checkTable(TableBlock table, String prefix, Checks checks) {
    checks.require(table.rows() >= 0, prefix + "rows", "must be >= 0");
    checks.require(table.columns() >= 1, prefix + "columns", "must be >= 1");
    checks.require(
        table.headers().size() == table.columns(),
        prefix + "headers",
        "expected " + table.columns() + " headers but found " + table.headers().size());
    checks.require(
        table.cells().size() == table.rows(),
        prefix + "cells",
        "expected " + table.rows() + " rows but found " + table.cells().size());
    for (int r = 0; r < table.cells().size(); r++) {
      int width = table.cells().get(r).size();
      checks.require(
          width == table.columns(),
          prefix + "cells[" + r + "]",
          "expected " + table.columns() + " cells but found " + width);
    }
  }

  private void checkCondition(ConditionNode node, String path, Checks checks) {
    if (node instanceof ConditionGroup group) {
      checks.require(group.logic() != null, path + ".logic", "must be AND or OR");
      for (int i = 0; i < group.rules().size(); i++) {
        checkCondition(group.rules().get(i), path + ".rules[" + i + "]", checks);
      }
    } else if (node instanceof ConditionRule rule) {
      checks.require(
          rule.field() != null && !rule.field().isBlank(), path + ".field", "must not be blank");
      checks.require(rule.operator() != null, path + ".operator", "must not be null");
      checks.require(
          rule.value() instanceof String
              || rule.value() instanceof Number
              || rule.value() instanceof Boolean,
          path + ".value",
          "must be a string, number or boolean");
    }
  }

  private static void checkCurrency(String currency, String prefix, Checks checks) {
    checks.require(
        currency != null && CURRENCY_PATTERN.matcher(currency).matches(),
        prefix + "currency",
        "must be a three-letter ISO code");
  }

  private static String newId() {
    return UUID.randomUUID().toString();
  }

  private static final class Checks {

    private final List<Violation> violations = new ArrayList<>();

    void require(boolean condition, String path, String message) {
      if (!condition) {
        violations.add(new Violation(path, message));
      }
    }
  }
}
