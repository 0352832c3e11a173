package io.openproposal.composer.condition;

import io.openproposal.composer.block.Block;
import io.openproposal.composer.block.CheckboxBlock;
import io.openproposal.composer.block.DateBlock;
import io.openproposal.composer.block.PricingTableBlock;
import io.openproposal.composer.block.TextInputBlock;
import io.openproposal.composer.pricing.PricingCalculator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Flattens a block sequence into the dotted-path field map that visibility rules read.
 *
 * <p>Keys produced:
 *
 * <ul>
 *   <li>{@code pricing.items.<itemId>.isSelected}, {@code .quantity}, {@code .total}
 *   <li>{@code pricing.subtotal}, {@code pricing.total} across every pricing table
 *   <li>{@code fields.<blockId>.checked} for checkboxes
 *   <li>{@code fields.<blockId>.value} for text inputs and date fields that hold a value
 * </ul>
 */
@Component
public class FieldContextBuilder {

  private final PricingCalculator pricingCalculator;

  public FieldContextBuilder(PricingCalculator pricingCalculator) {
    this.pricingCalculator = pricingCalculator;
  }

  /**
   * Builds the field map for a document.
   *
   * @param blocks the document's blocks
   * @param overrides caller-supplied values (e.g. live selections); applied last and win on clashes
   * @return an insertion-ordered map of field paths to scalars
   */
  public Map<String, Object> build(List<Block> blocks, Map<String, ?> overrides) {
    var fields = new LinkedHashMap<String, Object>();
    for (var block : blocks) {
      fields.putAll(fieldsOf(block));
    }

    var summary = pricingCalculator.summarizeDocument(blocks);
    fields.put("pricing.subtotal", summary.subtotal());
    fields.put("pricing.total", summary.total());

    if (overrides != null) {
      fields.putAll(overrides);
    }
    return fields;
  }

  private Map<String, Object> fieldsOf(Block block) {
    return switch (block.type()) {
      case PRICING_TABLE -> pricingItemFields((PricingTableBlock) block);
      case CHECKBOX ->
          Map.of("fields." + block.id() + ".checked", ((CheckboxBlock) block).checked());
      case TEXT_INPUT -> valueField(block.id(), ((TextInputBlock) block).value());
      case DATE -> valueField(block.id(), ((DateBlock) block).value());
      case TEXT,
          HEADING,
          IMAGE,
          DIVIDER,
          SPACER,
          SIGNATURE,
          VIDEO,
          DATA_URI,
          TABLE,
          PAYMENT,
          PAGE_BREAK -> Map.of();
    };
  }

  private static Map<String, Object> pricingItemFields(PricingTableBlock table) {
    var fields = new LinkedHashMap<String, Object>();
    for (var item : table.items()) {
      String prefix = "pricing.items." + item.id() + ".";
      fields.put(prefix + "isSelected", item.isIncluded());
      fields.put(prefix + "quantity", item.quantity());
      fields.put(prefix + "total", item.lineTotal());
    }
    return fields;
  }

  private static Map<String, Object> valueField(String blockId, String value) {
    return value != null ? Map.of("fields." + blockId + ".value", value) : Map.of();
  }
}
