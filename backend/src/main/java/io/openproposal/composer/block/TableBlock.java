package io.openproposal.composer.block;

import java.util.List;

/**
 * Static grid of text cells. {@code cells} holds {@code rows} lists of {@code columns} entries
 * each; the header row is kept separately in {@code headers}.
 */
public record TableBlock(
    String id,
    BlockVisibility visibility,
    int rows,
    int columns,
    List<String> headers,
    List<List<String>> cells)
    implements Block {

  public TableBlock {
    headers = headers != null ? List.copyOf(headers) : List.of();
    cells = cells != null ? cells.stream().map(List::copyOf).toList() : List.of();
  }

  @Override
  public BlockType type() {
    return BlockType.TABLE;
  }
}
