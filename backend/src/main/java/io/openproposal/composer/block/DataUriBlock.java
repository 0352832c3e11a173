package io.openproposal.composer.block;

import java.util.Set;

/**
 * Data payload to be inscribed on chain once the document completes. The payload itself is hidden
 * from recipients; {@code label} is shown to the author only.
 */
public record DataUriBlock(
    String id, BlockVisibility visibility, String payload, String network, String label)
    implements Block {

  public static final Set<String> NETWORKS =
      Set.of("ethereum", "base", "arbitrum", "optimism", "polygon");

  @Override
  public BlockType type() {
    return BlockType.DATA_URI;
  }
}
