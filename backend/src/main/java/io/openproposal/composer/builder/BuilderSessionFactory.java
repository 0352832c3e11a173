package io.openproposal.composer.builder;

import io.openproposal.composer.block.Block;
import io.openproposal.composer.block.BlockJsonCodec;
import io.openproposal.composer.block.BlockRegistry;
import io.openproposal.composer.builder.BuilderAction.SetDocument;
import java.time.Clock;
import java.util.List;
import org.springframework.stereotype.Component;

/** Opens {@link BuilderSession}s on loaded documents. */
@Component
public class BuilderSessionFactory {

  private final BuilderReducer reducer;
  private final BlockRegistry registry;
  private final BlockJsonCodec codec;
  private final Clock clock;

  public BuilderSessionFactory(
      BuilderReducer reducer, BlockRegistry registry, BlockJsonCodec codec, Clock clock) {
    this.reducer = reducer;
    this.registry = registry;
    this.codec = codec;
    this.clock = clock;
  }

  public BuilderSession open(String documentId, String title, List<Block> blocks, boolean locked) {
    var state =
        reducer.reduce(BuilderState.initial(), new SetDocument(documentId, title, blocks, locked));
    return new BuilderSession(reducer, registry, codec, clock, state);
  }

  /** Opens a session on stored content, decoding the JSON block array first. */
  public BuilderSession openFromJson(
      String documentId, String title, String contentJson, boolean locked) {
    return open(documentId, title, codec.decode(contentJson), locked);
  }
}
