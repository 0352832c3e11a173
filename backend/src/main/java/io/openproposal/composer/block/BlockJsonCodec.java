package io.openproposal.composer.block;

import io.openproposal.composer.exception.ContentValidationException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.DeserializationFeature;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.node.ObjectNode;

/**
 * Translates block sequences and variable maps to and from their persisted JSON form: an ordered
 * array of block objects discriminated by {@code type}, and an object of variable name to default
 * value. Unknown properties are ignored so content written by newer editors still loads.
 */
@Component
public class BlockJsonCodec {

  private static final TypeReference<List<Block>> BLOCK_LIST = new TypeReference<>() {};
  private static final TypeReference<LinkedHashMap<String, Object>> VARIABLE_MAP =
      new TypeReference<>() {};

  private final ObjectMapper mapper;

  public BlockJsonCodec(ObjectMapper objectMapper) {
    this.mapper =
        objectMapper
            .rebuild()
            .disable(
                DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES,
                DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
            .build();
  }

  /**
   * Decodes persisted document content.
   *
   * @param json a JSON array of blocks; null or blank yields an empty list
   * @return the blocks in persisted order
   * @throws ContentValidationException if the JSON is malformed, a block has an unknown type, or an
   *     entry is null
   */
  public List<Block> decode(String json) {
    if (json == null || json.isBlank()) {
      return List.of();
    }
    List<Block> blocks;
    try {
      blocks = mapper.readValue(json, BLOCK_LIST);
    } catch (JacksonException e) {
      throw ContentValidationException.of("content", e.getOriginalMessage());
    }
    if (blocks == null) {
      return List.of();
    }
    for (int i = 0; i < blocks.size(); i++) {
      if (blocks.get(i) == null) {
        throw ContentValidationException.of("content[" + i + "]", "block must not be null");
      }
    }
    return List.copyOf(blocks);
  }

  public String encode(List<Block> blocks) {
    return mapper.writerFor(BLOCK_LIST).writeValueAsString(blocks);
  }

  /**
   * Decodes the persisted variable map in definition order. Non-string scalars are kept as their
   * text form and a null default becomes an empty string.
   */
  public Map<String, String> decodeVariables(String json) {
    var values = new LinkedHashMap<String, String>();
    if (json == null || json.isBlank()) {
      return values;
    }
    Map<String, Object> raw;
    try {
      raw = mapper.readValue(json, VARIABLE_MAP);
    } catch (JacksonException e) {
      throw ContentValidationException.of("variables", e.getOriginalMessage());
    }
    if (raw != null) {
      raw.forEach((name, value) -> values.put(name, value != null ? String.valueOf(value) : ""));
    }
    return values;
  }

  public String encodeVariables(Map<String, String> variables) {
    return mapper.writeValueAsString(variables != null ? variables : Map.of());
  }

  /**
   * Applies a shallow patch to a block: each top-level property in {@code changes} replaces the
   * block's property of the same name. The identifier and type cannot be changed.
   *
   * @throws ContentValidationException if the patch touches {@code id} or {@code type}, or the
   *     patched payload does not fit the block's variant
   */
  public Block applyPatch(Block block, Map<String, Object> changes) {
    if (changes.containsKey("id") && !Objects.equals(changes.get("id"), block.id())) {
      throw ContentValidationException.of("id", "block id is immutable");
    }
    if (changes.containsKey("type")
        && !Objects.equals(changes.get("type"), block.type().getTag())) {
      throw ContentValidationException.of("type", "block type is immutable");
    }
    try {
      String current = mapper.writerFor(Block.class).writeValueAsString(block);
      var node = (ObjectNode) mapper.readTree(current);
      JsonNode patch = mapper.valueToTree(changes);
      node.setAll((ObjectNode) patch);
      return mapper.treeToValue(node, Block.class);
    } catch (JacksonException e) {
      throw ContentValidationException.of(block.type().getTag(), e.getOriginalMessage());
    }
  }
}
