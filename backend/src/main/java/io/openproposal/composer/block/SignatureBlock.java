package io.openproposal.composer.block;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Instant;

/**
 * Signature field for one signer role. {@code signedData} holds the drawn image (base64) or the
 * typed name once the recipient has signed.
 */
public record SignatureBlock(
    String id,
    BlockVisibility visibility,
    String signerRole,
    boolean required,
    String signedData,
    Instant signedAt)
    implements Block {

  @Override
  public BlockType type() {
    return BlockType.SIGNATURE;
  }

  @JsonIgnore
  public boolean isSigned() {
    return signedData != null && !signedData.isBlank();
  }
}
