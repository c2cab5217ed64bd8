package com.slack.indexgateway.ring;

import java.nio.charset.StandardCharsets;

/** Computes ring tokens for tenants. */
public final class RingTokens {
  private static final int FNV32_OFFSET_BASIS = 0x811c9dc5;
  private static final int FNV32_PRIME = 0x01000193;

  private RingTokens() {}

  /**
   * 32-bit FNV-1 hash of the tenant id followed by the labels. The result is an unsigned 32-bit
   * value carried in an int.
   */
  public static int tokenFor(String tenantId, String labels) {
    int hash = FNV32_OFFSET_BASIS;
    hash = fnv1(hash, tenantId.getBytes(StandardCharsets.UTF_8));
    hash = fnv1(hash, labels.getBytes(StandardCharsets.UTF_8));
    return hash;
  }

  private static int fnv1(int hash, byte[] bytes) {
    for (byte b : bytes) {
      hash *= FNV32_PRIME;
      hash ^= (b & 0xff);
    }
    return hash;
  }
}
