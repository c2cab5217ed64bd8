package com.slack.indexgateway.index;

import java.nio.charset.StandardCharsets;

/**
 * Derives the correlation key the gateway attaches to every response. The layout is the table
 * name and hash value followed by each non-empty filter, joined by {@link #SEPARATOR}. Filter
 * bytes are mapped one-to-one onto chars so no input byte is lost. On the wire the key is UTF-8,
 * so the separator and every filter byte above 0x7F take two bytes.
 *
 * <p>Keys do not record which filter a segment came from, so a query with only a prefix and a
 * query with only a start of the same bytes collide. Callers that build a key map must reject
 * such collisions.
 */
public final class QueryKeys {
  public static final char SEPARATOR = '\u00ff';

  private QueryKeys() {}

  public static String queryKey(IndexQuery query) {
    StringBuilder key =
        new StringBuilder(query.getTableName()).append(SEPARATOR).append(query.getHashValue());
    if (query.hasRangeValuePrefix()) {
      key.append(SEPARATOR).append(latin1(query.getRangeValuePrefix()));
    }
    if (query.hasRangeValueStart()) {
      key.append(SEPARATOR).append(latin1(query.getRangeValueStart()));
    }
    if (query.hasValueEqual()) {
      key.append(SEPARATOR).append(latin1(query.getValueEqual()));
    }
    return key.toString();
  }

  private static String latin1(byte[] bytes) {
    return new String(bytes, StandardCharsets.ISO_8859_1);
  }
}
