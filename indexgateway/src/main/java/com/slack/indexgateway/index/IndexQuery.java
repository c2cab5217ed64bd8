package com.slack.indexgateway.index;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.MoreObjects;
import com.google.protobuf.TextFormat;
import java.util.Arrays;
import java.util.Objects;

/**
 * A range lookup against one row of an index table. The table name and hash value address the
 * row; the optional range value prefix, range value start and value-equal filters narrow the
 * columns returned. Absent filters are represented by empty arrays.
 */
public final class IndexQuery {
  private static final byte[] EMPTY = new byte[0];

  private final String tableName;
  private final String hashValue;
  private final byte[] rangeValuePrefix;
  private final byte[] rangeValueStart;
  private final byte[] valueEqual;

  private IndexQuery(Builder builder) {
    this.tableName = builder.tableName;
    this.hashValue = builder.hashValue;
    this.rangeValuePrefix = builder.rangeValuePrefix;
    this.rangeValueStart = builder.rangeValueStart;
    this.valueEqual = builder.valueEqual;
  }

  public static Builder builder(String tableName, String hashValue) {
    return new Builder(tableName, hashValue);
  }

  public String getTableName() {
    return tableName;
  }

  public String getHashValue() {
    return hashValue;
  }

  public byte[] getRangeValuePrefix() {
    return rangeValuePrefix.clone();
  }

  public byte[] getRangeValueStart() {
    return rangeValueStart.clone();
  }

  public byte[] getValueEqual() {
    return valueEqual.clone();
  }

  public boolean hasRangeValuePrefix() {
    return rangeValuePrefix.length > 0;
  }

  public boolean hasRangeValueStart() {
    return rangeValueStart.length > 0;
  }

  public boolean hasValueEqual() {
    return valueEqual.length > 0;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof IndexQuery)) return false;
    IndexQuery that = (IndexQuery) o;
    return tableName.equals(that.tableName)
        && hashValue.equals(that.hashValue)
        && Arrays.equals(rangeValuePrefix, that.rangeValuePrefix)
        && Arrays.equals(rangeValueStart, that.rangeValueStart)
        && Arrays.equals(valueEqual, that.valueEqual);
  }

  @Override
  public int hashCode() {
    int result = Objects.hash(tableName, hashValue);
    result = 31 * result + Arrays.hashCode(rangeValuePrefix);
    result = 31 * result + Arrays.hashCode(rangeValueStart);
    result = 31 * result + Arrays.hashCode(valueEqual);
    return result;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("tableName", tableName)
        .add("hashValue", hashValue)
        .add("rangeValuePrefix", TextFormat.escapeBytes(rangeValuePrefix))
        .add("rangeValueStart", TextFormat.escapeBytes(rangeValueStart))
        .add("valueEqual", TextFormat.escapeBytes(valueEqual))
        .toString();
  }

  public static class Builder {
    private final String tableName;
    private final String hashValue;
    private byte[] rangeValuePrefix = EMPTY;
    private byte[] rangeValueStart = EMPTY;
    private byte[] valueEqual = EMPTY;

    private Builder(String tableName, String hashValue) {
      this.tableName = checkNotNull(tableName, "tableName");
      this.hashValue = checkNotNull(hashValue, "hashValue");
    }

    public Builder rangeValuePrefix(byte[] rangeValuePrefix) {
      this.rangeValuePrefix = copyOf(rangeValuePrefix);
      return this;
    }

    public Builder rangeValueStart(byte[] rangeValueStart) {
      this.rangeValueStart = copyOf(rangeValueStart);
      return this;
    }

    public Builder valueEqual(byte[] valueEqual) {
      this.valueEqual = copyOf(valueEqual);
      return this;
    }

    public IndexQuery build() {
      return new IndexQuery(this);
    }

    private static byte[] copyOf(byte[] bytes) {
      return bytes == null ? EMPTY : bytes.clone();
    }
  }
}
