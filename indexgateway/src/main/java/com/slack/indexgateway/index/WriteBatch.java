package com.slack.indexgateway.index;

/** A set of index entries to be written or deleted together. */
public interface WriteBatch {

  void add(String tableName, String hashValue, byte[] rangeValue, byte[] value);

  void delete(String tableName, String hashValue, byte[] rangeValue);
}
