package com.slack.indexgateway.index;

/**
 * Forward-only cursor over the rows of a {@link ReadBatch}. A fresh cursor is positioned before
 * the first row, so {@link #next()} must be called before reading.
 */
public interface ReadBatchIterator {

  /** Moves to the next row, returning false once the rows are exhausted. */
  boolean next();

  byte[] rangeValue();

  byte[] value();
}
