package com.slack.indexgateway.index;

/** The rows returned for a single query in one response from the gateway. */
public interface ReadBatch {

  /** Returns a new cursor positioned before the first row. */
  ReadBatchIterator iterator();
}
