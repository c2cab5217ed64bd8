package com.slack.indexgateway.index;

/** Receives query results as they are streamed back. */
@FunctionalInterface
public interface QueryPagesCallback {

  /**
   * Called once per received batch of rows.
   *
   * @return false to stop receiving rows for the remainder of the RPC call
   */
  boolean onBatch(IndexQuery query, ReadBatch batch);
}
