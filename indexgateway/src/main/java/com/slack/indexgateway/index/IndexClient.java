package com.slack.indexgateway.index;

import io.grpc.Context;
import java.util.List;

/**
 * Read and write access to the index tables of the log store.
 *
 * <p>Implementations that only support reads throw {@link UnsupportedIndexOperationException} from
 * the write methods.
 */
public interface IndexClient {

  /**
   * Runs every query and streams the matched rows to the callback. The context carries the tenant,
   * the deadline and cancellation for all the RPC calls made on behalf of this invocation.
   */
  void queryPages(Context ctx, List<IndexQuery> queries, QueryPagesCallback callback);

  default void queryPages(List<IndexQuery> queries, QueryPagesCallback callback) {
    queryPages(Context.current(), queries, callback);
  }

  WriteBatch newWriteBatch();

  void batchWrite(Context ctx, WriteBatch batch);
}
