package com.slack.indexgateway.client;

import static com.google.common.base.Preconditions.checkState;

import com.slack.indexgateway.index.ReadBatch;
import com.slack.indexgateway.index.ReadBatchIterator;
import com.slack.indexgateway.proto.service.IndexGateway;
import java.util.List;

/** {@link ReadBatch} over the rows of one received {@code QueryIndexResponse}. */
public class GrpcReadBatch implements ReadBatch {
  private final IndexGateway.QueryIndexResponse response;

  public GrpcReadBatch(IndexGateway.QueryIndexResponse response) {
    this.response = response;
  }

  @Override
  public ReadBatchIterator iterator() {
    return new RowIterator(response.getRowsList());
  }

  private static class RowIterator implements ReadBatchIterator {
    private final List<IndexGateway.Row> rows;
    private int i = -1;

    RowIterator(List<IndexGateway.Row> rows) {
      this.rows = rows;
    }

    @Override
    public boolean next() {
      if (i < rows.size()) {
        i++;
      }
      return i < rows.size();
    }

    @Override
    public byte[] rangeValue() {
      return current().getRangeValue().toByteArray();
    }

    @Override
    public byte[] value() {
      return current().getValue().toByteArray();
    }

    private IndexGateway.Row current() {
      checkState(i >= 0 && i < rows.size(), "iterator is not positioned on a row");
      return rows.get(i);
    }
  }
}
