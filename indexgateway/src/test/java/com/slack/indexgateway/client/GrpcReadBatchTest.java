package com.slack.indexgateway.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalStateException;

import com.google.protobuf.ByteString;
import com.slack.indexgateway.index.ReadBatchIterator;
import com.slack.indexgateway.proto.service.IndexGateway;
import org.junit.jupiter.api.Test;

public class GrpcReadBatchTest {

  private static IndexGateway.Row row(String rangeValue, String value) {
    return IndexGateway.Row.newBuilder()
        .setRangeValue(ByteString.copyFromUtf8(rangeValue))
        .setValue(ByteString.copyFromUtf8(value))
        .build();
  }

  @Test
  public void testIteratesRowsInOrder() {
    GrpcReadBatch batch =
        new GrpcReadBatch(
            IndexGateway.QueryIndexResponse.newBuilder()
                .setQueryKey("key")
                .addRows(row("r1", "v1"))
                .addRows(row("r2", "v2"))
                .build());

    ReadBatchIterator iterator = batch.iterator();
    assertThat(iterator.next()).isTrue();
    assertThat(iterator.rangeValue()).isEqualTo("r1".getBytes());
    assertThat(iterator.value()).isEqualTo("v1".getBytes());
    assertThat(iterator.next()).isTrue();
    assertThat(iterator.rangeValue()).isEqualTo("r2".getBytes());
    assertThat(iterator.value()).isEqualTo("v2".getBytes());
    assertThat(iterator.next()).isFalse();
    assertThat(iterator.next()).isFalse();
  }

  @Test
  public void testReadingOutsideRowsFails() {
    GrpcReadBatch batch =
        new GrpcReadBatch(
            IndexGateway.QueryIndexResponse.newBuilder().addRows(row("r1", "v1")).build());

    ReadBatchIterator iterator = batch.iterator();
    assertThatIllegalStateException().isThrownBy(iterator::rangeValue);

    iterator.next();
    iterator.next();
    assertThatIllegalStateException().isThrownBy(iterator::value);
  }

  @Test
  public void testEmptyResponse() {
    GrpcReadBatch batch = new GrpcReadBatch(IndexGateway.QueryIndexResponse.getDefaultInstance());
    assertThat(batch.iterator().next()).isFalse();
  }

  @Test
  public void testEachIteratorStartsBeforeFirstRow() {
    GrpcReadBatch batch =
        new GrpcReadBatch(
            IndexGateway.QueryIndexResponse.newBuilder().addRows(row("r1", "v1")).build());

    ReadBatchIterator first = batch.iterator();
    while (first.next()) {
      // drain
    }

    ReadBatchIterator second = batch.iterator();
    assertThat(second.next()).isTrue();
    assertThat(second.rangeValue()).isEqualTo("r1".getBytes());
  }
}
