package com.slack.indexgateway.testlib;

import com.google.protobuf.ByteString;
import com.slack.indexgateway.index.IndexQuery;
import com.slack.indexgateway.index.QueryKeys;
import com.slack.indexgateway.proto.service.IndexGateway;
import com.slack.indexgateway.proto.service.IndexGatewayServiceGrpc;
import com.google.common.util.concurrent.MoreExecutors;
import io.grpc.Context;
import io.grpc.Status;
import io.grpc.stub.StreamObserver;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory gateway. Every query is answered with {@link #ROWS_PER_QUERY} rows whose range value
 * is {@code <hashValue>:<n>} and whose value is the table name, so results can be checked without
 * a backing store. A fixed response sequence can be scripted instead.
 */
public class FakeIndexGatewayService extends IndexGatewayServiceGrpc.IndexGatewayServiceImplBase {
  public static final int ROWS_PER_QUERY = 2;

  private final List<IndexGateway.QueryIndexRequest> requests = new CopyOnWriteArrayList<>();
  private final AtomicInteger cancelledCalls = new AtomicInteger();
  private final AtomicInteger inFlightCalls = new AtomicInteger();
  private final AtomicInteger peakInFlightCalls = new AtomicInteger();

  private volatile Status failWith;
  private volatile int failAfterResponses = -1;
  private volatile String unknownQueryKey;
  private volatile int unknownKeyAfterResponses = 0;
  private volatile List<IndexGateway.QueryIndexResponse> scriptedResponses;
  private volatile int holdOpenAfterResponses = -1;
  private volatile Duration responseDelay = Duration.ZERO;

  /** Fails every call with the status before sending anything. */
  public FakeIndexGatewayService failWith(Status status) {
    this.failWith = status;
    this.failAfterResponses = 0;
    return this;
  }

  /** Sends the given number of responses, then fails the stream. */
  public FakeIndexGatewayService failAfter(int responses, Status status) {
    this.failWith = status;
    this.failAfterResponses = responses;
    return this;
  }

  /** Sends a response for a key the client never asked for after the given number of responses. */
  public FakeIndexGatewayService respondWithUnknownKey(String queryKey, int afterResponses) {
    this.unknownQueryKey = queryKey;
    this.unknownKeyAfterResponses = afterResponses;
    return this;
  }

  /** Answers every call with exactly these responses, in this order, whatever was asked. */
  public FakeIndexGatewayService respondWith(List<IndexGateway.QueryIndexResponse> responses) {
    this.scriptedResponses = List.copyOf(responses);
    return this;
  }

  /**
   * Sends the given number of responses, then keeps the stream open until the client cancels the
   * call. Calls that are never cancelled complete after 10 seconds.
   */
  public FakeIndexGatewayService holdOpenAfter(int responses) {
    this.holdOpenAfterResponses = responses;
    return this;
  }

  /** Waits before answering each call, so concurrent calls overlap on the server. */
  public FakeIndexGatewayService delayResponses(Duration delay) {
    this.responseDelay = delay;
    return this;
  }

  @Override
  public void queryIndex(
      IndexGateway.QueryIndexRequest request,
      StreamObserver<IndexGateway.QueryIndexResponse> responseObserver) {
    requests.add(request);
    peakInFlightCalls.accumulateAndGet(inFlightCalls.incrementAndGet(), Math::max);
    try {
      if (!responseDelay.isZero()) {
        Thread.sleep(responseDelay.toMillis());
      }
      respond(request, responseObserver);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      responseObserver.onError(Status.ABORTED.withCause(e).asRuntimeException());
    } finally {
      inFlightCalls.decrementAndGet();
    }
  }

  private void respond(
      IndexGateway.QueryIndexRequest request,
      StreamObserver<IndexGateway.QueryIndexResponse> responseObserver)
      throws InterruptedException {
    List<IndexGateway.QueryIndexResponse> responses = new ArrayList<>();
    if (scriptedResponses != null) {
      responses.addAll(scriptedResponses);
    } else {
      for (IndexGateway.IndexQuery query : request.getQueriesList()) {
        responses.add(responseFor(query));
      }
    }
    if (unknownQueryKey != null) {
      int position = Math.min(unknownKeyAfterResponses, responses.size());
      responses.add(
          position,
          IndexGateway.QueryIndexResponse.newBuilder().setQueryKey(unknownQueryKey).build());
    }

    int sent = 0;
    for (IndexGateway.QueryIndexResponse response : responses) {
      if (failWith != null && sent == failAfterResponses) {
        responseObserver.onError(failWith.asRuntimeException());
        return;
      }
      if (sent == holdOpenAfterResponses) {
        awaitCancellation(responseObserver);
        return;
      }
      if (Context.current().isCancelled()) {
        cancelledCalls.incrementAndGet();
        return;
      }
      responseObserver.onNext(response);
      sent++;
    }
    if (sent == holdOpenAfterResponses) {
      awaitCancellation(responseObserver);
      return;
    }
    if (failWith != null && sent == failAfterResponses) {
      responseObserver.onError(failWith.asRuntimeException());
      return;
    }
    responseObserver.onCompleted();
  }

  // The call context is cancelled on the transport thread, so this doesn't wait on call events
  // that are queued behind the running handler.
  private void awaitCancellation(StreamObserver<IndexGateway.QueryIndexResponse> responseObserver)
      throws InterruptedException {
    CountDownLatch cancelled = new CountDownLatch(1);
    Context.current().addListener(context -> cancelled.countDown(), MoreExecutors.directExecutor());
    if (cancelled.await(10, TimeUnit.SECONDS)) {
      cancelledCalls.incrementAndGet();
    } else {
      responseObserver.onCompleted();
    }
  }

  public static IndexGateway.QueryIndexResponse response(
      IndexQuery query, String... rangeValues) {
    IndexGateway.QueryIndexResponse.Builder response =
        IndexGateway.QueryIndexResponse.newBuilder().setQueryKey(QueryKeys.queryKey(query));
    for (String rangeValue : rangeValues) {
      response.addRows(
          IndexGateway.Row.newBuilder()
              .setRangeValue(ByteString.copyFromUtf8(rangeValue))
              .setValue(ByteString.copyFromUtf8(query.getTableName())));
    }
    return response.build();
  }

  public static IndexGateway.QueryIndexResponse responseFor(IndexGateway.IndexQuery query) {
    IndexGateway.QueryIndexResponse.Builder response =
        IndexGateway.QueryIndexResponse.newBuilder().setQueryKey(QueryKeys.queryKey(toQuery(query)));
    for (int i = 0; i < ROWS_PER_QUERY; i++) {
      response.addRows(
          IndexGateway.Row.newBuilder()
              .setRangeValue(ByteString.copyFromUtf8(query.getHashValue() + ":" + i))
              .setValue(ByteString.copyFromUtf8(query.getTableName())));
    }
    return response.build();
  }

  public static IndexQuery toQuery(IndexGateway.IndexQuery query) {
    return IndexQuery.builder(query.getTableName(), query.getHashValue())
        .rangeValuePrefix(query.getRangeValuePrefix().toByteArray())
        .rangeValueStart(query.getRangeValueStart().toByteArray())
        .valueEqual(query.getValueEqual().toByteArray())
        .build();
  }

  public static List<IndexQuery> queries(int count) {
    List<IndexQuery> queries = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      queries.add(
          IndexQuery.builder("index_19000", "tenant-a:" + i)
              .rangeValuePrefix(("prefix-" + i).getBytes(StandardCharsets.UTF_8))
              .build());
    }
    return queries;
  }

  public List<IndexGateway.QueryIndexRequest> getRequests() {
    return requests;
  }

  public int getCallCount() {
    return requests.size();
  }

  public int getCancelledCalls() {
    return cancelledCalls.get();
  }

  public int getPeakInFlightCalls() {
    return peakInFlightCalls.get();
  }
}
