package com.slack.indexgateway.client;

import static com.google.common.base.Preconditions.checkNotNull;

import com.slack.indexgateway.index.IndexQuery;
import com.slack.indexgateway.index.QueryPagesCallback;
import com.slack.indexgateway.proto.service.IndexGateway;
import com.slack.indexgateway.proto.service.IndexGatewayServiceGrpc;
import io.grpc.Context;
import io.grpc.StatusRuntimeException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.Iterator;
import java.util.Map;
import org.slf4j.Logger;

/**
 * Issues a QueryIndex call and hands every streamed response to the caller's callback, matched to
 * the query it answers by its query key.
 *
 * <p>The call runs in a cancellable child of the current context which is cancelled whenever
 * consumption ends, so a callback asking to stop also stops the server stream.
 */
public class QueryStreamConsumer {
  public static final String REQUEST_DURATION = "index_gateway_client_request_duration_seconds";
  private static final String OPERATION = "QueryIndex";

  private final MeterRegistry meterRegistry;
  private final Logger logger;

  public QueryStreamConsumer(MeterRegistry meterRegistry, Logger logger) {
    this.meterRegistry = checkNotNull(meterRegistry, "meterRegistry");
    this.logger = checkNotNull(logger, "logger");
  }

  /**
   * @throws QueryStreamException when the call can't be started or the stream breaks
   * @throws QueryKeyMismatchException when the gateway answers a query that was not sent
   */
  public void consume(
      String address,
      IndexGatewayServiceGrpc.IndexGatewayServiceBlockingStub stub,
      IndexGateway.QueryIndexRequest request,
      Map<String, IndexQuery> queryKeyQueryMap,
      QueryPagesCallback callback) {
    Timer.Sample sample = Timer.start(meterRegistry);
    String statusCode = "error";

    Context.CancellableContext callContext = Context.current().withCancellation();
    Context previous = callContext.attach();
    try {
      Iterator<IndexGateway.QueryIndexResponse> responses;
      try {
        responses = stub.queryIndex(request);
      } catch (StatusRuntimeException e) {
        statusCode = e.getStatus().getCode().name();
        throw new QueryStreamException("query index on " + address, e);
      }

      while (true) {
        IndexGateway.QueryIndexResponse response;
        try {
          if (!responses.hasNext()) {
            break;
          }
          response = responses.next();
        } catch (StatusRuntimeException e) {
          statusCode = e.getStatus().getCode().name();
          throw new QueryStreamException("receive query index response from " + address, e);
        }

        IndexQuery query = queryKeyQueryMap.get(response.getQueryKey());
        if (query == null) {
          logger.error(
              "unexpected {} QueryKey received from {}, expected queries {}",
              response.getQueryKey(),
              address,
              queryKeyQueryMap);
          throw new QueryKeyMismatchException(response.getQueryKey());
        }
        if (!callback.onBatch(query, new GrpcReadBatch(response))) {
          break;
        }
      }
      statusCode = "success";
    } finally {
      callContext.detach(previous);
      callContext.cancel(null);
      sample.stop(
          meterRegistry.timer(REQUEST_DURATION, "operation", OPERATION, "status_code", statusCode));
    }
  }
}
