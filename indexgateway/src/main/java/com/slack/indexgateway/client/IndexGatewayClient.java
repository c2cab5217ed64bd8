package com.slack.indexgateway.client;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.protobuf.ByteString;
import com.slack.indexgateway.config.ValidateIndexGatewayConfig;
import com.slack.indexgateway.index.IndexClient;
import com.slack.indexgateway.index.IndexQuery;
import com.slack.indexgateway.index.QueryKeys;
import com.slack.indexgateway.index.QueryPagesCallback;
import com.slack.indexgateway.index.UnsupportedIndexOperationException;
import com.slack.indexgateway.index.WriteBatch;
import com.slack.indexgateway.proto.config.IndexGatewayConfigs;
import com.slack.indexgateway.proto.service.IndexGateway;
import com.slack.indexgateway.proto.service.IndexGatewayServiceGrpc;
import com.slack.indexgateway.ring.ReadRing;
import com.slack.indexgateway.ring.ReplicaResolver;
import com.slack.indexgateway.tenant.TenantContext;
import com.slack.indexgateway.util.ConcurrencyUtil;
import io.grpc.Context;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.Closeable;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Read-only index client that queries the index gateway.
 *
 * <p>In SIMPLE mode every request goes to the one configured gateway address. In RING mode the
 * gateway replicas owning the request's tenant are looked up in the ring and tried one at a time,
 * in random order, until one of them serves the whole batch.
 *
 * <p>Large query lists are split into batches of {@link #MAX_QUERIES_PER_CALL} queries, each sent
 * in its own QueryIndex call, with at most {@link #MAX_CONCURRENT_CALLS} calls in flight for a
 * single {@link #queryPages} invocation.
 */
public class IndexGatewayClient implements IndexClient, Closeable {
  public static final int MAX_QUERIES_PER_CALL = 100;
  public static final int MAX_CONCURRENT_CALLS = 10;

  public static final String REPLICA_FAILURES = "index_gateway_client_replica_failures";

  private static final Duration STOP_TIMEOUT = Duration.ofSeconds(15);

  private final IndexGatewayConfigs.IndexGatewayMode mode;
  private final Logger logger;
  private final QueryStreamConsumer streamConsumer;
  private final ListeningExecutorService queryExecutor;
  private final List<Closeable> ownedResources;

  // SIMPLE mode
  private final String serverAddress;
  private final IndexGatewayServiceGrpc.IndexGatewayServiceBlockingStub serverStub;

  // RING mode
  private final ReplicaResolver replicaResolver;
  private final ClientPool<IndexGatewayServiceGrpc.IndexGatewayServiceBlockingStub> clientPool;
  private final ClientPoolCleanupService clientPoolCleanupService;
  private final Consumer<List<String>> addressShuffler;
  private final Counter replicaFailures;

  private IndexGatewayClient(Builder builder) {
    this.mode = builder.config.getMode();
    this.logger = builder.logger;
    this.streamConsumer = new QueryStreamConsumer(builder.meterRegistry, logger);
    this.ownedResources = new ArrayList<>(builder.ownedResources);
    this.replicaFailures = builder.meterRegistry.counter(REPLICA_FAILURES);

    if (mode == IndexGatewayConfigs.IndexGatewayMode.RING) {
      this.serverAddress = null;
      this.serverStub = null;
      this.replicaResolver = new ReplicaResolver(builder.ring, logger);
      this.clientPool = new ClientPool<>(builder.stubFactory, logger);
      this.addressShuffler = builder.addressShuffler;
      long cleanupPeriodMs = builder.config.getPoolConfig().getClientCleanupPeriodMs();
      this.clientPoolCleanupService =
          cleanupPeriodMs > 0
              ? new ClientPoolCleanupService(
                  clientPool, builder.ring, Duration.ofMillis(cleanupPeriodMs), logger)
              : null;
    } else {
      this.serverAddress = builder.config.getServerAddress();
      try {
        this.serverStub = builder.stubFactory.create(serverAddress);
      } catch (Exception e) {
        throw new IndexGatewayClientException("index gateway grpc dial " + serverAddress, e);
      }
      this.replicaResolver = null;
      this.clientPool = null;
      this.addressShuffler = null;
      this.clientPoolCleanupService = null;
    }

    this.queryExecutor =
        MoreExecutors.listeningDecorator(
            Executors.newCachedThreadPool(
                new ThreadFactoryBuilder()
                    .setNameFormat("index-gateway-query-%d")
                    .setDaemon(true)
                    .build()));

    if (clientPoolCleanupService != null) {
      clientPoolCleanupService.startAsync().awaitRunning();
    }
    logger.info(
        "Started index gateway client in mode={} serverAddress={}", mode, serverAddress);
  }

  public static Builder builder(
      IndexGatewayConfigs.IndexGatewayClientConfig config, MeterRegistry meterRegistry) {
    return new Builder(config, meterRegistry);
  }

  @Override
  public void queryPages(Context ctx, List<IndexQuery> queries, QueryPagesCallback callback) {
    checkNotNull(ctx, "ctx");
    checkNotNull(queries, "queries");
    checkNotNull(callback, "callback");
    if (queries.isEmpty()) {
      return;
    }

    if (queries.size() <= MAX_QUERIES_PER_CALL) {
      Context previous = ctx.attach();
      try {
        doQueries(queries, callback);
      } finally {
        ctx.detach(previous);
      }
      return;
    }

    int jobsCount = queries.size() / MAX_QUERIES_PER_CALL;
    if (queries.size() % MAX_QUERIES_PER_CALL != 0) {
      jobsCount++;
    }
    ConcurrencyUtil.forEachJob(
        queryExecutor,
        ctx,
        jobsCount,
        MAX_CONCURRENT_CALLS,
        idx ->
            doQueries(
                queries.subList(
                    idx * MAX_QUERIES_PER_CALL,
                    Math.min((idx + 1) * MAX_QUERIES_PER_CALL, queries.size())),
                callback));
  }

  private void doQueries(List<IndexQuery> queries, QueryPagesCallback callback) {
    Map<String, IndexQuery> queryKeyQueryMap = buildQueryKeyMap(queries);
    IndexGateway.QueryIndexRequest.Builder request = IndexGateway.QueryIndexRequest.newBuilder();
    for (IndexQuery query : queries) {
      request.addQueries(toGatewayQuery(query));
    }

    if (mode == IndexGatewayConfigs.IndexGatewayMode.RING) {
      ringModeDoQueries(request.build(), queryKeyQueryMap, callback);
    } else {
      streamConsumer.consume(
          serverAddress, serverStub, request.build(), queryKeyQueryMap, callback);
    }
  }

  /**
   * Maps every query to its correlation key. Repeated identical queries share an entry; two
   * different queries with the same key can't be told apart in the responses and are rejected.
   */
  @VisibleForTesting
  static Map<String, IndexQuery> buildQueryKeyMap(List<IndexQuery> queries) {
    Map<String, IndexQuery> queryKeyQueryMap = new HashMap<>(queries.size());
    for (IndexQuery query : queries) {
      String queryKey = QueryKeys.queryKey(query);
      IndexQuery existing = queryKeyQueryMap.putIfAbsent(queryKey, query);
      if (existing != null && !existing.equals(query)) {
        throw new DuplicateQueryKeyException(
            String.format("queries %s and %s share query key %s", existing, query, queryKey));
      }
    }
    return Collections.unmodifiableMap(queryKeyQueryMap);
  }

  private static IndexGateway.IndexQuery toGatewayQuery(IndexQuery query) {
    return IndexGateway.IndexQuery.newBuilder()
        .setTableName(query.getTableName())
        .setHashValue(query.getHashValue())
        .setRangeValuePrefix(ByteString.copyFrom(query.getRangeValuePrefix()))
        .setRangeValueStart(ByteString.copyFrom(query.getRangeValueStart()))
        .setValueEqual(ByteString.copyFrom(query.getValueEqual()))
        .build();
  }

  /**
   * Sends the request to the replicas owning the tenant of the current context:
   *
   * <ol>
   *   <li>Extract the tenant from the context.
   *   <li>Fetch the gateway replicas assigned to the tenant from the ring.
   *   <li>Try the replicas one after the other in random order, getting their client from the pool,
   *       until one of them streams back the whole response.
   * </ol>
   */
  private void ringModeDoQueries(
      IndexGateway.QueryIndexRequest request,
      Map<String, IndexQuery> queryKeyQueryMap,
      QueryPagesCallback callback) {
    String tenantId = TenantContext.tenantId(Context.current());
    List<String> addresses = replicaResolver.resolve(tenantId);
    // so the same tenant doesn't always hit its replicas in the same order
    addressShuffler.accept(addresses);

    for (String address : addresses) {
      IndexGatewayServiceGrpc.IndexGatewayServiceBlockingStub client;
      try {
        client = clientPool.getClientFor(address);
      } catch (IndexGatewayClientException e) {
        logger.error("failed to get client for instance {}", address, e);
        replicaFailures.increment();
        continue;
      }

      try {
        streamConsumer.consume(address, client, request, queryKeyQueryMap, callback);
      } catch (QueryStreamException e) {
        if (Context.current().isCancelled()) {
          throw e;
        }
        logger.error("client do queries failed for instance {}", address, e);
        replicaFailures.increment();
        continue;
      }
      return;
    }

    throw new NoReplicaSucceededException(tenantId, addresses);
  }

  @Override
  public WriteBatch newWriteBatch() {
    throw new UnsupportedIndexOperationException("index gateway client does not support writes");
  }

  @Override
  public void batchWrite(Context ctx, WriteBatch batch) {
    throw new UnsupportedIndexOperationException("index gateway client does not support writes");
  }

  @VisibleForTesting
  ClientPool<IndexGatewayServiceGrpc.IndexGatewayServiceBlockingStub> getClientPool() {
    return clientPool;
  }

  @Override
  public void close() throws IOException {
    logger.info("Closing index gateway client");
    if (clientPoolCleanupService != null) {
      try {
        clientPoolCleanupService.stopAsync().awaitTerminated(STOP_TIMEOUT);
      } catch (TimeoutException e) {
        logger.warn("Timed out stopping the index gateway client pool cleanup", e);
      }
    }
    if (clientPool != null) {
      clientPool.clear();
    }

    queryExecutor.shutdown();
    try {
      if (!queryExecutor.awaitTermination(STOP_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
        queryExecutor.shutdownNow();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      queryExecutor.shutdownNow();
    }

    for (Closeable resource : ownedResources) {
      resource.close();
    }
  }

  public static class Builder {
    private final IndexGatewayConfigs.IndexGatewayClientConfig config;
    private final MeterRegistry meterRegistry;
    private final List<Closeable> ownedResources = new ArrayList<>();
    private Logger logger = LoggerFactory.getLogger(IndexGatewayClient.class);
    private ReadRing ring;
    private ClientFactory<IndexGatewayServiceGrpc.IndexGatewayServiceBlockingStub> stubFactory;
    private Consumer<List<String>> addressShuffler =
        addresses -> Collections.shuffle(addresses, ThreadLocalRandom.current());

    private Builder(
        IndexGatewayConfigs.IndexGatewayClientConfig config, MeterRegistry meterRegistry) {
      this.config = checkNotNull(config, "config");
      this.meterRegistry = checkNotNull(meterRegistry, "meterRegistry");
    }

    /** Ring of gateway instances, required in RING mode. */
    public Builder withRing(ReadRing ring) {
      this.ring = ring;
      return this;
    }

    public Builder withLogger(Logger logger) {
      this.logger = checkNotNull(logger, "logger");
      return this;
    }

    /** Replaces the Armeria stub factory. The client does not close a supplied factory. */
    public Builder withStubFactory(
        ClientFactory<IndexGatewayServiceGrpc.IndexGatewayServiceBlockingStub> stubFactory) {
      this.stubFactory = checkNotNull(stubFactory, "stubFactory");
      return this;
    }

    @VisibleForTesting
    Builder withAddressShuffler(Consumer<List<String>> addressShuffler) {
      this.addressShuffler = checkNotNull(addressShuffler, "addressShuffler");
      return this;
    }

    public IndexGatewayClient build() {
      ValidateIndexGatewayConfig.validateConfig(config);
      if (config.getMode() == IndexGatewayConfigs.IndexGatewayMode.RING) {
        checkArgument(ring != null, "A ring is required when the client runs in RING mode");
      }
      if (stubFactory == null) {
        ArmeriaStubFactory armeriaStubFactory =
            new ArmeriaStubFactory(config.getGrpcClientConfig());
        ownedResources.add(armeriaStubFactory);
        stubFactory = armeriaStubFactory;
      }
      return new IndexGatewayClient(this);
    }
  }
}
