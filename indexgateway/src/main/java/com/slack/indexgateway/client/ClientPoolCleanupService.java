package com.slack.indexgateway.client;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.AbstractScheduledService;
import com.slack.indexgateway.ring.ReadRing;
import java.time.Duration;
import java.util.Set;
import org.slf4j.Logger;

/** Periodically drops pooled clients of gateway instances that are no longer in the ring. */
public class ClientPoolCleanupService extends AbstractScheduledService {
  private final ClientPool<?> clientPool;
  private final ReadRing ring;
  private final Duration cleanupPeriod;
  private final Logger logger;

  public ClientPoolCleanupService(
      ClientPool<?> clientPool, ReadRing ring, Duration cleanupPeriod, Logger logger) {
    checkArgument(!cleanupPeriod.isNegative() && !cleanupPeriod.isZero(), "period must be > 0");
    this.clientPool = clientPool;
    this.ring = ring;
    this.cleanupPeriod = cleanupPeriod;
    this.logger = logger;
  }

  @Override
  protected Scheduler scheduler() {
    return Scheduler.newFixedDelaySchedule(cleanupPeriod, cleanupPeriod);
  }

  @Override
  protected void runOneIteration() {
    try {
      removeStaleClients();
    } catch (Exception e) {
      logger.error("Error removing stale index gateway clients", e);
    }
  }

  @VisibleForTesting
  int removeStaleClients() {
    Set<String> ringAddresses = ring.instanceAddresses();
    int removed = 0;
    for (String address : clientPool.registeredAddresses()) {
      if (!ringAddresses.contains(address)) {
        clientPool.removeClientFor(address);
        removed++;
      }
    }
    if (removed > 0) {
      logger.info(
          "Removed {} stale index gateway clients, pool_size={}", removed, clientPool.size());
    }
    return removed;
  }

  @Override
  protected String serviceName() {
    return "index-gateway-client-pool-cleanup";
  }
}
