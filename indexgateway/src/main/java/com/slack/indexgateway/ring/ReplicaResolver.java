package com.slack.indexgateway.ring;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.List;
import org.slf4j.Logger;

/** Resolves the gateway replicas that own a tenant's index. */
public class ReplicaResolver {
  private final ReadRing ring;
  private final Logger logger;

  public ReplicaResolver(ReadRing ring, Logger logger) {
    this.ring = checkNotNull(ring, "ring");
    this.logger = checkNotNull(logger, "logger");
  }

  /**
   * Returns the addresses of the replicas for the tenant, in ring order. The list is freshly
   * allocated on every call and may be mutated by the caller.
   *
   * @throws RingResolutionException when the ring can't produce a replica set
   */
  public List<String> resolve(String tenantId) {
    int token = RingTokens.tokenFor(tenantId, "");
    ReplicationSet replicationSet;
    try {
      replicationSet = ring.get(token, RingOperation.WRITE_NO_EXTEND);
    } catch (RingResolutionException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new RingResolutionException("index gateway get ring", e);
    }
    List<String> addresses = replicationSet.getAddresses();
    logger.debug(
        "Resolved tenant={} token={} to addresses={}",
        tenantId,
        Integer.toUnsignedString(token),
        addresses);
    return addresses;
  }
}
