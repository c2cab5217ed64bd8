package com.slack.indexgateway.client;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;

/**
 * Caches one client per gateway address. Lookups and creation are safe to call concurrently; if
 * two threads create a client for the same address at once, the first one stored wins.
 */
public class ClientPool<C> {
  private final Map<String, C> clients = new ConcurrentHashMap<>();
  private final ClientFactory<C> factory;
  private final Logger logger;

  public ClientPool(ClientFactory<C> factory, Logger logger) {
    this.factory = checkNotNull(factory, "factory");
    this.logger = checkNotNull(logger, "logger");
  }

  /**
   * @throws IndexGatewayClientException when no client exists and one can't be created
   */
  public C getClientFor(String address) {
    C client = clients.get(address);
    if (client != null) {
      return client;
    }

    C created;
    try {
      created = factory.create(address);
    } catch (Exception e) {
      throw new IndexGatewayClientException("new index gateway grpc client for " + address, e);
    }
    checkNotNull(created, "client factory returned null for %s", address);

    C existing = clients.putIfAbsent(address, created);
    if (existing != null) {
      return existing;
    }
    logger.debug("Added index gateway client for address={} pool_size={}", address, clients.size());
    return created;
  }

  public void removeClientFor(String address) {
    if (clients.remove(address) != null) {
      logger.debug("Removed index gateway client for address={}", address);
    }
  }

  public Set<String> registeredAddresses() {
    return ImmutableSet.copyOf(clients.keySet());
  }

  public int size() {
    return clients.size();
  }

  public void clear() {
    clients.clear();
  }
}
