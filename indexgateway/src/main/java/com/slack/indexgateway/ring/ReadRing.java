package com.slack.indexgateway.ring;

import java.util.Set;

/**
 * Read access to the consistent hash ring of gateway instances. Membership and heartbeating are
 * maintained by the ring implementation.
 */
public interface ReadRing {

  /**
   * Returns the instances responsible for the given token.
   *
   * @throws RingResolutionException when not enough healthy instances are available
   */
  ReplicationSet get(int key, RingOperation op);

  /** Addresses of every instance currently registered in the ring. */
  Set<String> instanceAddresses();
}
