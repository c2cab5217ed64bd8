package com.slack.indexgateway.ring;

/** Replication strategy used when resolving a token to instances. */
public enum RingOperation {
  READ,
  WRITE,
  // Same instances as WRITE, without extending the set to replace unhealthy instances.
  WRITE_NO_EXTEND
}
