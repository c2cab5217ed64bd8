package com.slack.indexgateway.client;

import java.util.List;

/** Every gateway replica resolved for a tenant failed to serve a batch of queries. */
public class NoReplicaSucceededException extends IndexGatewayClientException {
  private final List<String> attemptedAddresses;

  public NoReplicaSucceededException(String tenantId, List<String> attemptedAddresses) {
    super(
        String.format(
            "index gateway replicationSet clientDoQueries: no replica succeeded for tenant %s, attempted %s",
            tenantId, attemptedAddresses));
    this.attemptedAddresses = List.copyOf(attemptedAddresses);
  }

  public List<String> getAttemptedAddresses() {
    return attemptedAddresses;
  }
}
