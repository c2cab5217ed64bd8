package com.slack.indexgateway.client;

/** Two different queries of the same request map to one correlation key. */
public class DuplicateQueryKeyException extends IndexGatewayClientException {
  public DuplicateQueryKeyException(String msg) {
    super(msg);
  }
}
