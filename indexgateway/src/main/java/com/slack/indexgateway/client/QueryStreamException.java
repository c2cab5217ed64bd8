package com.slack.indexgateway.client;

/** The QueryIndex call to a gateway instance failed to start or broke while streaming. */
public class QueryStreamException extends IndexGatewayClientException {
  public QueryStreamException(String msg, Throwable t) {
    super(msg, t);
  }
}
