package com.slack.indexgateway.client;

public class IndexGatewayClientException extends RuntimeException {
  public IndexGatewayClientException(String msg) {
    super(msg);
  }

  public IndexGatewayClientException(String msg, Throwable t) {
    super(msg, t);
  }
}
