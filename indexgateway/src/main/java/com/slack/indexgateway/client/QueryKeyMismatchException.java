package com.slack.indexgateway.client;

/** The gateway returned rows for a query key that was not part of the request. */
public class QueryKeyMismatchException extends IndexGatewayClientException {
  private final String queryKey;

  public QueryKeyMismatchException(String queryKey) {
    super(String.format("unexpected %s QueryKey received", queryKey));
    this.queryKey = queryKey;
  }

  public String getQueryKey() {
    return queryKey;
  }
}
