package com.slack.indexgateway.ring;

public class RingResolutionException extends RuntimeException {
  public RingResolutionException(String msg) {
    super(msg);
  }

  public RingResolutionException(String msg, Throwable t) {
    super(msg, t);
  }
}
