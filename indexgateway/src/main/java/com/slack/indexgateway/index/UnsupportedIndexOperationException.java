package com.slack.indexgateway.index;

/** Thrown by index clients for operations they deliberately do not implement. */
public class UnsupportedIndexOperationException extends UnsupportedOperationException {
  public UnsupportedIndexOperationException(String msg) {
    super(msg);
  }
}
