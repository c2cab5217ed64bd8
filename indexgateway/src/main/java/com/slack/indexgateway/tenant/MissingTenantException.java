package com.slack.indexgateway.tenant;

public class MissingTenantException extends RuntimeException {
  public MissingTenantException(String msg) {
    super(msg);
  }
}
