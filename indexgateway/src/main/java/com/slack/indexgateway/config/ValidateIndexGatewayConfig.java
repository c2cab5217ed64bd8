package com.slack.indexgateway.config;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.net.HostAndPort;
import com.slack.indexgateway.proto.config.IndexGatewayConfigs;

public class ValidateIndexGatewayConfig {

  /**
   * Checks that the config values are consistent with the selected mode. Dependencies that are not
   * part of the config, like the ring in RING mode, are checked when the client is built.
   */
  public static void validateConfig(IndexGatewayConfigs.IndexGatewayClientConfig config) {
    checkArgument(
        config.getMode() != IndexGatewayConfigs.IndexGatewayMode.UNRECOGNIZED,
        "Unknown index gateway mode");
    if (config.getMode() == IndexGatewayConfigs.IndexGatewayMode.SIMPLE) {
      validateServerAddress(config.getServerAddress());
    }
    validateGrpcClientConfig(config.getGrpcClientConfig());
    checkArgument(
        config.getPoolConfig().getClientCleanupPeriodMs() >= 0,
        "PoolConfig clientCleanupPeriodMs cannot be negative");
  }

  private static void validateServerAddress(String serverAddress) {
    checkArgument(
        !serverAddress.isBlank(), "serverAddress is required when running in SIMPLE mode");
    HostAndPort hostAndPort;
    try {
      hostAndPort = HostAndPort.fromString(serverAddress);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid serverAddress " + serverAddress, e);
    }
    checkArgument(hostAndPort.hasPort(), "serverAddress must be host:port, got %s", serverAddress);
  }

  private static void validateGrpcClientConfig(
      IndexGatewayConfigs.GrpcClientConfig grpcClientConfig) {
    checkArgument(
        grpcClientConfig.getMaxRecvMsgSize() >= 0,
        "GrpcClientConfig maxRecvMsgSize cannot be negative");
    checkArgument(
        grpcClientConfig.getMaxSendMsgSize() >= 0,
        "GrpcClientConfig maxSendMsgSize cannot be negative");
    checkArgument(
        grpcClientConfig.getResponseTimeoutMs() >= 0,
        "GrpcClientConfig responseTimeoutMs cannot be negative");
    checkArgument(
        grpcClientConfig.getConnectTimeoutMs() >= 0,
        "GrpcClientConfig connectTimeoutMs cannot be negative");
    String compression = grpcClientConfig.getGrpcCompression();
    checkArgument(
        compression.isEmpty() || compression.equals("gzip"),
        "GrpcClientConfig grpcCompression must be empty or gzip, got %s",
        compression);
  }
}
