package com.slack.indexgateway.client;

import com.linecorp.armeria.client.ClientFactoryBuilder;
import com.linecorp.armeria.client.grpc.GrpcClientBuilder;
import com.linecorp.armeria.client.grpc.GrpcClients;
import com.slack.indexgateway.proto.config.IndexGatewayConfigs;
import com.slack.indexgateway.proto.service.IndexGatewayServiceGrpc;
import com.slack.indexgateway.tenant.TenantClientInterceptor;
import java.io.Closeable;

/**
 * Builds blocking gateway stubs over Armeria. All stubs share one Armeria client factory, and so
 * one connection pool, which is released by {@link #close()}.
 */
public class ArmeriaStubFactory
    implements ClientFactory<IndexGatewayServiceGrpc.IndexGatewayServiceBlockingStub>, Closeable {

  private final IndexGatewayConfigs.GrpcClientConfig grpcClientConfig;
  private final com.linecorp.armeria.client.ClientFactory clientFactory;

  public ArmeriaStubFactory(IndexGatewayConfigs.GrpcClientConfig grpcClientConfig) {
    this.grpcClientConfig = grpcClientConfig;
    ClientFactoryBuilder clientFactoryBuilder = com.linecorp.armeria.client.ClientFactory.builder();
    if (grpcClientConfig.getConnectTimeoutMs() > 0) {
      clientFactoryBuilder.connectTimeoutMillis(grpcClientConfig.getConnectTimeoutMs());
    }
    this.clientFactory = clientFactoryBuilder.build();
  }

  @Override
  public IndexGatewayServiceGrpc.IndexGatewayServiceBlockingStub create(String address) {
    GrpcClientBuilder builder =
        GrpcClients.builder("http://" + address)
            .factory(clientFactory)
            .responseTimeoutMillis(grpcClientConfig.getResponseTimeoutMs());
    if (grpcClientConfig.getMaxRecvMsgSize() > 0) {
      builder.maxResponseMessageLength(grpcClientConfig.getMaxRecvMsgSize());
    }
    if (grpcClientConfig.getMaxSendMsgSize() > 0) {
      builder.maxRequestMessageLength(grpcClientConfig.getMaxSendMsgSize());
    }

    IndexGatewayServiceGrpc.IndexGatewayServiceBlockingStub stub =
        builder
            .build(IndexGatewayServiceGrpc.IndexGatewayServiceBlockingStub.class)
            .withInterceptors(new TenantClientInterceptor());
    if (!grpcClientConfig.getGrpcCompression().isEmpty()) {
      // Servers choose independently whether to compress responses
      stub = stub.withCompression(grpcClientConfig.getGrpcCompression());
    }
    return stub;
  }

  @Override
  public void close() {
    clientFactory.close();
  }
}
