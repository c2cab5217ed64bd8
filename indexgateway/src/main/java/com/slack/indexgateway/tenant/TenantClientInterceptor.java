package com.slack.indexgateway.tenant;

import io.grpc.CallOptions;
import io.grpc.Channel;
import io.grpc.ClientCall;
import io.grpc.ClientInterceptor;
import io.grpc.Context;
import io.grpc.ForwardingClientCall;
import io.grpc.Metadata;
import io.grpc.MethodDescriptor;

/**
 * Forwards the tenant of the current context to the gateway in the {@value #ORG_ID_HEADER_NAME}
 * header. Calls made without a tenant are sent unchanged.
 */
public class TenantClientInterceptor implements ClientInterceptor {
  public static final String ORG_ID_HEADER_NAME = "X-Scope-OrgID";
  public static final Metadata.Key<String> ORG_ID_HEADER =
      Metadata.Key.of(ORG_ID_HEADER_NAME, Metadata.ASCII_STRING_MARSHALLER);

  @Override
  public <ReqT, RespT> ClientCall<ReqT, RespT> interceptCall(
      MethodDescriptor<ReqT, RespT> method, CallOptions callOptions, Channel next) {
    String tenantId = TenantContext.TENANT_ID_KEY.get(Context.current());
    return new ForwardingClientCall.SimpleForwardingClientCall<>(
        next.newCall(method, callOptions)) {
      @Override
      public void start(Listener<RespT> responseListener, Metadata headers) {
        if (tenantId != null && !tenantId.isEmpty()) {
          headers.put(ORG_ID_HEADER, tenantId);
        }
        super.start(responseListener, headers);
      }
    };
  }
}
