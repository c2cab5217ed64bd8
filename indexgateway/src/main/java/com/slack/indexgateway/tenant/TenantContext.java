package com.slack.indexgateway.tenant;

import com.google.common.base.Strings;
import io.grpc.Context;

/** Carries the tenant a request is issued for on the gRPC {@link Context}. */
public final class TenantContext {
  public static final Context.Key<String> TENANT_ID_KEY = Context.key("indexgateway-tenant-id");

  private TenantContext() {}

  public static Context withTenantId(Context ctx, String tenantId) {
    return ctx.withValue(TENANT_ID_KEY, tenantId);
  }

  /**
   * @throws MissingTenantException when the context carries no tenant
   */
  public static String tenantId(Context ctx) {
    String tenantId = TENANT_ID_KEY.get(ctx);
    if (Strings.isNullOrEmpty(tenantId)) {
      throw new MissingTenantException("no tenant id found in request context");
    }
    return tenantId;
  }
}
