package com.slack.indexgateway.tenant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

import io.grpc.Context;
import org.junit.jupiter.api.Test;

public class TenantContextTest {

  @Test
  public void testReadsTenantFromContext() {
    Context ctx = TenantContext.withTenantId(Context.ROOT, "tenant-a");
    assertThat(TenantContext.tenantId(ctx)).isEqualTo("tenant-a");
  }

  @Test
  public void testMissingTenantFails() {
    assertThatExceptionOfType(MissingTenantException.class)
        .isThrownBy(() -> TenantContext.tenantId(Context.ROOT));
    assertThatExceptionOfType(MissingTenantException.class)
        .isThrownBy(() -> TenantContext.tenantId(TenantContext.withTenantId(Context.ROOT, "")));
  }

  @Test
  public void testTenantIsInheritedByChildContexts() {
    Context ctx = TenantContext.withTenantId(Context.ROOT, "tenant-a").withCancellation();
    assertThat(TenantContext.tenantId(ctx)).isEqualTo("tenant-a");
  }
}
