package dev.minutes.tenant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Enforces tenant isolation at the service boundary.
 *
 * <p>The gateway in front of this service exchanges the caller's federated identity for
 * tenant-scoped credentials and forwards the resulting tenant id. Every request that names a tenant
 * is checked against that id before any registry or catalog read.
 */
@Component
public class TenantGuard {

  /** Header carrying the tenant resolved by the credential-exchange gateway. */
  public static final String AUTHENTICATED_TENANT_HEADER = "X-Authenticated-Tenant";

  private static final Logger log = LoggerFactory.getLogger(TenantGuard.class);

  /**
   * Verifies that the authenticated tenant may access {@code requestedTenant}.
   *
   * @param authenticatedTenant tenant id attached by the gateway
   * @param requestedTenant tenant id named by the request
   * @throws TenantAccessDeniedException if the header is missing or the ids differ
   */
  public void requireTenant(String authenticatedTenant, String requestedTenant) {
    if (authenticatedTenant == null || authenticatedTenant.isBlank()) {
      log.warn("Rejected request for tenant {} without an authenticated tenant", requestedTenant);
      throw new TenantAccessDeniedException("<anonymous>", requestedTenant);
    }
    if (!authenticatedTenant.equals(requestedTenant)) {
      log.warn("Rejected cross-tenant request: {} -> {}", authenticatedTenant, requestedTenant);
      throw new TenantAccessDeniedException(authenticatedTenant, requestedTenant);
    }
  }
}
