package dev.minutes.session;

import dev.minutes.tenant.TenantGuard;
import org.springframework.stereotype.Service;

/** Tenant-checked read access to the session catalog. */
@Service
public class SessionQueryService {

  private final SessionCatalog sessionCatalog;
  private final TenantGuard tenantGuard;

  public SessionQueryService(SessionCatalog sessionCatalog, TenantGuard tenantGuard) {
    this.sessionCatalog = sessionCatalog;
    this.tenantGuard = tenantGuard;
  }

  /**
   * Returns a session of {@code tenantId} on behalf of {@code authenticatedTenant}.
   *
   * @throws dev.minutes.tenant.TenantAccessDeniedException if the tenants differ; raised before
   *     the catalog is read
   * @throws SessionNotFoundException if the session does not exist
   */
  public SessionRecord getSession(String authenticatedTenant, String tenantId, String sessionId) {
    tenantGuard.requireTenant(authenticatedTenant, tenantId);
    return sessionCatalog
        .findSession(tenantId, sessionId)
        .orElseThrow(() -> new SessionNotFoundException(tenantId, sessionId));
  }
}
