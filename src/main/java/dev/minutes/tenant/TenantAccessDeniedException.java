package dev.minutes.tenant;

/** Thrown when an authenticated caller names a tenant other than its own. */
public class TenantAccessDeniedException extends RuntimeException {

  public TenantAccessDeniedException(String authenticatedTenant, String requestedTenant) {
    super(
        "Tenant '"
            + authenticatedTenant
            + "' is not allowed to access resources of tenant '"
            + requestedTenant
            + "'");
  }
}
