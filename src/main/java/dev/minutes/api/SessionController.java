package dev.minutes.api;

import dev.minutes.completion.DeclarationResult;
import dev.minutes.completion.SessionDeclarationService;
import dev.minutes.session.SessionDeclaration;
import dev.minutes.session.SessionQueryService;
import dev.minutes.session.SessionRecord;
import dev.minutes.tenant.TenantGuard;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Session declaration and status endpoints, scoped to the authenticated tenant. */
@RestController
@RequestMapping("/api")
public class SessionController {

  private final SessionDeclarationService declarationService;
  private final SessionQueryService queryService;

  public SessionController(
      SessionDeclarationService declarationService, SessionQueryService queryService) {
    this.declarationService = declarationService;
    this.queryService = queryService;
  }

  @PostMapping("/sessions")
  public DeclarationResult declare(
      @RequestHeader(name = TenantGuard.AUTHENTICATED_TENANT_HEADER, required = false)
          String authenticatedTenant,
      @Valid @RequestBody SessionDeclaration declaration) {
    return declarationService.declare(authenticatedTenant, declaration);
  }

  @GetMapping("/tenants/{tenantId}/sessions/{sessionId}")
  public SessionRecord get(
      @RequestHeader(name = TenantGuard.AUTHENTICATED_TENANT_HEADER, required = false)
          String authenticatedTenant,
      @PathVariable String tenantId,
      @PathVariable String sessionId) {
    return queryService.getSession(authenticatedTenant, tenantId, sessionId);
  }
}
