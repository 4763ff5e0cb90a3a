package dev.minutes.completion;

import dev.minutes.session.SessionCatalog;
import dev.minutes.session.SessionDeclaration;
import dev.minutes.session.SessionRecord;
import dev.minutes.tenant.TenantGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Records a session declaration and immediately checks completeness, since every chunk may
 * already have arrived before the declaration.
 */
@Service
public class SessionDeclarationService {

  private static final Logger log = LoggerFactory.getLogger(SessionDeclarationService.class);

  private final SessionCatalog sessionCatalog;
  private final CompletionDetector completionDetector;
  private final TenantGuard tenantGuard;

  public SessionDeclarationService(
      SessionCatalog sessionCatalog,
      CompletionDetector completionDetector,
      TenantGuard tenantGuard) {
    this.sessionCatalog = sessionCatalog;
    this.completionDetector = completionDetector;
    this.tenantGuard = tenantGuard;
  }

  public DeclarationResult declare(String authenticatedTenant, SessionDeclaration declaration) {
    tenantGuard.requireTenant(authenticatedTenant, declaration.tenantId());
    SessionRecord session = sessionCatalog.declareSession(declaration);

    CompletionResult completion = null;
    try {
      completion = completionDetector.evaluate(declaration.tenantId(), declaration.sessionId());
    } catch (RuntimeException e) {
      log.warn(
          "Completion check after declaring {}/{} failed: {}",
          declaration.tenantId(),
          declaration.sessionId(),
          e.getMessage());
    }
    return new DeclarationResult(session, completion);
  }
}
