package dev.minutes.session;

/** Thrown when a session lookup finds no row for the tenant and session id. */
public class SessionNotFoundException extends RuntimeException {

  public SessionNotFoundException(String tenantId, String sessionId) {
    super("Session not found: " + tenantId + "/" + sessionId);
  }
}
