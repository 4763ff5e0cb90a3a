package dev.minutes.session;

/** Thrown when a declaration tries to change the chunk count of an already dispatched session. */
public class SessionDeclarationConflictException extends RuntimeException {

  public SessionDeclarationConflictException(String message) {
    super(message);
  }
}
