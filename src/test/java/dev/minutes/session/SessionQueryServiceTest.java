package dev.minutes.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import dev.minutes.tenant.TenantAccessDeniedException;
import dev.minutes.tenant.TenantGuard;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SessionQueryServiceTest {

  @Mock private SessionCatalog sessionCatalog;

  private SessionQueryService service;

  @BeforeEach
  void setUp() {
    service = new SessionQueryService(sessionCatalog, new TenantGuard());
  }

  @Test
  void crossTenantReadIsDeniedBeforeCatalogAccess() {
    assertThatThrownBy(() -> service.getSession("u2", "u1", "r1"))
        .isInstanceOf(TenantAccessDeniedException.class);

    verifyNoInteractions(sessionCatalog);
  }

  @Test
  void unknownSessionIsNotFound() {
    when(sessionCatalog.findSession("u1", "missing")).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.getSession("u1", "u1", "missing"))
        .isInstanceOf(SessionNotFoundException.class);
  }

  @Test
  void ownSessionIsReturned() {
    SessionRecord record = SessionRecord.from(new RecordingSession("u1", "r1"));
    when(sessionCatalog.findSession("u1", "r1")).thenReturn(Optional.of(record));

    assertThat(service.getSession("u1", "u1", "r1")).isSameAs(record);
  }
}
