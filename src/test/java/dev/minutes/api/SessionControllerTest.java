package dev.minutes.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import dev.minutes.completion.DeclarationResult;
import dev.minutes.completion.SessionDeclarationService;
import dev.minutes.config.GlobalExceptionHandler;
import dev.minutes.session.SessionDeclarationConflictException;
import dev.minutes.session.SessionNotFoundException;
import dev.minutes.session.SessionQueryService;
import dev.minutes.session.SessionRecord;
import dev.minutes.session.SessionStatus;
import dev.minutes.tenant.TenantAccessDeniedException;
import dev.minutes.tenant.TenantGuard;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class SessionControllerTest {

  private static final Instant CREATED = Instant.parse("2026-03-01T09:00:00Z");

  @Mock private SessionDeclarationService declarationService;

  @Mock private SessionQueryService queryService;

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(new SessionController(declarationService, queryService))
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
  }

  private static SessionRecord record(SessionStatus status) {
    return new SessionRecord(
        "u1", "r1", 3, 1800, status, null, null, null, null, null, null, null, null, null,
        CREATED, CREATED);
  }

  @Test
  void declareReturnsSessionAndCompletion() throws Exception {
    when(declarationService.declare(eq("u1"), any()))
        .thenReturn(new DeclarationResult(record(SessionStatus.PENDING), null));

    mockMvc
        .perform(
            post("/api/sessions")
                .header(TenantGuard.AUTHENTICATED_TENANT_HEADER, "u1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    "{\"tenantId\": \"u1\", \"sessionId\": \"r1\", \"expectedSegmentCount\": 3}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.session.expectedSegmentCount").value(3))
        .andExpect(jsonPath("$.session.status").value("PENDING"));
  }

  @Test
  void declareRejectsNonPositiveCount() throws Exception {
    mockMvc
        .perform(
            post("/api/sessions")
                .header(TenantGuard.AUTHENTICATED_TENANT_HEADER, "u1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    "{\"tenantId\": \"u1\", \"sessionId\": \"r1\", \"expectedSegmentCount\": 0}"))
        .andExpect(status().isBadRequest());

    verifyNoInteractions(declarationService);
  }

  @Test
  void declareRejectsCountBeyondChunkKeyRange() throws Exception {
    mockMvc
        .perform(
            post("/api/sessions")
                .header(TenantGuard.AUTHENTICATED_TENANT_HEADER, "u1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    "{\"tenantId\": \"u1\", \"sessionId\": \"r1\","
                        + " \"expectedSegmentCount\": 1001}"))
        .andExpect(status().isBadRequest());

    verifyNoInteractions(declarationService);
  }

  @Test
  void conflictingDeclarationReturns409() throws Exception {
    when(declarationService.declare(eq("u1"), any()))
        .thenThrow(new SessionDeclarationConflictException("Session u1/r1 is already READY"));

    mockMvc
        .perform(
            post("/api/sessions")
                .header(TenantGuard.AUTHENTICATED_TENANT_HEADER, "u1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    "{\"tenantId\": \"u1\", \"sessionId\": \"r1\", \"expectedSegmentCount\": 5}"))
        .andExpect(status().isConflict());
  }

  @Test
  void getReturnsSession() throws Exception {
    when(queryService.getSession("u1", "u1", "r1")).thenReturn(record(SessionStatus.TRANSCODING));

    mockMvc
        .perform(
            get("/api/tenants/u1/sessions/r1")
                .header(TenantGuard.AUTHENTICATED_TENANT_HEADER, "u1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("TRANSCODING"));
  }

  @Test
  void crossTenantGetReturns403() throws Exception {
    when(queryService.getSession("u2", "u1", "r1"))
        .thenThrow(new TenantAccessDeniedException("u2", "u1"));

    mockMvc
        .perform(
            get("/api/tenants/u1/sessions/r1")
                .header(TenantGuard.AUTHENTICATED_TENANT_HEADER, "u2"))
        .andExpect(status().isForbidden());
  }

  @Test
  void unknownSessionReturns404() throws Exception {
    when(queryService.getSession("u1", "u1", "nope"))
        .thenThrow(new SessionNotFoundException("u1", "nope"));

    mockMvc
        .perform(
            get("/api/tenants/u1/sessions/nope")
                .header(TenantGuard.AUTHENTICATED_TENANT_HEADER, "u1"))
        .andExpect(status().isNotFound());
  }
}
