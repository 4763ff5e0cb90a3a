package dev.minutes;

import dev.minutes.storage.ObjectStore;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.testcontainers.service.connection.ServiceConnection;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.utility.DockerImageName;

/**
 * Shared base class for all integration tests.
 *
 * <p>Provides a Testcontainers-managed PostgreSQL instance and empties the ingestion tables before
 * each test. Object storage is mocked; subclasses stub {@link ObjectStore#head} for the chunks
 * they upload.
 */
@SpringBootTest
@ActiveProfiles("it")
public abstract class BaseIntegrationTest {

  @ServiceConnection
  static PostgreSQLContainer<?> postgres =
      new PostgreSQLContainer<>(DockerImageName.parse("postgres:16"));

  static {
    postgres.start();
  }

  @MockBean protected ObjectStore objectStore;

  @Autowired protected JdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanTables() {
    jdbcTemplate.execute("TRUNCATE segments, recording_sessions, pipeline_executions");
  }
}
