package com.civicdesk.backend.support;

import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * Shared PostgreSQL container for DB-backed integration tests. Flyway applies the schema and the
 * seeded role ladder once per JVM; the container is started lazily so tests are skipped without Docker.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
public abstract class AbstractPostgresIntegrationTest {

    private static final Object START_LOCK = new Object();
    private static PostgreSQLContainer<?> postgres;

    @DynamicPropertySource
    static void configureDatasource(DynamicPropertyRegistry registry) {
        PostgreSQLContainer<?> container = container();
        registry.add("spring.datasource.url", container::getJdbcUrl);
        registry.add("spring.datasource.username", container::getUsername);
        registry.add("spring.datasource.password", container::getPassword);
    }

    private static PostgreSQLContainer<?> container() {
        synchronized (START_LOCK) {
            if (postgres == null) {
                postgres = new PostgreSQLContainer<>("postgres:16.4")
                        .withDatabaseName("civicdesk_test")
                        .withUsername("civicdesk")
                        .withPassword("civicdesk");
                postgres.start();
            }
            return postgres;
        }
    }
}
