package net.kairo.app;

import org.awaitility.Awaitility;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Full stack: REST create, scheduler tick over PostgreSQL, run timestamps written back.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@Testcontainers(disabledWithoutDocker = true)
class SchedulingFlowIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine");

    @DynamicPropertySource
    static void dbProps(DynamicPropertyRegistry r) {
        r.add("spring.datasource.url", postgres::getJdbcUrl);
        r.add("spring.datasource.username", postgres::getUsername);
        r.add("spring.datasource.password", postgres::getPassword);
        r.add("kairo.scheduler.tick-interval", () -> "200ms");
        r.add("kairo.executors.default-latency", () -> "0s");
        r.add("kairo.catalog.jobs[0].name", () -> "nightly report");
        r.add("kairo.catalog.jobs[0].schedule", () -> "0 3 * * *");
    }

    @Autowired TestRestTemplate http;
    @Autowired JdbcTemplate jdbc;

    @Test
    @SuppressWarnings("unchecked")
    void createdJobRunsAndGetsNextOccurrence() {
        ResponseEntity<Map> created = http.postForEntity("/jobs",
                Map.of("name", "welcome email", "schedule", "* * * * *"), Map.class);
        assertThat(created.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        long id = ((Number) created.getBody().get("id")).longValue();
        assertThat(created.getBody().get("lastRun")).isNull();

        Awaitility.await().atMost(Duration.ofSeconds(30)).untilAsserted(() -> {
            Map<String, Object> job = http.getForObject("/jobs/" + id, Map.class);
            assertThat(job.get("lastRun")).isNotNull();
        });

        Map<String, Object> job = http.getForObject("/jobs/" + id, Map.class);
        Instant lastRun = Instant.parse((String) job.get("lastRun"));
        Instant nextRun = Instant.parse((String) job.get("nextRun"));
        assertThat(nextRun).isEqualTo(lastRun.truncatedTo(ChronoUnit.MINUTES).plus(1, ChronoUnit.MINUTES));

        Integer leased = jdbc.queryForObject(
                "SELECT COUNT(*) FROM TB_JOB WHERE ID = ? AND LEASE_OWNER IS NOT NULL", Integer.class, id);
        assertThat(leased).isZero();
    }

    @Test
    void catalogJobIsRegisteredAtStartup() {
        Integer rows = jdbc.queryForObject("SELECT COUNT(*) FROM TB_JOB WHERE NAME = 'nightly report'", Integer.class);
        assertThat(rows).isEqualTo(1);
    }

    @Test
    void apiDocsDescribeTheJobsEndpoints() {
        ResponseEntity<String> docs = http.getForEntity("/api-docs", String.class);
        assertThat(docs.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(docs.getBody()).contains("\"/jobs\"").contains("\"/jobs/{id}\"").contains("Kairo Scheduler");
    }

    @Test
    void missingJobIs404() {
        ResponseEntity<Map> res = http.getForEntity("/jobs/424242", Map.class);
        assertThat(res.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(res.getBody()).containsEntry("status", 404);
    }
}
