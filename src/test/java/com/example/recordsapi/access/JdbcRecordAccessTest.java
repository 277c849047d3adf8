package com.example.recordsapi.access;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.recordsapi.models.Record;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.core.io.ClassPathResource;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

/**
 * Runs the JDBC adapter against a real PostgreSQL started through Testcontainers, using the
 * same schema.sql the application runs at startup.
 */
@Testcontainers(disabledWithoutDocker = true)
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class JdbcRecordAccessTest {

    private static final DockerImageName POSTGRES_IMAGE = DockerImageName.parse("postgres:16-alpine");
    private static final Instant CREATED = Instant.parse("2024-10-02T08:00:00.123456Z");
    private static final Instant UPDATED = Instant.parse("2024-10-02T09:30:00.654321Z");

    @Container
    private static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>(POSTGRES_IMAGE);

    private NamedParameterJdbcTemplate jdbcTemplate;
    private RecordAccess recordAccess;

    @BeforeAll
    void init() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource(
                POSTGRES.getJdbcUrl(), POSTGRES.getUsername(), POSTGRES.getPassword());
        new ResourceDatabasePopulator(new ClassPathResource("schema.sql")).execute(dataSource);

        jdbcTemplate = new NamedParameterJdbcTemplate(dataSource);
        recordAccess = new JdbcRecordAccess(jdbcTemplate);
    }

    @BeforeEach
    void cleanup() {
        jdbcTemplate.update("DELETE FROM records", new MapSqlParameterSource());
    }

    @Test
    @DisplayName("insert returns the generated id and preserves microsecond timestamps")
    void insertAndFindById() {
        Record inserted = recordAccess.insert(record("A", "B", null));

        assertNotNull(inserted.getId());
        Optional<Record> found = recordAccess.findById(inserted.getId());
        assertTrue(found.isPresent());
        assertEquals("A", found.get().getName());
        assertEquals("B", found.get().getMessage());
        assertNull(found.get().getNote());
        assertEquals(CREATED, found.get().getCreatedAt());
        assertEquals(CREATED, found.get().getUpdatedAt());
    }

    @Test
    @DisplayName("findAll returns every record ordered by id")
    void findAllOrderedById() {
        Record first = recordAccess.insert(record("first", "1", "n1"));
        Record second = recordAccess.insert(record("second", "2", null));

        List<Record> all = recordAccess.findAll();

        assertEquals(2, all.size());
        assertEquals(first.getId(), all.get(0).getId());
        assertEquals(second.getId(), all.get(1).getId());
        assertEquals("n1", all.get(0).getNote());
    }

    @Test
    @DisplayName("update writes mutable columns and never touches created_at")
    void updateKeepsCreatedAt() {
        Record inserted = recordAccess.insert(record("A", "B", "note"));

        Record changed = inserted.toBuilder()
                .name("A2")
                .note(null)
                .createdAt(UPDATED)
                .updatedAt(UPDATED)
                .build();
        Optional<Record> updated = recordAccess.update(changed);

        assertTrue(updated.isPresent());
        assertEquals("A2", updated.get().getName());
        assertEquals("B", updated.get().getMessage());
        assertNull(updated.get().getNote());
        assertEquals(CREATED, updated.get().getCreatedAt());
        assertEquals(UPDATED, updated.get().getUpdatedAt());
    }

    @Test
    @DisplayName("update and delete report a missing row")
    void missingRow() {
        Record ghost = record("ghost", "boo", null).toBuilder().id(123456L).build();

        assertTrue(recordAccess.update(ghost).isEmpty());
        assertFalse(recordAccess.delete(123456L));
        assertTrue(recordAccess.findById(123456L).isEmpty());
    }

    @Test
    @DisplayName("deleted ids are not handed out again")
    void deleteDoesNotRecycleIds() {
        Record first = recordAccess.insert(record("A", "1", null));
        assertTrue(recordAccess.delete(first.getId()));

        Record second = recordAccess.insert(record("A", "2", null));

        assertNotEquals(first.getId(), second.getId());
        assertTrue(second.getId() > first.getId());
        assertTrue(recordAccess.findById(first.getId()).isEmpty());
    }

    @Test
    @DisplayName("names longer than the column allows are rejected by the database")
    void oversizedNameRejected() {
        assertThrows(DataAccessException.class,
                () -> recordAccess.insert(record("x".repeat(256), "B", null)));
        assertTrue(recordAccess.findAll().isEmpty());
    }

    private Record record(String name, String message, String note) {
        return Record.builder()
                .name(name)
                .message(message)
                .note(note)
                .createdAt(CREATED)
                .updatedAt(CREATED)
                .build();
    }
}
