package com.example.recordsapi.access;

import com.example.recordsapi.models.Record;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JdbcRecordAccess implements RecordAccess {

    private static final String COLUMNS = "id, name, message, note, created_at, updated_at";

    private final NamedParameterJdbcTemplate jdbcTemplate;

    @Override
    public List<Record> findAll() {
        final String sql = "SELECT " + COLUMNS + " FROM records ORDER BY id";
        return jdbcTemplate.query(sql, new MapSqlParameterSource(), this::mapRow);
    }

    @Override
    public Optional<Record> findById(long id) {
        final String sql = "SELECT " + COLUMNS + " FROM records WHERE id = :id";
        final MapSqlParameterSource params = new MapSqlParameterSource().addValue("id", id);
        return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
    }

    @Override
    public Record insert(Record record) {
        final String sql =
                """
                INSERT INTO records (name, message, note, created_at, updated_at)
                VALUES (:name, :message, :note, :createdAt, :updatedAt)
                RETURNING id, name, message, note, created_at, updated_at
                """;
        final MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("name", record.getName())
                .addValue("message", record.getMessage())
                .addValue("note", record.getNote(), Types.VARCHAR)
                .addValue("createdAt", toOffsetDateTime(record.getCreatedAt()))
                .addValue("updatedAt", toOffsetDateTime(record.getUpdatedAt()));
        return jdbcTemplate.queryForObject(sql, params, this::mapRow);
    }

    @Override
    public Optional<Record> update(Record record) {
        Objects.requireNonNull(record.getId(), "record.id");
        final String sql =
                """
                UPDATE records
                SET name = :name,
                    message = :message,
                    note = :note,
                    updated_at = :updatedAt
                WHERE id = :id
                RETURNING id, name, message, note, created_at, updated_at
                """;
        final MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", record.getId())
                .addValue("name", record.getName())
                .addValue("message", record.getMessage())
                .addValue("note", record.getNote(), Types.VARCHAR)
                .addValue("updatedAt", toOffsetDateTime(record.getUpdatedAt()));
        return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
    }

    @Override
    public boolean delete(long id) {
        final String sql = "DELETE FROM records WHERE id = :id";
        final MapSqlParameterSource params = new MapSqlParameterSource().addValue("id", id);
        return jdbcTemplate.update(sql, params) > 0;
    }

    // timestamptz binds and reads reliably as OffsetDateTime with the PostgreSQL driver
    private static OffsetDateTime toOffsetDateTime(Instant instant) {
        return instant.atOffset(ZoneOffset.UTC);
    }

    private Record mapRow(ResultSet rs, int rowNum) throws SQLException {
        return Record.builder()
                .id(rs.getLong("id"))
                .name(rs.getString("name"))
                .message(rs.getString("message"))
                .note(rs.getString("note"))
                .createdAt(rs.getObject("created_at", OffsetDateTime.class).toInstant())
                .updatedAt(rs.getObject("updated_at", OffsetDateTime.class).toInstant())
                .build();
    }
}
