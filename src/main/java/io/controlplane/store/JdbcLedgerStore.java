package io.controlplane.store;

import io.controlplane.enums.ProvisioningState;
import io.controlplane.models.IdempotencyRecord;
import io.controlplane.models.LeaseRecord;
import io.controlplane.models.ResourceRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of {@link LedgerStore} over the {@code resource_ledger},
 * {@code idempotency_records} and {@code control_plane_lease} tables.
 * Every conditional mutation is a single statement so the database row lock is the
 * only arbiter between nodes.
 */
@Slf4j
public class JdbcLedgerStore implements LedgerStore {

    private static final String SCHEMA_SCRIPT = "schema.sql";

    private final JdbcTemplate jdbc;
    private final Clock clock;

    private static final RowMapper<ResourceRecord> RESOURCE_MAPPER = (rs, n) -> ResourceRecord.builder()
        .id(rs.getString("id"))
        .state(ProvisioningState.valueOf(rs.getString("state")))
        .createdAt(readInstant(rs, "created_at"))
        .updatedAt(readInstant(rs, "updated_at"))
        .build();

    private static final RowMapper<IdempotencyRecord> IDEMPOTENCY_MAPPER = (rs, n) -> IdempotencyRecord.builder()
        .key(rs.getString("idempotency_key"))
        .statusCode(rs.getInt("status_code"))
        .responseBody(rs.getBytes("response_body"))
        .contentType(rs.getString("content_type"))
        .createdAt(readInstant(rs, "created_at"))
        .build();

    private static final RowMapper<LeaseRecord> LEASE_MAPPER = (rs, n) -> LeaseRecord.builder()
        .id(rs.getString("id"))
        .nodeId(rs.getString("node_id"))
        .expiresAt(readInstant(rs, "expires_at"))
        .build();

    public JdbcLedgerStore(JdbcTemplate jdbc, Clock clock) {
        this.jdbc = jdbc;
        this.clock = clock;
    }

    @Override
    public void initialize() {
        log.info("Ensuring ledger schema exists");
        ResourceDatabasePopulator populator = new ResourceDatabasePopulator(new ClassPathResource(SCHEMA_SCRIPT));
        populator.execute(jdbc.getDataSource());
    }

    // ------------------------------------------------------------------
    // Resource ledger
    // ------------------------------------------------------------------

    @Override
    public Optional<ResourceRecord> findResource(String id) {
        List<ResourceRecord> rows = jdbc.query(
            "SELECT id, state, created_at, updated_at FROM resource_ledger WHERE id = ?",
            RESOURCE_MAPPER, id);
        return rows.stream().findFirst();
    }

    @Override
    public void insertResource(ResourceRecord record) {
        Instant now = Instant.now(clock);
        Instant createdAt = record.getCreatedAt() != null ? record.getCreatedAt() : now;
        Instant updatedAt = record.getUpdatedAt() != null ? record.getUpdatedAt() : createdAt;
        jdbc.update(
            "INSERT INTO resource_ledger (id, state, created_at, updated_at) VALUES (?, ?, ?, ?)",
            record.getId(), record.getState().name(), utc(createdAt), utc(updatedAt));
        record.setCreatedAt(createdAt);
        record.setUpdatedAt(updatedAt);
    }

    @Override
    public boolean transitionResource(String id, ProvisioningState from, ProvisioningState to) {
        int updated = jdbc.update("""
            UPDATE resource_ledger
               SET state = ?, updated_at = ?
             WHERE id = ? AND state = ?
            """, to.name(), utc(Instant.now(clock)), id, from.name());
        return updated > 0;
    }

    @Override
    public boolean deleteResource(String id, ProvisioningState expected) {
        return jdbc.update("DELETE FROM resource_ledger WHERE id = ? AND state = ?", id, expected.name()) > 0;
    }

    @Override
    public List<ResourceRecord> findAllResources() {
        return jdbc.query(
            "SELECT id, state, created_at, updated_at FROM resource_ledger ORDER BY created_at, id",
            RESOURCE_MAPPER);
    }

    @Override
    public List<ResourceRecord> findResourcesByState(ProvisioningState state, int limit) {
        return jdbc.query("""
            SELECT id, state, created_at, updated_at
              FROM resource_ledger
             WHERE state = ?
             ORDER BY created_at, id
             FETCH FIRST ? ROWS ONLY
            """, RESOURCE_MAPPER, state.name(), limit);
    }

    @Override
    public long countResources() {
        Long count = jdbc.queryForObject("SELECT COUNT(*) FROM resource_ledger", Long.class);
        return count == null ? 0L : count;
    }

    @Override
    public long countResourcesByState(ProvisioningState state) {
        Long count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM resource_ledger WHERE state = ?", Long.class, state.name());
        return count == null ? 0L : count;
    }

    // ------------------------------------------------------------------
    // Idempotency records
    // ------------------------------------------------------------------

    @Override
    public Optional<IdempotencyRecord> findIdempotencyRecord(String key) {
        List<IdempotencyRecord> rows = jdbc.query("""
            SELECT idempotency_key, status_code, response_body, content_type, created_at
              FROM idempotency_records
             WHERE idempotency_key = ?
            """, IDEMPOTENCY_MAPPER, key);
        return rows.stream().findFirst();
    }

    @Override
    public void insertIdempotencyRecord(IdempotencyRecord record) {
        Instant createdAt = record.getCreatedAt() != null ? record.getCreatedAt() : Instant.now(clock);
        jdbc.update("""
            INSERT INTO idempotency_records
              (idempotency_key, status_code, response_body, content_type, created_at)
            VALUES (?, ?, ?, ?, ?)
            """,
            record.getKey(), record.getStatusCode(), record.getResponseBody(),
            record.getContentType(), utc(createdAt));
        record.setCreatedAt(createdAt);
    }

    // ------------------------------------------------------------------
    // Lease
    // ------------------------------------------------------------------

    @Override
    public boolean renewOrTakeOverLease(String leaseId, String nodeId, Instant now, Instant expiresAt) {
        int updated = jdbc.update("""
            UPDATE control_plane_lease
               SET node_id = ?, expires_at = ?
             WHERE id = ?
               AND (node_id = ? OR expires_at < ?)
            """, nodeId, utc(expiresAt), leaseId, nodeId, utc(now));
        return updated > 0;
    }

    @Override
    public void insertLease(LeaseRecord lease) {
        jdbc.update("INSERT INTO control_plane_lease (id, node_id, expires_at) VALUES (?, ?, ?)",
            lease.getId(), lease.getNodeId(), utc(lease.getExpiresAt()));
    }

    @Override
    public Optional<LeaseRecord> findLease(String leaseId) {
        List<LeaseRecord> rows = jdbc.query(
            "SELECT id, node_id, expires_at FROM control_plane_lease WHERE id = ?", LEASE_MAPPER, leaseId);
        return rows.stream().findFirst();
    }

    // Bound as UTC offsets so comparisons never depend on the JVM default zone
    private static OffsetDateTime utc(Instant instant) {
        return instant.atOffset(ZoneOffset.UTC);
    }

    private static Instant readInstant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value == null ? null : value.toInstant();
    }
}
