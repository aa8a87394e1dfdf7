package io.tagkeeper.storage;

import io.tagkeeper.model.IntegrityTag;
import io.tagkeeper.model.LedgerRecord;
import io.tagkeeper.model.Subject;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Durable ledger backed by the {@code records} table. Each call opens its own
 * connection; statements are bounded by the database query timeout.
 */
public final class SqliteLedger implements Ledger {
    private static final String COLUMNS = "subject_kind,subject_id,tag,watermark,payload,last_verified_at_ms";

    private final Database database;
    private final String namespace;

    public SqliteLedger(Database database) {
        this.database = database;
        this.namespace = database.namespace();
    }

    @Override
    public Optional<LedgerRecord> get(Subject subject) {
        String sql = "SELECT " + COLUMNS + " FROM records WHERE namespace=? AND subject_kind=? AND subject_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = prepare(c, sql)) {
            ps.setString(1, namespace);
            ps.setString(2, subject.kind());
            ps.setString(3, subject.id());
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(readRecord(rs));
            }
        } catch (SQLException e) {
            throw new LedgerIoException("get", subject, e);
        }
    }

    @Override
    public void put(LedgerRecord record) {
        Objects.requireNonNull(record, "record");
        String sql = """
                INSERT INTO records(namespace,subject_kind,subject_id,tag,watermark,payload,last_verified_at_ms,created_at_ms,updated_at_ms)
                VALUES(?,?,?,?,?,?,?,?,?)
                ON CONFLICT(namespace,subject_kind,subject_id) DO UPDATE SET
                    tag=excluded.tag,
                    watermark=excluded.watermark,
                    payload=excluded.payload,
                    last_verified_at_ms=excluded.last_verified_at_ms,
                    updated_at_ms=excluded.updated_at_ms
                """;
        long now = Instant.now().toEpochMilli();
        try (Connection c = database.openConnection(); PreparedStatement ps = prepare(c, sql)) {
            ps.setString(1, namespace);
            ps.setString(2, record.subject().kind());
            ps.setString(3, record.subject().id());
            ps.setString(4, record.tag().value());
            ps.setString(5, record.watermark());
            setNullableString(ps, 6, record.payload());
            setNullableInstant(ps, 7, record.lastVerifiedAt());
            ps.setLong(8, now);
            ps.setLong(9, now);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new LedgerIoException("put", record.subject(), e);
        }
    }

    @Override
    public boolean delete(Subject subject) {
        String sql = "DELETE FROM records WHERE namespace=? AND subject_kind=? AND subject_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = prepare(c, sql)) {
            ps.setString(1, namespace);
            ps.setString(2, subject.kind());
            ps.setString(3, subject.id());
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new LedgerIoException("delete", subject, e);
        }
    }

    @Override
    public boolean compareAndSwap(Subject subject, IntegrityTag expectedTag, LedgerRecord newRecord) {
        Objects.requireNonNull(newRecord, "newRecord");
        if (!subject.equals(newRecord.subject())) {
            throw new IllegalArgumentException("Record subject " + newRecord.subject() + " does not match " + subject);
        }
        String sql = """
                UPDATE records SET tag=?,watermark=?,payload=?,last_verified_at_ms=?,updated_at_ms=?
                WHERE namespace=? AND subject_kind=? AND subject_id=? AND tag=?
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = prepare(c, sql)) {
            ps.setString(1, newRecord.tag().value());
            ps.setString(2, newRecord.watermark());
            setNullableString(ps, 3, newRecord.payload());
            setNullableInstant(ps, 4, newRecord.lastVerifiedAt());
            ps.setLong(5, Instant.now().toEpochMilli());
            ps.setString(6, namespace);
            ps.setString(7, subject.kind());
            ps.setString(8, subject.id());
            ps.setString(9, expectedTag == null ? "" : expectedTag.value());
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new LedgerIoException("compare-and-swap", subject, e);
        }
    }

    @Override
    public List<LedgerRecord> list() {
        String sql = "SELECT " + COLUMNS + " FROM records WHERE namespace=? ORDER BY subject_kind, subject_id";
        List<LedgerRecord> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = prepare(c, sql)) {
            ps.setString(1, namespace);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(readRecord(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new LedgerIoException("list", null, e);
        }
    }

    @Override
    public int size() {
        String sql = "SELECT COUNT(1) FROM records WHERE namespace=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = prepare(c, sql)) {
            ps.setString(1, namespace);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new LedgerIoException("size", null, e);
        }
    }

    private PreparedStatement prepare(Connection c, String sql) throws SQLException {
        PreparedStatement ps = c.prepareStatement(sql);
        ps.setQueryTimeout(database.queryTimeoutSeconds());
        return ps;
    }

    private static LedgerRecord readRecord(ResultSet rs) throws SQLException {
        long verifiedMs = rs.getLong("last_verified_at_ms");
        Instant verifiedAt = rs.wasNull() ? null : Instant.ofEpochMilli(verifiedMs);
        return new LedgerRecord(
                new Subject(rs.getString("subject_id"), rs.getString("subject_kind")),
                IntegrityTag.of(rs.getString("tag")),
                rs.getString("payload"),
                verifiedAt,
                rs.getString("watermark")
        );
    }

    private static void setNullableString(PreparedStatement ps, int index, String value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.VARCHAR);
        } else {
            ps.setString(index, value);
        }
    }

    private static void setNullableInstant(PreparedStatement ps, int index, Instant value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.INTEGER);
        } else {
            ps.setLong(index, value.toEpochMilli());
        }
    }
}
