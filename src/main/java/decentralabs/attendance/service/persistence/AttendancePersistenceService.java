package decentralabs.attendance.service.persistence;

import decentralabs.attendance.service.checkin.AttendanceRecord;
import decentralabs.attendance.service.session.AttendanceSession;
import decentralabs.attendance.service.token.AttendanceToken;
import decentralabs.attendance.util.LogSanitizer;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

/**
 * Mirrors sessions, tokens and attendance records into MySQL (see db/attendance-schema.sql).
 * Designed to fail gracefully when JDBC is not configured or the tables are absent; the
 * in-memory stores stay authoritative for verification.
 */
@Service
@Slf4j
public class AttendancePersistenceService {

    private final JdbcTemplate jdbcTemplate; // May be null if no datasource provided
    private final AtomicBoolean schemaMissing = new AtomicBoolean(false);

    public AttendancePersistenceService(ObjectProvider<JdbcTemplate> jdbcTemplateProvider) {
        this.jdbcTemplate = jdbcTemplateProvider.getIfAvailable();
    }

    public boolean isEnabled() {
        return jdbcTemplate != null;
    }

    public void saveSession(AttendanceSession session) {
        if (jdbcTemplate == null) {
            log.debug("Skipping session persistence (no JdbcTemplate/data source)");
            return;
        }
        try {
            jdbcTemplate.update(
                """
                INSERT INTO attendance_sessions (
                    session_id, owner_identity, label, opens_at, closes_at, radius_meters,
                    origin_latitude, origin_longitude, status, updated_at
                ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                ON DUPLICATE KEY UPDATE
                    status = IF(status = 'open', VALUES(status), status),
                    updated_at = VALUES(updated_at)
                """,
                session.id(),
                session.ownerIdentity(),
                session.label(),
                Timestamp.from(session.opensAt()),
                Timestamp.from(session.closesAt()),
                session.allowedRadiusMeters(),
                session.origin().latitude(),
                session.origin().longitude(),
                session.status().getWireValue(),
                Timestamp.from(Instant.now())
            );
        } catch (DataAccessException ex) {
            reportFailure("session " + session.id(), ex);
        } catch (Exception ex) {
            log.warn("Failed to persist session {}: {}", session.id(), LogSanitizer.sanitize(ex.getMessage()));
        }
    }

    /**
     * Upserts token metadata. Once a stored status leaves {@code active} it is kept, so a late
     * write can never bring a token back. Consumers are not stored here; they are the
     * {@code attendance_records} rows carrying the token id.
     */
    public void saveToken(AttendanceToken token) {
        if (jdbcTemplate == null) {
            log.debug("Skipping token persistence (no JdbcTemplate/data source)");
            return;
        }
        try {
            jdbcTemplate.update(
                """
                INSERT INTO attendance_tokens (
                    token_id, session_id, issued_at, expires_at, status, updated_at
                ) VALUES (?, ?, ?, ?, ?, ?)
                ON DUPLICATE KEY UPDATE
                    status = IF(status = 'active', VALUES(status), status),
                    updated_at = VALUES(updated_at)
                """,
                token.getId(),
                token.getSessionId(),
                Timestamp.from(token.getIssuedAt()),
                Timestamp.from(token.getExpiresAt()),
                token.getStatus().getWireValue(),
                Timestamp.from(Instant.now())
            );
        } catch (DataAccessException ex) {
            reportFailure("token " + LogSanitizer.maskIdentifier(token.getId()), ex);
        }
    }

    public void insertRecord(AttendanceRecord record) {
        if (jdbcTemplate == null) {
            log.debug("Skipping attendance record persistence (no JdbcTemplate/data source)");
            return;
        }
        try {
            jdbcTemplate.update(
                """
                INSERT INTO attendance_records (
                    session_id, attendee_identity, token_id, verified_at, distance_meters
                ) VALUES (?, ?, ?, ?, ?)
                """,
                record.sessionId(),
                record.attendeeIdentity(),
                record.tokenId(),
                Timestamp.from(record.verifiedAt()),
                record.distanceMeters()
            );
        } catch (DuplicateKeyException ex) {
            log.warn("Attendance record for session {} already stored for {}",
                record.sessionId(), LogSanitizer.maskIdentifier(record.attendeeIdentity()));
        } catch (DataAccessException ex) {
            reportFailure("attendance record for session " + record.sessionId(), ex);
        }
    }

    private void reportFailure(String subject, DataAccessException ex) {
        if (schemaMissing.compareAndSet(false, true)) {
            log.warn("Attendance persistence skipped for {} (database or schema unavailable): {}",
                subject, LogSanitizer.sanitize(ex.getMessage()));
        } else {
            log.debug("Attendance persistence skipped for {}: {}", subject, LogSanitizer.sanitize(ex.getMessage()));
        }
    }
}
