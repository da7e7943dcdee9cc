package decentralabs.attendance.service.session;

import decentralabs.attendance.service.geo.GeoPoint;
import java.time.Instant;
import java.util.Objects;

/**
 * Immutable attendance session. The only transition is OPEN to CLOSED.
 */
public record AttendanceSession(
    String id,
    String ownerIdentity,
    String label,
    Instant opensAt,
    Instant closesAt,
    double allowedRadiusMeters,
    GeoPoint origin,
    SessionStatus status,
    Instant closedAt
) {

    public AttendanceSession {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(ownerIdentity, "ownerIdentity");
        Objects.requireNonNull(opensAt, "opensAt");
        Objects.requireNonNull(closesAt, "closesAt");
        Objects.requireNonNull(origin, "origin");
        Objects.requireNonNull(status, "status");
    }

    public boolean isOpenAt(Instant now) {
        return status == SessionStatus.OPEN && now.isBefore(closesAt);
    }

    public boolean isOwnedBy(String identity) {
        return ownerIdentity.equals(identity);
    }

    AttendanceSession close(Instant when) {
        if (status == SessionStatus.CLOSED) {
            return this;
        }
        return new AttendanceSession(
            id, ownerIdentity, label, opensAt, closesAt, allowedRadiusMeters, origin, SessionStatus.CLOSED, when
        );
    }
}
