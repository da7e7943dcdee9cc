package decentralabs.attendance.service.checkin;

import java.time.Instant;
import java.util.Objects;

/**
 * Proof that an attendee checked in to a session. At most one exists per (sessionId, attendeeIdentity).
 */
public record AttendanceRecord(
    String sessionId,
    String attendeeIdentity,
    String tokenId,
    Instant verifiedAt,
    double distanceMeters
) {

    public AttendanceRecord {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(attendeeIdentity, "attendeeIdentity");
        Objects.requireNonNull(tokenId, "tokenId");
        Objects.requireNonNull(verifiedAt, "verifiedAt");
    }
}
