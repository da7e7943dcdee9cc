package decentralabs.attendance.service.token;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import lombok.Getter;

/**
 * Immutable snapshot of an issued attendance token. State changes produce a new snapshot
 * through {@link #withStatus} and {@link #withConsumer}; the token store swaps snapshots atomically.
 */
@Getter
public final class AttendanceToken {

    private final String id;
    private final String sessionId;
    private final String payload;
    private final Instant issuedAt;
    private final Instant expiresAt;
    private final TokenStatus status;
    private final Set<String> consumedBy;

    public AttendanceToken(String id, String sessionId, String payload, Instant issuedAt, Instant expiresAt) {
        this(id, sessionId, payload, issuedAt, expiresAt, TokenStatus.ACTIVE, Set.of());
    }

    private AttendanceToken(
        String id,
        String sessionId,
        String payload,
        Instant issuedAt,
        Instant expiresAt,
        TokenStatus status,
        Set<String> consumedBy
    ) {
        this.id = Objects.requireNonNull(id, "id");
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.payload = Objects.requireNonNull(payload, "payload");
        this.issuedAt = Objects.requireNonNull(issuedAt, "issuedAt");
        this.expiresAt = Objects.requireNonNull(expiresAt, "expiresAt");
        if (expiresAt.isBefore(issuedAt)) {
            throw new IllegalArgumentException("Token expires before it is issued");
        }
        this.status = Objects.requireNonNull(status, "status");
        this.consumedBy = consumedBy;
    }

    public boolean isUsableAt(Instant now) {
        return status == TokenStatus.ACTIVE && !now.isAfter(expiresAt);
    }

    public boolean isConsumedBy(String attendeeIdentity) {
        return consumedBy.contains(attendeeIdentity);
    }

    /**
     * Moves out of ACTIVE. Terminal states are kept as they are.
     */
    AttendanceToken withStatus(TokenStatus next) {
        if (status.isTerminal() || next == status) {
            return this;
        }
        return new AttendanceToken(id, sessionId, payload, issuedAt, expiresAt, next, consumedBy);
    }

    AttendanceToken withConsumer(String attendeeIdentity) {
        if (consumedBy.contains(attendeeIdentity)) {
            return this;
        }
        Set<String> next = new LinkedHashSet<>(consumedBy);
        next.add(attendeeIdentity);
        return new AttendanceToken(id, sessionId, payload, issuedAt, expiresAt, status, Collections.unmodifiableSet(next));
    }

    @Override
    public String toString() {
        return "AttendanceToken{sessionId=" + sessionId + ", status=" + status + ", expiresAt=" + expiresAt
            + ", consumers=" + consumedBy.size() + "}";
    }
}
