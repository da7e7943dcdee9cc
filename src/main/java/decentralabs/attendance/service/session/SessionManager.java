package decentralabs.attendance.service.session;

import decentralabs.attendance.config.AttendanceProperties;
import decentralabs.attendance.exception.InvalidSessionConfigException;
import decentralabs.attendance.exception.ResourceNotFoundException;
import decentralabs.attendance.exception.SessionNotOpenException;
import decentralabs.attendance.service.geo.GeoPoint;
import decentralabs.attendance.service.persistence.AttendancePersistenceService;
import decentralabs.attendance.service.time.ClockSource;
import decentralabs.attendance.service.token.AttendanceToken;
import decentralabs.attendance.service.token.TokenPayloadCodec;
import decentralabs.attendance.service.token.TokenStatus;
import decentralabs.attendance.service.token.TokenStore;
import decentralabs.attendance.util.LogSanitizer;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Owns the session lifecycle and token issuance. Mutations of one session run inside a
 * {@code compute} on that session's key, so they are serialized per session and never globally.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionManager {

    private static final Logger AUDIT = LoggerFactory.getLogger("attendance.audit");

    private final AttendanceProperties properties;
    private final ClockSource clock;
    private final TokenStore tokenStore;
    private final TokenPayloadCodec payloadCodec;
    private final AttendancePersistenceService persistence;

    private final Map<String, AttendanceSession> sessions = new ConcurrentHashMap<>();

    /**
     * Opens a session centred on {@code origin}.
     *
     * @param radiusMeters geofence radius; the configured default applies when null
     * @throws InvalidSessionConfigException if the radius, duration or origin is unusable
     */
    public AttendanceSession openSession(String owner, Double radiusMeters, GeoPoint origin, Duration duration, String label) {
        if (owner == null || owner.isBlank()) {
            throw new InvalidSessionConfigException("owner", "Session owner is required");
        }
        double radius = radiusMeters != null ? radiusMeters : properties.getSession().getDefaultRadiusMeters();
        if (!Double.isFinite(radius) || radius <= 0) {
            throw new InvalidSessionConfigException("radiusMeters", "Radius must be greater than zero");
        }
        if (duration == null || duration.isZero() || duration.isNegative()) {
            throw new InvalidSessionConfigException("duration", "Duration must be greater than zero");
        }
        Duration maxDuration = properties.getSession().getMaxDuration();
        if (maxDuration != null && duration.compareTo(maxDuration) > 0) {
            throw new InvalidSessionConfigException("duration", "Duration exceeds the maximum of " + maxDuration);
        }
        if (origin == null || !origin.isValid()) {
            throw new InvalidSessionConfigException("origin", "Origin must be a valid latitude/longitude");
        }

        Instant now = clock.now();
        AttendanceSession session = new AttendanceSession(
            UUID.randomUUID().toString(),
            owner,
            label,
            now,
            now.plus(duration),
            radius,
            origin,
            SessionStatus.OPEN,
            null
        );
        sessions.put(session.id(), session);
        persistence.saveSession(session);

        AUDIT.info("session_opened session={} owner={} radius={} closesAt={}",
            session.id(), LogSanitizer.maskIdentifier(owner), radius, session.closesAt());
        return session;
    }

    /**
     * Issues a token bound to an open session. With rotation disabled the session's live token
     * is returned instead of minting a second one.
     *
     * @throws SessionNotOpenException if the session is closed or past {@code closesAt}
     */
    public AttendanceToken issueToken(String sessionId, String requester) {
        AtomicReference<AttendanceToken> issued = new AtomicReference<>();
        AtomicBoolean minted = new AtomicBoolean(false);
        AttendanceSession after = sessions.compute(sessionId, (id, current) -> {
            if (current == null) {
                throw new ResourceNotFoundException("session", "Session not found");
            }
            requireOwner(current, requester);
            Instant now = clock.now();
            if (!current.isOpenAt(now)) {
                throw new SessionNotOpenException(id);
            }

            AttendanceProperties.Token tokenConfig = properties.getToken();
            if (!tokenConfig.isRotationEnabled()) {
                Optional<AttendanceToken> live = tokenStore.findUsable(id, now);
                if (live.isPresent()) {
                    issued.set(live.get());
                    return current;
                }
            }

            Instant expiresAt = current.closesAt();
            if (tokenConfig.isRotationEnabled()) {
                Instant rotated = now.plus(tokenConfig.getTtl());
                if (rotated.isBefore(expiresAt)) {
                    expiresAt = rotated;
                }
            }
            String tokenId = payloadCodec.newTokenId();
            AttendanceToken token = new AttendanceToken(tokenId, id, payloadCodec.encode(tokenId), now, expiresAt);
            tokenStore.put(token);
            issued.set(token);
            minted.set(true);
            return current;
        });

        AttendanceToken token = issued.get();
        if (minted.get()) {
            persistence.saveToken(token);
            log.info("Issued attendance token for session {} expiring at {}", after.id(), token.getExpiresAt());
        }
        return token;
    }

    /**
     * Stops further issuance. Tokens already issued keep working until their own expiry.
     */
    public AttendanceSession closeSession(String sessionId, String requester) {
        AtomicBoolean changed = new AtomicBoolean(false);
        AttendanceSession closed = sessions.compute(sessionId, (id, current) -> {
            if (current == null) {
                throw new ResourceNotFoundException("session", "Session not found");
            }
            requireOwner(current, requester);
            if (current.status() == SessionStatus.CLOSED) {
                return current;
            }
            changed.set(true);
            return current.close(clock.now());
        });
        if (changed.get()) {
            persistence.saveSession(closed);
            AUDIT.info("session_closed session={} by={}", closed.id(), LogSanitizer.maskIdentifier(requester));
        }
        return closed;
    }

    /**
     * Revokes a token on behalf of the owner of its session. Idempotent.
     */
    public AttendanceToken revokeToken(String tokenId, String requester) {
        AttendanceToken token = tokenStore.get(tokenId)
            .orElseThrow(() -> new ResourceNotFoundException("token", "Token not found"));
        AttendanceSession session = findSession(token.getSessionId())
            .orElseThrow(() -> new ResourceNotFoundException("session", "Session not found"));
        requireOwner(session, requester);

        AttendanceToken revoked = tokenStore.revoke(tokenId).orElse(token);
        if (token.getStatus() == TokenStatus.ACTIVE && revoked.getStatus() == TokenStatus.REVOKED) {
            persistence.saveToken(revoked);
            AUDIT.info("token_revoked session={} token={} by={}",
                session.id(), LogSanitizer.maskIdentifier(tokenId), LogSanitizer.maskIdentifier(requester));
        }
        return revoked;
    }

    public Optional<AttendanceSession> findSession(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(sessions.get(sessionId));
    }

    /**
     * Session lookup restricted to its owner.
     */
    public AttendanceSession getOwnedSession(String sessionId, String requester) {
        AttendanceSession session = findSession(sessionId)
            .orElseThrow(() -> new ResourceNotFoundException("session", "Session not found"));
        requireOwner(session, requester);
        return session;
    }

    public List<AttendanceToken> listTokens(String sessionId, String requester) {
        getOwnedSession(sessionId, requester);
        return tokenStore.findBySession(sessionId);
    }

    /**
     * Closes every open session whose end time has passed.
     *
     * @return sessions closed by this call
     */
    public List<AttendanceSession> closeExpiredSessions() {
        Instant now = clock.now();
        List<AttendanceSession> closed = new ArrayList<>();
        for (String sessionId : sessions.keySet()) {
            sessions.computeIfPresent(sessionId, (id, current) -> {
                if (current.status() == SessionStatus.OPEN && now.isAfter(current.closesAt())) {
                    AttendanceSession next = current.close(current.closesAt());
                    closed.add(next);
                    return next;
                }
                return current;
            });
        }
        for (AttendanceSession session : closed) {
            persistence.saveSession(session);
            AUDIT.info("session_closed session={} by=expiry", session.id());
        }
        return closed;
    }

    private void requireOwner(AttendanceSession session, String requester) {
        if (!session.isOwnedBy(requester)) {
            log.warn("Rejected session operation on {} by non-owner {}", session.id(), LogSanitizer.maskIdentifier(requester));
            throw new SecurityException("Only the session owner may manage this session");
        }
    }
}
