package decentralabs.attendance.service.token;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Concurrent token registry and the single source of truth for one-time use per attendee.
 * Every mutation is a per-key {@link ConcurrentHashMap#compute} so unrelated tokens never contend,
 * and no I/O happens while a key is held.
 */
@Service
@Slf4j
public class TokenStore {

    // Tokens are never removed, which keeps ids from ever being handed out twice.
    private final Map<String, AttendanceToken> tokens = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> tokenIdsBySession = new ConcurrentHashMap<>();

    /**
     * Registers a freshly issued token.
     *
     * @throws IllegalStateException if the id was already issued
     */
    public void put(AttendanceToken token) {
        AttendanceToken previous = tokens.putIfAbsent(token.getId(), token);
        if (previous != null) {
            throw new IllegalStateException("Token id already issued");
        }
        tokenIdsBySession.computeIfAbsent(token.getSessionId(), id -> ConcurrentHashMap.newKeySet()).add(token.getId());
    }

    public Optional<AttendanceToken> get(String tokenId) {
        if (tokenId == null || tokenId.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(tokens.get(tokenId));
    }

    /**
     * Atomically checks status, expiry and prior use by the attendee, and records the attendee
     * when the token is still usable.
     */
    public ConsumeOutcome tryConsume(String tokenId, String attendeeIdentity, Instant now) {
        if (tokenId == null || attendeeIdentity == null || attendeeIdentity.isBlank() || now == null) {
            return ConsumeOutcome.TOKEN_INVALID;
        }
        AtomicReference<ConsumeOutcome> outcome = new AtomicReference<>(ConsumeOutcome.TOKEN_INVALID);
        tokens.computeIfPresent(tokenId, (id, current) -> {
            if (current.getStatus() != TokenStatus.ACTIVE) {
                return current;
            }
            if (now.isAfter(current.getExpiresAt())) {
                return current.withStatus(TokenStatus.EXPIRED);
            }
            if (current.isConsumedBy(attendeeIdentity)) {
                outcome.set(ConsumeOutcome.ALREADY_CONSUMED_BY_THIS_ATTENDEE);
                return current;
            }
            outcome.set(ConsumeOutcome.ACCEPTED);
            return current.withConsumer(attendeeIdentity);
        });
        return outcome.get();
    }

    /**
     * Revokes an active token. Revoking twice, or revoking an expired token, changes nothing.
     *
     * @return the token after the call, empty when the id is unknown
     */
    public Optional<AttendanceToken> revoke(String tokenId) {
        if (tokenId == null) {
            return Optional.empty();
        }
        AttendanceToken updated = tokens.computeIfPresent(tokenId, (id, current) -> current.withStatus(TokenStatus.REVOKED));
        return Optional.ofNullable(updated);
    }

    /**
     * Marks active tokens whose expiry has passed as EXPIRED.
     *
     * @return tokens that changed state
     */
    public List<AttendanceToken> expireDue(Instant now) {
        List<String> due = tokens.values().stream()
            .filter(token -> token.getStatus() == TokenStatus.ACTIVE && now.isAfter(token.getExpiresAt()))
            .map(AttendanceToken::getId)
            .toList();
        List<AttendanceToken> expired = new ArrayList<>();
        for (String tokenId : due) {
            tokens.computeIfPresent(tokenId, (id, current) -> {
                if (current.getStatus() != TokenStatus.ACTIVE || !now.isAfter(current.getExpiresAt())) {
                    return current;
                }
                AttendanceToken next = current.withStatus(TokenStatus.EXPIRED);
                expired.add(next);
                return next;
            });
        }
        if (!expired.isEmpty()) {
            log.debug("Expired {} attendance tokens", expired.size());
        }
        return expired;
    }

    public List<AttendanceToken> findBySession(String sessionId) {
        return sessionTokens(sessionId)
            .sorted(Comparator.comparing(AttendanceToken::getIssuedAt))
            .toList();
    }

    /**
     * Latest token of the session that can still be scanned at {@code now}.
     */
    public Optional<AttendanceToken> findUsable(String sessionId, Instant now) {
        return sessionTokens(sessionId)
            .filter(token -> token.isUsableAt(now))
            .max(Comparator.comparing(AttendanceToken::getIssuedAt));
    }

    private Stream<AttendanceToken> sessionTokens(String sessionId) {
        Set<String> ids = sessionId == null ? null : tokenIdsBySession.get(sessionId);
        if (ids == null) {
            return Stream.empty();
        }
        return ids.stream()
            .map(tokens::get)
            .filter(Objects::nonNull);
    }
}
