package decentralabs.attendance.service.session;

import decentralabs.attendance.service.persistence.AttendancePersistenceService;
import decentralabs.attendance.service.time.ClockSource;
import decentralabs.attendance.service.token.AttendanceToken;
import decentralabs.attendance.service.token.TokenStore;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Closes sessions past their end time and marks lapsed tokens as expired.
 * Verification does not depend on this job; it only keeps stored state tidy.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SessionExpirySweeper {

    private final SessionManager sessionManager;
    private final TokenStore tokenStore;
    private final ClockSource clock;
    private final AttendancePersistenceService persistence;

    @Scheduled(fixedDelayString = "${attendance.session.sweep-interval-ms:30000}")
    public void sweep() {
        try {
            List<AttendanceSession> closed = sessionManager.closeExpiredSessions();
            List<AttendanceToken> expired = tokenStore.expireDue(clock.now());
            expired.forEach(persistence::saveToken);
            if (!closed.isEmpty() || !expired.isEmpty()) {
                log.info("Expiry sweep closed {} sessions and expired {} tokens", closed.size(), expired.size());
            }
        } catch (RuntimeException ex) {
            log.error("Expiry sweep failed", ex);
        }
    }
}
