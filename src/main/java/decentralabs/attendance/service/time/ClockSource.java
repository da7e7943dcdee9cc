package decentralabs.attendance.service.time;

import java.time.Instant;

/**
 * Wall-clock source shared by session, token and check-in logic.
 */
public interface ClockSource {

    Instant now();
}
