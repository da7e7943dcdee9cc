package decentralabs.attendance.service.checkin;

import decentralabs.attendance.config.AttendanceProperties;
import decentralabs.attendance.util.LogSanitizer;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Per-attendee token bucket in front of check-in verification. Throttling happens before any
 * token lookup, so a throttled attempt never touches session or token state.
 */
@Service
@Slf4j
public class CheckInRateLimiter {

    private static final int MAX_TRACKED_ATTENDEES = 50_000;

    private final int maxAttemptsPerMinute;
    private final Map<String, Bucket> buckets = new ConcurrentHashMap<>();

    public CheckInRateLimiter(AttendanceProperties properties) {
        this.maxAttemptsPerMinute = Math.max(1, properties.getCheckin().getMaxAttemptsPerMinute());
    }

    public boolean tryAcquire(String attendeeIdentity) {
        Bucket bucket = buckets.computeIfAbsent(attendeeIdentity, key -> createBucket());
        boolean allowed = bucket.tryConsume(1);
        if (!allowed) {
            log.warn("Check-in rate limit exceeded for {}", LogSanitizer.maskIdentifier(attendeeIdentity));
        }
        return allowed;
    }

    @Scheduled(fixedDelayString = "${attendance.checkin.bucket-cleanup-interval-ms:600000}")
    public void cleanupBuckets() {
        if (buckets.size() > MAX_TRACKED_ATTENDEES) {
            log.info("Clearing check-in rate limit buckets, current size: {}", buckets.size());
            buckets.clear();
        }
    }

    private Bucket createBucket() {
        return Bucket.builder()
            .addLimit(Bandwidth.builder()
                .capacity(maxAttemptsPerMinute)
                .refillIntervally(maxAttemptsPerMinute, Duration.ofMinutes(1))
                .build())
            .build();
    }
}
