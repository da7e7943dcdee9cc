package decentralabs.attendance.config;

import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "attendance")
public class AttendanceProperties {

    private Session session = new Session();
    private Token token = new Token();
    private Checkin checkin = new Checkin();

    @Data
    public static class Session {
        /** Radius applied when an open request does not carry one. */
        private double defaultRadiusMeters = 50;
        /** Longest session an instructor may open. */
        private Duration maxDuration = Duration.ofHours(4);
        private long sweepIntervalMs = 30_000;
    }

    @Data
    public static class Token {
        /**
         * When false a session has one token valid until it closes. When true each issuance
         * produces a short-lived token so a screenshot of the code goes stale quickly.
         */
        private boolean rotationEnabled = false;
        private Duration ttl = Duration.ofSeconds(30);
        private String payloadPrefix = "attendance_token";
        /** HMAC key for the payload tag. A random key is generated at startup when blank. */
        private String payloadSecret;
        private int idBytes = 32;
    }

    @Data
    public static class Checkin {
        private int maxAttemptsPerMinute = 20;
    }
}
