package decentralabs.attendance.dto.session;

import decentralabs.attendance.service.token.AttendanceToken;
import decentralabs.attendance.service.token.TokenStatus;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/**
 * Token as handed to the instructor's screen. {@code payload} is the string to encode in the QR image.
 */
@Getter
@Builder
public class TokenResponse {
    private final String tokenId;
    private final String sessionId;
    private final String payload;
    private final Instant issuedAt;
    private final Instant expiresAt;
    private final TokenStatus status;
    private final int checkIns;

    public static TokenResponse from(AttendanceToken token) {
        return TokenResponse.builder()
            .tokenId(token.getId())
            .sessionId(token.getSessionId())
            .payload(token.getPayload())
            .issuedAt(token.getIssuedAt())
            .expiresAt(token.getExpiresAt())
            .status(token.getStatus())
            .checkIns(token.getConsumedBy().size())
            .build();
    }
}
