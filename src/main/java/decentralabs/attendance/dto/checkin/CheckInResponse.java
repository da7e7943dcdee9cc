package decentralabs.attendance.dto.checkin;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CheckInResponse {
    private final boolean accepted;
    private final String reason;
    private final String message;
    private final boolean retryable;
    private final String sessionId;
    private final Instant verifiedAt;
    private final Double distanceMeters;
}
