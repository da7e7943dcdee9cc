package decentralabs.attendance.dto.session;

import com.fasterxml.jackson.annotation.JsonInclude;
import decentralabs.attendance.service.session.AttendanceSession;
import decentralabs.attendance.service.session.SessionStatus;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SessionResponse {
    private final String sessionId;
    private final String label;
    private final SessionStatus status;
    private final Instant opensAt;
    private final Instant closesAt;
    private final Instant closedAt;
    private final double radiusMeters;
    private final Double latitude;
    private final Double longitude;
    private final Integer attendanceCount;

    public static SessionResponse from(AttendanceSession session, Integer attendanceCount) {
        return SessionResponse.builder()
            .sessionId(session.id())
            .label(session.label())
            .status(session.status())
            .opensAt(session.opensAt())
            .closesAt(session.closesAt())
            .closedAt(session.closedAt())
            .radiusMeters(session.allowedRadiusMeters())
            .latitude(session.origin().latitude())
            .longitude(session.origin().longitude())
            .attendanceCount(attendanceCount)
            .build();
    }
}
