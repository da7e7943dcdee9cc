package decentralabs.attendance.dto.checkin;

import decentralabs.attendance.service.checkin.AttendanceRecord;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class AttendanceRecordResponse {
    private final String sessionId;
    private final String attendee;
    private final Instant verifiedAt;
    private final double distanceMeters;

    public static AttendanceRecordResponse from(AttendanceRecord record) {
        return AttendanceRecordResponse.builder()
            .sessionId(record.sessionId())
            .attendee(record.attendeeIdentity())
            .verifiedAt(record.verifiedAt())
            .distanceMeters(Math.round(record.distanceMeters() * 10) / 10.0)
            .build();
    }
}
