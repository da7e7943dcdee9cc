package decentralabs.attendance.dto.checkin;

import lombok.Getter;
import lombok.Setter;

/**
 * Check-in submitted by an attendee device. Either {@code payload} (the scanned QR text)
 * or {@code tokenId} must be present. Coordinates may be missing when the device has no fix.
 */
@Getter
@Setter
public class CheckInRequest {
    private String tokenId;
    private String payload;
    private Double latitude;
    private Double longitude;
    private Long timestamp;      // device time, unix millis
}
