package decentralabs.attendance.service.checkin;

import decentralabs.attendance.service.geo.GeoPoint;
import java.time.Instant;

/**
 * One check-in attempt as received from the transport layer. The attendee identity has already
 * been authenticated upstream. {@code submittedAt} is the device time and is only logged.
 */
public record CheckInCommand(String tokenId, String attendeeIdentity, GeoPoint claimed, Instant submittedAt) {
}
