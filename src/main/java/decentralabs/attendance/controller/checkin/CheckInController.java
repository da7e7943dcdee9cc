package decentralabs.attendance.controller.checkin;

import decentralabs.attendance.dto.checkin.AttendanceRecordResponse;
import decentralabs.attendance.dto.checkin.CheckInRequest;
import decentralabs.attendance.dto.checkin.CheckInResponse;
import decentralabs.attendance.security.CallerIdentity;
import decentralabs.attendance.service.checkin.AttendanceRecord;
import decentralabs.attendance.service.checkin.CheckInCommand;
import decentralabs.attendance.service.checkin.CheckInOutcome;
import decentralabs.attendance.service.checkin.CheckInRateLimiter;
import decentralabs.attendance.service.checkin.CheckInVerifier;
import decentralabs.attendance.service.checkin.VerificationResult;
import decentralabs.attendance.service.geo.GeoPoint;
import decentralabs.attendance.service.report.AttendanceReportService;
import java.security.Principal;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Attendee check-in endpoint. Unknown, tampered and expired tokens share one public reason so
 * the response does not reveal which token ids exist.
 */
@RestController
@RequestMapping("${endpoint.check-ins:/check-ins}")
@RequiredArgsConstructor
public class CheckInController {

    static final String REASON_TOKEN_REJECTED = "token_rejected";
    static final String REASON_RATE_LIMITED = "rate_limited";

    private final CheckInVerifier verifier;
    private final CheckInRateLimiter rateLimiter;
    private final AttendanceReportService reportService;

    @PostMapping
    public ResponseEntity<CheckInResponse> checkIn(@RequestBody CheckInRequest request, Principal principal) {
        String attendee = CallerIdentity.require(principal);
        boolean hasPayload = request.getPayload() != null && !request.getPayload().isBlank();
        boolean hasTokenId = request.getTokenId() != null && !request.getTokenId().isBlank();
        if (!hasPayload && !hasTokenId) {
            throw new IllegalArgumentException("Missing token");
        }
        if (!rateLimiter.tryAcquire(attendee)) {
            return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS).body(CheckInResponse.builder()
                .accepted(false)
                .reason(REASON_RATE_LIMITED)
                .message("Too many check-in attempts, try again shortly")
                .retryable(true)
                .build());
        }

        CheckInCommand command = new CheckInCommand(
            request.getTokenId(),
            attendee,
            new GeoPoint(request.getLatitude(), request.getLongitude()),
            request.getTimestamp() != null ? Instant.ofEpochMilli(request.getTimestamp()) : null
        );
        VerificationResult result = hasPayload
            ? verifier.verifyPayload(request.getPayload(), command)
            : verifier.verify(command);
        return toResponse(result);
    }

    @GetMapping("/history")
    public ResponseEntity<List<AttendanceRecordResponse>> history(Principal principal) {
        List<AttendanceRecord> records = reportService.attendeeHistory(CallerIdentity.require(principal));
        return ResponseEntity.ok(records.stream().map(AttendanceRecordResponse::from).toList());
    }

    private ResponseEntity<CheckInResponse> toResponse(VerificationResult result) {
        CheckInOutcome outcome = result.outcome();
        return switch (outcome) {
            case ACCEPTED -> {
                AttendanceRecord record = result.record();
                yield ResponseEntity.ok(CheckInResponse.builder()
                    .accepted(true)
                    .reason(outcome.getWireValue())
                    .message("Attendance recorded")
                    .sessionId(record.sessionId())
                    .verifiedAt(record.verifiedAt())
                    .distanceMeters(Math.round(record.distanceMeters() * 10) / 10.0)
                    .build());
            }
            case DUPLICATE_CHECK_IN -> ResponseEntity.ok(CheckInResponse.builder()
                .accepted(false)
                .reason(outcome.getWireValue())
                .message("Attendance already recorded")
                .build());
            case OUT_OF_RANGE -> ResponseEntity.unprocessableEntity().body(CheckInResponse.builder()
                .accepted(false)
                .reason(outcome.getWireValue())
                .message("Location is out of range, move closer and try again")
                .build());
            case TOKEN_NOT_FOUND, TOKEN_EXPIRED -> ResponseEntity.badRequest().body(CheckInResponse.builder()
                .accepted(false)
                .reason(REASON_TOKEN_REJECTED)
                .message("Invalid or expired code")
                .build());
        };
    }
}
