package decentralabs.attendance.service.checkin;

import decentralabs.attendance.service.geo.GeoValidator;
import decentralabs.attendance.service.geo.GeofenceResult;
import decentralabs.attendance.service.persistence.AttendancePersistenceService;
import decentralabs.attendance.service.session.AttendanceSession;
import decentralabs.attendance.service.session.SessionManager;
import decentralabs.attendance.service.time.ClockSource;
import decentralabs.attendance.service.token.AttendanceToken;
import decentralabs.attendance.service.token.ConsumeOutcome;
import decentralabs.attendance.service.token.TokenPayloadCodec;
import decentralabs.attendance.service.token.TokenStore;
import decentralabs.attendance.util.LogSanitizer;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Check-in verification pipeline. Lookup, expiry and geofence steps only read state. The consume
 * and the ledger write run while the attendee's ledger slot is claimed, so a token only lists an
 * attendee who also holds the session's attendance record.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CheckInVerifier {

    private static final Logger AUDIT = LoggerFactory.getLogger("attendance.audit");

    private final TokenStore tokenStore;
    private final SessionManager sessionManager;
    private final GeoValidator geoValidator;
    private final AttendanceLedger ledger;
    private final ClockSource clock;
    private final TokenPayloadCodec payloadCodec;
    private final AttendancePersistenceService persistence;

    /**
     * Verifies a check-in made with the raw payload read from the QR code.
     */
    public VerificationResult verifyPayload(String payload, CheckInCommand command) {
        Optional<String> tokenId = payloadCodec.decode(payload);
        if (tokenId.isEmpty()) {
            AUDIT.warn("integrity_failure reason=tampered_payload attendee={} payload={}",
                LogSanitizer.maskIdentifier(command.attendeeIdentity()), LogSanitizer.maskIdentifier(payload));
            return VerificationResult.rejected(CheckInOutcome.TOKEN_NOT_FOUND);
        }
        return verify(new CheckInCommand(tokenId.get(), command.attendeeIdentity(), command.claimed(), command.submittedAt()));
    }

    public VerificationResult verify(CheckInCommand command) {
        if (command == null) {
            throw new IllegalArgumentException("Missing check-in request");
        }
        String attendee = command.attendeeIdentity();
        if (attendee == null || attendee.isBlank()) {
            throw new IllegalArgumentException("Missing attendee identity");
        }
        String maskedAttendee = LogSanitizer.maskIdentifier(attendee);

        Optional<AttendanceToken> found = tokenStore.get(command.tokenId());
        if (found.isEmpty()) {
            AUDIT.warn("integrity_failure reason=unknown_token attendee={} token={}",
                maskedAttendee, LogSanitizer.maskIdentifier(command.tokenId()));
            return VerificationResult.rejected(CheckInOutcome.TOKEN_NOT_FOUND);
        }
        AttendanceToken token = found.get();

        Instant now = clock.now();
        if (!token.isUsableAt(now)) {
            log.info("Check-in with {} token by {}", token.getStatus().getWireValue(), maskedAttendee);
            return VerificationResult.rejected(CheckInOutcome.TOKEN_EXPIRED);
        }

        Optional<AttendanceSession> sessionLookup = sessionManager.findSession(token.getSessionId());
        if (sessionLookup.isEmpty()) {
            AUDIT.warn("integrity_failure reason=orphan_token attendee={} token={}",
                maskedAttendee, LogSanitizer.maskIdentifier(token.getId()));
            return VerificationResult.rejected(CheckInOutcome.TOKEN_NOT_FOUND);
        }
        AttendanceSession session = sessionLookup.get();

        GeofenceResult geofence = geoValidator.evaluate(session.origin(), command.claimed(), session.allowedRadiusMeters());
        if (!geofence.validFix()) {
            log.info("Check-in by {} for session {} rejected: no usable location fix", maskedAttendee, session.id());
            return VerificationResult.rejected(CheckInOutcome.OUT_OF_RANGE);
        }
        if (!geofence.within()) {
            log.info("Check-in by {} for session {} rejected: {}m from origin (radius {}m)",
                maskedAttendee, session.id(), Math.round(geofence.distanceMeters()), session.allowedRadiusMeters());
            return VerificationResult.rejected(CheckInOutcome.OUT_OF_RANGE);
        }

        if (!ledger.claim(session.id(), attendee)) {
            return VerificationResult.rejected(CheckInOutcome.DUPLICATE_CHECK_IN);
        }
        AttendanceRecord record;
        try {
            ConsumeOutcome consumed = tokenStore.tryConsume(token.getId(), attendee, now);
            if (consumed == ConsumeOutcome.ALREADY_CONSUMED_BY_THIS_ATTENDEE) {
                return VerificationResult.rejected(CheckInOutcome.DUPLICATE_CHECK_IN);
            }
            if (consumed != ConsumeOutcome.ACCEPTED) {
                log.info("Token for session {} became unusable during check-in by {}", session.id(), maskedAttendee);
                return VerificationResult.rejected(CheckInOutcome.TOKEN_EXPIRED);
            }
            record = new AttendanceRecord(session.id(), attendee, token.getId(), now, geofence.distanceMeters());
            if (!ledger.record(record)) {
                log.warn("Attendance record for session {} already present for {}", session.id(), maskedAttendee);
                return VerificationResult.rejected(CheckInOutcome.DUPLICATE_CHECK_IN);
            }
        } finally {
            ledger.release(session.id(), attendee);
        }
        // Token consumers are mirrored through the record rows, keyed by token id.
        persistence.insertRecord(record);

        AUDIT.info("check_in_accepted session={} attendee={} distance={}m submittedAt={}",
            session.id(), maskedAttendee, Math.round(geofence.distanceMeters()), command.submittedAt());
        return VerificationResult.accepted(record);
    }
}
