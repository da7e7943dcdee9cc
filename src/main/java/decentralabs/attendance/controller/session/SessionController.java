package decentralabs.attendance.controller.session;

import decentralabs.attendance.dto.checkin.AttendanceRecordResponse;
import decentralabs.attendance.dto.session.OpenSessionRequest;
import decentralabs.attendance.dto.session.SessionResponse;
import decentralabs.attendance.dto.session.TokenResponse;
import decentralabs.attendance.exception.InvalidSessionConfigException;
import decentralabs.attendance.security.CallerIdentity;
import decentralabs.attendance.service.checkin.AttendanceLedger;
import decentralabs.attendance.service.geo.GeoPoint;
import decentralabs.attendance.service.report.AttendanceReportService;
import decentralabs.attendance.service.session.AttendanceSession;
import decentralabs.attendance.service.session.SessionManager;
import decentralabs.attendance.service.token.AttendanceToken;
import jakarta.validation.Valid;
import java.security.Principal;
import java.time.Duration;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("${endpoint.sessions:/sessions}")
@RequiredArgsConstructor
public class SessionController {

    private final SessionManager sessionManager;
    private final AttendanceLedger ledger;
    private final AttendanceReportService reportService;

    @PostMapping
    public ResponseEntity<SessionResponse> openSession(
        @RequestBody @Valid OpenSessionRequest request,
        Principal principal
    ) {
        String owner = CallerIdentity.require(principal);
        AttendanceSession session = sessionManager.openSession(
            owner,
            request.getRadiusMeters(),
            new GeoPoint(request.getLatitude(), request.getLongitude()),
            durationOf(request.getDurationMinutes()),
            request.getLabel()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(SessionResponse.from(session, 0));
    }

    @GetMapping("/{sessionId}")
    public ResponseEntity<SessionResponse> getSession(@PathVariable String sessionId, Principal principal) {
        AttendanceSession session = sessionManager.getOwnedSession(sessionId, CallerIdentity.require(principal));
        return ResponseEntity.ok(SessionResponse.from(session, ledger.countBySession(session.id())));
    }

    @PostMapping("/{sessionId}/tokens")
    public ResponseEntity<TokenResponse> issueToken(@PathVariable String sessionId, Principal principal) {
        AttendanceToken token = sessionManager.issueToken(sessionId, CallerIdentity.require(principal));
        return ResponseEntity.ok(TokenResponse.from(token));
    }

    @GetMapping("/{sessionId}/tokens")
    public ResponseEntity<List<TokenResponse>> listTokens(@PathVariable String sessionId, Principal principal) {
        List<TokenResponse> tokens = sessionManager.listTokens(sessionId, CallerIdentity.require(principal)).stream()
            .map(TokenResponse::from)
            .toList();
        return ResponseEntity.ok(tokens);
    }

    @PostMapping("/{sessionId}/close")
    public ResponseEntity<SessionResponse> closeSession(@PathVariable String sessionId, Principal principal) {
        AttendanceSession session = sessionManager.closeSession(sessionId, CallerIdentity.require(principal));
        return ResponseEntity.ok(SessionResponse.from(session, ledger.countBySession(session.id())));
    }

    @PostMapping("/tokens/{tokenId}/revoke")
    public ResponseEntity<TokenResponse> revokeToken(@PathVariable String tokenId, Principal principal) {
        AttendanceToken token = sessionManager.revokeToken(tokenId, CallerIdentity.require(principal));
        return ResponseEntity.ok(TokenResponse.from(token));
    }

    @GetMapping("/{sessionId}/attendance")
    public ResponseEntity<List<AttendanceRecordResponse>> attendance(@PathVariable String sessionId, Principal principal) {
        List<AttendanceRecordResponse> records = reportService.sessionAttendance(sessionId, CallerIdentity.require(principal))
            .stream()
            .map(AttendanceRecordResponse::from)
            .toList();
        return ResponseEntity.ok(records);
    }

    @GetMapping(value = "/{sessionId}/attendance.csv", produces = "text/csv")
    public ResponseEntity<String> attendanceCsv(@PathVariable String sessionId, Principal principal) {
        String csv = reportService.sessionCsv(sessionId, CallerIdentity.require(principal));
        return ResponseEntity.ok()
            .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"attendance_" + sessionId + ".csv\"")
            .contentType(MediaType.parseMediaType("text/csv"))
            .body(csv);
    }

    private static Duration durationOf(long minutes) {
        try {
            return Duration.ofMinutes(minutes);
        } catch (ArithmeticException ex) {
            throw new InvalidSessionConfigException("duration", "Duration is out of range");
        }
    }
}
