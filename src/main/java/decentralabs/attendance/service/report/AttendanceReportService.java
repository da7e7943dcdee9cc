package decentralabs.attendance.service.report;

import decentralabs.attendance.service.checkin.AttendanceLedger;
import decentralabs.attendance.service.checkin.AttendanceRecord;
import decentralabs.attendance.service.session.AttendanceSession;
import decentralabs.attendance.service.session.SessionManager;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Attendance listings for session owners and attendees, plus a CSV export of a session.
 */
@Service
@RequiredArgsConstructor
public class AttendanceReportService {

    private static final String CSV_HEADER = "attendee,verified_at,distance_meters";

    private final SessionManager sessionManager;
    private final AttendanceLedger ledger;

    public List<AttendanceRecord> sessionAttendance(String sessionId, String requester) {
        AttendanceSession session = sessionManager.getOwnedSession(sessionId, requester);
        return ledger.findBySession(session.id());
    }

    public List<AttendanceRecord> attendeeHistory(String attendeeIdentity) {
        return ledger.findByAttendee(attendeeIdentity);
    }

    public String sessionCsv(String sessionId, String requester) {
        List<AttendanceRecord> records = sessionAttendance(sessionId, requester);
        StringBuilder csv = new StringBuilder(CSV_HEADER).append("\r\n");
        for (AttendanceRecord record : records) {
            csv.append(escape(record.attendeeIdentity())).append(',')
                .append(record.verifiedAt()).append(',')
                .append(String.format(Locale.ROOT, "%.1f", record.distanceMeters()))
                .append("\r\n");
        }
        return csv.toString();
    }

    /**
     * RFC 4180 quoting, and a leading quote for values a spreadsheet would evaluate as formulas.
     */
    static String escape(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        String safe = value;
        char first = safe.charAt(0);
        if (first == '=' || first == '+' || first == '-' || first == '@') {
            safe = "'" + safe;
        }
        if (safe.contains(",") || safe.contains("\"") || safe.contains("\n") || safe.contains("\r")) {
            return "\"" + safe.replace("\"", "\"\"") + "\"";
        }
        return safe;
    }
}
