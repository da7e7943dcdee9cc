package decentralabs.attendance.service.checkin;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Service;

/**
 * Session-scoped attendance records. A record is written once per attendee and session,
 * whichever token of the session was used.
 *
 * <p>A check-in first {@link #claim claims} the (session, attendee) slot, so at most one attempt per
 * attendee and session can reach the token store at a time. The claim is released after the
 * record is written or the attempt is rejected.
 */
@Service
public class AttendanceLedger {

    private final Map<String, Map<String, AttendanceRecord>> recordsBySession = new ConcurrentHashMap<>();
    private final Set<SlotKey> claims = ConcurrentHashMap.newKeySet();

    /**
     * Reserves the slot for an in-flight check-in.
     *
     * @return false when the attendee already has a record or another attempt holds the slot
     */
    public boolean claim(String sessionId, String attendeeIdentity) {
        SlotKey key = new SlotKey(sessionId, attendeeIdentity);
        if (!claims.add(key)) {
            return false;
        }
        // A competing attempt records before releasing, so its record is visible here.
        if (hasRecord(sessionId, attendeeIdentity)) {
            claims.remove(key);
            return false;
        }
        return true;
    }

    public void release(String sessionId, String attendeeIdentity) {
        claims.remove(new SlotKey(sessionId, attendeeIdentity));
    }

    /**
     * @return true when stored, false when the attendee already had a record for the session
     */
    public boolean record(AttendanceRecord record) {
        Map<String, AttendanceRecord> session = recordsBySession.computeIfAbsent(
            record.sessionId(), id -> new ConcurrentHashMap<>()
        );
        return session.putIfAbsent(record.attendeeIdentity(), record) == null;
    }

    public boolean hasRecord(String sessionId, String attendeeIdentity) {
        Map<String, AttendanceRecord> session = recordsBySession.get(sessionId);
        return session != null && session.containsKey(attendeeIdentity);
    }

    public Optional<AttendanceRecord> find(String sessionId, String attendeeIdentity) {
        Map<String, AttendanceRecord> session = recordsBySession.get(sessionId);
        return session == null ? Optional.empty() : Optional.ofNullable(session.get(attendeeIdentity));
    }

    public List<AttendanceRecord> findBySession(String sessionId) {
        Map<String, AttendanceRecord> session = recordsBySession.get(sessionId);
        if (session == null) {
            return List.of();
        }
        return session.values().stream()
            .sorted(Comparator.comparing(AttendanceRecord::attendeeIdentity))
            .toList();
    }

    public List<AttendanceRecord> findByAttendee(String attendeeIdentity) {
        return recordsBySession.values().stream()
            .map(session -> session.get(attendeeIdentity))
            .filter(Objects::nonNull)
            .sorted(Comparator.comparing(AttendanceRecord::verifiedAt).reversed())
            .toList();
    }

    public int countBySession(String sessionId) {
        Map<String, AttendanceRecord> session = recordsBySession.get(sessionId);
        return session == null ? 0 : session.size();
    }

    private record SlotKey(String sessionId, String attendeeIdentity) {
    }
}
