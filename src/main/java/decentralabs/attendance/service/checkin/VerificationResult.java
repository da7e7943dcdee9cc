package decentralabs.attendance.service.checkin;

public record VerificationResult(CheckInOutcome outcome, AttendanceRecord record) {

    public static VerificationResult accepted(AttendanceRecord record) {
        return new VerificationResult(CheckInOutcome.ACCEPTED, record);
    }

    public static VerificationResult rejected(CheckInOutcome outcome) {
        return new VerificationResult(outcome, null);
    }

    public boolean isAccepted() {
        return outcome == CheckInOutcome.ACCEPTED;
    }
}
