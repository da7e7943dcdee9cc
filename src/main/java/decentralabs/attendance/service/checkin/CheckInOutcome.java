package decentralabs.attendance.service.checkin;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Verification outcomes. Only ACCEPTED changes state; DUPLICATE_CHECK_IN, OUT_OF_RANGE and
 * TOKEN_EXPIRED are definitive and must not be retried as transient failures.
 */
public enum CheckInOutcome {
    ACCEPTED("accepted", false),
    TOKEN_NOT_FOUND("token_not_found", true),
    TOKEN_EXPIRED("token_expired", false),
    OUT_OF_RANGE("out_of_range", false),
    DUPLICATE_CHECK_IN("duplicate_check_in", false);

    private final String wireValue;
    private final boolean retryable;

    CheckInOutcome(String wireValue, boolean retryable) {
        this.wireValue = wireValue;
        this.retryable = retryable;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
