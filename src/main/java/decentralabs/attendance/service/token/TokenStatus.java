package decentralabs.attendance.service.token;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TokenStatus {
    ACTIVE("active"),
    EXPIRED("expired"),
    REVOKED("revoked");

    private final String wireValue;

    TokenStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }

    public boolean isTerminal() {
        return this != ACTIVE;
    }
}
