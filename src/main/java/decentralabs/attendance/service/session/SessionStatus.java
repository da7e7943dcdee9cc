package decentralabs.attendance.service.session;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SessionStatus {
    OPEN("open"),
    CLOSED("closed");

    private final String wireValue;

    SessionStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }
}
