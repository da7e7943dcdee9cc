package decentralabs.attendance.dto.session;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class OpenSessionRequest {

    @NotNull
    private Double latitude;

    @NotNull
    private Double longitude;

    /**
     * Geofence radius. The configured default applies when omitted.
     */
    private Double radiusMeters;

    @NotNull
    private Long durationMinutes;

    @Size(max = 255)
    private String label;   // free text, e.g. course code
}
