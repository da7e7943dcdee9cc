package decentralabs.attendance.service.geo;

/**
 * Outcome of a geofence test. {@code distanceMeters} is NaN when either point was not a usable fix.
 */
public record GeofenceResult(boolean within, double distanceMeters, boolean validFix) {

    static GeofenceResult invalidFix() {
        return new GeofenceResult(false, Double.NaN, false);
    }
}
