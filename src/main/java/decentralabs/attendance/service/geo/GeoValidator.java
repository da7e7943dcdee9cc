package decentralabs.attendance.service.geo;

import org.springframework.stereotype.Component;

/**
 * Great-circle distance and circular geofence membership.
 * Missing or out-of-range coordinates never pass.
 */
@Component
public class GeoValidator {

    /** IUGG mean Earth radius. */
    public static final double EARTH_RADIUS_METERS = 6_371_008.8;

    /**
     * Haversine distance between two valid points.
     *
     * @throws IllegalArgumentException if either point is not a valid coordinate
     */
    public double distanceMeters(GeoPoint from, GeoPoint to) {
        if (from == null || !from.isValid() || to == null || !to.isValid()) {
            throw new IllegalArgumentException("Invalid coordinate");
        }
        double phi1 = Math.toRadians(from.latitude());
        double phi2 = Math.toRadians(to.latitude());
        double deltaPhi = phi2 - phi1;
        double deltaLambda = Math.toRadians(to.longitude() - from.longitude());

        double a = Math.sin(deltaPhi / 2) * Math.sin(deltaPhi / 2)
            + Math.cos(phi1) * Math.cos(phi2) * Math.sin(deltaLambda / 2) * Math.sin(deltaLambda / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_METERS * c;
    }

    public GeofenceResult evaluate(GeoPoint origin, GeoPoint claimed, double radiusMeters) {
        if (origin == null || !origin.isValid() || claimed == null || !claimed.isValid()) {
            return GeofenceResult.invalidFix();
        }
        if (!Double.isFinite(radiusMeters) || radiusMeters <= 0) {
            return GeofenceResult.invalidFix();
        }
        double distance = distanceMeters(origin, claimed);
        return new GeofenceResult(distance <= radiusMeters, distance, true);
    }

    public boolean withinGeofence(GeoPoint origin, GeoPoint claimed, double radiusMeters) {
        return evaluate(origin, claimed, radiusMeters).within();
    }
}
