package decentralabs.attendance.service.geo;

/**
 * WGS84 coordinate in decimal degrees. Components may be null when the device sent no fix.
 */
public record GeoPoint(Double latitude, Double longitude) {

    public static GeoPoint of(double latitude, double longitude) {
        return new GeoPoint(latitude, longitude);
    }

    public boolean isValid() {
        return latitude != null
            && longitude != null
            && Double.isFinite(latitude)
            && Double.isFinite(longitude)
            && latitude >= -90.0 && latitude <= 90.0
            && longitude >= -180.0 && longitude <= 180.0;
    }
}
