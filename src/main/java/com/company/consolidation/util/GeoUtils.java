package com.company.consolidation.util;

public class GeoUtils {

    public static final double EARTH_RADIUS_KM = 6371.0;

    /**
     * Great-circle distance between two points using the haversine formula
     *
     * @return Distance in kilometers, at most half the earth's circumference; NaN if any coordinate is NaN
     */
    public static double haversineDistanceKm(double lat1, double lon1, double lat2, double lon2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLon = Math.toRadians(lon2 - lon1);

        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
                * Math.sin(dLon / 2) * Math.sin(dLon / 2);
        // rounding can push a just past 1 for near-antipodal points
        a = Math.min(1.0, Math.max(0.0, a));

        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_KM * c;
    }

    /**
     * Length of the longest shared prefix, used to compare geohash cells
     */
    public static int commonPrefixLength(String a, String b) {
        if (a == null || b == null) return 0;

        int limit = Math.min(a.length(), b.length());
        int i = 0;
        while (i < limit && a.charAt(i) == b.charAt(i)) {
            i++;
        }
        return i;
    }

    /**
     * Geohash similarity: shared prefix relative to the longer hash.
     * NaN when both hashes are empty.
     */
    public static double geohashSimilarity(String geohash1, String geohash2) {
        int longest = Math.max(geohash1.length(), geohash2.length());
        if (longest == 0) return Double.NaN;
        return (double) commonPrefixLength(geohash1, geohash2) / longest;
    }

    /**
     * Exponential distance decay: 1.0 at zero distance, ~0.90 at 5 km and
     * ~0.50 at 35 km for a 50 km decay constant.
     */
    public static double distanceDecay(double distanceKm, double decayKm) {
        return Math.exp(-distanceKm / decayKm);
    }
}
