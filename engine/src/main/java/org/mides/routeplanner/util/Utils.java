package org.mides.routeplanner.util;

import org.mides.routeplanner.model.Coordinate;

public class Utils {

    public static double round(double value, int decimals) {
        double scale = Math.pow(10, decimals);
        return Math.round(value * scale) / scale;
    }

    /** Great-circle distance in kilometers. */
    public static double haversineKm(Coordinate a, Coordinate b) {
        double lat1 = Math.toRadians(a.getLatitude());
        double lat2 = Math.toRadians(b.getLatitude());
        double dLat = lat2 - lat1;
        double dLon = Math.toRadians(b.getLongitude() - a.getLongitude());
        double sinLat = Math.sin(dLat / 2);
        double sinLon = Math.sin(dLon / 2);
        double h = sinLat * sinLat + Math.cos(lat1) * Math.cos(lat2) * sinLon * sinLon;
        return 2 * Constants.EARTH_RADIUS_KM * Math.asin(Math.min(1.0, Math.sqrt(h)));
    }

    /**
     * Driving time in minutes at {@code averageSpeedKmh}, inflated by
     * {@code bufferMultiplier} for stops and traffic.
     */
    public static double estimateTravelMinutes(double distanceKm, double averageSpeedKmh, double bufferMultiplier) {
        if (distanceKm <= 0 || averageSpeedKmh <= 0) {
            return 0;
        }
        return distanceKm / averageSpeedKmh * 60 * bufferMultiplier;
    }

    /** Short route label from the driver name: "Michael Schneider" becomes "MS". */
    public static String routeName(String driverName, int routeIndex) {
        if (driverName == null || driverName.isBlank()) {
            return "R" + (routeIndex + 1);
        }
        String[] words = driverName.trim().split("\\s+");
        if (words.length >= 2) {
            return ("" + words[0].charAt(0) + words[1].charAt(0)).toUpperCase();
        }
        return words[0].substring(0, Math.min(2, words[0].length())).toUpperCase();
    }

    public static String routeColor(int routeIndex) {
        return Constants.ROUTE_COLORS[routeIndex % Constants.ROUTE_COLORS.length];
    }
}
