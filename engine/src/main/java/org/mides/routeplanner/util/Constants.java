package org.mides.routeplanner.util;

public final class Constants {

    /* Scales meters before they become integer solver costs */
    public static final int DISTANCE_MULTIPLIER = 1;

    public static final double EARTH_RADIUS_KM = 6371.0;

    /* Map colours handed out by route index */
    public static final String[] ROUTE_COLORS = {
        "#9b59b6", "#e91e63", "#00bcd4", "#4caf50", "#ff9800",
        "#2196f3", "#f44336", "#009688", "#ffc107", "#795548",
        "#607d8b", "#9c27b0", "#ff5722", "#00acc1", "#8bc34a"
    };

    private Constants() {
    }
}
