package org.mimir.report;

public enum Priority {
    HIGH,
    MEDIUM,
    LOW;

    /** Maps a projected improvement (fraction of requests) to a priority. */
    public static Priority forImprovement(double improvement) {
        if (improvement >= 0.20) return HIGH;
        if (improvement >= 0.10) return MEDIUM;
        return LOW;
    }
}
