package com.bmsedge.hvi.model;

public enum OutlierSeverity {
    NORMAL,
    ALERT,
    CRITICAL;

    public static final double ALERT_Z = 2.0;
    public static final double CRITICAL_Z = 3.0;

    public static OutlierSeverity fromZScore(double zScore) {
        double absZ = Math.abs(zScore);
        if (absZ > CRITICAL_Z) {
            return CRITICAL;
        } else if (absZ > ALERT_Z) {
            return ALERT;
        } else {
            return NORMAL;
        }
    }
}
