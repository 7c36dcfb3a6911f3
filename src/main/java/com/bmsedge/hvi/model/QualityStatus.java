package com.bmsedge.hvi.model;

/**
 * Status tier derived from an in-range probability expressed in percent.
 */
public enum QualityStatus {
    OK,
    ALERT,
    CRITICAL;

    private static final double OK_THRESHOLD = 90.0;
    private static final double ALERT_THRESHOLD = 70.0;

    public static QualityStatus fromProbability(double probabilityPercent) {
        if (probabilityPercent >= OK_THRESHOLD) {
            return OK;
        } else if (probabilityPercent >= ALERT_THRESHOLD) {
            return ALERT;
        } else {
            return CRITICAL;
        }
    }
}
