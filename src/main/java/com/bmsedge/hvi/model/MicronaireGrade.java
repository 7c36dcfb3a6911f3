package com.bmsedge.hvi.model;

/**
 * Commercial grade bands for micronaire readings.
 */
public enum MicronaireGrade {

    PREMIUM("Premium", "#10b981"),
    REGULAR("Regular", "#f59e0b"),
    OUT_OF_STANDARD("Out of Standard", "#ef4444");

    private final String label;
    private final String color;

    MicronaireGrade(String label, String color) {
        this.label = label;
        this.color = color;
    }

    public String getLabel() { return label; }

    public String getColor() { return color; }

    public static MicronaireGrade classify(double mic) {
        if (mic >= 3.8 && mic <= 4.9) {
            return PREMIUM;
        } else if ((mic >= 3.5 && mic < 3.8) || (mic > 4.9 && mic <= 5.2)) {
            return REGULAR;
        } else {
            return OUT_OF_STANDARD;
        }
    }
}
