package com.bmsedge.hvi.model;

import java.util.Arrays;

/**
 * The six HVI instrument readings, declared in classification priority order.
 * The CV threshold is the dispersion (in percent) at which the pattern classifier
 * considers the parameter discriminative enough to group by.
 */
public enum FiberParameter {

    MIC("mic", "MIC", "MICRONAIRE", 1.2),
    LEN("len", "LEN(UHML)", "LENGTH (LEN)", 1.0),
    UNF("unf", "UNF", "UNIFORMITY (UNF)", 0.8),
    STR("str", "STR", "STRENGTH (STR)", 1.5),
    RD("rd", "RD", "REFLECTANCE (RD)", 1.2),
    B("b", "+B", "YELLOWNESS (+B)", 2.5);

    private final String key;
    private final String displayName;
    private final String classifierLabel;
    private final double cvThreshold;

    FiberParameter(String key, String displayName, String classifierLabel, double cvThreshold) {
        this.key = key;
        this.displayName = displayName;
        this.classifierLabel = classifierLabel;
        this.cvThreshold = cvThreshold;
    }

    public String getKey() { return key; }

    public String getDisplayName() { return displayName; }

    public String getClassifierLabel() { return classifierLabel; }

    public double getCvThreshold() { return cvThreshold; }

    /**
     * Resolve a parameter from its key ("mic") or constant name ("MIC"), case-insensitive.
     */
    public static FiberParameter fromKey(String key) {
        if (key == null || key.trim().isEmpty()) {
            throw new IllegalArgumentException("Parameter key cannot be empty");
        }
        String trimmed = key.trim();
        return Arrays.stream(values())
                .filter(p -> p.key.equalsIgnoreCase(trimmed) || p.name().equalsIgnoreCase(trimmed))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown fiber parameter: " + key));
    }
}
