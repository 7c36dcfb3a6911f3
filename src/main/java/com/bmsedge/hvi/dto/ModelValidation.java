package com.bmsedge.hvi.dto;

import lombok.Getter;
import lombok.Setter;

@Setter
@Getter
public class ModelValidation {
    private double maeGlobal;
    private double rmseGlobal;
    private double withinIntervalPercentage;
    private double averageStdDev;
    private boolean valid;

    public ModelValidation() {}

    public ModelValidation(double maeGlobal, double rmseGlobal, double withinIntervalPercentage,
                           double averageStdDev, boolean valid) {
        this.maeGlobal = maeGlobal;
        this.rmseGlobal = rmseGlobal;
        this.withinIntervalPercentage = withinIntervalPercentage;
        this.averageStdDev = averageStdDev;
        this.valid = valid;
    }
}
