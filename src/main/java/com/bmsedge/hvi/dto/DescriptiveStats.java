package com.bmsedge.hvi.dto;

import lombok.Getter;
import lombok.Setter;

@Setter
@Getter
public class DescriptiveStats {
    private int count;
    private double mean;
    private double stdDev;
    // Coefficient of variation, in percent
    private double cv;
    private double min;
    private double max;
    private double q1;
    private double q3;
    private double iqr;

    public DescriptiveStats() {}

    public DescriptiveStats(int count, double mean, double stdDev, double cv, double min, double max,
                            double q1, double q3, double iqr) {
        this.count = count;
        this.mean = mean;
        this.stdDev = stdDev;
        this.cv = cv;
        this.min = min;
        this.max = max;
        this.q1 = q1;
        this.q3 = q3;
        this.iqr = iqr;
    }
}
