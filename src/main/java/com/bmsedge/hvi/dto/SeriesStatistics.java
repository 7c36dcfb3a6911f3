package com.bmsedge.hvi.dto;

import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * Quick table statistics for one series: population spread and the ids lying beyond 1.5 standard deviations.
 */
@Setter
@Getter
public class SeriesStatistics {
    private int count;
    private double mean;
    private double median;
    private double stdDev;
    private double min;
    private double max;
    private List<String> outlierIds = new ArrayList<>();

    public SeriesStatistics() {}

    public SeriesStatistics(int count, double mean, double median, double stdDev, double min, double max,
                            List<String> outlierIds) {
        this.count = count;
        this.mean = mean;
        this.median = median;
        this.stdDev = stdDev;
        this.min = min;
        this.max = max;
        this.outlierIds = outlierIds;
    }
}
