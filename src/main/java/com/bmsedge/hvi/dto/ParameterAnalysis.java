package com.bmsedge.hvi.dto;

import com.bmsedge.hvi.model.FiberParameter;
import lombok.Getter;
import lombok.Setter;

import java.util.List;

/**
 * Everything computed for one parameter inside one partition.
 */
@Setter
@Getter
public class ParameterAnalysis {
    private FiberParameter parameter;
    private String displayName;
    private DescriptiveStats stats;
    private List<OutlierRecord> outliers;
    private PredictionResult prediction;
    private List<HistogramBucket> distribution;
    // Raw value sequence in sample order
    private List<Double> trend;
    private double discriminantScore;
    private boolean dominant;

    public ParameterAnalysis() {}

    public ParameterAnalysis(FiberParameter parameter, DescriptiveStats stats, List<OutlierRecord> outliers,
                             PredictionResult prediction, List<HistogramBucket> distribution, List<Double> trend) {
        this.parameter = parameter;
        this.displayName = parameter.getDisplayName();
        this.stats = stats;
        this.outliers = outliers;
        this.prediction = prediction;
        this.distribution = distribution;
        this.trend = trend;
    }
}
