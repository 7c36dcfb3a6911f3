package com.bmsedge.hvi.dto;

import com.bmsedge.hvi.model.QualityStatus;
import lombok.Getter;
import lombok.Setter;

@Setter
@Getter
public class PredictionResult {
    private double predictedNextValue;
    private double confidenceLower;
    private double confidenceUpper;
    // Percent of the normal model's mass inside [confidenceLower, confidenceUpper]
    private double probabilityWithinRange;
    private double mae;
    private double rmse;
    private QualityStatus status;

    public PredictionResult() {}

    public PredictionResult(double predictedNextValue, double confidenceLower, double confidenceUpper,
                            double probabilityWithinRange, double mae, double rmse) {
        this.predictedNextValue = predictedNextValue;
        this.confidenceLower = confidenceLower;
        this.confidenceUpper = confidenceUpper;
        this.probabilityWithinRange = probabilityWithinRange;
        this.mae = mae;
        this.rmse = rmse;
        this.status = QualityStatus.fromProbability(probabilityWithinRange);
    }

    public boolean contains(double value) {
        return value >= confidenceLower && value <= confidenceUpper;
    }
}
