package com.bmsedge.hvi.dto;

import com.bmsedge.hvi.model.QualityStatus;
import lombok.Getter;
import lombok.Setter;

@Setter
@Getter
public class ConsolidatedScore {
    private double weightedMean;
    private double intervalLower;
    private double intervalUpper;
    private double probability;
    private QualityStatus status;

    public ConsolidatedScore() {}

    public ConsolidatedScore(double weightedMean, double intervalLower, double intervalUpper, double probability) {
        this.weightedMean = weightedMean;
        this.intervalLower = intervalLower;
        this.intervalUpper = intervalUpper;
        this.probability = probability;
        this.status = QualityStatus.fromProbability(probability);
    }
}
