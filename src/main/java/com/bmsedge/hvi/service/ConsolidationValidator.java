package com.bmsedge.hvi.service;

import com.bmsedge.hvi.dto.ConsolidatedScore;
import com.bmsedge.hvi.dto.DominantFactorResult;
import com.bmsedge.hvi.dto.ModelValidation;
import com.bmsedge.hvi.dto.ParameterAnalysis;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Folds the per-parameter results of a partition into one weighted score and checks
 * whether the prediction model is trustworthy for that partition.
 */
@Service
public class ConsolidationValidator {

    static final double INTERVAL_BAND = 0.05;

    public ConsolidatedScore consolidate(List<ParameterAnalysis> analyses, DominantFactorResult factors) {
        double weightedMean = 0;
        double weightedProbability = 0;
        for (ParameterAnalysis analysis : analyses) {
            double weight = factors.weightOf(analysis.getParameter());
            weightedMean += analysis.getStats().getMean() * weight;
            weightedProbability += analysis.getPrediction().getProbabilityWithinRange() * weight;
        }
        return new ConsolidatedScore(
                weightedMean,
                weightedMean * (1 - INTERVAL_BAND),
                weightedMean * (1 + INTERVAL_BAND),
                weightedProbability);
    }

    /**
     * Weighted walk-forward errors plus the share of readings inside their own parameter's interval.
     * The model is considered valid while the global RMSE stays within the average standard deviation.
     */
    public ModelValidation validate(List<ParameterAnalysis> analyses, DominantFactorResult factors) {
        double mae = 0;
        double rmseSquared = 0;
        long within = 0;
        long total = 0;
        double stdDevSum = 0;

        for (ParameterAnalysis analysis : analyses) {
            double weight = factors.weightOf(analysis.getParameter());
            mae += analysis.getPrediction().getMae() * weight;
            rmseSquared += Math.pow(analysis.getPrediction().getRmse(), 2) * weight;
            stdDevSum += analysis.getStats().getStdDev();

            for (Double value : analysis.getTrend()) {
                if (analysis.getPrediction().contains(value)) {
                    within++;
                }
                total++;
            }
        }

        double rmse = Math.sqrt(rmseSquared);
        double averageStdDev = analyses.isEmpty() ? 0 : stdDevSum / analyses.size();
        double bound = averageStdDev == 0 ? 1 : averageStdDev;
        double withinPercentage = (within / (double) (total == 0 ? 1 : total)) * 100;

        return new ModelValidation(mae, rmse, withinPercentage, averageStdDev, rmse <= bound);
    }
}
