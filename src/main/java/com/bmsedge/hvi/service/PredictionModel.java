package com.bmsedge.hvi.service;

import com.bmsedge.hvi.dto.DescriptiveStats;
import com.bmsedge.hvi.dto.PredictionResult;
import org.springframework.stereotype.Service;

/**
 * Normal-model projection of a parameter: 95% interval, in-range probability and
 * walk-forward error of the running mean used as a predictor.
 */
@Service
public class PredictionModel {

    // Fixed 95% quantile, applied regardless of sample size
    public static final double Z_95 = 1.96;

    public PredictionResult predict(double[] values, DescriptiveStats stats) {
        int n = values.length;
        double margin = Z_95 * stats.getStdDev();
        double lower = stats.getMean() - margin;
        double upper = stats.getMean() + margin;
        double probability = (normalCdf(upper, stats.getMean(), stats.getStdDev())
                - normalCdf(lower, stats.getMean(), stats.getStdDev())) * 100;

        double absoluteError = 0;
        double squaredError = 0;
        double runningSum = 0;
        for (int i = 1; i < n; i++) {
            runningSum += values[i - 1];
            double error = Math.abs(values[i] - runningSum / i);
            absoluteError += error;
            squaredError += error * error;
        }
        int steps = n > 1 ? n - 1 : 1;

        return new PredictionResult(
                stats.getMean(),
                lower,
                upper,
                probability,
                absoluteError / steps,
                Math.sqrt(squaredError / steps));
    }

    /**
     * Normal CDF by the Zelen &amp; Severo rational approximation (Abramowitz-Stegun 26.2.17),
     * absolute error below 2e-7. A non-positive standard deviation is treated as a step at the mean.
     */
    public static double normalCdf(double x, double mean, double stdDev) {
        if (stdDev <= 0) {
            return x >= mean ? 1.0 : 0.0;
        }
        double z = (x - mean) / stdDev;
        double t = 1 / (1 + 0.2316419 * Math.abs(z));
        double d = 0.3989423 * Math.exp(-z * z / 2);
        double p = d * t * (0.3193815 + t * (-0.3565638 + t * (1.7814779 + t * (-1.821256 + t * 1.330274))));
        return z >= 0 ? 1 - p : p;
    }
}
