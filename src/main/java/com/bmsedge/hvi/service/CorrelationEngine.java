package com.bmsedge.hvi.service;

import com.bmsedge.hvi.model.FiberParameter;
import com.bmsedge.hvi.model.Sample;
import com.bmsedge.hvi.util.DecimalReadings;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Pearson correlation between every pair of parameters, self-pairs included.
 */
@Service
public class CorrelationEngine {

    /**
     * Each pair is computed over the samples where both readings are present. A pair without
     * common samples, or where one side has no variance, correlates at 0.
     */
    public Map<FiberParameter, Map<FiberParameter, Double>> calculate(List<Sample> samples) {
        Map<FiberParameter, Map<FiberParameter, Double>> matrix = new EnumMap<>(FiberParameter.class);
        for (FiberParameter first : FiberParameter.values()) {
            matrix.put(first, new EnumMap<>(FiberParameter.class));
        }

        FiberParameter[] parameters = FiberParameter.values();
        for (int i = 0; i < parameters.length; i++) {
            for (int j = i; j < parameters.length; j++) {
                double correlation = pairCorrelation(samples, parameters[i], parameters[j]);
                matrix.get(parameters[i]).put(parameters[j], correlation);
                matrix.get(parameters[j]).put(parameters[i], correlation);
            }
        }
        return matrix;
    }

    private double pairCorrelation(List<Sample> samples, FiberParameter first, FiberParameter second) {
        List<Double> x = new ArrayList<>();
        List<Double> y = new ArrayList<>();
        for (Sample sample : samples) {
            OptionalDouble a = DecimalReadings.read(sample, first);
            OptionalDouble b = DecimalReadings.read(sample, second);
            if (a.isPresent() && b.isPresent()) {
                x.add(a.getAsDouble());
                y.add(b.getAsDouble());
            }
        }
        return pearson(x, y);
    }

    public double pearson(List<Double> x, List<Double> y) {
        if (x.size() != y.size() || x.isEmpty()) {
            return 0.0;
        }

        int n = x.size();
        double meanX = x.stream().mapToDouble(Double::doubleValue).sum() / n;
        double meanY = y.stream().mapToDouble(Double::doubleValue).sum() / n;

        double numerator = 0;
        double sumSqX = 0;
        double sumSqY = 0;
        for (int i = 0; i < n; i++) {
            double diffX = x.get(i) - meanX;
            double diffY = y.get(i) - meanY;
            numerator += diffX * diffY;
            sumSqX += diffX * diffX;
            sumSqY += diffY * diffY;
        }

        double denominator = Math.sqrt(sumSqX * sumSqY);
        if (denominator == 0) {
            return 0.0;
        }

        // Rounding can push |r| a hair past 1
        return Math.max(-1.0, Math.min(1.0, numerator / denominator));
    }
}
