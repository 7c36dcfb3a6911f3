package com.bmsedge.hvi.service;

import com.bmsedge.hvi.dto.ParameterSeries;
import com.bmsedge.hvi.dto.SeriesStatistics;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Lightweight statistics for sample tables. Unlike {@link DescriptiveStatsCalculator} this uses the
 * population standard deviation and flags every item further than 1.5 standard deviations from the mean.
 */
@Service
public class SeriesStatisticsCalculator {

    static final double OUTLIER_SIGMA = 1.5;

    public SeriesStatistics calculate(List<ParameterSeries.Point> points) {
        int count = points.size();
        if (count == 0) {
            return new SeriesStatistics(0, 0, 0, 0, 0, 0, new ArrayList<>());
        }

        double[] values = points.stream().mapToDouble(ParameterSeries.Point::getValue).toArray();
        double mean = Arrays.stream(values).sum() / count;

        double[] sorted = Arrays.copyOf(values, count);
        Arrays.sort(sorted);
        int mid = count / 2;
        double median = count % 2 != 0 ? sorted[mid] : (sorted[mid - 1] + sorted[mid]) / 2;

        double variance = Arrays.stream(values).map(v -> (v - mean) * (v - mean)).sum() / count;
        double stdDev = Math.sqrt(variance);

        List<String> outlierIds = stdDev > 0
                ? points.stream()
                        .filter(p -> Math.abs(p.getValue() - mean) > OUTLIER_SIGMA * stdDev)
                        .map(ParameterSeries.Point::getSampleId)
                        .collect(Collectors.toList())
                : new ArrayList<>();

        return new SeriesStatistics(count, mean, median, stdDev, sorted[0], sorted[count - 1], outlierIds);
    }
}
