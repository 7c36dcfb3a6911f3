package com.bmsedge.hvi.service;

import com.bmsedge.hvi.dto.DescriptiveStats;
import com.bmsedge.hvi.dto.HistogramBucket;
import com.bmsedge.hvi.dto.ParameterSeries;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

@Service
public class DescriptiveStatsCalculator {

    public static final int HISTOGRAM_BUCKETS = 10;

    private static final QuartileStrategy QUARTILES = QuartileStrategy.NEAREST_RANK;

    public DescriptiveStats calculate(ParameterSeries series) {
        return calculate(series.values());
    }

    /**
     * Mean, sample standard deviation (n-1), CV in percent and nearest-rank quartiles.
     * The caller must have removed absent readings.
     */
    public DescriptiveStats calculate(double[] values) {
        int n = values.length;
        if (n == 0) {
            throw new IllegalArgumentException("Cannot describe an empty series");
        }

        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        double mean = sum / n;

        double[] sorted = Arrays.copyOf(values, n);
        Arrays.sort(sorted);

        double sumSquares = 0;
        for (double v : values) {
            sumSquares += (v - mean) * (v - mean);
        }
        int denominator = n > 1 ? n - 1 : 1;
        // a flat series must report exactly zero spread, not rounding residue of the mean
        double stdDev = sorted[0] == sorted[n - 1] ? 0.0 : Math.sqrt(sumSquares / denominator);
        double cv = mean == 0 ? 0 : (stdDev / mean) * 100;
        double q1 = QUARTILES.quantile(sorted, 0.25);
        double q3 = QUARTILES.quantile(sorted, 0.75);

        return new DescriptiveStats(n, mean, stdDev, cv, sorted[0], sorted[n - 1], q1, q3, q3 - q1);
    }

    /**
     * Equal-width histogram between min and max. A flat series uses a unit range so every
     * value lands in the first bucket.
     */
    public List<HistogramBucket> distribution(double[] values, int buckets) {
        List<HistogramBucket> distribution = new ArrayList<>();
        if (values.length == 0 || buckets <= 0) {
            return distribution;
        }

        double min = Arrays.stream(values).min().getAsDouble();
        double max = Arrays.stream(values).max().getAsDouble();
        double range = max - min == 0 ? 1 : max - min;
        double step = range / buckets;

        int[] counts = new int[buckets];
        for (double v : values) {
            int index = Math.min((int) Math.floor((v - min) / step), buckets - 1);
            counts[index]++;
        }

        for (int i = 0; i < buckets; i++) {
            String label = String.format(Locale.ROOT, "%.2f", min + i * step);
            double percent = (counts[i] / (double) values.length) * 100;
            distribution.add(new HistogramBucket(label, counts[i], percent));
        }
        return distribution;
    }
}
