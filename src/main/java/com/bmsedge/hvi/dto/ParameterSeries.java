package com.bmsedge.hvi.dto;

import com.bmsedge.hvi.model.FiberParameter;
import com.bmsedge.hvi.model.Sample;
import com.bmsedge.hvi.util.DecimalReadings;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Values of one parameter, in sample order, for the samples where that parameter was read.
 * Rebuilt for every analysis and never stored.
 */
@Getter
public class ParameterSeries {

    private final FiberParameter parameter;
    private final List<Point> points;

    public ParameterSeries(FiberParameter parameter, List<Point> points) {
        this.parameter = parameter;
        this.points = Collections.unmodifiableList(new ArrayList<>(points));
    }

    /**
     * Collect the present readings of {@code parameter}; samples without a usable reading are skipped.
     */
    public static ParameterSeries from(List<Sample> samples, FiberParameter parameter) {
        List<Point> points = new ArrayList<>();
        for (Sample sample : samples) {
            OptionalDouble value = DecimalReadings.read(sample, parameter);
            if (value.isPresent()) {
                points.add(new Point(sample.getId(), value.getAsDouble()));
            }
        }
        return new ParameterSeries(parameter, points);
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    public double[] values() {
        return points.stream().mapToDouble(Point::getValue).toArray();
    }

    @Getter
    public static class Point {
        private final String sampleId;
        private final double value;

        public Point(String sampleId, double value) {
            this.sampleId = sampleId;
            this.value = value;
        }
    }
}
