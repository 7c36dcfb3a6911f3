package com.bmsedge.hvi.service;

import com.bmsedge.hvi.dto.DescriptiveStats;
import com.bmsedge.hvi.dto.OutlierRecord;
import com.bmsedge.hvi.dto.ParameterSeries;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Z-score classification of every present reading of one parameter.
 */
@Service
public class OutlierDetector {

    public List<OutlierRecord> detect(ParameterSeries series, DescriptiveStats stats) {
        return series.getPoints().stream()
                .map(point -> new OutlierRecord(
                        point.getSampleId(),
                        series.getParameter(),
                        point.getValue(),
                        zScore(point.getValue(), stats)))
                .collect(Collectors.toList());
    }

    public double zScore(double value, DescriptiveStats stats) {
        if (stats.getStdDev() == 0) {
            return 0.0;
        }
        return (value - stats.getMean()) / stats.getStdDev();
    }
}
