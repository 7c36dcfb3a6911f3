package com.bmsedge.hvi.service;

import com.bmsedge.hvi.dto.DescriptiveStats;
import com.bmsedge.hvi.dto.OutlierRecord;
import com.bmsedge.hvi.dto.ParameterSeries;
import com.bmsedge.hvi.model.FiberParameter;
import com.bmsedge.hvi.model.OutlierSeverity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OutlierDetectorTest {

    private OutlierDetector detector;

    @BeforeEach
    void setUp() {
        detector = new OutlierDetector();
    }

    private DescriptiveStats stats(double mean, double stdDev) {
        return new DescriptiveStats(10, mean, stdDev, 0, 0, 0, 0, 0, 0);
    }

    @Test
    @DisplayName("Every reading gets a record with its z-score")
    void testDetectReturnsRecordPerReading() {
        // Arrange
        List<ParameterSeries.Point> points = new ArrayList<>();
        for (int i = 1; i <= 19; i++) {
            points.add(new ParameterSeries.Point("S" + i, 10.0));
        }
        points.add(new ParameterSeries.Point("S20", 20.0));
        ParameterSeries series = new ParameterSeries(FiberParameter.STR, points);
        DescriptiveStats stats = new DescriptiveStatsCalculator().calculate(series);

        // Act
        List<OutlierRecord> records = detector.detect(series, stats);

        // Assert
        assertEquals(20, records.size());
        OutlierRecord spike = records.get(19);
        assertEquals("S20", spike.getSampleId());
        assertEquals(FiberParameter.STR, spike.getParameter());
        assertEquals(9.5 / Math.sqrt(5.0), spike.getZScore(), 1e-9);
        assertEquals(OutlierSeverity.CRITICAL, spike.getSeverity());
        assertTrue(spike.isOutlier());
        assertEquals(OutlierSeverity.NORMAL, records.get(0).getSeverity());
        assertFalse(records.get(0).isOutlier());
    }

    @Test
    @DisplayName("Severity bands are exclusive at their lower bound")
    void testSeverityThresholds() {
        ParameterSeries series = new ParameterSeries(FiberParameter.MIC, Arrays.asList(
                new ParameterSeries.Point("A", 12.0),
                new ParameterSeries.Point("B", 12.5),
                new ParameterSeries.Point("C", 13.0),
                new ParameterSeries.Point("D", 6.5)));

        List<OutlierRecord> records = detector.detect(series, stats(10.0, 1.0));

        assertEquals(OutlierSeverity.NORMAL, records.get(0).getSeverity());
        assertEquals(OutlierSeverity.ALERT, records.get(1).getSeverity());
        assertEquals(OutlierSeverity.ALERT, records.get(2).getSeverity());
        assertEquals(OutlierSeverity.CRITICAL, records.get(3).getSeverity());
        assertEquals(-3.5, records.get(3).getZScore(), 1e-12);
    }

    @Test
    @DisplayName("Zero standard deviation yields zero z-scores")
    void testZeroStdDev() {
        ParameterSeries series = new ParameterSeries(FiberParameter.RD, Arrays.asList(
                new ParameterSeries.Point("A", 75.0),
                new ParameterSeries.Point("B", 75.0)));

        List<OutlierRecord> records = detector.detect(series, stats(75.0, 0.0));

        assertTrue(records.stream().allMatch(r -> r.getZScore() == 0.0));
        assertTrue(records.stream().noneMatch(OutlierRecord::isOutlier));
    }
}
