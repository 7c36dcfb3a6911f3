package com.bmsedge.hvi.service;

import com.bmsedge.hvi.dto.ConsolidatedScore;
import com.bmsedge.hvi.dto.DescriptiveStats;
import com.bmsedge.hvi.dto.DominantFactorResult;
import com.bmsedge.hvi.dto.ModelValidation;
import com.bmsedge.hvi.dto.ParameterAnalysis;
import com.bmsedge.hvi.dto.PredictionResult;
import com.bmsedge.hvi.model.FiberParameter;
import com.bmsedge.hvi.model.QualityStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConsolidationValidatorTest {

    private ConsolidationValidator validator;
    private List<ParameterAnalysis> analyses;
    private DominantFactorResult factors;

    @BeforeEach
    void setUp() {
        validator = new ConsolidationValidator();

        ParameterAnalysis mic = analysis(FiberParameter.MIC, 4.0, 0.2,
                new PredictionResult(4.0, 3.608, 4.392, 95.0, 0.1, 0.2),
                Arrays.asList(4.0, 4.5, 3.9, 3.5));
        ParameterAnalysis len = analysis(FiberParameter.LEN, 1.1, 0.05,
                new PredictionResult(1.1, 1.002, 1.198, 60.0, 0.02, 0.04),
                Arrays.asList(1.1, 1.15));
        analyses = Arrays.asList(mic, len);

        Map<FiberParameter, Double> weights = new EnumMap<>(FiberParameter.class);
        weights.put(FiberParameter.MIC, 0.4);
        weights.put(FiberParameter.LEN, 0.6);
        factors = new DominantFactorResult(new EnumMap<>(FiberParameter.class), new EnumMap<>(FiberParameter.class),
                weights, EnumSet.of(FiberParameter.MIC), FiberParameter.MIC);
    }

    private ParameterAnalysis analysis(FiberParameter parameter, double mean, double stdDev,
                                       PredictionResult prediction, List<Double> trend) {
        DescriptiveStats stats = new DescriptiveStats(trend.size(), mean, stdDev, stdDev / mean * 100,
                0, 0, 0, 0, 0);
        return new ParameterAnalysis(parameter, stats, Collections.emptyList(), prediction,
                Collections.emptyList(), trend);
    }

    @Test
    @DisplayName("Weighted mean and probability with a 5% band")
    void testConsolidate() {
        // Act
        ConsolidatedScore score = validator.consolidate(analyses, factors);

        // Assert
        assertEquals(2.26, score.getWeightedMean(), 1e-9);
        assertEquals(2.26 * 0.95, score.getIntervalLower(), 1e-9);
        assertEquals(2.26 * 1.05, score.getIntervalUpper(), 1e-9);
        assertEquals(74.0, score.getProbability(), 1e-9);
        assertEquals(QualityStatus.ALERT, score.getStatus());
    }

    @Test
    @DisplayName("Global errors, interval coverage and validity flag")
    void testValidate() {
        // Act
        ModelValidation validation = validator.validate(analyses, factors);

        // Assert
        assertEquals(0.052, validation.getMaeGlobal(), 1e-9);
        assertEquals(Math.sqrt(0.01696), validation.getRmseGlobal(), 1e-9);
        assertEquals(0.125, validation.getAverageStdDev(), 1e-12);
        assertEquals(4.0 / 6.0 * 100, validation.getWithinIntervalPercentage(), 1e-9);
        // 0.1302 is above the average standard deviation of 0.125
        assertFalse(validation.isValid());
    }

    @Test
    @DisplayName("Zero spread everywhere falls back to a unit bound")
    void testValidateUnitBound() {
        ParameterAnalysis flat = analysis(FiberParameter.RD, 75.0, 0.0,
                new PredictionResult(75.0, 75.0, 75.0, 0.0, 0.0, 0.0),
                Arrays.asList(75.0, 75.0));
        Map<FiberParameter, Double> weights = new EnumMap<>(FiberParameter.class);
        weights.put(FiberParameter.RD, 1.0);
        DominantFactorResult single = new DominantFactorResult(new EnumMap<>(FiberParameter.class),
                new EnumMap<>(FiberParameter.class), weights, EnumSet.noneOf(FiberParameter.class), null);

        ModelValidation validation = validator.validate(Collections.singletonList(flat), single);

        assertEquals(0.0, validation.getAverageStdDev());
        assertEquals(100.0, validation.getWithinIntervalPercentage(), 1e-12);
        assertTrue(validation.isValid());
    }

    @Test
    @DisplayName("No analyses gives an empty, valid validation")
    void testValidateEmpty() {
        DominantFactorResult none = new DominantFactorResult(new EnumMap<>(FiberParameter.class),
                new EnumMap<>(FiberParameter.class), new EnumMap<>(FiberParameter.class),
                EnumSet.noneOf(FiberParameter.class), null);

        ModelValidation validation = validator.validate(Collections.emptyList(), none);

        assertEquals(0.0, validation.getRmseGlobal());
        assertEquals(0.0, validation.getWithinIntervalPercentage());
        assertTrue(validation.isValid());
    }
}
