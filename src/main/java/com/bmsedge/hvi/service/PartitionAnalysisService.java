package com.bmsedge.hvi.service;

import com.bmsedge.hvi.dto.DescriptiveStats;
import com.bmsedge.hvi.dto.DominantFactorResult;
import com.bmsedge.hvi.dto.HviAnalysisReport;
import com.bmsedge.hvi.dto.OutlierRecord;
import com.bmsedge.hvi.dto.ParameterAnalysis;
import com.bmsedge.hvi.dto.ParameterSeries;
import com.bmsedge.hvi.dto.PredictionResult;
import com.bmsedge.hvi.exception.InsufficientDataException;
import com.bmsedge.hvi.model.FiberParameter;
import com.bmsedge.hvi.model.PartitionType;
import com.bmsedge.hvi.model.Sample;
import com.bmsedge.hvi.util.DecimalReadings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Runs the full statistical pipeline over one partition of samples and assembles its report.
 */
@Service
public class PartitionAnalysisService {

    private static final Logger logger = LoggerFactory.getLogger(PartitionAnalysisService.class);

    @Autowired
    private DescriptiveStatsCalculator statsCalculator;

    @Autowired
    private OutlierDetector outlierDetector;

    @Autowired
    private PredictionModel predictionModel;

    @Autowired
    private DominantFactorSelector dominantFactorSelector;

    @Autowired
    private CorrelationEngine correlationEngine;

    @Autowired
    private ConsolidationValidator consolidationValidator;

    /**
     * @throws InsufficientDataException when no sample of the partition has a usable reading
     */
    public HviAnalysisReport analyze(String label, PartitionType type, List<Sample> samples) {
        HviAnalysisReport report = new HviAnalysisReport(label, type);
        List<String> logs = report.getLogs();

        // A sample is kept when at least one parameter parses
        List<Sample> validSamples = samples.stream()
                .filter(this::hasAnyReading)
                .collect(Collectors.toList());
        int n = validSamples.size();
        report.setInitialCount(samples.size());
        report.setCleanedCount(n);
        logs.add(String.format("Starting analysis for %s. Valid samples: %d/%d", label, n, samples.size()));

        if (n < 1) {
            throw new InsufficientDataException(label, n);
        }

        Map<FiberParameter, DescriptiveStats> statsByParameter = new EnumMap<>(FiberParameter.class);
        List<ParameterAnalysis> analyses = new ArrayList<>();

        for (FiberParameter parameter : FiberParameter.values()) {
            ParameterSeries series = ParameterSeries.from(validSamples, parameter);
            if (series.isEmpty()) {
                logs.add("Parameter " + parameter.getDisplayName() + " skipped: no readings in this group");
                continue;
            }

            double[] values = series.values();
            DescriptiveStats stats = statsCalculator.calculate(values);
            List<OutlierRecord> outliers = outlierDetector.detect(series, stats);
            PredictionResult prediction = predictionModel.predict(values, stats);

            ParameterAnalysis analysis = new ParameterAnalysis(
                    parameter,
                    stats,
                    outliers,
                    prediction,
                    statsCalculator.distribution(values, DescriptiveStatsCalculator.HISTOGRAM_BUCKETS),
                    Arrays.stream(values).boxed().collect(Collectors.toList()));
            analyses.add(analysis);
            statsByParameter.put(parameter, stats);

            logger.debug("{} {}: n={}, mean={}, sd={}, cv={}%", label, parameter, stats.getCount(),
                    stats.getMean(), stats.getStdDev(), stats.getCv());
        }

        DominantFactorResult factors = dominantFactorSelector.select(validSamples, statsByParameter);
        for (ParameterAnalysis analysis : analyses) {
            analysis.setDiscriminantScore(factors.getScores().getOrDefault(analysis.getParameter(), 0.0));
            analysis.setDominant(factors.isFlagged(analysis.getParameter()));
        }
        if (factors.getFlaggedParameters().isEmpty()) {
            logs.add("No dominant parameter: equal weights applied");
        } else {
            for (FiberParameter parameter : factors.getFlaggedParameters()) {
                logs.add("Critical/dominant parameter: " + parameter.getDisplayName());
            }
        }

        report.setParameterAnalyses(analyses);
        report.setOutlierCount(countOutlierSamples(analyses));
        report.setCorrelationMatrix(correlationEngine.calculate(validSamples));
        report.setConsolidated(consolidationValidator.consolidate(analyses, factors));
        report.setValidation(consolidationValidator.validate(analyses, factors));

        logs.add(String.format(Locale.ROOT, "Model %s: global RMSE %.4f against average std dev %.4f",
                report.getValidation().isValid() ? "valid" : "not valid",
                report.getValidation().getRmseGlobal(),
                report.getValidation().getAverageStdDev()));

        logger.info("Analysed {}: {} valid of {}, {} outlier samples, status {}",
                label, n, samples.size(), report.getOutlierCount(), report.getConsolidated().getStatus());
        return report;
    }

    private boolean hasAnyReading(Sample sample) {
        return Arrays.stream(FiberParameter.values())
                .anyMatch(parameter -> DecimalReadings.isPresent(sample, parameter));
    }

    // Samples with at least one reading beyond |z| = 2
    private int countOutlierSamples(List<ParameterAnalysis> analyses) {
        return (int) analyses.stream()
                .flatMap(analysis -> analysis.getOutliers().stream())
                .filter(OutlierRecord::isOutlier)
                .map(OutlierRecord::getSampleId)
                .distinct()
                .count();
    }
}
