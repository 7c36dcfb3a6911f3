package com.bmsedge.hvi.service;

import com.bmsedge.hvi.dto.ColorGroupSummary;
import com.bmsedge.hvi.dto.ParameterSeries;
import com.bmsedge.hvi.dto.SeriesStatistics;
import com.bmsedge.hvi.model.FiberParameter;
import com.bmsedge.hvi.model.MicronaireGrade;
import com.bmsedge.hvi.model.Sample;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Table-level statistics for a sample set: one quick summary per parameter and one per
 * classification colour.
 */
@Service
public class SampleSetSummaryService {

    static final double MIC_VARIABILITY_LIMIT = 0.4;
    static final double MIC_MEAN_LOW = 3.5;
    static final double MIC_MEAN_HIGH = 5.0;

    @Autowired
    private SeriesStatisticsCalculator seriesStatisticsCalculator;

    public Map<FiberParameter, SeriesStatistics> summarize(List<Sample> samples) {
        Map<FiberParameter, SeriesStatistics> summary = new EnumMap<>(FiberParameter.class);
        for (FiberParameter parameter : FiberParameter.values()) {
            summary.put(parameter, summarize(samples, parameter));
        }
        return summary;
    }

    public SeriesStatistics summarize(List<Sample> samples, FiberParameter parameter) {
        return seriesStatisticsCalculator.calculate(ParameterSeries.from(samples, parameter).getPoints());
    }

    /**
     * Summaries for each colour already assigned to samples; untagged samples are ignored.
     */
    public List<ColorGroupSummary> summarizeByColor(List<Sample> samples) {
        Map<String, List<Sample>> byColor = samples.stream()
                .filter(s -> s.getClassificationTag() != null && !s.getClassificationTag().trim().isEmpty())
                .collect(Collectors.groupingBy(s -> s.getClassificationTag().trim(),
                        LinkedHashMap::new, Collectors.toList()));

        List<ColorGroupSummary> summaries = new ArrayList<>();
        for (Map.Entry<String, List<Sample>> entry : byColor.entrySet()) {
            List<Sample> group = entry.getValue();

            Map<FiberParameter, Double> averages = new EnumMap<>(FiberParameter.class);
            for (FiberParameter parameter : FiberParameter.values()) {
                averages.put(parameter, summarize(group, parameter).getMean());
            }

            // The colour panel reads a missing micronaire as 0
            List<ParameterSeries.Point> micPoints = group.stream()
                    .map(s -> new ParameterSeries.Point(s.getId(), PatternClassifier.readingOrZero(s, FiberParameter.MIC)))
                    .collect(Collectors.toList());
            SeriesStatistics micStatistics = seriesStatisticsCalculator.calculate(micPoints);

            summaries.add(new ColorGroupSummary(
                    entry.getKey(),
                    group.size(),
                    averages,
                    micStatistics,
                    MicronaireGrade.classify(micStatistics.getMean()),
                    insightFor(micStatistics)));
        }
        return summaries;
    }

    ColorGroupSummary.Insight insightFor(SeriesStatistics micStatistics) {
        if (micStatistics.getStdDev() > MIC_VARIABILITY_LIMIT) {
            return ColorGroupSummary.Insight.HIGH_VARIABILITY;
        }
        if (micStatistics.getMean() < MIC_MEAN_LOW || micStatistics.getMean() > MIC_MEAN_HIGH) {
            return ColorGroupSummary.Insight.ATYPICAL_MEAN;
        }
        return ColorGroupSummary.Insight.STABLE;
    }
}
