package com.bmsedge.hvi.service;

import com.bmsedge.hvi.dto.PatternGroup;
import com.bmsedge.hvi.model.FiberParameter;
import com.bmsedge.hvi.model.Sample;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Plain-text technical narrative of a pattern classification run, for lab notes and exports.
 */
@Service
public class PatternReportWriter {

    private static final List<FiberParameter> VOLATILITY_CANDIDATES =
            List.of(FiberParameter.MIC, FiberParameter.LEN, FiberParameter.STR, FiberParameter.RD);

    @Autowired
    private PatternClassifier patternClassifier;

    public String write(List<Sample> samples) {
        List<PatternGroup> groups = patternClassifier.classify(samples);
        int total = samples == null ? 0 : samples.size();

        StringBuilder report = new StringBuilder();
        report.append("[ HVI PATTERN INTELLIGENCE - TECHNICAL REPORT ]\n");
        report.append("===========================================================\n\n");
        report.append("HIERARCHICAL EXAMINATION OF ").append(total).append(" OBSERVATIONS\n\n");

        if (!groups.isEmpty()) {
            report.append("DIAGNOSIS: the lot was segmented by statistical similarity patterns, in parameter priority order.\n\n");
            for (int i = 0; i < groups.size(); i++) {
                PatternGroup group = groups.get(i);
                double share = (group.getCount() / (double) total) * 100;
                report.append(String.format(Locale.ROOT, "%d. %s (%.1f%% of lot)\n", i + 1, group.getLabel(), share));
                report.append("   - FEATURE: ").append(String.join(" + ", group.getPatternFeatures())).append('\n');
                report.append(String.format(Locale.ROOT, "   - METRICS: MIC %.2f | LEN %.2f | STR %.1f\n\n",
                        group.averageOf(FiberParameter.MIC),
                        group.averageOf(FiberParameter.LEN),
                        group.averageOf(FiberParameter.STR)));
            }
        }

        if (total > 0) {
            Volatility driver = volatilityDriver(samples);
            report.append("VOLATILITY ANALYSIS:\n");
            report.append(String.format(Locale.ROOT,
                    "Parameter \"%s\" shows the highest variability pressure (CV: %.2f%%).\n",
                    driver.parameter.name(), driver.cv));
        }

        report.append("\nTECHNICAL CONCLUSION:\n");
        if (groups.size() > 1) {
            report.append("Lot heterogeneity identified. Classification followed technical sensitivity order "
                    + "(MIC > LEN > UNF > STR). ").append(groups.size()).append(" distinct behaviour cores were isolated.");
        } else {
            report.append("Lot is highly stable. No significant deviation was detected in any parameter of the priority order.");
        }
        return report.toString();
    }

    private Volatility volatilityDriver(List<Sample> samples) {
        return VOLATILITY_CANDIDATES.stream()
                .map(parameter -> {
                    double[] values = samples.stream()
                            .mapToDouble(sample -> PatternClassifier.readingOrZero(sample, parameter))
                            .toArray();
                    double mean = PatternClassifier.populationMean(values);
                    double std = PatternClassifier.populationStdDev(values, mean);
                    return new Volatility(parameter, (std / (mean == 0 ? 1 : mean)) * 100);
                })
                .max(Comparator.comparingDouble(v -> v.cv))
                .orElseThrow();
    }

    private static class Volatility {
        private final FiberParameter parameter;
        private final double cv;

        Volatility(FiberParameter parameter, double cv) {
            this.parameter = parameter;
            this.cv = cv;
        }
    }
}
