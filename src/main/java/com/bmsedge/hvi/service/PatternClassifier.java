package com.bmsedge.hvi.service;

import com.bmsedge.hvi.dto.PatternGroup;
import com.bmsedge.hvi.model.FiberParameter;
import com.bmsedge.hvi.model.Sample;
import com.bmsedge.hvi.util.DecimalReadings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Hierarchical auto-classification used to colour samples into homogeneity groups.
 *
 * Parameters are examined in {@link FiberParameter} priority order; the first whose population CV
 * reaches its threshold drives the grouping (yellowness is used when none does). Samples are then
 * split into four bands around that parameter's mean, half a standard deviation wide.
 *
 * Missing or unreadable values count as 0 here, whereas the report pipeline leaves them out.
 * Both behaviours are relied upon, so they stay separate.
 */
@Service
public class PatternClassifier {

    private static final Logger logger = LoggerFactory.getLogger(PatternClassifier.class);

    static final double ZONE_HALF_WIDTH = 0.5;

    // Blue, green, amber, red by zone index
    static final List<String> PALETTE = List.of("#3b82f6", "#10b981", "#f59e0b", "#ef4444");
    static final List<String> ZONE_NAMES = List.of("Superior", "Above Mean", "Below Mean", "Inferior");

    public List<PatternGroup> classify(List<Sample> samples) {
        if (samples == null || samples.isEmpty()) {
            return new ArrayList<>();
        }

        List<double[]> rows = samples.stream()
                .map(PatternClassifier::readingsOrZero)
                .collect(Collectors.toList());

        FiberParameter[] hierarchy = FiberParameter.values();
        FiberParameter selected = hierarchy[hierarchy.length - 1];
        double mean = 0;
        double std = 0;
        for (FiberParameter parameter : hierarchy) {
            double[] column = column(rows, parameter);
            double columnMean = populationMean(column);
            double columnStd = populationStdDev(column, columnMean);
            double cv = (columnStd / (columnMean == 0 ? 1 : columnMean)) * 100;

            if (cv >= parameter.getCvThreshold() || parameter == hierarchy[hierarchy.length - 1]) {
                selected = parameter;
                mean = columnMean;
                std = columnStd;
                logger.debug("Grouping by {} (cv={}%, threshold {}%)", parameter, cv, parameter.getCvThreshold());
                break;
            }
        }

        List<List<Integer>> zones = new ArrayList<>();
        for (int i = 0; i < ZONE_NAMES.size(); i++) {
            zones.add(new ArrayList<>());
        }
        for (int i = 0; i < rows.size(); i++) {
            zones.get(zoneOf(rows.get(i)[selected.ordinal()], mean, std)).add(i);
        }

        List<PatternGroup> groups = new ArrayList<>();
        for (int zone = 0; zone < zones.size(); zone++) {
            List<Integer> members = zones.get(zone);
            if (members.isEmpty()) {
                continue;
            }

            Map<FiberParameter, Double> averages = new EnumMap<>(FiberParameter.class);
            for (FiberParameter parameter : FiberParameter.values()) {
                double sum = members.stream().mapToDouble(i -> rows.get(i)[parameter.ordinal()]).sum();
                averages.put(parameter, sum / members.size());
            }

            List<String> sampleIds = members.stream()
                    .map(i -> samples.get(i).getId())
                    .collect(Collectors.toList());
            List<String> features = Arrays.asList(
                    selected.getClassifierLabel() + " " + ZONE_NAMES.get(zone),
                    "Focus: " + selected.getKey().toUpperCase());

            groups.add(new PatternGroup("G" + (zone + 1), "GROUP " + (zone + 1), selected, averages,
                    sampleIds, PALETTE.get(zone), features));
        }

        logger.info("Classified {} samples into {} groups by {}", samples.size(), groups.size(), selected);
        return groups;
    }

    /**
     * Zone index: 0 at or above mean + 0.5 sd, 1 from the mean up, 2 down to mean - 0.5 sd, 3 below.
     */
    static int zoneOf(double value, double mean, double std) {
        if (value >= mean + ZONE_HALF_WIDTH * std) {
            return 0;
        } else if (value >= mean) {
            return 1;
        } else if (value >= mean - ZONE_HALF_WIDTH * std) {
            return 2;
        } else {
            return 3;
        }
    }

    /**
     * All six readings indexed by {@link FiberParameter#ordinal()}, absent or malformed values as 0.
     */
    public static double[] readingsOrZero(Sample sample) {
        double[] values = new double[FiberParameter.values().length];
        for (FiberParameter parameter : FiberParameter.values()) {
            values[parameter.ordinal()] = readingOrZero(sample, parameter);
        }
        return values;
    }

    public static double readingOrZero(Sample sample, FiberParameter parameter) {
        return DecimalReadings.read(sample, parameter).orElse(0.0);
    }

    static double populationMean(double[] values) {
        return values.length == 0 ? 0 : Arrays.stream(values).sum() / values.length;
    }

    static double populationStdDev(double[] values, double mean) {
        if (values.length == 0) {
            return 0;
        }
        double variance = Arrays.stream(values).map(v -> (v - mean) * (v - mean)).sum() / values.length;
        return Math.sqrt(variance);
    }

    private static double[] column(List<double[]> rows, FiberParameter parameter) {
        return rows.stream().mapToDouble(row -> row[parameter.ordinal()]).toArray();
    }
}
