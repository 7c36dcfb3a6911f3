package com.bmsedge.hvi.dto;

import com.bmsedge.hvi.model.FiberParameter;
import com.bmsedge.hvi.model.PartitionType;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Statistical quality-control report for one partition of a sample set.
 */
@Setter
@Getter
public class HviAnalysisReport {
    private LocalDateTime generatedAt;
    private String partitionLabel;
    private PartitionType partitionType;

    private int initialCount;
    private int cleanedCount;
    private int outlierCount;

    private List<ParameterAnalysis> parameterAnalyses = new ArrayList<>();
    private Map<FiberParameter, Map<FiberParameter, Double>> correlationMatrix;
    private ConsolidatedScore consolidated;
    private ModelValidation validation;
    private List<String> logs = new ArrayList<>();

    public HviAnalysisReport() {
        this.generatedAt = LocalDateTime.now();
    }

    public HviAnalysisReport(String partitionLabel, PartitionType partitionType) {
        this.partitionLabel = partitionLabel;
        this.partitionType = partitionType;
        this.generatedAt = LocalDateTime.now();
    }

    public Optional<ParameterAnalysis> analysisFor(FiberParameter parameter) {
        return parameterAnalyses.stream()
                .filter(a -> a.getParameter() == parameter)
                .findFirst();
    }
}
