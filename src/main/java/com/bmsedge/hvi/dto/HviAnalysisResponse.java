package com.bmsedge.hvi.dto;

import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Setter
@Getter
public class HviAnalysisResponse {
    private List<HviAnalysisReport> reports;
    private List<SkippedPartition> skippedPartitions;
    private LocalDateTime generatedAt;

    public HviAnalysisResponse() {
        this.reports = new ArrayList<>();
        this.skippedPartitions = new ArrayList<>();
        this.generatedAt = LocalDateTime.now();
    }

    public HviAnalysisResponse(List<HviAnalysisReport> reports, List<SkippedPartition> skippedPartitions) {
        this.reports = reports;
        this.skippedPartitions = skippedPartitions;
        this.generatedAt = LocalDateTime.now();
    }
}
