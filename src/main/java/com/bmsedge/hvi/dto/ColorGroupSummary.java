package com.bmsedge.hvi.dto;

import com.bmsedge.hvi.model.FiberParameter;
import com.bmsedge.hvi.model.MicronaireGrade;
import lombok.Getter;
import lombok.Setter;

import java.util.Map;

@Setter
@Getter
public class ColorGroupSummary {
    private String color;
    private int count;
    private Map<FiberParameter, Double> averages;
    private SeriesStatistics micStatistics;
    private MicronaireGrade micGrade;
    private Insight insight;

    public ColorGroupSummary() {}

    public ColorGroupSummary(String color, int count, Map<FiberParameter, Double> averages,
                             SeriesStatistics micStatistics, MicronaireGrade micGrade, Insight insight) {
        this.color = color;
        this.count = count;
        this.averages = averages;
        this.micStatistics = micStatistics;
        this.micGrade = micGrade;
        this.insight = insight;
    }

    public enum Insight {
        HIGH_VARIABILITY,
        ATYPICAL_MEAN,
        STABLE
    }
}
