package com.bmsedge.hvi.dto;

import com.bmsedge.hvi.model.FiberParameter;
import lombok.Getter;
import lombok.Setter;

import java.util.List;
import java.util.Map;

/**
 * One homogeneity zone produced by the pattern classifier, with the colour suggested for its members.
 */
@Setter
@Getter
public class PatternGroup {
    private String id;
    private String label;
    private FiberParameter selectedParameter;
    private Map<FiberParameter, Double> averages;
    private int count;
    private List<String> sampleIds;
    private String color;
    private List<String> patternFeatures;

    public PatternGroup() {}

    public PatternGroup(String id, String label, FiberParameter selectedParameter, Map<FiberParameter, Double> averages,
                        List<String> sampleIds, String color, List<String> patternFeatures) {
        this.id = id;
        this.label = label;
        this.selectedParameter = selectedParameter;
        this.averages = averages;
        this.count = sampleIds.size();
        this.sampleIds = sampleIds;
        this.color = color;
        this.patternFeatures = patternFeatures;
    }

    public double averageOf(FiberParameter parameter) {
        return averages.getOrDefault(parameter, 0.0);
    }
}
