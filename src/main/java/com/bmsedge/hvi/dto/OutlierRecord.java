package com.bmsedge.hvi.dto;

import com.bmsedge.hvi.model.FiberParameter;
import com.bmsedge.hvi.model.OutlierSeverity;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.Setter;

@Setter
@Getter
public class OutlierRecord {
    private String sampleId;
    private FiberParameter parameter;
    private double value;
    private double zScore;
    private OutlierSeverity severity;

    public OutlierRecord() {}

    public OutlierRecord(String sampleId, FiberParameter parameter, double value, double zScore) {
        this.sampleId = sampleId;
        this.parameter = parameter;
        this.value = value;
        this.zScore = zScore;
        this.severity = OutlierSeverity.fromZScore(zScore);
    }

    @JsonProperty("zScore")
    public double getZScore() {
        return zScore;
    }

    @JsonProperty("zScore")
    public void setZScore(double zScore) {
        this.zScore = zScore;
    }

    public boolean isOutlier() {
        return severity != OutlierSeverity.NORMAL;
    }
}
