package com.bmsedge.hvi.dto;

import lombok.Getter;
import lombok.Setter;

@Setter
@Getter
public class HistogramBucket {
    // Lower edge of the bucket, two decimals
    private String label;
    private int count;
    private double percent;

    public HistogramBucket() {}

    public HistogramBucket(String label, int count, double percent) {
        this.label = label;
        this.count = count;
        this.percent = percent;
    }
}
