package com.bmsedge.hvi.dto;

import com.bmsedge.hvi.model.PartitionType;
import lombok.Getter;
import lombok.Setter;

/**
 * A partition that produced no report, kept so callers can render an "insufficient data" state for it.
 */
@Setter
@Getter
public class SkippedPartition {
    private String partitionLabel;
    private PartitionType partitionType;
    private int initialCount;
    private String reason;

    public SkippedPartition() {}

    public SkippedPartition(String partitionLabel, PartitionType partitionType, int initialCount, String reason) {
        this.partitionLabel = partitionLabel;
        this.partitionType = partitionType;
        this.initialCount = initialCount;
        this.reason = reason;
    }
}
