package com.bmsedge.hvi.exception;

/**
 * Raised when a partition holds no sample with any usable reading. It only concerns
 * that partition; other partitions of the same run are still analysed.
 */
public class InsufficientDataException extends RuntimeException {

    private final String partitionLabel;
    private final int validCount;

    public InsufficientDataException(String partitionLabel, int validCount) {
        super("Insufficient data for " + partitionLabel + " (n=" + validCount + "). At least 1 valid sample is required.");
        this.partitionLabel = partitionLabel;
        this.validCount = validCount;
    }

    public String getPartitionLabel() {
        return partitionLabel;
    }

    public int getValidCount() {
        return validCount;
    }
}
