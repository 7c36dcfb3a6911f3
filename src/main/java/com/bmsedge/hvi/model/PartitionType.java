package com.bmsedge.hvi.model;

import java.util.function.Function;

/**
 * How a sample set is split before analysis. Each type knows which sample attribute
 * it groups by, how samples lacking that attribute are labelled and how its
 * reports are labelled.
 */
public enum PartitionType {

    CONSOLIDATED(sample -> "ALL", "ALL", "GENERAL REPORT (CONSOLIDATED)"),
    MACHINE(Sample::getMachineId, "UNIDENTIFIED MACHINE", "MACHINE: "),
    COLOR(Sample::getClassificationTag, "UNCLASSIFIED", "QUALITY: ");

    /**
     * Key of the bucket for samples without the grouping attribute. Real keys are trimmed
     * and non-empty, so no supplied value can land in this bucket.
     */
    public static final String MISSING_KEY = "";

    private final Function<Sample, String> keyExtractor;
    private final String missingLabel;
    private final String labelPrefix;

    PartitionType(Function<Sample, String> keyExtractor, String missingLabel, String labelPrefix) {
        this.keyExtractor = keyExtractor;
        this.missingLabel = missingLabel;
        this.labelPrefix = labelPrefix;
    }

    /**
     * Partition key of a sample, with blank or missing attributes mapped to {@link #MISSING_KEY}.
     */
    public String keyOf(Sample sample) {
        String key = keyExtractor.apply(sample);
        if (key == null || key.trim().isEmpty()) {
            return MISSING_KEY;
        }
        return key.trim();
    }

    public String labelFor(String key) {
        if (this == CONSOLIDATED) {
            return labelPrefix;
        }
        if (MISSING_KEY.equals(key)) {
            return labelPrefix + missingLabel;
        }
        return labelPrefix + key;
    }
}
