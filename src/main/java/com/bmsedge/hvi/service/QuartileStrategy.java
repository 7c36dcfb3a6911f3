package com.bmsedge.hvi.service;

/**
 * Rule used to pick quartiles out of a sorted series.
 */
public enum QuartileStrategy {

    /**
     * Positional pick {@code sorted[floor(n * p)]}, no interpolation.
     */
    NEAREST_RANK {
        @Override
        public double quantile(double[] sorted, double p) {
            if (sorted.length == 0) {
                return 0.0;
            }
            int index = (int) Math.floor(sorted.length * p);
            index = Math.max(0, Math.min(index, sorted.length - 1));
            return sorted[index];
        }
    };

    public abstract double quantile(double[] sorted, double p);
}
