package com.bmsedge.hvi.dto;

import com.bmsedge.hvi.model.FiberParameter;
import lombok.Getter;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Outcome of the principal-component screening of one partition.
 */
@Getter
public class DominantFactorResult {

    private final Map<FiberParameter, Double> loadings;
    private final Map<FiberParameter, Double> scores;
    private final Map<FiberParameter, Double> weights;
    // Every parameter meeting the dominance rule
    private final Set<FiberParameter> flaggedParameters;
    // The flagged parameter that carries the dominant weight, null when none is flagged
    private final FiberParameter dominantParameter;

    public DominantFactorResult(Map<FiberParameter, Double> loadings, Map<FiberParameter, Double> scores,
                                Map<FiberParameter, Double> weights, Set<FiberParameter> flaggedParameters,
                                FiberParameter dominantParameter) {
        this.loadings = Collections.unmodifiableMap(loadings);
        this.scores = Collections.unmodifiableMap(scores);
        this.weights = Collections.unmodifiableMap(weights);
        this.flaggedParameters = Collections.unmodifiableSet(flaggedParameters);
        this.dominantParameter = dominantParameter;
    }

    public Optional<FiberParameter> dominant() {
        return Optional.ofNullable(dominantParameter);
    }

    public boolean isFlagged(FiberParameter parameter) {
        return flaggedParameters.contains(parameter);
    }

    public double weightOf(FiberParameter parameter) {
        return weights.getOrDefault(parameter, 0.0);
    }
}
