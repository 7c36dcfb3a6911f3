package com.bmsedge.hvi.service;

import com.bmsedge.hvi.dto.DescriptiveStats;
import com.bmsedge.hvi.dto.DominantFactorResult;
import com.bmsedge.hvi.model.FiberParameter;
import com.bmsedge.hvi.model.Sample;
import com.bmsedge.hvi.util.DecimalReadings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Random;
import java.util.Set;

/**
 * Finds the parameter that best discriminates a sample population.
 *
 * The first principal component of the standardized readings is approximated with a fixed
 * number of power iterations. Each parameter is then scored by the magnitude of its loading
 * divided by its relative spread, so a parameter that drives the main axis while staying tight
 * around its own mean ranks highest.
 */
@Service
public class DominantFactorSelector {

    private static final Logger logger = LoggerFactory.getLogger(DominantFactorSelector.class);

    public static final long DEFAULT_SEED = 42L;
    static final int POWER_ITERATIONS = 10;
    static final double DOMINANCE_FACTOR = 1.25;
    static final double CV_FLOOR = 0.001;
    static final double DOMINANT_WEIGHT = 0.40;

    @Value("${hvi.analysis.power-iteration-seed:42}")
    private long seed = DEFAULT_SEED;

    public DominantFactorResult select(List<Sample> samples, Map<FiberParameter, DescriptiveStats> statsByParameter) {
        return select(samples, statsByParameter, seed);
    }

    /**
     * @param samples          valid samples of the partition
     * @param statsByParameter statistics of every parameter present in the partition
     * @param seed             seed of the power-iteration start vector
     */
    public DominantFactorResult select(List<Sample> samples, Map<FiberParameter, DescriptiveStats> statsByParameter,
                                       long seed) {
        List<FiberParameter> parameters = new ArrayList<>(statsByParameter.keySet());
        parameters.sort(Comparator.naturalOrder());
        int k = parameters.size();

        Map<FiberParameter, Double> loadings = new EnumMap<>(FiberParameter.class);
        Map<FiberParameter, Double> scores = new EnumMap<>(FiberParameter.class);
        if (k == 0) {
            return new DominantFactorResult(loadings, scores, new EnumMap<>(FiberParameter.class),
                    EnumSet.noneOf(FiberParameter.class), null);
        }

        double[][] standardized = standardize(samples, parameters, statsByParameter);
        double[][] covariance = covariance(standardized, k);
        double[] firstComponent = powerIteration(covariance, seed);

        double scoreSum = 0;
        for (int i = 0; i < k; i++) {
            FiberParameter parameter = parameters.get(i);
            double cv = statsByParameter.get(parameter).getCv();
            double divisor = cv / 100 == 0 ? CV_FLOOR : cv / 100;
            double score = Math.abs(firstComponent[i]) / divisor;
            loadings.put(parameter, firstComponent[i]);
            scores.put(parameter, score);
            scoreSum += score;
        }
        double meanScore = scoreSum / k;
        double medianCv = parameters.stream()
                .mapToDouble(p -> statsByParameter.get(p).getCv())
                .sorted()
                .toArray()[k / 2];

        // Every qualifier is flagged; the last one in priority order takes the dominant weight
        Set<FiberParameter> flagged = EnumSet.noneOf(FiberParameter.class);
        FiberParameter dominant = null;
        if (k > 1 && meanScore > 0) {
            for (FiberParameter parameter : parameters) {
                boolean qualifies = scores.get(parameter) >= DOMINANCE_FACTOR * meanScore
                        && statsByParameter.get(parameter).getCv() <= medianCv;
                if (qualifies) {
                    flagged.add(parameter);
                    dominant = parameter;
                }
            }
        }

        logger.debug("Principal loadings {} scores {} flagged {} weighted {}", loadings, scores, flagged, dominant);
        return new DominantFactorResult(loadings, scores, weights(parameters, dominant), flagged, dominant);
    }

    /**
     * 0.40 to the dominant parameter and the rest split evenly, or an even split when there is none.
     */
    Map<FiberParameter, Double> weights(List<FiberParameter> parameters, FiberParameter dominant) {
        Map<FiberParameter, Double> weights = new EnumMap<>(FiberParameter.class);
        int k = parameters.size();
        for (FiberParameter parameter : parameters) {
            if (dominant == null) {
                weights.put(parameter, 1.0 / k);
            } else {
                weights.put(parameter, parameter == dominant ? DOMINANT_WEIGHT : (1 - DOMINANT_WEIGHT) / (k - 1));
            }
        }
        return weights;
    }

    private double[][] standardize(List<Sample> samples, List<FiberParameter> parameters,
                                   Map<FiberParameter, DescriptiveStats> statsByParameter) {
        double[][] matrix = new double[samples.size()][parameters.size()];
        for (int row = 0; row < samples.size(); row++) {
            for (int col = 0; col < parameters.size(); col++) {
                FiberParameter parameter = parameters.get(col);
                DescriptiveStats stats = statsByParameter.get(parameter);
                OptionalDouble value = DecimalReadings.read(samples.get(row), parameter);
                // missing readings sit on the column mean
                if (value.isPresent()) {
                    double stdDev = stats.getStdDev() == 0 ? 1 : stats.getStdDev();
                    matrix[row][col] = (value.getAsDouble() - stats.getMean()) / stdDev;
                }
            }
        }
        return matrix;
    }

    private double[][] covariance(double[][] matrix, int k) {
        int n = matrix.length;
        int denominator = n > 1 ? n - 1 : 1;
        double[][] covariance = new double[k][k];
        for (int i = 0; i < k; i++) {
            for (int j = 0; j < k; j++) {
                double sum = 0;
                for (double[] row : matrix) {
                    sum += row[i] * row[j];
                }
                covariance[i][j] = sum / denominator;
            }
        }
        return covariance;
    }

    private double[] powerIteration(double[][] covariance, long seed) {
        int k = covariance.length;
        Random random = new Random(seed);
        double[] vector = new double[k];
        for (int i = 0; i < k; i++) {
            vector[i] = random.nextDouble();
        }

        for (int iteration = 0; iteration < POWER_ITERATIONS; iteration++) {
            double[] next = new double[k];
            for (int i = 0; i < k; i++) {
                for (int j = 0; j < k; j++) {
                    next[i] += covariance[i][j] * vector[j];
                }
            }
            double norm = 0;
            for (double v : next) {
                norm += v * v;
            }
            norm = Math.sqrt(norm);
            if (norm == 0) {
                norm = 1;
            }
            for (int i = 0; i < k; i++) {
                vector[i] = next[i] / norm;
            }
        }
        return vector;
    }
}
