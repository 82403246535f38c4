package com.yhy.recourse.mip;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of one solve. {@code actions} and {@code costs} span every feature
 * of the action set; untouched and immutable features carry zeros. The
 * builder copies every list, so a built record cannot be changed.
 */
@Value
@Builder
@Jacksonized
public class SolutionRecord {

    boolean feasible;
    String status;
    double cost;
    @Singular
    List<Double> actions;
    @Singular("featureCost")
    List<Double> costs;
    @Singular
    List<String> changedFeatures;
    double upperBound;
    double lowerBound;
    double gap;
    long iterations;
    long nodesProcessed;
    long nodesRemaining;
    double runtime;
    @Singular
    List<String> warnings;

    /**
     * Sentinel for a solve that found no feasible action.
     */
    public static SolutionRecord infeasible(int featureCount, String status, long iterations, long nodesProcessed,
                                            long nodesRemaining, double runtime) {
        List<Double> zeros = Collections.nCopies(featureCount, 0.0);
        return SolutionRecord.builder()
                .feasible(false)
                .status(status)
                .cost(Double.POSITIVE_INFINITY)
                .actions(zeros)
                .costs(zeros)
                .changedFeatures(Collections.emptyList())
                .upperBound(Double.POSITIVE_INFINITY)
                .lowerBound(Double.POSITIVE_INFINITY)
                .gap(Double.POSITIVE_INFINITY)
                .iterations(iterations)
                .nodesProcessed(nodesProcessed)
                .nodesRemaining(nodesRemaining)
                .runtime(runtime)
                .build();
    }

    public double action(int feature) {
        return actions.get(feature);
    }

    public int changedCount() {
        return changedFeatures.size();
    }
}
