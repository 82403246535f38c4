package com.yhy.recourse.mip;

import com.yhy.recourse.mip.solver.BackendType;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Immutable defaults handed to a {@link RecourseBuilder} when it is configured.
 */
@Value
@Builder(toBuilder = true)
public class MipParameters {

    @Builder.Default
    BackendType backend = BackendType.OR_TOOLS;

    @Builder.Default
    String solverId = "SCIP";

    @Builder.Default
    CostType costType = CostType.MAX;

    @Builder.Default
    EnumerationPolicy enumerationPolicy = EnumerationPolicy.DISTINCT_SUBSETS;

    /** {@code null} means no limit. */
    Duration timeLimit;

    /** {@code null} means no limit. */
    Long nodeLimit;

    boolean display;

    @Builder.Default
    boolean checkFlag = true;

    @Builder.Default
    long totalItems = 10;

    public static MipParameters defaults() {
        return MipParameters.builder().build();
    }

    public SolveOptions defaultSolveOptions() {
        return SolveOptions.builder()
                .timeLimit(timeLimit)
                .nodeLimit(nodeLimit)
                .display(display)
                .build();
    }
}
