package com.yhy.recourse.mip;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Limits applied before every solve. There is no mid-solve cancellation.
 */
@Value
@Builder
public class SolveOptions {

    Duration timeLimit;

    Long nodeLimit;

    boolean display;

    public static SolveOptions unlimited() {
        return SolveOptions.builder().build();
    }
}
