package com.yhy.recourse.mip.solver;

import java.time.Duration;
import java.util.Set;

/**
 * Minimal MIP modelling surface the recourse formulation is written against.
 * Variables are addressed by the id returned on creation; rows by their name.
 * The objective is always minimised.
 */
public interface MipBackend {

    String getName();

    Set<BackendCapability> capabilities();

    default boolean supports(BackendCapability capability) {
        return capabilities().contains(capability);
    }

    /**
     * Adds a continuous variable. Infinite bounds mean unbounded on that side.
     *
     * @return the variable id
     */
    int addContinuous(String name, double lowerBound, double upperBound, double objective);

    /**
     * Adds a {0,1} variable.
     *
     * @return the variable id
     */
    int addBinary(String name, double objective);

    /**
     * Adds a named linear row {@code sum(coefficients[i] * x[variables[i]]) sense rhs}.
     */
    void addConstraint(String name, int[] variables, double[] coefficients, ConstraintSense sense, double rhs);

    boolean hasConstraint(String name);

    void setObjectiveCoefficient(int variable, double coefficient);

    /**
     * Moves the right-hand side of an existing row, keeping its sense.
     */
    void setConstraintRhs(String name, double rhs);

    void setLowerBound(int variable, double lowerBound);

    int variableCount();

    /**
     * @param limit wall-clock limit, {@code null} for none
     */
    void setTimeLimit(Duration limit);

    /**
     * @param limit explored-node limit, {@code null} for none
     */
    void setNodeLimit(Long limit);

    void setDisplay(boolean display);

    MipSolveResult solve();
}
