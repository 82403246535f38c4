package com.yhy.recourse.mip;

import com.yhy.recourse.mip.exception.RecourseConfigurationException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RecourseBuilderTest {

    private static final double TOL = 1e-6;

    private final MipParameters parameters = MipParameters.defaults();

    private static double newScore(ClassifierModel classifier, double[] x, SolutionRecord record) {
        double[] moved = x.clone();
        for (int j = 0; j < moved.length; j++) {
            moved[j] += record.action(j);
        }
        return classifier.score(moved);
    }

    @Test
    void solveOnce_shouldFindCheapestFlip_forSingleFeature() {
        RecourseBuilder builder = RecourseBuilder.configure(Fixtures.singleFeature(), Fixtures.singleClassifier(),
                Fixtures.singleX(), CostType.MAX, null, null, parameters);

        SolutionRecord record = builder.solveOnce();

        assertTrue(record.isFeasible());
        assertEquals(1.0, record.action(0), TOL);
        assertEquals(0.4, record.getCost(), TOL);
        assertTrue(newScore(Fixtures.singleClassifier(), Fixtures.singleX(), record) >= -1e-4);
        assertTrue(record.getWarnings().isEmpty(), () -> "unexpected warnings " + record.getWarnings());
    }

    @Test
    void solveOnce_shouldUseLogOddsCosts_forLocalCostType() {
        RecourseBuilder builder = RecourseBuilder.configure(Fixtures.singleFeature(), Fixtures.singleClassifier(),
                Fixtures.singleX(), CostType.LOCAL, null, null, parameters);

        SolutionRecord record = builder.solveOnce();

        assertEquals(1.0, record.action(0), TOL);
        // ln((1 - 0.1) / (1 - 0.5))
        assertEquals(Math.log(1.8), record.getCost(), TOL);
    }

    @Test
    void solveOnce_shouldBeInfeasible_whenMinItemsExceedsActionableFeatures() {
        GridActionSet actionSet = Fixtures.actionSet(
                Fixtures.actionable("f0", new double[]{-1, 0, 1, 2}, new double[]{0.1, 0.5, 0.6, 0.9}),
                Fixtures.immutable("age"));
        ClassifierModel classifier = new ClassifierModel(new double[]{1.0, 0.5}, -1.0);

        RecourseBuilder builder = RecourseBuilder.configure(actionSet, classifier, new double[]{-1.0, 0.0},
                CostType.MAX, 2, 2, parameters);
        SolutionRecord record = builder.solveOnce();

        assertFalse(record.isFeasible());
        assertEquals(Double.POSITIVE_INFINITY, record.getCost());
        assertEquals(List.of(0.0, 0.0), record.getActions());
    }

    @Test
    void solveOnce_shouldMinimizeMaxCost_andReportConsistentCost() {
        RecourseBuilder builder = RecourseBuilder.configure(Fixtures.twoFeatures(), Fixtures.twoClassifier(),
                Fixtures.twoX(), CostType.MAX, null, null, parameters);

        SolutionRecord record = builder.solveOnce();

        assertEquals(1.0, record.action(0), TOL);
        assertEquals(2.0, record.action(1), TOL);
        assertEquals(0.4, record.getCost(), TOL);
        double maxCost = Collections.max(record.getCosts());
        assertEquals(maxCost, record.getCost(), 1e-4 * maxCost);
    }

    @Test
    void solveOnce_shouldMinimizeTotalCost() {
        RecourseBuilder builder = RecourseBuilder.configure(Fixtures.twoFeatures(), Fixtures.twoClassifier(),
                Fixtures.twoX(), CostType.TOTAL, null, null, parameters);

        SolutionRecord record = builder.solveOnce();

        assertEquals(0.7, record.getCost(), TOL);
        double total = record.getCosts().stream().mapToDouble(Double::doubleValue).sum();
        assertEquals(total, record.getCost(), 1e-4 * total);
    }

    @Test
    void solveOnce_shouldBeIdempotent() {
        RecourseBuilder builder = RecourseBuilder.configure(Fixtures.twoFeatures(), Fixtures.twoClassifier(),
                Fixtures.twoX(), CostType.MAX, null, null, parameters);

        SolutionRecord first = builder.solveOnce();
        SolutionRecord second = builder.solveOnce();

        assertEquals(first.getActions(), second.getActions());
        assertEquals(first.getCosts(), second.getCosts());
        assertEquals(first.getCost(), second.getCost(), 1e-9);
    }

    @Test
    void setItemLimits_shouldApplyToNextSolve() {
        RecourseBuilder builder = RecourseBuilder.configure(Fixtures.twoFeatures(), Fixtures.twoClassifier(),
                Fixtures.twoX(), CostType.MAX, null, null, parameters);

        builder.setItemLimits(1, 1);
        SolutionRecord single = builder.solveOnce();
        assertEquals(List.of("f0"), single.getChangedFeatures());
        assertEquals(3.0, single.action(0), TOL);
        assertEquals(0.8, single.getCost(), TOL);

        builder.setItemLimits(2, 2);
        SolutionRecord both = builder.solveOnce();
        assertEquals(2, both.changedCount());
        assertEquals(0.4, both.getCost(), TOL);
    }

    @Test
    void solveOnce_shouldKeepChangedCountWithinLimits() {
        for (int max = 1; max <= 2; max++) {
            for (int min = 0; min <= max; min++) {
                RecourseBuilder builder = RecourseBuilder.configure(Fixtures.twoFeatures(), Fixtures.twoClassifier(),
                        Fixtures.twoX(), CostType.TOTAL, min, max, parameters);
                SolutionRecord record = builder.solveOnce();
                assertTrue(record.isFeasible());
                assertTrue(record.changedCount() >= Math.max(min, 1) && record.changedCount() <= max,
                        "min=" + min + " max=" + max + " changed=" + record.changedCount());
                assertTrue(newScore(Fixtures.twoClassifier(), Fixtures.twoX(), record) >= -1e-4);
            }
        }
    }

    @Test
    void rebuild_shouldSolveForNewPoint() {
        RecourseBuilder builder = RecourseBuilder.configure(Fixtures.twoFeatures(), Fixtures.twoClassifier(),
                Fixtures.twoX(), CostType.MAX, null, null, parameters);
        long generation = builder.getGeneration();

        builder.rebuild(new double[]{1.0, 0.0});
        SolutionRecord record = builder.solveOnce();

        assertEquals(generation + 1, builder.getGeneration());
        assertArrayEquals(new double[]{1.0, 0.0}, builder.getX());
        assertEquals(1.0, record.action(0), TOL);
        assertEquals(1.0, record.action(1), TOL);
        assertEquals(0.3, record.getCost(), TOL);
    }

    @Test
    void solveOnce_shouldAcceptLimits() {
        RecourseBuilder builder = RecourseBuilder.configure(Fixtures.twoFeatures(), Fixtures.twoClassifier(),
                Fixtures.twoX(), CostType.MAX, null, null, parameters);

        SolutionRecord record = builder.solveOnce(SolveOptions.builder()
                .timeLimit(Duration.ofSeconds(30))
                .nodeLimit(10_000L)
                .build());

        assertTrue(record.isFeasible());
        assertEquals(0.4, record.getCost(), TOL);
    }

    @Test
    void configure_shouldRejectShapeMismatch() {
        assertThrows(RecourseConfigurationException.class, () -> RecourseBuilder.configure(Fixtures.singleFeature(),
                Fixtures.twoClassifier(), Fixtures.singleX(), CostType.MAX, null, null, parameters));
        assertThrows(RecourseConfigurationException.class, () -> RecourseBuilder.configure(Fixtures.singleFeature(),
                Fixtures.singleClassifier(), Fixtures.twoX(), CostType.MAX, null, null, parameters));
        assertThrows(RecourseConfigurationException.class, () -> RecourseBuilder.configure(Fixtures.singleFeature(),
                Fixtures.singleClassifier(), new double[]{Double.NaN}, CostType.MAX, null, null, parameters));
    }

    @Test
    void configure_shouldRejectBadItemLimits() {
        assertThrows(RecourseConfigurationException.class, () -> RecourseBuilder.configure(Fixtures.twoFeatures(),
                Fixtures.twoClassifier(), Fixtures.twoX(), CostType.MAX, 2, 1, parameters));
        assertThrows(RecourseConfigurationException.class, () -> RecourseBuilder.configure(Fixtures.twoFeatures(),
                Fixtures.twoClassifier(), Fixtures.twoX(), CostType.MAX, 0, 3, parameters));
    }

    @Test
    void configure_shouldFallBackToParameterDefaults() {
        RecourseBuilder builder = RecourseBuilder.configure(Fixtures.twoFeatures(), Fixtures.twoClassifier(),
                Fixtures.twoX(), null, null, null, parameters);

        assertEquals(CostType.MAX, builder.getCostType());
        assertEquals(0, builder.getMinItems());
        assertEquals(2, builder.getMaxItems());
    }
}
