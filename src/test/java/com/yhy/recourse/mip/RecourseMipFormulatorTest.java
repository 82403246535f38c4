package com.yhy.recourse.mip;

import com.yhy.recourse.mip.exception.RecourseConfigurationException;
import com.yhy.recourse.mip.exception.UnsupportedBackendOperationException;
import com.yhy.recourse.mip.solver.BackendCapability;
import com.yhy.recourse.mip.solver.ConstraintSense;
import com.yhy.recourse.mip.solver.MipBackend;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.AdditionalMatchers.aryEq;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RecourseMipFormulatorTest {

    private static final double EPS = 1e-9;

    @Mock
    private MipBackend backend;

    private final RecourseMipFormulator formulator = new RecourseMipFormulator();
    private final MipEncodingAssembler assembler = new MipEncodingAssembler();

    @BeforeEach
    void setUp() {
        AtomicInteger ids = new AtomicInteger();
        lenient().when(backend.addContinuous(anyString(), anyDouble(), anyDouble(), anyDouble()))
                .thenAnswer(inv -> ids.getAndIncrement());
        lenient().when(backend.addBinary(anyString(), anyDouble()))
                .thenAnswer(inv -> ids.getAndIncrement());
    }

    private RecourseMip formulateTwo(CostType costType, int minItems, int maxItems) {
        MipEncoding encoding = assembler.assemble(Fixtures.twoFeatures(), Fixtures.twoClassifier(), Fixtures.twoX(), costType);
        return formulator.formulate(encoding, Fixtures.twoClassifier().score(Fixtures.twoX()), costType, minItems, maxItems, backend);
    }

    @Test
    void formulate_shouldWriteScoreRow() {
        RecourseMip mip = formulateTwo(CostType.TOTAL, 0, 2);

        // a[0] and a[1] come first
        verify(backend).addConstraint(eq("score"), aryEq(new int[]{0, 1}), aryEq(new double[]{1.0, 1.0}),
                eq(ConstraintSense.GE), eq(3.0));
        assertEquals(0, mip.actionVar(0));
        assertEquals(1, mip.actionVar(1));
    }

    @Test
    void formulate_shouldLinkActionsToIndicators() {
        RecourseMip mip = formulateTwo(CostType.TOTAL, 0, 2);

        ArgumentCaptor<double[]> coefficients = ArgumentCaptor.forClass(double[].class);
        verify(backend).addConstraint(eq("set_a[0]"), any(int[].class), coefficients.capture(),
                eq(ConstraintSense.EQ), eq(0.0));
        assertArrayEquals(new double[]{-1.0, 0.0, 1.0, 2.0, 3.0}, coefficients.getValue(), EPS);

        verify(backend).addConstraint(eq("pick_a[1]"), any(int[].class), aryEq(new double[]{1, 1, 1, 1}),
                eq(ConstraintSense.EQ), eq(1.0));
        assertEquals(2, mip.noOpVar(0));
    }

    @Test
    void formulate_shouldPriceIndicators_forTotalCost() {
        formulateTwo(CostType.TOTAL, 0, 2);

        verify(backend).addBinary("u[0][0]", 0.0);
        verify(backend).addBinary(eq("u[1][1]"), doubleThat(c -> Math.abs(c - 0.2) < EPS));
        verify(backend, never()).addContinuous(eq("max_cost"), anyDouble(), anyDouble(), anyDouble());
    }

    @Test
    void formulate_shouldCountUntouchedFeatures_inCardinalityRows() {
        formulateTwo(CostType.TOTAL, 0, 1);

        verify(backend).addConstraint(eq("max_items"), any(int[].class), aryEq(new double[]{1, 1}),
                eq(ConstraintSense.GE), eq(1.0));
        // min_items 0 still asks for at least one change
        verify(backend).addConstraint(eq("min_items"), any(int[].class), aryEq(new double[]{1, 1}),
                eq(ConstraintSense.LE), eq(1.0));
    }

    @Test
    void formulate_shouldLinearizeMaxCost() {
        RecourseMip mip = formulateTwo(CostType.MAX, 0, 2);

        double epsilon = mip.getEncoding().epsilon();
        assertTrue(epsilon > 0.0);
        verify(backend).addContinuous("max_cost", 0.0, Double.POSITIVE_INFINITY, 1.0);
        verify(backend).addContinuous("c[0]", 0.0, Double.POSITIVE_INFINITY, epsilon);
        verify(backend).addContinuous("c[1]", 0.0, Double.POSITIVE_INFINITY, epsilon);
        verify(backend).addBinary("u[0][1]", 0.0);
        verify(backend).addConstraint(eq("set_max_cost[1]"), aryEq(new int[]{mip.maxCostVar(), mip.costVar(1)}),
                aryEq(new double[]{1.0, -1.0}), eq(ConstraintSense.GE), eq(0.0));
        verify(backend).addConstraint(eq("def_cost[0]"), any(int[].class), any(double[].class),
                eq(ConstraintSense.EQ), eq(0.0));
        assertTrue(mip.hasMaxCostVar());
    }

    @Test
    void setItemLimits_shouldMoveRowsInPlace() {
        when(backend.supports(BackendCapability.BOUND_MUTATION)).thenReturn(true);
        RecourseMip mip = formulateTwo(CostType.MAX, 0, 2);

        mip.setItemLimits(2, 2);

        verify(backend).setConstraintRhs("max_items", 0.0);
        verify(backend).setConstraintRhs("min_items", 0.0);
        verify(backend, never()).addConstraint(startsWith("exclude"), any(), any(), any(), anyDouble());
        assertEquals(2, mip.getMinItems());
        assertEquals(2, mip.getMaxItems());
    }

    @Test
    void setItemLimits_shouldFail_whenBackendCannotMutateBounds() {
        RecourseMip mip = formulateTwo(CostType.MAX, 0, 2);

        UnsupportedBackendOperationException ex = assertThrows(UnsupportedBackendOperationException.class,
                () -> mip.setItemLimits(1, 1));
        assertEquals(BackendCapability.BOUND_MUTATION, ex.getCapability());
        verify(backend, never()).setConstraintRhs(anyString(), anyDouble());
    }

    @Test
    void excludePattern_shouldCutOffExactlyThatPattern() {
        when(backend.supports(BackendCapability.INCREMENTAL_CONSTRAINTS)).thenReturn(true);
        RecourseMip mip = formulateTwo(CostType.TOTAL, 0, 2);

        mip.excludePattern(new boolean[]{true, false});

        verify(backend).addConstraint(eq("exclude[0]"), aryEq(new int[]{mip.noOpVar(0), mip.noOpVar(1)}),
                aryEq(new double[]{-1.0, 1.0}), eq(ConstraintSense.LE), eq(0.0));
        assertTrue(mip.hasTrail());
    }

    @Test
    void freezeFeatures_shouldRaiseNoOpLowerBound() {
        when(backend.supports(BackendCapability.BOUND_MUTATION)).thenReturn(true);
        RecourseMip mip = formulateTwo(CostType.TOTAL, 0, 2);

        mip.freezeFeatures(new boolean[]{false, true});

        verify(backend).setLowerBound(mip.noOpVar(1), 1.0);
        verify(backend, never()).setLowerBound(eq(mip.noOpVar(0)), anyDouble());
        assertEquals(1, mip.getFrozenCount());
    }

    @Test
    void excludePattern_shouldFail_withoutIncrementalConstraints() {
        RecourseMip mip = formulateTwo(CostType.TOTAL, 0, 2);

        assertThrows(UnsupportedBackendOperationException.class, () -> mip.excludePattern(new boolean[]{true, true}));
        assertFalse(mip.hasTrail());
    }

    @Test
    void validateItemLimits_shouldRejectBadLimits() {
        assertThrows(RecourseConfigurationException.class, () -> RecourseMipFormulator.validateItemLimits(2, 1, 3));
        assertThrows(RecourseConfigurationException.class, () -> RecourseMipFormulator.validateItemLimits(-1, 1, 3));
        assertThrows(RecourseConfigurationException.class, () -> RecourseMipFormulator.validateItemLimits(0, 4, 3));
        assertDoesNotThrow(() -> RecourseMipFormulator.validateItemLimits(0, 3, 3));
    }
}
