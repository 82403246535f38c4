package com.yhy.recourse.mip;

import com.yhy.recourse.mip.exception.UnsupportedBackendOperationException;
import com.yhy.recourse.mip.solver.BackendCapability;
import com.yhy.recourse.mip.solver.MipBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Lazily produces the items of a flipset: solve, record, exclude, repeat.
 * Stops when the MIP turns infeasible or {@code totalItems} records have been
 * produced. Each record is solved only when the caller asks for it.
 */
public class FlipsetEnumerator implements Iterator<SolutionRecord> {

    private static final Logger LOGGER = LoggerFactory.getLogger(FlipsetEnumerator.class);

    public enum State {
        READY, SOLVING, RECORDED, EXHAUSTED, LIMIT_REACHED
    }

    private final RecourseBuilder builder;
    private final long generation;
    private final long totalItems;
    private final EnumerationPolicy policy;
    private final SolveOptions options;

    private State state = State.READY;
    private SolutionRecord pending;
    private long produced;
    private long startNanos;

    FlipsetEnumerator(RecourseBuilder builder, long totalItems, EnumerationPolicy policy, SolveOptions options) {
        if (totalItems < 1) {
            throw new IllegalArgumentException("totalItems must be at least 1");
        }
        this.builder = builder;
        this.generation = builder.getGeneration();
        this.totalItems = totalItems;
        this.policy = policy;
        this.options = options;

        MipBackend backend = builder.getMip().getBackend();
        BackendCapability required = policy.getRequiredCapability();
        if (totalItems > 1 && !backend.supports(required)) {
            throw new UnsupportedBackendOperationException(required,
                    "backend " + backend.getName() + " cannot enumerate with policy " + policy);
        }
        if (totalItems == RecourseBuilder.UNBOUNDED) {
            LOGGER.warn("Enumerating without an item limit: only infeasibility ends the run, which may take long");
        }
    }

    public State getState() {
        return state;
    }

    public long getProduced() {
        return produced;
    }

    @Override
    public boolean hasNext() {
        checkGeneration();
        if (pending != null) {
            return true;
        }
        if (state == State.EXHAUSTED || state == State.LIMIT_REACHED) {
            return false;
        }
        advance();
        return pending != null;
    }

    @Override
    public SolutionRecord next() {
        if (!hasNext()) {
            throw new NoSuchElementException("flipset enumeration ended in state " + state);
        }
        SolutionRecord record = pending;
        pending = null;
        return record;
    }

    private void advance() {
        if (state == State.READY) {
            startNanos = System.nanoTime();
        }
        state = State.SOLVING;
        SolutionRecord record = builder.solveOnce(options);
        if (!record.isFeasible()) {
            state = State.EXHAUSTED;
            finish();
            return;
        }

        produced++;
        pending = record;
        state = State.RECORDED;
        if (produced >= totalItems) {
            state = State.LIMIT_REACHED;
            finish();
            return;
        }

        RecourseMip mip = builder.getMip();
        boolean[] changed = mip.changedPattern(record);
        if (policy == EnumerationPolicy.MUTUALLY_EXCLUSIVE) {
            mip.freezeFeatures(changed);
        } else {
            mip.excludePattern(changed);
        }
    }

    private void finish() {
        LOGGER.info("Flipset enumeration produced {} items in {} s, ended {}",
                produced, String.format("%.3f", (System.nanoTime() - startNanos) / 1e9), state);
    }

    private void checkGeneration() {
        if (builder.getGeneration() != generation) {
            throw new IllegalStateException("MIP was rebuilt; this enumeration is stale");
        }
    }
}
