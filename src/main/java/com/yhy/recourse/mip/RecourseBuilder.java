package com.yhy.recourse.mip;

import com.yhy.recourse.mip.exception.RecourseConfigurationException;
import com.yhy.recourse.mip.solver.MipBackend;
import com.yhy.recourse.mip.solver.MipBackendFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Builds and solves recourse MIPs for one classifier, one action set and one
 * input point. A builder owns its MIP and the backend behind it; it is not
 * safe for concurrent use.
 * <pre>
 * RecourseBuilder rb = RecourseBuilder.configure(actionSet, classifier, x, CostType.MAX, null, null, parameters);
 * SolutionRecord best = rb.solveOnce(parameters.defaultSolveOptions());
 * List&lt;SolutionRecord&gt; flipset = rb.enumerate(5, EnumerationPolicy.DISTINCT_SUBSETS, options).collect(toList());
 * </pre>
 */
public class RecourseBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(RecourseBuilder.class);

    /** Enumerate until the MIP becomes infeasible. */
    public static final long UNBOUNDED = Long.MAX_VALUE;

    private final ActionSet actionSet;
    private final ClassifierModel classifier;
    private final CostType costType;
    private final MipParameters parameters;
    private final MipEncodingAssembler assembler = new MipEncodingAssembler();
    private final RecourseMipFormulator formulator = new RecourseMipFormulator();
    private final SolutionExtractor extractor;

    private double[] x;
    private int minItems;
    private int maxItems;
    private RecourseMip mip;
    private long generation;

    private RecourseBuilder(ActionSet actionSet, ClassifierModel classifier, CostType costType, int minItems,
                            int maxItems, MipParameters parameters) {
        this.actionSet = actionSet;
        this.classifier = classifier;
        this.costType = costType;
        this.minItems = minItems;
        this.maxItems = maxItems;
        this.parameters = parameters;
        this.extractor = new SolutionExtractor(actionSet, classifier);
    }

    /**
     * Validates the inputs and builds the MIP.
     *
     * @param costType  {@code null} for the default of {@code parameters}
     * @param minItems  {@code null} for 0
     * @param maxItems  {@code null} for the number of actionable features
     * @throws RecourseConfigurationException on shape mismatches, non-finite values or bad item limits
     */
    public static RecourseBuilder configure(ActionSet actionSet, ClassifierModel classifier, double[] x,
                                            CostType costType, Integer minItems, Integer maxItems,
                                            MipParameters parameters) {
        if (actionSet == null || classifier == null) {
            throw new RecourseConfigurationException("action set and classifier are required");
        }
        if (classifier.size() != actionSet.size()) {
            throw new RecourseConfigurationException("classifier has " + classifier.size()
                    + " coefficients but the action set has " + actionSet.size() + " features");
        }
        MipParameters params = parameters == null ? MipParameters.defaults() : parameters;
        int min = minItems == null ? 0 : minItems;
        int max = maxItems == null ? actionSet.actionableCount() : maxItems;
        RecourseMipFormulator.validateItemLimits(min, max, actionSet.size());

        RecourseBuilder builder = new RecourseBuilder(actionSet, classifier,
                costType == null ? params.getCostType() : costType, min, max, params);
        builder.rebuild(x);
        return builder;
    }

    /**
     * Builds a fresh MIP for a new input point. Exclusions from earlier
     * enumerations are dropped and running enumerators become stale.
     */
    public void rebuild(double[] newX) {
        double[] point = checkPoint(newX);
        MipEncoding encoding = assembler.assemble(actionSet, classifier, point, costType);
        MipBackend backend = MipBackendFactory.create(parameters);
        RecourseMip built = formulator.formulate(encoding, classifier.score(point), costType, minItems, maxItems, backend);
        this.x = point;
        this.mip = built;
        this.generation++;
        LOGGER.debug("Rebuilt recourse MIP, generation {}", generation);
    }

    /**
     * Moves the item limits of the current MIP in place.
     *
     * @throws com.yhy.recourse.mip.exception.UnsupportedBackendOperationException when the backend cannot mutate bounds
     */
    public void setItemLimits(int minItems, int maxItems) {
        RecourseMipFormulator.validateItemLimits(minItems, maxItems, actionSet.size());
        mip.setItemLimits(minItems, maxItems);
        this.minItems = minItems;
        this.maxItems = maxItems;
    }

    public SolutionRecord solveOnce(SolveOptions options) {
        SolveOptions opts = options == null ? parameters.defaultSolveOptions() : options;
        MipBackend backend = mip.getBackend();
        backend.setTimeLimit(opts.getTimeLimit());
        backend.setNodeLimit(opts.getNodeLimit());
        backend.setDisplay(opts.isDisplay());
        return extractor.extract(mip, backend.solve(), x, parameters.isCheckFlag());
    }

    public SolutionRecord solveOnce() {
        return solveOnce(parameters.defaultSolveOptions());
    }

    /**
     * Lazily enumerates up to {@code totalItems} flipset items.
     *
     * @throws IllegalStateException when the MIP still carries exclusions from an earlier enumeration
     * @throws com.yhy.recourse.mip.exception.UnsupportedBackendOperationException when the backend lacks what the policy needs
     */
    public Stream<SolutionRecord> enumerate(long totalItems, EnumerationPolicy policy, SolveOptions options) {
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(
                enumerator(totalItems, policy, options), Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    public Stream<SolutionRecord> enumerate() {
        return enumerate(parameters.getTotalItems(), parameters.getEnumerationPolicy(), parameters.defaultSolveOptions());
    }

    public FlipsetEnumerator enumerator(long totalItems, EnumerationPolicy policy, SolveOptions options) {
        if (mip.hasTrail()) {
            throw new IllegalStateException("MIP carries an earlier enumeration; rebuild before enumerating again");
        }
        EnumerationPolicy p = policy == null ? parameters.getEnumerationPolicy() : policy;
        SolveOptions opts = options == null ? parameters.defaultSolveOptions() : options;
        return new FlipsetEnumerator(this, totalItems, p, opts);
    }

    private double[] checkPoint(double[] point) {
        if (point == null || point.length != actionSet.size()) {
            throw new RecourseConfigurationException("input point must have " + actionSet.size() + " values");
        }
        for (double v : point) {
            if (!Double.isFinite(v)) {
                throw new RecourseConfigurationException("input point has a non-finite value");
            }
        }
        return point.clone();
    }

    public RecourseMip getMip() {
        return mip;
    }

    public long getGeneration() {
        return generation;
    }

    public double[] getX() {
        return x.clone();
    }

    public CostType getCostType() {
        return costType;
    }

    public int getMinItems() {
        return minItems;
    }

    public int getMaxItems() {
        return maxItems;
    }
}
