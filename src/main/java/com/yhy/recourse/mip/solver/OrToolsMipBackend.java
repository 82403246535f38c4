package com.yhy.recourse.mip.solver;

import com.google.ortools.Loader;
import com.google.ortools.linearsolver.MPConstraint;
import com.google.ortools.linearsolver.MPObjective;
import com.google.ortools.linearsolver.MPSolver;
import com.google.ortools.linearsolver.MPVariable;
import com.yhy.recourse.mip.exception.MipSolverException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.*;

/**
 * {@link MipBackend} on top of the OR-Tools linear solver wrapper. The model
 * stays alive between solves, so rows can be added and bounds tightened
 * incrementally.
 */
public class OrToolsMipBackend implements MipBackend {

    private static final Logger LOGGER = LoggerFactory.getLogger(OrToolsMipBackend.class);

    private static final Set<BackendCapability> CAPABILITIES =
            Collections.unmodifiableSet(EnumSet.of(BackendCapability.INCREMENTAL_CONSTRAINTS, BackendCapability.BOUND_MUTATION));

    private final String solverId;
    private final MPSolver solver;
    private final List<MPVariable> variables = new ArrayList<>();
    private final Map<String, MPConstraint> constraints = new HashMap<>();
    private final Map<String, ConstraintSense> senses = new HashMap<>();

    private boolean nodeLimitWarned;

    public OrToolsMipBackend(String solverId) {
        Loader.loadNativeLibraries();
        this.solverId = solverId;
        this.solver = MPSolver.createSolver(solverId);
        if (solver == null) {
            LOGGER.error("Could not create solver {}", solverId);
            throw new MipSolverException("OR-Tools solver '" + solverId + "' is not available");
        }
        solver.objective().setMinimization();
        solver.suppressOutput();
    }

    @Override
    public String getName() {
        return "or-tools/" + solverId;
    }

    @Override
    public Set<BackendCapability> capabilities() {
        return CAPABILITIES;
    }

    @Override
    public int addContinuous(String name, double lowerBound, double upperBound, double objective) {
        MPVariable var = solver.makeNumVar(toSolver(lowerBound), toSolver(upperBound), name);
        return register(var, objective);
    }

    @Override
    public int addBinary(String name, double objective) {
        return register(solver.makeBoolVar(name), objective);
    }

    private int register(MPVariable var, double objective) {
        if (objective != 0.0) {
            solver.objective().setCoefficient(var, objective);
        }
        variables.add(var);
        return variables.size() - 1;
    }

    @Override
    public void addConstraint(String name, int[] vars, double[] coefficients, ConstraintSense sense, double rhs) {
        if (constraints.containsKey(name)) {
            throw new IllegalArgumentException("duplicate constraint name " + name);
        }
        MPConstraint ct = solver.makeConstraint(lowerFor(sense, rhs), upperFor(sense, rhs), name);
        for (int i = 0; i < vars.length; i++) {
            ct.setCoefficient(variables.get(vars[i]), coefficients[i]);
        }
        constraints.put(name, ct);
        senses.put(name, sense);
    }

    @Override
    public boolean hasConstraint(String name) {
        return constraints.containsKey(name);
    }

    @Override
    public void setObjectiveCoefficient(int variable, double coefficient) {
        solver.objective().setCoefficient(variables.get(variable), coefficient);
    }

    @Override
    public void setConstraintRhs(String name, double rhs) {
        MPConstraint ct = constraints.get(name);
        if (ct == null) {
            throw new IllegalArgumentException("unknown constraint " + name);
        }
        ConstraintSense sense = senses.get(name);
        ct.setBounds(lowerFor(sense, rhs), upperFor(sense, rhs));
    }

    @Override
    public void setLowerBound(int variable, double lowerBound) {
        variables.get(variable).setLb(toSolver(lowerBound));
    }

    @Override
    public int variableCount() {
        return variables.size();
    }

    @Override
    public void setTimeLimit(Duration limit) {
        // 0 lifts the limit
        solver.setTimeLimit(limit == null ? 0L : Math.max(1L, limit.toMillis()));
    }

    @Override
    public void setNodeLimit(Long limit) {
        if ("SCIP".equalsIgnoreCase(solverId)) {
            solver.setSolverSpecificParametersAsString("limits/nodes = " + (limit == null ? -1L : limit));
        } else if (limit != null && !nodeLimitWarned) {
            LOGGER.warn("Node limit {} ignored: not supported for solver {}", limit, solverId);
            nodeLimitWarned = true;
        }
    }

    @Override
    public void setDisplay(boolean display) {
        if (display) {
            solver.enableOutput();
        } else {
            solver.suppressOutput();
        }
    }

    @Override
    public MipSolveResult solve() {
        // wallTime() counts from solver creation, so time the call itself
        long start = System.nanoTime();
        MPSolver.ResultStatus status = solver.solve();
        double wallSeconds = (System.nanoTime() - start) / 1e9;
        if (status == MPSolver.ResultStatus.ABNORMAL || status == MPSolver.ResultStatus.MODEL_INVALID) {
            LOGGER.error("Solver {} returned {}", solverId, status);
            throw new MipSolverException("solver " + solverId + " returned " + status);
        }

        MipStatus mapped = map(status);
        MipSolveResult.MipSolveResultBuilder result = MipSolveResult.builder()
                .status(mapped)
                .statusText(status.name().toLowerCase(Locale.ROOT))
                .iterations(solver.iterations())
                .nodesProcessed(solver.nodes())
                .nodesRemaining(0L)
                .wallSeconds(wallSeconds);

        if (mapped.isPrimalFeasible()) {
            MPObjective objective = solver.objective();
            double value = objective.value();
            double bound = objective.bestBound();
            double[] values = new double[variables.size()];
            for (int i = 0; i < values.length; i++) {
                values[i] = variables.get(i).solutionValue();
            }
            result.objectiveValue(value)
                    .bestBound(bound)
                    .relativeGap(Math.abs(value - bound) / Math.max(Math.abs(value), 1e-10))
                    .values(values);
        }
        return result.build();
    }

    private static MipStatus map(MPSolver.ResultStatus status) {
        switch (status) {
            case OPTIMAL:
                return MipStatus.OPTIMAL;
            case FEASIBLE:
                return MipStatus.FEASIBLE;
            case INFEASIBLE:
                return MipStatus.INFEASIBLE;
            case UNBOUNDED:
                return MipStatus.UNBOUNDED;
            default:
                return MipStatus.NOT_SOLVED;
        }
    }

    private static double lowerFor(ConstraintSense sense, double rhs) {
        return sense == ConstraintSense.LE ? -MPSolver.infinity() : rhs;
    }

    private static double upperFor(ConstraintSense sense, double rhs) {
        return sense == ConstraintSense.GE ? MPSolver.infinity() : rhs;
    }

    private static double toSolver(double bound) {
        if (bound == Double.POSITIVE_INFINITY) {
            return MPSolver.infinity();
        }
        if (bound == Double.NEGATIVE_INFINITY) {
            return -MPSolver.infinity();
        }
        return bound;
    }
}
