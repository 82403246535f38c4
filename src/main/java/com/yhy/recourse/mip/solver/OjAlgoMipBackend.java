package com.yhy.recourse.mip.solver;

import com.yhy.recourse.mip.exception.MipSolverException;
import com.yhy.recourse.mip.exception.UnsupportedBackendOperationException;
import org.ojalgo.optimisation.Expression;
import org.ojalgo.optimisation.ExpressionsBasedModel;
import org.ojalgo.optimisation.Optimisation;
import org.ojalgo.optimisation.Variable;
import org.ojalgo.optimisation.integer.IntegerSolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.*;

/**
 * Pure-Java backend built on ojAlgo's {@link ExpressionsBasedModel}.
 * <p>
 * Single-shot: the model can be assembled freely, but once it has been solved
 * the structure is frozen. Re-solving the same model is allowed, adding rows
 * or moving bounds is not.
 */
public class OjAlgoMipBackend implements MipBackend {

    private static final Logger LOGGER = LoggerFactory.getLogger(OjAlgoMipBackend.class);

    final ExpressionsBasedModel model = new ExpressionsBasedModel();
    private final List<Variable> variables = new ArrayList<>();
    private final Map<String, Expression> expressions = new HashMap<>();
    private final Map<String, ConstraintSense> senses = new HashMap<>();

    private boolean solved;

    @Override
    public String getName() {
        return "ojalgo";
    }

    @Override
    public Set<BackendCapability> capabilities() {
        return Collections.emptySet();
    }

    @Override
    public int addContinuous(String name, double lowerBound, double upperBound, double objective) {
        requireOpen(BackendCapability.INCREMENTAL_CONSTRAINTS, "add variable " + name);
        Variable var = model.addVariable(name);
        if (Double.isFinite(lowerBound)) {
            var.lower(lowerBound);
        }
        if (Double.isFinite(upperBound)) {
            var.upper(upperBound);
        }
        return register(var, objective);
    }

    @Override
    public int addBinary(String name, double objective) {
        requireOpen(BackendCapability.INCREMENTAL_CONSTRAINTS, "add variable " + name);
        return register(model.addVariable(name).binary(), objective);
    }

    private int register(Variable var, double objective) {
        if (objective != 0.0) {
            var.weight(objective);
        }
        variables.add(var);
        return variables.size() - 1;
    }

    @Override
    public void addConstraint(String name, int[] vars, double[] coefficients, ConstraintSense sense, double rhs) {
        requireOpen(BackendCapability.INCREMENTAL_CONSTRAINTS, "add constraint " + name);
        if (expressions.containsKey(name)) {
            throw new IllegalArgumentException("duplicate constraint name " + name);
        }
        Expression expr = model.addExpression(name);
        for (int i = 0; i < vars.length; i++) {
            expr.set(variables.get(vars[i]), coefficients[i]);
        }
        applyRhs(expr, sense, rhs);
        expressions.put(name, expr);
        senses.put(name, sense);
    }

    @Override
    public boolean hasConstraint(String name) {
        return expressions.containsKey(name);
    }

    @Override
    public void setObjectiveCoefficient(int variable, double coefficient) {
        requireOpen(BackendCapability.BOUND_MUTATION, "change objective");
        variables.get(variable).weight(coefficient);
    }

    @Override
    public void setConstraintRhs(String name, double rhs) {
        requireOpen(BackendCapability.BOUND_MUTATION, "change rhs of " + name);
        Expression expr = expressions.get(name);
        if (expr == null) {
            throw new IllegalArgumentException("unknown constraint " + name);
        }
        applyRhs(expr, senses.get(name), rhs);
    }

    @Override
    public void setLowerBound(int variable, double lowerBound) {
        requireOpen(BackendCapability.BOUND_MUTATION, "change lower bound of " + variables.get(variable).getName());
        variables.get(variable).lower(lowerBound);
    }

    @Override
    public int variableCount() {
        return variables.size();
    }

    @Override
    public void setTimeLimit(Duration limit) {
        model.options.time_abort = limit == null ? Long.MAX_VALUE : Math.max(1L, limit.toMillis());
    }

    @Override
    public void setNodeLimit(Long limit) {
        // ojAlgo exposes no node counter; iterations are the closest knob
        model.options.iterations_abort = limit == null ? Integer.MAX_VALUE : (int) Math.min(limit, Integer.MAX_VALUE);
    }

    @Override
    public void setDisplay(boolean display) {
        if (display) {
            model.options.progress(IntegerSolver.class);
        } else {
            model.options.logger_appender = null;
            model.options.logger_solver = null;
            model.options.logger_detailed = false;
        }
    }

    @Override
    public MipSolveResult solve() {
        long start = System.nanoTime();
        Optimisation.Result result = model.minimise();
        double wallSeconds = (System.nanoTime() - start) / 1e9;
        solved = true;

        Optimisation.State state = result.getState();
        if (state == Optimisation.State.FAILED || state == Optimisation.State.INVALID) {
            LOGGER.error("ojAlgo returned {}", state);
            throw new MipSolverException("ojAlgo returned " + state);
        }

        MipStatus status;
        if (state.isOptimal()) {
            status = MipStatus.OPTIMAL;
        } else if (state.isFeasible()) {
            status = MipStatus.FEASIBLE;
        } else if (state == Optimisation.State.INFEASIBLE) {
            status = MipStatus.INFEASIBLE;
        } else if (state == Optimisation.State.UNBOUNDED) {
            status = MipStatus.UNBOUNDED;
        } else {
            status = MipStatus.NOT_SOLVED;
        }

        MipSolveResult.MipSolveResultBuilder builder = MipSolveResult.builder()
                .status(status)
                .statusText(state.name().toLowerCase(Locale.ROOT))
                .wallSeconds(wallSeconds);
        if (status.isPrimalFeasible()) {
            double[] values = new double[variables.size()];
            for (int i = 0; i < values.length; i++) {
                values[i] = result.doubleValue(i);
            }
            double objective = result.getValue();
            builder.objectiveValue(objective).values(values);
            if (status == MipStatus.OPTIMAL) {
                builder.bestBound(objective).relativeGap(0.0);
            }
        }
        return builder.build();
    }

    private void requireOpen(BackendCapability capability, String operation) {
        if (solved) {
            throw new UnsupportedBackendOperationException(capability, "ojalgo backend cannot " + operation + " after solving");
        }
    }

    private static void applyRhs(Expression expr, ConstraintSense sense, double rhs) {
        switch (sense) {
            case EQ:
                expr.level(rhs);
                break;
            case LE:
                expr.upper(rhs);
                break;
            case GE:
                expr.lower(rhs);
                break;
        }
    }
}
