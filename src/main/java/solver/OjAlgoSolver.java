package solver;

import optimization.OptimizationProblem;
import optimization.OptimizationProblem.Constraint;
import optimization.OptimizationProblem.RowBounds;
import optimization.OptimizationProblem.Term;
import optimization.OptimizationProblem.VariableBounds;
import org.ojalgo.optimisation.Expression;
import org.ojalgo.optimisation.ExpressionsBasedModel;
import org.ojalgo.optimisation.Optimisation;
import org.ojalgo.optimisation.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-process solver backed by ojAlgo's ExpressionsBasedModel.
 * Variables without declared bounds default to [0, +inf).
 */
public class OjAlgoSolver implements Solver {
    private static final Logger logger = LoggerFactory.getLogger(OjAlgoSolver.class);

    @Override
    public SolverResult solve(OptimizationProblem problem) {
        ExpressionsBasedModel model = new ExpressionsBasedModel();
        Map<String, Variable> variables = new LinkedHashMap<>();
        List<String> order = new ArrayList<>();
        Set<String> binaries = new HashSet<>(problem.getBinaries());

        for (String name : problem.getBinaries()) {
            variables.put(name, model.addVariable(name).binary());
            order.add(name);
        }
        for (VariableBounds bounds : problem.getBounds()) {
            Variable variable = variableOf(model, variables, order, bounds.getName());
            variable.lower(bounds.getLb()).upper(bounds.getUb());
        }

        Map<String, Double> weights = new LinkedHashMap<>();
        for (Term term : problem.getObjective().getVars()) {
            weights.merge(term.getName(), term.getCoef(), Double::sum);
        }
        for (Map.Entry<String, Double> weight : weights.entrySet()) {
            variableOf(model, variables, order, weight.getKey()).weight(weight.getValue());
        }

        List<Constraint> rows = problem.getSubjectTo();
        for (int r = 0; r < rows.size(); r++) {
            Constraint row = rows.get(r);
            // expression names are keys inside the model
            Expression expression = model.addExpression(r + " " + row.getName());
            Map<String, Double> coefficients = new LinkedHashMap<>();
            for (Term term : row.getVars()) {
                coefficients.merge(term.getName(), term.getCoef(), Double::sum);
            }
            for (Map.Entry<String, Double> coefficient : coefficients.entrySet()) {
                expression.set(variableOf(model, variables, order, coefficient.getKey()), coefficient.getValue());
            }
            applyBounds(expression, row.getBounds());
        }

        Optimisation.Result result = problem.getObjective().getDirection() == OptimizationProblem.Sense.MAXIMIZE
                ? model.maximise()
                : model.minimise();
        SolverStatus status = statusOf(result.getState());
        if (!status.isOptimal()) {
            logger.info("Solver finished without an optimal solution: {}", result.getState());
            return SolverResult.failed(status);
        }

        Map<String, Double> assignment = new LinkedHashMap<>();
        for (int i = 0; i < order.size(); i++) {
            String name = order.get(i);
            double value = result.doubleValue(i);
            assignment.put(name, binaries.contains(name) ? (double) Math.round(value) : value);
        }
        logger.debug("Solver found an optimal solution with objective {}", result.getValue());
        return new SolverResult(status, assignment, result.getValue());
    }

    private static Variable variableOf(ExpressionsBasedModel model, Map<String, Variable> variables,
                                       List<String> order, String name) {
        Variable variable = variables.get(name);
        if (variable == null) {
            variable = model.addVariable(name).lower(0.0);
            variables.put(name, variable);
            order.add(name);
        }
        return variable;
    }

    private static void applyBounds(Expression expression, RowBounds bounds) {
        switch (bounds.getType()) {
            case UPPER:
                expression.upper(bounds.getUb());
                break;
            case LOWER:
                expression.lower(bounds.getLb());
                break;
            case DOUBLE:
                expression.lower(bounds.getLb()).upper(bounds.getUb());
                break;
            default:
                expression.level(bounds.getLb());
                break;
        }
    }

    static SolverStatus statusOf(Optimisation.State state) {
        if (state.isOptimal()) {
            return SolverStatus.OPTIMAL;
        }
        if (state == Optimisation.State.INFEASIBLE) {
            return SolverStatus.INFEASIBLE;
        }
        if (state == Optimisation.State.UNBOUNDED) {
            return SolverStatus.UNBOUNDED;
        }
        if (state.isFeasible()) {
            return SolverStatus.FEASIBLE;
        }
        return SolverStatus.FAILED;
    }
}
