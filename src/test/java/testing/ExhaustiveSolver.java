package testing;

import optimization.OptimizationProblem;
import optimization.OptimizationProblem.Constraint;
import optimization.OptimizationProblem.Term;
import optimization.OptimizationProblem.VariableBounds;
import solver.Solver;
import solver.SolverResult;
import solver.SolverStatus;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reference solver for small problems: tries every assignment with each
 * variable at one of its bounds (0/1 for binaries). Exact for the programs
 * the model builder produces, where auxiliaries are forced to 0 or 1.
 */
public class ExhaustiveSolver implements Solver {
    private static final int MAX_VARIABLES = 22;
    private static final double TOLERANCE = 1e-9;

    private int calls;

    @Override
    public SolverResult solve(OptimizationProblem problem) {
        calls++;
        Set<String> names = new LinkedHashSet<>(problem.getBinaries());
        Map<String, double[]> bounds = new LinkedHashMap<>();
        for (String name : problem.getBinaries()) {
            bounds.put(name, new double[]{0.0, 1.0});
        }
        for (VariableBounds b : problem.getBounds()) {
            names.add(b.getName());
            bounds.put(b.getName(), new double[]{b.getLb(), b.getUb()});
        }
        for (Constraint row : problem.getSubjectTo()) {
            for (Term term : row.getVars()) {
                names.add(term.getName());
                bounds.putIfAbsent(term.getName(), new double[]{0.0, 1.0});
            }
        }
        List<String> order = new ArrayList<>(names);
        if (order.size() > MAX_VARIABLES) {
            throw new IllegalArgumentException("Too many variables for exhaustive search: " + order.size());
        }

        double best = Double.POSITIVE_INFINITY;
        Map<String, Double> bestAssignment = null;
        Map<String, Double> assignment = new LinkedHashMap<>();
        for (long mask = 0; mask < (1L << order.size()); mask++) {
            for (int i = 0; i < order.size(); i++) {
                double[] b = bounds.get(order.get(i));
                assignment.put(order.get(i), ((mask >> i) & 1) == 1 ? b[1] : b[0]);
            }
            if (!feasible(problem, assignment)) {
                continue;
            }
            double objective = evaluate(problem.getObjective().getVars(), assignment);
            if (problem.getObjective().getDirection() == OptimizationProblem.Sense.MAXIMIZE) {
                objective = -objective;
            }
            if (objective < best - TOLERANCE) {
                best = objective;
                bestAssignment = new LinkedHashMap<>(assignment);
            }
        }
        if (bestAssignment == null) {
            return SolverResult.failed(SolverStatus.INFEASIBLE);
        }
        double value = problem.getObjective().getDirection() == OptimizationProblem.Sense.MAXIMIZE ? -best : best;
        return new SolverResult(SolverStatus.OPTIMAL, bestAssignment, value);
    }

    private static boolean feasible(OptimizationProblem problem, Map<String, Double> assignment) {
        for (Constraint row : problem.getSubjectTo()) {
            if (!row.getBounds().admits(evaluate(row.getVars(), assignment), TOLERANCE)) {
                return false;
            }
        }
        return true;
    }

    private static double evaluate(List<Term> terms, Map<String, Double> assignment) {
        double total = 0.0;
        for (Term term : terms) {
            total += term.getCoef() * assignment.getOrDefault(term.getName(), 0.0);
        }
        return total;
    }

    public int getCalls() {
        return calls;
    }
}
