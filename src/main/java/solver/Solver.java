package solver;

import optimization.OptimizationProblem;

/**
 * A mixed-integer program solver. Implementations may be in-process or a
 * remote service; each call is an independent request.
 */
public interface Solver {

    SolverResult solve(OptimizationProblem problem);
}
