package solver;

public enum SolverStatus {
    OPTIMAL,
    FEASIBLE,
    INFEASIBLE,
    UNBOUNDED,
    FAILED;

    public boolean isOptimal() {
        return this == OPTIMAL;
    }
}
