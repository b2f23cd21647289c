package solver;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one solve: status, the value of every variable and the
 * objective value.
 */
public final class SolverResult {
    private final SolverStatus status;
    private final Map<String, Double> variableAssignment;
    private final double objectiveValue;

    public SolverResult(SolverStatus status, Map<String, Double> variableAssignment, double objectiveValue) {
        this.status = status;
        this.variableAssignment = Collections.unmodifiableMap(new LinkedHashMap<>(variableAssignment));
        this.objectiveValue = objectiveValue;
    }

    public static SolverResult failed(SolverStatus status) {
        return new SolverResult(status, Collections.emptyMap(), Double.NaN);
    }

    public SolverStatus getStatus() {
        return status;
    }

    public boolean isOptimal() {
        return status.isOptimal();
    }

    public Map<String, Double> getVariableAssignment() {
        return variableAssignment;
    }

    public double valueOf(String variableName) {
        Double value = variableAssignment.get(variableName);
        return value == null ? 0.0 : value;
    }

    public double getObjectiveValue() {
        return objectiveValue;
    }

    @Override
    public String toString() {
        return "SolverResult{status=" + status + ", objective=" + objectiveValue
                + ", variables=" + variableAssignment.size() + "}";
    }
}
