package optimization;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Solver-neutral binary/mixed-integer problem: a linear objective, linear
 * rows with bounds, the names of the binary variables and explicit bounds
 * for the continuous ones. Serialises to the JSON shape external solver
 * services accept.
 */
public final class OptimizationProblem {
    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    public enum Sense {
        MINIMIZE,
        MAXIMIZE
    }

    public enum BoundType {
        /** row <= ub */
        UPPER,
        /** row >= lb */
        LOWER,
        /** lb <= row <= ub */
        DOUBLE,
        /** row == lb */
        FIXED
    }

    public static final class Term {
        private final String name;
        private final double coef;

        public Term(String name, double coef) {
            this.name = name;
            this.coef = coef;
        }

        public String getName() {
            return name;
        }

        public double getCoef() {
            return coef;
        }
    }

    public static final class Objective {
        private final Sense direction;
        private final String name;
        private final List<Term> vars;

        public Objective(Sense direction, String name, List<Term> vars) {
            this.direction = direction;
            this.name = name;
            this.vars = Collections.unmodifiableList(new ArrayList<>(vars));
        }

        public Sense getDirection() {
            return direction;
        }

        public String getName() {
            return name;
        }

        public List<Term> getVars() {
            return vars;
        }
    }

    public static final class RowBounds {
        private final BoundType type;
        private final double lb;
        private final double ub;

        private RowBounds(BoundType type, double lb, double ub) {
            this.type = type;
            this.lb = lb;
            this.ub = ub;
        }

        public static RowBounds atMost(double ub) {
            return new RowBounds(BoundType.UPPER, 0.0, ub);
        }

        public static RowBounds atLeast(double lb) {
            return new RowBounds(BoundType.LOWER, lb, 0.0);
        }

        public static RowBounds between(double lb, double ub) {
            return new RowBounds(BoundType.DOUBLE, lb, ub);
        }

        public static RowBounds exactly(double value) {
            return new RowBounds(BoundType.FIXED, value, value);
        }

        public BoundType getType() {
            return type;
        }

        public double getLb() {
            return lb;
        }

        public double getUb() {
            return ub;
        }

        public boolean admits(double value, double tolerance) {
            switch (type) {
                case UPPER:
                    return value <= ub + tolerance;
                case LOWER:
                    return value >= lb - tolerance;
                case DOUBLE:
                    return value >= lb - tolerance && value <= ub + tolerance;
                default:
                    return Math.abs(value - lb) <= tolerance;
            }
        }
    }

    public static final class Constraint {
        private final String name;
        private final List<Term> vars;
        private final RowBounds bounds;

        public Constraint(String name, List<Term> vars, RowBounds bounds) {
            this.name = name;
            this.vars = Collections.unmodifiableList(new ArrayList<>(vars));
            this.bounds = bounds;
        }

        public String getName() {
            return name;
        }

        public List<Term> getVars() {
            return vars;
        }

        public RowBounds getBounds() {
            return bounds;
        }
    }

    public static final class VariableBounds {
        private final String name;
        private final double lb;
        private final double ub;

        public VariableBounds(String name, double lb, double ub) {
            this.name = name;
            this.lb = lb;
            this.ub = ub;
        }

        public String getName() {
            return name;
        }

        public double getLb() {
            return lb;
        }

        public double getUb() {
            return ub;
        }
    }

    private final String name;
    private final Objective objective;
    private final List<Constraint> subjectTo;
    private final List<String> binaries;
    private final List<VariableBounds> bounds;

    public OptimizationProblem(String name, Objective objective, List<Constraint> subjectTo,
                               List<String> binaries, List<VariableBounds> bounds) {
        this.name = name;
        this.objective = objective;
        this.subjectTo = Collections.unmodifiableList(new ArrayList<>(subjectTo));
        this.binaries = Collections.unmodifiableList(new ArrayList<>(binaries));
        this.bounds = Collections.unmodifiableList(new ArrayList<>(bounds));
    }

    public String getName() {
        return name;
    }

    public Objective getObjective() {
        return objective;
    }

    public List<Constraint> getSubjectTo() {
        return subjectTo;
    }

    public List<String> getBinaries() {
        return binaries;
    }

    public List<VariableBounds> getBounds() {
        return bounds;
    }

    public String toJson() {
        return GSON.toJson(this);
    }
}
