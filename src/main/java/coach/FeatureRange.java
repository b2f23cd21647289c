package coach;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Values a feature may take in a counterfactual: a closed interval for a
 * continuous feature, a set of level codes for a categorical one.
 */
public final class FeatureRange {
    private final double min;
    private final double max;
    private final Set<Integer> levels;

    private FeatureRange(double min, double max, Set<Integer> levels) {
        this.min = min;
        this.max = max;
        this.levels = levels;
    }

    public static FeatureRange interval(double min, double max) {
        if (min > max) {
            throw new IllegalArgumentException("Range [" + min + ", " + max + "] is empty");
        }
        return new FeatureRange(min, max, null);
    }

    public static FeatureRange levels(Set<Integer> levelCodes) {
        return new FeatureRange(Double.NaN, Double.NaN,
                Collections.unmodifiableSet(new LinkedHashSet<>(levelCodes)));
    }

    public static FeatureRange levels(int... levelCodes) {
        Set<Integer> codes = new LinkedHashSet<>();
        for (int code : levelCodes) {
            codes.add(code);
        }
        return levels(codes);
    }

    public boolean isCategorical() {
        return levels != null;
    }

    /** Whether an encoded value (number or level code) is allowed. */
    public boolean admits(double encodedValue) {
        if (levels != null) {
            return levels.contains((int) encodedValue);
        }
        return encodedValue >= min && encodedValue <= max;
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    public Set<Integer> getLevels() {
        return levels == null ? Collections.emptySet() : levels;
    }

    @Override
    public String toString() {
        if (levels != null) {
            return "FeatureRange" + levels;
        }
        return "FeatureRange" + Arrays.toString(new double[]{min, max});
    }
}
