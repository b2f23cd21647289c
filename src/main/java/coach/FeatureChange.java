package coach;

/**
 * One feature edit inside a counterfactual.
 */
public final class FeatureChange {
    private final int featureIndex;
    private final String featureName;
    private final Object originalValue;
    private final Object newValue;
    // continuous: [lower, upper] of the target bin; categorical: null
    private final double[] binRange;
    private final double scoreGain;

    public FeatureChange(int featureIndex, String featureName, Object originalValue, Object newValue,
                         double[] binRange, double scoreGain) {
        this.featureIndex = featureIndex;
        this.featureName = featureName;
        this.originalValue = originalValue;
        this.newValue = newValue;
        this.binRange = binRange == null ? null : binRange.clone();
        this.scoreGain = scoreGain;
    }

    public int getFeatureIndex() {
        return featureIndex;
    }

    public String getFeatureName() {
        return featureName;
    }

    public Object getOriginalValue() {
        return originalValue;
    }

    public Object getNewValue() {
        return newValue;
    }

    public boolean isCategorical() {
        return binRange == null;
    }

    public double[] getBinRange() {
        return binRange == null ? null : binRange.clone();
    }

    /** What a user may aim for: the bin range, or the new level itself. */
    public Object getTargetRange() {
        return binRange == null ? newValue : getBinRange();
    }

    public double getScoreGain() {
        return scoreGain;
    }

    @Override
    public String toString() {
        return featureName + ": " + originalValue + " -> " + newValue;
    }
}
