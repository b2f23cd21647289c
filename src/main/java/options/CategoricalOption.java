package options;

import java.util.Map;

public final class CategoricalOption extends MainEffectOption {
    private final int level;

    public CategoricalOption(int featureIndex, String featureName, int binIndex, int level,
                             double scoreGain, double distance, Map<Integer, Double> interactionGains) {
        super(featureIndex, featureName, binIndex, scoreGain, distance, interactionGains);
        this.level = level;
    }

    /** Level code of the new category. */
    public int getLevel() {
        return level;
    }

    @Override
    public double getEncodedTarget() {
        return level;
    }

    @Override
    public OptionKind getKind() {
        return OptionKind.CATEGORICAL;
    }

    @Override
    public CategoricalOption withDistance(double newDistance) {
        return new CategoricalOption(getFeatureIndex(), getFeatureName(), getBinIndex(), level,
                getScoreGain(), newDistance, getInteractionGains());
    }

    @Override
    public String toString() {
        return String.format("CategoricalOption{%s -> level %d (bin %d), gain=%.5f, distance=%.5f}",
                getFeatureName(), level, getBinIndex(), getScoreGain(), getDistance());
    }
}
