package options;

import java.util.Map;

public final class ContinuousOption extends MainEffectOption {
    private final double target;

    public ContinuousOption(int featureIndex, String featureName, int binIndex, double target,
                            double scoreGain, double distance, Map<Integer, Double> interactionGains) {
        super(featureIndex, featureName, binIndex, scoreGain, distance, interactionGains);
        this.target = target;
    }

    public double getTarget() {
        return target;
    }

    @Override
    public double getEncodedTarget() {
        return target;
    }

    @Override
    public OptionKind getKind() {
        return OptionKind.CONTINUOUS;
    }

    @Override
    public ContinuousOption withDistance(double newDistance) {
        return new ContinuousOption(getFeatureIndex(), getFeatureName(), getBinIndex(), target,
                getScoreGain(), newDistance, getInteractionGains());
    }

    @Override
    public String toString() {
        return String.format("ContinuousOption{%s -> %s (bin %d), gain=%.5f, distance=%.5f}",
                getFeatureName(), target, getBinIndex(), getScoreGain(), getDistance());
    }
}
