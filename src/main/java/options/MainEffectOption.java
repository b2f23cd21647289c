package options;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Replacement value for a single main feature.
 *
 * The score gain covers the main effect plus every interaction touching
 * the feature, evaluated with the other parent at its current value;
 * interactionGains keeps that per-interaction share, keyed by interaction
 * term index.
 */
public abstract class MainEffectOption extends Option {
    private final int featureIndex;
    private final String featureName;
    private final int binIndex;
    private final double distance;
    private final Map<Integer, Double> interactionGains;

    protected MainEffectOption(int featureIndex, String featureName, int binIndex, double scoreGain,
                               double distance, Map<Integer, Double> interactionGains) {
        super(scoreGain);
        this.featureIndex = featureIndex;
        this.featureName = featureName;
        this.binIndex = binIndex;
        this.distance = distance;
        this.interactionGains = Collections.unmodifiableMap(new LinkedHashMap<>(interactionGains));
    }

    public int getFeatureIndex() {
        return featureIndex;
    }

    public String getFeatureName() {
        return featureName;
    }

    public int getBinIndex() {
        return binIndex;
    }

    public double getDistance() {
        return distance;
    }

    public Map<Integer, Double> getInteractionGains() {
        return interactionGains;
    }

    /** Share of the score gain coming from one interaction term, 0 if none. */
    public double interactionGain(int interactionIndex) {
        Double gain = interactionGains.get(interactionIndex);
        return gain == null ? 0.0 : gain;
    }

    /**
     * Encoded target: the number itself (continuous) or the level code.
     */
    public abstract double getEncodedTarget();

    public abstract MainEffectOption withDistance(double newDistance);
}
