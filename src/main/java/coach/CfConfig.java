package coach;

import ebm.Sample;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Inputs of one counterfactual batch. Build with {@link #builder(Sample)}.
 */
public final class CfConfig {
    public static final double DEFAULT_SIM_THRESHOLD_FACTOR = 0.005;

    private final Sample sample;
    private final int totalCfs;
    private final double[] targetRange;
    private final Double simThreshold;
    private final double simThresholdFactor;
    private final Double categoricalWeight;
    private final List<String> featuresToVary;
    private final Map<String, FeatureRange> featureRanges;
    private final Map<String, Double> featureWeightMultipliers;
    private final Integer maxNumFeaturesToVary;
    private final List<String> continuousIntegerFeatures;

    private CfConfig(Builder builder) {
        this.sample = builder.sample;
        this.totalCfs = builder.totalCfs;
        this.targetRange = builder.targetRange;
        this.simThreshold = builder.simThreshold;
        this.simThresholdFactor = builder.simThresholdFactor;
        this.categoricalWeight = builder.categoricalWeight;
        this.featuresToVary = builder.featuresToVary == null ? null
                : Collections.unmodifiableList(new ArrayList<>(builder.featuresToVary));
        this.featureRanges = Collections.unmodifiableMap(new LinkedHashMap<>(builder.featureRanges));
        this.featureWeightMultipliers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.featureWeightMultipliers));
        this.maxNumFeaturesToVary = builder.maxNumFeaturesToVary;
        this.continuousIntegerFeatures = Collections.unmodifiableList(new ArrayList<>(builder.continuousIntegerFeatures));
    }

    public static Builder builder(Sample sample) {
        return new Builder(sample);
    }

    public Builder toBuilder() {
        Builder builder = new Builder(sample)
                .totalCfs(totalCfs)
                .simThreshold(simThreshold)
                .simThresholdFactor(simThresholdFactor)
                .categoricalWeight(categoricalWeight)
                .featuresToVary(featuresToVary)
                .featureRanges(featureRanges)
                .featureWeightMultipliers(featureWeightMultipliers)
                .maxNumFeaturesToVary(maxNumFeaturesToVary)
                .continuousIntegerFeatures(continuousIntegerFeatures);
        if (targetRange != null) {
            builder.targetRange(targetRange[0], targetRange[1]);
        }
        return builder;
    }

    public Sample getSample() {
        return sample;
    }

    public int getTotalCfs() {
        return totalCfs;
    }

    /** [low, high] for regression, null otherwise. */
    public double[] getTargetRange() {
        return targetRange == null ? null : targetRange.clone();
    }

    /** Null means derive it from the model. */
    public Double getSimThreshold() {
        return simThreshold;
    }

    public double getSimThresholdFactor() {
        return simThresholdFactor;
    }

    /** Null means balance categorical against continuous distances automatically. */
    public Double getCategoricalWeight() {
        return categoricalWeight;
    }

    /** Null means every main feature may vary. */
    public List<String> getFeaturesToVary() {
        return featuresToVary;
    }

    public Map<String, FeatureRange> getFeatureRanges() {
        return featureRanges;
    }

    public Map<String, Double> getFeatureWeightMultipliers() {
        return featureWeightMultipliers;
    }

    public Integer getMaxNumFeaturesToVary() {
        return maxNumFeaturesToVary;
    }

    public List<String> getContinuousIntegerFeatures() {
        return continuousIntegerFeatures;
    }

    public static final class Builder {
        private final Sample sample;
        private int totalCfs = 1;
        private double[] targetRange;
        private Double simThreshold;
        private double simThresholdFactor = DEFAULT_SIM_THRESHOLD_FACTOR;
        private Double categoricalWeight;
        private List<String> featuresToVary;
        private Map<String, FeatureRange> featureRanges = new LinkedHashMap<>();
        private Map<String, Double> featureWeightMultipliers = new LinkedHashMap<>();
        private Integer maxNumFeaturesToVary;
        private List<String> continuousIntegerFeatures = new ArrayList<>();

        private Builder(Sample sample) {
            if (sample == null) {
                throw new IllegalArgumentException("A sample is required");
            }
            this.sample = sample;
        }

        public Builder totalCfs(int totalCfs) {
            if (totalCfs < 1) {
                throw new IllegalArgumentException("totalCfs must be at least 1, got " + totalCfs);
            }
            this.totalCfs = totalCfs;
            return this;
        }

        public Builder targetRange(double low, double high) {
            if (low > high) {
                throw new IllegalArgumentException("Target range [" + low + ", " + high + "] is empty");
            }
            this.targetRange = new double[]{low, high};
            return this;
        }

        public Builder simThreshold(Double simThreshold) {
            this.simThreshold = simThreshold;
            return this;
        }

        public Builder simThresholdFactor(double simThresholdFactor) {
            this.simThresholdFactor = simThresholdFactor;
            return this;
        }

        public Builder categoricalWeight(Double categoricalWeight) {
            this.categoricalWeight = categoricalWeight;
            return this;
        }

        public Builder featuresToVary(List<String> featuresToVary) {
            this.featuresToVary = featuresToVary == null ? null : new ArrayList<>(featuresToVary);
            return this;
        }

        public Builder featureRanges(Map<String, FeatureRange> featureRanges) {
            this.featureRanges = new LinkedHashMap<>(featureRanges);
            return this;
        }

        public Builder featureRange(String featureName, FeatureRange range) {
            this.featureRanges.put(featureName, range);
            return this;
        }

        public Builder featureWeightMultipliers(Map<String, Double> multipliers) {
            this.featureWeightMultipliers = new LinkedHashMap<>(multipliers);
            return this;
        }

        public Builder featureWeightMultiplier(String featureName, double multiplier) {
            this.featureWeightMultipliers.put(featureName, multiplier);
            return this;
        }

        public Builder maxNumFeaturesToVary(Integer maxNumFeaturesToVary) {
            if (maxNumFeaturesToVary != null && maxNumFeaturesToVary < 1) {
                throw new IllegalArgumentException("maxNumFeaturesToVary must be at least 1");
            }
            this.maxNumFeaturesToVary = maxNumFeaturesToVary;
            return this;
        }

        public Builder continuousIntegerFeatures(List<String> features) {
            this.continuousIntegerFeatures = new ArrayList<>(features);
            return this;
        }

        public CfConfig build() {
            return new CfConfig(this);
        }
    }
}
