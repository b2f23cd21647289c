package coach;

import ebm.FeatureConfig;
import ebm.FeatureType;
import ebm.Sample;
import ebm.ScoringModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * User preferences for one sample: per-feature difficulty, acceptable
 * ranges and the feature cap. Seeded from the per-feature config in the
 * model description and converted into a {@link CfConfig}.
 */
public class CoachConstraints {
    private static final Logger logger = LoggerFactory.getLogger(CoachConstraints.class);

    public static final int DEFAULT_MAX_NUM_FEATURES_TO_VARY = 4;

    private final ScoringModel model;
    private final Sample sample;
    private final Map<String, Difficulty> difficulties = new LinkedHashMap<>();
    private final Map<String, FeatureRange> acceptableRanges = new LinkedHashMap<>();
    private final List<String> continuousIntegerFeatures = new ArrayList<>();
    private Integer maxNumFeaturesToVary = DEFAULT_MAX_NUM_FEATURES_TO_VARY;

    public CoachConstraints(ScoringModel model, Sample sample) {
        this.model = model;
        this.sample = sample;
        for (int i = 0; i < model.getFeatureCount(); i++) {
            String name = model.getFeatureName(i);
            FeatureConfig config = model.getFeatureConfig(i);
            if (config == null) {
                continue;
            }
            if (config.getDifficulty() != FeatureConfig.NEUTRAL_DIFFICULTY) {
                difficulties.put(name, Difficulty.ofCode(config.getDifficulty()));
            }
            FeatureRange range = initialRange(i, config);
            if (range != null) {
                acceptableRanges.put(name, range);
            }
            if (model.getFeatureType(i) == FeatureType.CONTINUOUS
                    && config.isRequiresInt() && config.getUsesTransform() == null) {
                continuousIntegerFeatures.add(name);
            }
        }
    }

    private FeatureRange initialRange(int feature, FeatureConfig config) {
        double[] range = config.getAcceptableRange();
        if (model.getFeatureType(feature) == FeatureType.CATEGORICAL) {
            if (range == null) {
                return null;
            }
            Set<Integer> levels = new LinkedHashSet<>();
            for (double code : range) {
                levels.add((int) code);
            }
            return FeatureRange.levels(levels);
        }

        if (range != null) {
            return FeatureRange.interval(range[0], range[1]);
        }
        // without an explicit range the monotonic requirement bounds one side
        double[] edges = model.getFullBinEdges(feature);
        double low = edges[0];
        double high = edges[edges.length - 1];
        double current = model.encode(feature, sample.get(feature));
        if (config.isRequiresIncreasing()) {
            low = current;
        } else if (config.isRequiresDecreasing()) {
            high = current;
        } else {
            return null;
        }
        if (low > high) {
            logger.warn("Acceptable range of '{}' is empty for value {}, ignoring it", model.getFeatureName(feature), current);
            return null;
        }
        return FeatureRange.interval(low, high);
    }

    public CoachConstraints setDifficulty(String featureName, Difficulty difficulty) {
        model.featureIndex(featureName);
        if (difficulty == Difficulty.NEUTRAL) {
            difficulties.remove(featureName);
        } else {
            difficulties.put(featureName, difficulty);
        }
        return this;
    }

    public Difficulty getDifficulty(String featureName) {
        return difficulties.getOrDefault(featureName, Difficulty.NEUTRAL);
    }

    public CoachConstraints setAcceptableRange(String featureName, FeatureRange range) {
        model.featureIndex(featureName);
        if (range == null) {
            acceptableRanges.remove(featureName);
        } else {
            acceptableRanges.put(featureName, range);
        }
        return this;
    }

    public Map<String, FeatureRange> getAcceptableRanges() {
        return acceptableRanges;
    }

    public CoachConstraints setMaxNumFeaturesToVary(Integer maxNumFeaturesToVary) {
        this.maxNumFeaturesToVary = maxNumFeaturesToVary;
        return this;
    }

    public Integer getMaxNumFeaturesToVary() {
        return maxNumFeaturesToVary;
    }

    /** Every feature that is not locked, in model order. */
    public List<String> featuresToVary() {
        List<String> names = new ArrayList<>();
        for (String name : model.getFeatureNames()) {
            if (getDifficulty(name) != Difficulty.LOCK) {
                names.add(name);
            }
        }
        return names;
    }

    public Map<String, Double> featureWeightMultipliers() {
        Map<String, Double> multipliers = new LinkedHashMap<>();
        difficulties.forEach((name, difficulty) -> {
            if (difficulty != Difficulty.LOCK) {
                multipliers.put(name, difficulty.getWeightMultiplier());
            }
        });
        return multipliers;
    }

    public List<String> getContinuousIntegerFeatures() {
        return continuousIntegerFeatures;
    }

    public CfConfig.Builder toConfig() {
        Map<String, FeatureRange> ranges = new LinkedHashMap<>();
        acceptableRanges.forEach((name, range) -> {
            if (getDifficulty(name) != Difficulty.LOCK) {
                ranges.put(name, range);
            }
        });
        return CfConfig.builder(sample)
                .featuresToVary(featuresToVary())
                .featureRanges(ranges)
                .featureWeightMultipliers(featureWeightMultipliers())
                .maxNumFeaturesToVary(maxNumFeaturesToVary)
                .continuousIntegerFeatures(continuousIntegerFeatures);
    }
}
