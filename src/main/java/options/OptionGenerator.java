package options;

import ebm.DistanceTables;
import ebm.FeatureType;
import ebm.InteractionTerm;
import ebm.LocalScoringModel;
import ebm.ScoringModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import smile.math.MathEx;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Enumerates candidate replacement values for the features of one sample,
 * with the score gain and distance of each.
 */
public class OptionGenerator {
    private static final Logger logger = LoggerFactory.getLogger(OptionGenerator.class);

    /** Offset keeping a left-hand target inside its bin. */
    public static final double EPSILON = 1e-6;

    private final LocalScoringModel local;
    private final ScoringModel model;
    private final DistanceTables distances;

    public OptionGenerator(LocalScoringModel local, DistanceTables distances) {
        this.local = local;
        this.model = local.getModel();
        this.distances = distances;
    }

    /**
     * Default similarity threshold: the mean additive-score range of the
     * continuous features, scaled by factor.
     */
    public static double defaultSimilarityThreshold(ScoringModel model, double factor) {
        List<Double> ranges = new ArrayList<>();
        for (int i = 0; i < model.getFeatureCount(); i++) {
            if (model.getFeatureType(i) == FeatureType.CONTINUOUS) {
                double[] scores = model.getScores(i);
                ranges.add(MathEx.max(scores) - MathEx.min(scores));
            }
        }
        if (ranges.isEmpty()) {
            return 0.0;
        }
        double[] values = ranges.stream().mapToDouble(Double::doubleValue).toArray();
        return MathEx.mean(values) * factor;
    }

    /**
     * Options for a continuous feature: one per bin other than the current
     * one, filtered by direction and bound, then pruned so that no kept option
     * is costlier than another kept option with a gain within simThreshold.
     *
     * @param scoreGainBound  gains past this bound are dropped; null for none
     * @param integerValued   targets must be integers inside their bin
     * @param skipDirectionFilter keep options moving the score the wrong way
     */
    public List<ContinuousOption> generateContinuousOptions(Direction direction, int featureIndex,
                                                            double simThreshold, Double scoreGainBound,
                                                            boolean integerValued, boolean skipDirectionFilter) {
        checkType(featureIndex, FeatureType.CONTINUOUS);
        String name = model.getFeatureName(featureIndex);
        double value = local.getEncodedValue(featureIndex);
        int currentBin = local.getMainBin(featureIndex);
        double currentScore = local.getMainScore(featureIndex);
        double[] edges = model.getBinEdges(featureIndex);
        double[] scores = model.getScores(featureIndex);
        double mad = distances.mad(name);

        List<ContinuousOption> options = new ArrayList<>();
        for (int bin = 0; bin < edges.length; bin++) {
            if (bin == currentBin) {
                continue;
            }
            Double target = bin < currentBin
                    ? leftTarget(edges, bin, integerValued)
                    : rightTarget(edges, bin, integerValued);
            if (target == null) {
                logger.debug("No integer value inside bin {} of '{}', skipping it", bin, name);
                continue;
            }

            double distance = Math.abs(target - value);
            if (mad > 0) {
                distance /= mad;
            }

            Map<Integer, Double> interactionGains = interactionGains(featureIndex, target);
            double gain = scores[bin] - currentScore;
            for (double share : interactionGains.values()) {
                gain += share;
            }
            options.add(new ContinuousOption(featureIndex, name, bin, target, gain, distance, interactionGains));
        }

        options = filter(options, direction, scoreGainBound, skipDirectionFilter);
        options.sort(Comparator.comparingDouble(MainEffectOption::getDistance));
        List<ContinuousOption> pruned = pruneSimilar(options, simThreshold);
        logger.debug("Feature '{}': {} continuous options ({} pruned)", name, pruned.size(),
                options.size() - pruned.size());
        return pruned;
    }

    /**
     * Options for a categorical feature: one per other level, filtered by
     * direction and bound. Distances come from the categorical distance table.
     */
    public List<CategoricalOption> generateCategoricalOptions(Direction direction, int featureIndex,
                                                              Double scoreGainBound, boolean skipDirectionFilter) {
        checkType(featureIndex, FeatureType.CATEGORICAL);
        String name = model.getFeatureName(featureIndex);
        int currentBin = local.getMainBin(featureIndex);
        double currentScore = local.getMainScore(featureIndex);
        double[] levels = model.getBinEdges(featureIndex);
        double[] scores = model.getScores(featureIndex);

        List<CategoricalOption> options = new ArrayList<>();
        for (int bin = 0; bin < levels.length; bin++) {
            if (bin == currentBin) {
                continue;
            }
            int level = (int) levels[bin];
            Map<Integer, Double> interactionGains = interactionGains(featureIndex, level);
            double gain = scores[bin] - currentScore;
            for (double share : interactionGains.values()) {
                gain += share;
            }
            options.add(new CategoricalOption(featureIndex, name, bin, level, gain,
                    distances.levelDistance(name, level), interactionGains));
        }

        options = filter(options, direction, scoreGainBound, skipDirectionFilter);
        logger.debug("Feature '{}': {} categorical options", name, options.size());
        return options;
    }

    /**
     * Pairwise corrections for an interaction term, one per pair of parent
     * options. Each correction is the pair's interaction gain minus what the
     * two parents already claimed for this term.
     */
    public List<InteractionOption> generateInteractionOptions(InteractionTerm term,
                                                              List<? extends MainEffectOption> firstOptions,
                                                              List<? extends MainEffectOption> secondOptions) {
        double currentScore = local.getInteractionScore(term);
        List<InteractionOption> options = new ArrayList<>(firstOptions.size() * secondOptions.size());
        for (MainEffectOption first : firstOptions) {
            int firstBin = term.binOf(term.getFirstFeature(), first.getEncodedTarget());
            for (MainEffectOption second : secondOptions) {
                int secondBin = term.binOf(term.getSecondFeature(), second.getEncodedTarget());
                double rawGain = term.score(firstBin, secondBin) - currentScore;
                double netGain = rawGain
                        - first.interactionGain(term.getIndex())
                        - second.interactionGain(term.getIndex());
                options.add(new InteractionOption(term.getIndex(), term.getName(), first, second, netGain));
            }
        }
        return options;
    }

    /**
     * Per interaction touching the feature: score change when only this
     * feature moves to target.
     */
    private Map<Integer, Double> interactionGains(int featureIndex, double target) {
        Map<Integer, Double> gains = new LinkedHashMap<>();
        for (InteractionTerm term : model.interactionsOf(featureIndex)) {
            int other = term.otherFeature(featureIndex);
            int otherBin = local.getInteractionBin(term, other);
            int newBin = term.binOf(featureIndex, target);
            double newScore = term.scoreFor(featureIndex, newBin, otherBin);
            gains.put(term.getIndex(), newScore - local.getInteractionScore(term));
        }
        return gains;
    }

    private static Double leftTarget(double[] edges, int bin, boolean integerValued) {
        double nextLower = edges[bin + 1];
        if (integerValued) {
            double target = Math.ceil(nextLower) - 1;
            // the first bin is open to the left
            if (bin > 0 && target < edges[bin]) {
                return null;
            }
            return target;
        }
        return bin > 0 ? Math.max(edges[bin], nextLower - EPSILON) : nextLower - EPSILON;
    }

    private static Double rightTarget(double[] edges, int bin, boolean integerValued) {
        if (integerValued) {
            double target = Math.ceil(edges[bin]);
            if (bin + 1 < edges.length && target >= edges[bin + 1]) {
                return null;
            }
            return target;
        }
        return edges[bin];
    }

    private static <T extends MainEffectOption> List<T> filter(List<T> options, Direction direction,
                                                               Double scoreGainBound, boolean skipDirectionFilter) {
        List<T> kept = new ArrayList<>(options.size());
        for (T option : options) {
            if (!skipDirectionFilter && !direction.isTowards(option.getScoreGain())) {
                continue;
            }
            if (scoreGainBound != null && direction.overshoots(option.getScoreGain(), scoreGainBound)) {
                continue;
            }
            kept.add(option);
        }
        return kept;
    }

    /**
     * Walks the distance-sorted list; each kept option removes every later
     * option whose gain lies within threshold of its own.
     */
    static <T extends MainEffectOption> List<T> pruneSimilar(List<T> sortedByDistance, double threshold) {
        List<T> options = new ArrayList<>(sortedByDistance);
        int i = 0;
        while (i < options.size()) {
            double gain = options.get(i).getScoreGain();
            int j = i + 1;
            while (j < options.size()) {
                if (Math.abs(options.get(j).getScoreGain() - gain) < threshold) {
                    options.remove(j);
                } else {
                    j++;
                }
            }
            i++;
        }
        return options;
    }

    private void checkType(int featureIndex, FeatureType expected) {
        if (model.getFeatureType(featureIndex) != expected) {
            throw new IllegalArgumentException("Feature '" + model.getFeatureName(featureIndex)
                    + "' is not " + expected.name().toLowerCase());
        }
    }
}
