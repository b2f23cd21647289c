package coach;

import ebm.DistanceTables;
import ebm.FeatureType;
import ebm.InteractionTerm;
import ebm.LocalScoringModel;
import ebm.Sample;
import ebm.ScoringModel;
import optimization.VariableId;
import options.CategoricalOption;
import options.ContinuousOption;
import options.Direction;
import options.InteractionOption;
import options.MainEffectOption;
import options.OptionGenerator;
import options.OptionKind;
import options.OptionSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import smile.math.MathEx;
import solver.Solver;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Generates diverse counterfactual explanations for a {@link ScoringModel}.
 *
 * A batch starts from one sample: options are generated for every feature
 * allowed to vary, turned into a binary program, and solved repeatedly with
 * the previous solutions' variables muted. The returned {@link ResumeState}
 * lets {@link #generateSubCfs(ResumeState)} continue the same search.
 */
public class CounterfactualCoach {
    private static final Logger logger = LoggerFactory.getLogger(CounterfactualCoach.class);

    /** How far below log-odds 0 a counterfactual of a positive prediction has to land. */
    public static final double DECISION_MARGIN = 1e-4;

    private final ScoringModel model;
    private final DistanceTables distances;
    private final Solver solver;

    public CounterfactualCoach(ScoringModel model, Solver solver) {
        this(model, DistanceTables.fromDescription(model.getDescription()), solver);
    }

    public CounterfactualCoach(ScoringModel model, DistanceTables distances, Solver solver) {
        this.model = model;
        this.distances = distances;
        this.solver = solver;
    }

    public CfResult generateCfs(CfConfig config) {
        Sample sample = config.getSample();
        LocalScoringModel local = new LocalScoringModel(model, sample);
        double score = local.getScore();

        Direction direction;
        double scoreThreshold;
        Double scoreGainBound = null;
        if (model.isClassifier()) {
            // cross the decision boundary at log-odds 0; a probability that rounds to 0.5 is still class 1
            if (score < 0) {
                direction = Direction.INCREASE;
                scoreThreshold = -score;
            } else {
                direction = Direction.DECREASE;
                scoreThreshold = -score - DECISION_MARGIN;
            }
        } else {
            double[] target = config.getTargetRange();
            if (target == null) {
                throw new IllegalArgumentException("A target range is required for a regression model");
            }
            if (score >= target[0] && score <= target[1]) {
                throw new IllegalArgumentException("Score " + score + " is already inside the target range ["
                        + target[0] + ", " + target[1] + "]");
            }
            if (score < target[0]) {
                direction = Direction.INCREASE;
                scoreThreshold = target[0] - score;
                scoreGainBound = target[1] - score;
            } else {
                direction = Direction.DECREASE;
                scoreThreshold = target[1] - score;
                scoreGainBound = target[0] - score;
            }
        }

        double simThreshold = config.getSimThreshold() != null
                ? config.getSimThreshold()
                : OptionGenerator.defaultSimilarityThreshold(model, config.getSimThresholdFactor());
        Set<Integer> featuresToVary = resolveFeaturesToVary(config.getFeaturesToVary());
        Set<Integer> integerFeatures = resolveNames(config.getContinuousIntegerFeatures());
        Map<Integer, FeatureRange> ranges = new LinkedHashMap<>();
        config.getFeatureRanges().forEach((name, range) -> ranges.put(model.featureIndex(name), range));

        logger.info("Score {} -> need gain {} {} over {} features", score,
                direction == Direction.INCREASE ? ">=" : "<=", scoreThreshold, featuresToVary.size());

        OptionGenerator generator = new OptionGenerator(local, distances);
        Map<Integer, List<MainEffectOption>> mainOptions = new LinkedHashMap<>();
        for (int feature : featuresToVary) {
            List<? extends MainEffectOption> generated;
            if (model.getFeatureType(feature) == FeatureType.CONTINUOUS) {
                generated = generator.generateContinuousOptions(direction, feature, simThreshold,
                        scoreGainBound, integerFeatures.contains(feature), false);
            } else {
                generated = generator.generateCategoricalOptions(direction, feature, scoreGainBound, false);
            }
            FeatureRange range = ranges.get(feature);
            List<MainEffectOption> kept = new ArrayList<>();
            for (MainEffectOption option : generated) {
                if (range == null || range.admits(option.getEncodedTarget())) {
                    kept.add(option);
                }
            }
            mainOptions.put(feature, kept);
        }

        Map<Integer, List<InteractionOption>> interactionOptions = new LinkedHashMap<>();
        for (InteractionTerm term : model.getInteractions()) {
            List<MainEffectOption> first = mainOptions.get(term.getFirstFeature());
            List<MainEffectOption> second = mainOptions.get(term.getSecondFeature());
            if (first == null || second == null || first.isEmpty() || second.isEmpty()) {
                continue;
            }
            interactionOptions.put(term.getIndex(), generator.generateInteractionOptions(term, first, second));
        }

        OptionSet options = new OptionSet(mainOptions, interactionOptions);
        options = weighCategorical(options, config.getCategoricalWeight());
        options = applyMultipliers(options, config.getFeatureWeightMultipliers());
        logger.debug("Generated {} options", options.size());

        ResumeState state = new ResumeState(sample, direction, scoreThreshold, featuresToVary, options,
                config.getMaxNumFeaturesToVary(), new LinkedHashSet<>());
        return runBatch(state, config.getTotalCfs());
    }

    /** One more counterfactual from where an earlier batch stopped. */
    public CfResult generateSubCfs(ResumeState state) {
        return runBatch(state, 1);
    }

    private CfResult runBatch(ResumeState state, int totalCfs) {
        List<Counterfactual> found = new ArrayList<>();
        List<Integer> failed = new ArrayList<>();
        ResumeState current = state;

        Iterator<SearchStep> steps = new DiverseSearch(model.getFeatureNames(), solver, state).iterator();
        for (int i = 0; i < totalCfs; i++) {
            SearchStep step = steps.next();
            if (!step.isFound()) {
                for (int j = i; j < totalCfs; j++) {
                    failed.add(j);
                }
                logger.warn("Found {} of {} counterfactuals", found.size(), totalCfs);
                break;
            }
            found.add(decode(step, state));
            current = step.getNextState();
        }
        return new CfResult(found, failed.isEmpty(), failed, current);
    }

    private Counterfactual decode(SearchStep step, ResumeState state) {
        Sample original = state.getSample();
        OptionSet options = state.getOptions();
        Sample data = original;
        List<FeatureChange> changes = new ArrayList<>();
        double distance = 0.0;
        double gain = 0.0;

        for (VariableId id : step.getMainVariables()) {
            int feature = id.getFeatureIndex();
            MainEffectOption option = options.findMain(feature, id.getBinIndex());
            String name = model.getFeatureName(feature);
            Object newValue;
            double[] binRange = null;
            if (option.getKind() == OptionKind.CONTINUOUS) {
                newValue = ((ContinuousOption) option).getTarget();
                binRange = model.binRange(feature, id.getBinIndex());
            } else {
                newValue = model.getLabelEncoder().decode(name, ((CategoricalOption) option).getLevel());
            }
            data = data.with(feature, newValue);
            changes.add(new FeatureChange(feature, name, original.get(feature), newValue, binRange,
                    option.getScoreGain()));
            distance += option.getDistance();
            gain += option.getScoreGain();
        }

        for (VariableId id : step.getInteractionVariables()) {
            InteractionOption option = findInteraction(options, id);
            if (option != null) {
                gain += option.getScoreGain();
            }
        }
        return new Counterfactual(data, distance, changes, step.getMainVariables(), gain);
    }

    private static InteractionOption findInteraction(OptionSet options, VariableId id) {
        for (List<InteractionOption> list : options.getInteractionOptions().values()) {
            for (InteractionOption option : list) {
                if (option.getFirstFeature() == id.getFeatureIndex() && option.getFirstBin() == id.getBinIndex()
                        && option.getSecondFeature() == id.getSecondFeatureIndex()
                        && option.getSecondBin() == id.getSecondBinIndex()) {
                    return option;
                }
            }
        }
        return null;
    }

    /**
     * Scales categorical distances. A null weight balances the mean
     * categorical distance against the mean continuous one.
     */
    private OptionSet weighCategorical(OptionSet options, Double categoricalWeight) {
        double weight;
        if (categoricalWeight != null) {
            weight = categoricalWeight;
        } else {
            List<Double> continuous = new ArrayList<>();
            List<Double> categorical = new ArrayList<>();
            for (MainEffectOption option : options.allMainOptions()) {
                if (option.getKind() == OptionKind.CONTINUOUS) {
                    continuous.add(option.getDistance());
                } else {
                    categorical.add(option.getDistance());
                }
            }
            weight = 1.0;
            if (!continuous.isEmpty() && !categorical.isEmpty()) {
                double catMean = MathEx.mean(toArray(categorical));
                if (catMean > 0) {
                    weight = MathEx.mean(toArray(continuous)) / catMean;
                }
            }
            logger.debug("Categorical weight set to {}", weight);
        }
        if (weight == 1.0) {
            return options;
        }
        double w = weight;
        return options.mapMainOptions(option -> option.getKind() == OptionKind.CATEGORICAL
                ? option.withDistance(option.getDistance() * w)
                : option);
    }

    private OptionSet applyMultipliers(OptionSet options, Map<String, Double> multipliers) {
        if (multipliers.isEmpty()) {
            return options;
        }
        Map<Integer, Double> byIndex = new LinkedHashMap<>();
        multipliers.forEach((name, m) -> byIndex.put(model.featureIndex(name), m));
        return options.mapMainOptions(option -> {
            Double m = byIndex.get(option.getFeatureIndex());
            return m == null ? option : option.withDistance(option.getDistance() * m);
        });
    }

    private Set<Integer> resolveFeaturesToVary(List<String> names) {
        Set<Integer> features = new LinkedHashSet<>();
        if (names == null) {
            for (int i = 0; i < model.getFeatureCount(); i++) {
                features.add(i);
            }
            return features;
        }
        return resolveNames(names);
    }

    private Set<Integer> resolveNames(List<String> names) {
        Set<Integer> features = new LinkedHashSet<>();
        for (String name : names) {
            features.add(model.featureIndex(name));
        }
        return features;
    }

    private static double[] toArray(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).toArray();
    }

    public ScoringModel getModel() {
        return model;
    }
}
