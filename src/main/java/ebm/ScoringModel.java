package ebm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Additive, bin-based scoring engine.
 *
 * A sample's score is the intercept plus one lookup per main feature and one
 * 2-D lookup per interaction term. Continuous features are binned by lower
 * edge (binary search, clamped at both ends), categorical features by exact
 * level code.
 */
public class ScoringModel {
    private static final Logger logger = LoggerFactory.getLogger(ScoringModel.class);

    private final ModelDescription description;
    private final List<String> featureNames;
    private final FeatureType[] featureTypes;
    private final FeatureConfig[] featureConfigs;
    // continuous: bin lower edges; categorical: level codes
    private final double[][] binEdges;
    // continuous only: full edge list including the trailing upper edge
    private final double[][] fullBinEdges;
    private final double[][] scores;
    private final List<InteractionTerm> interactions;
    private final List<List<InteractionTerm>> interactionsByFeature;
    private final Map<String, Integer> indexByName = new HashMap<>();
    private final LabelEncoder labelEncoder;
    private final double intercept;
    private final boolean classifier;

    public ScoringModel(ModelDescription description) {
        this.description = description;
        this.intercept = description.getIntercept();
        this.classifier = description.isClassifier();
        this.labelEncoder = new LabelEncoder(description.getLabelEncoder());

        Map<String, FeatureDescription> mainByName = new LinkedHashMap<>();
        List<FeatureDescription> interactionDescriptions = new ArrayList<>();
        for (FeatureDescription feature : description.getFeatures()) {
            if (feature.getType() == null) {
                throw new ModelFormatException("Feature '" + feature.getName() + "' has no type");
            }
            if (feature.getType().isMainEffect()) {
                mainByName.put(feature.getName(), feature);
            } else {
                interactionDescriptions.add(feature);
            }
        }

        List<String> names = new ArrayList<>(description.getFeatureNames());
        if (names.isEmpty()) {
            names.addAll(mainByName.keySet());
        }
        this.featureNames = Collections.unmodifiableList(names);

        int n = names.size();
        this.featureTypes = new FeatureType[n];
        this.featureConfigs = new FeatureConfig[n];
        this.binEdges = new double[n][];
        this.fullBinEdges = new double[n][];
        this.scores = new double[n][];

        for (int i = 0; i < n; i++) {
            String name = names.get(i);
            FeatureDescription feature = mainByName.get(name);
            if (feature == null) {
                throw new ModelFormatException("Feature '" + name + "' is listed but not described");
            }
            indexByName.put(name, i);
            featureTypes[i] = feature.getType();
            featureConfigs[i] = feature.getConfig();
            scores[i] = feature.getMainScores();

            if (feature.getType() == FeatureType.CONTINUOUS) {
                double[] edges = feature.getBinEdge();
                if (edges == null || edges.length != scores[i].length + 1) {
                    throw new ModelFormatException("Continuous feature '" + name
                            + "' needs one more bin edge than additive scores");
                }
                fullBinEdges[i] = edges.clone();
                binEdges[i] = Arrays.copyOf(edges, edges.length - 1);
            } else {
                double[] levels = feature.getBinLabel();
                if (levels == null || levels.length != scores[i].length) {
                    throw new ModelFormatException("Categorical feature '" + name
                            + "' needs one additive score per level");
                }
                for (double level : levels) {
                    if ((int) level == LabelEncoder.UNSEEN_CODE) {
                        throw new ModelFormatException("Categorical feature '" + name + "' uses level code "
                                + LabelEncoder.UNSEEN_CODE + ", which is reserved for unseen labels");
                    }
                }
                binEdges[i] = levels.clone();
            }
        }

        List<InteractionTerm> terms = new ArrayList<>();
        List<List<InteractionTerm>> byFeature = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            byFeature.add(new ArrayList<>());
        }
        for (FeatureDescription feature : interactionDescriptions) {
            InteractionTerm term = buildInteraction(terms.size(), feature);
            terms.add(term);
            byFeature.get(term.getFirstFeature()).add(term);
            byFeature.get(term.getSecondFeature()).add(term);
        }
        this.interactions = Collections.unmodifiableList(terms);
        List<List<InteractionTerm>> frozen = new ArrayList<>();
        for (List<InteractionTerm> list : byFeature) {
            frozen.add(Collections.unmodifiableList(list));
        }
        this.interactionsByFeature = Collections.unmodifiableList(frozen);

        logger.info("Loaded {} with {} main features and {} interaction terms",
                classifier ? "classifier" : "regressor", n, terms.size());
    }

    private InteractionTerm buildInteraction(int index, FeatureDescription feature) {
        int[] id = feature.getId();
        if (id == null || id.length != 2) {
            throw new ModelFormatException("Interaction '" + feature.getName() + "' must reference two features");
        }
        for (int parent : id) {
            if (parent < 0 || parent >= featureNames.size()) {
                throw new ModelFormatException("Interaction '" + feature.getName()
                        + "' references unknown feature index " + parent);
            }
        }
        double[] axis1 = axisOf(feature.getName(), feature.getBinLabel1(), featureTypes[id[0]]);
        double[] axis2 = axisOf(feature.getName(), feature.getBinLabel2(), featureTypes[id[1]]);
        double[][] grid = feature.getInteractionScores();
        if (grid.length != axis1.length) {
            throw new ModelFormatException("Interaction '" + feature.getName() + "' grid has "
                    + grid.length + " rows, expected " + axis1.length);
        }
        for (double[] row : grid) {
            if (row.length != axis2.length) {
                throw new ModelFormatException("Interaction '" + feature.getName() + "' grid has a row of "
                        + row.length + " columns, expected " + axis2.length);
            }
        }
        return new InteractionTerm(index, feature.getName(), id[0], id[1],
                featureTypes[id[0]], featureTypes[id[1]], axis1, axis2, grid);
    }

    private static double[] axisOf(String name, double[] labels, FeatureType parentType) {
        if (labels == null || labels.length == 0) {
            throw new ModelFormatException("Interaction '" + name + "' is missing a bin axis");
        }
        // continuous axes carry their trailing upper edge like main effects do
        return parentType == FeatureType.CONTINUOUS ? Arrays.copyOf(labels, labels.length - 1) : labels.clone();
    }

    /**
     * Per-term contribution of a sample, main features first (in feature
     * order) followed by interaction terms.
     */
    public Map<String, Double> countScore(Sample sample) {
        checkLength(sample);
        double[] encoded = encode(sample);
        Map<String, Double> contributions = new LinkedHashMap<>();
        for (int i = 0; i < featureNames.size(); i++) {
            contributions.put(featureNames.get(i), mainScore(i, mainBin(i, encoded[i])));
        }
        for (InteractionTerm term : interactions) {
            contributions.put(term.getName(), interactionScore(term, encoded));
        }
        return contributions;
    }

    /**
     * Labels (classifier), log-odds (classifier with raw) or regression scores.
     */
    public double[] predict(List<Sample> samples, boolean raw) {
        double[] out = new double[samples.size()];
        for (int s = 0; s < samples.size(); s++) {
            double score = score(samples.get(s));
            if (!classifier || raw) {
                out[s] = score;
            } else {
                out[s] = label(sigmoid(score));
            }
        }
        return out;
    }

    public double[] predictProb(List<Sample> samples) {
        double[] out = new double[samples.size()];
        for (int s = 0; s < samples.size(); s++) {
            double score = score(samples.get(s));
            out[s] = classifier ? sigmoid(score) : score;
        }
        return out;
    }

    /** Intercept plus every contribution. */
    public double score(Sample sample) {
        double total = intercept;
        for (double contribution : countScore(sample).values()) {
            total += contribution;
        }
        return total;
    }

    public static double sigmoid(double logit) {
        double p = 1.0 / (1.0 + Math.exp(-logit));
        return Math.round(p * 100000.0) / 100000.0;
    }

    public static int label(double probability) {
        return probability >= 0.5 ? 1 : 0;
    }

    double[] encode(Sample sample) {
        double[] encoded = new double[featureNames.size()];
        for (int i = 0; i < encoded.length; i++) {
            encoded[i] = encode(i, sample.get(i));
        }
        return encoded;
    }

    /** Numeric form of a raw value: the number itself or the level code. */
    public double encode(int featureIndex, Object value) {
        if (featureTypes[featureIndex] == FeatureType.CATEGORICAL) {
            return labelEncoder.encode(featureNames.get(featureIndex), value);
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        try {
            return Double.parseDouble(String.valueOf(value));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Continuous feature '" + featureNames.get(featureIndex)
                    + "' got non-numeric value '" + value + "'", e);
        }
    }

    public int mainBin(int featureIndex, double encodedValue) {
        return BinSearch.locate(featureTypes[featureIndex], binEdges[featureIndex], encodedValue);
    }

    /** Additive score of a bin; -1 (unknown level) scores 0. */
    public double mainScore(int featureIndex, int bin) {
        return bin < 0 ? 0.0 : scores[featureIndex][bin];
    }

    double interactionScore(InteractionTerm term, double[] encoded) {
        int first = term.binOf(term.getFirstFeature(), encoded[term.getFirstFeature()]);
        int second = term.binOf(term.getSecondFeature(), encoded[term.getSecondFeature()]);
        return term.score(first, second);
    }

    void checkLength(Sample sample) {
        if (sample.size() != featureNames.size()) {
            throw new IllegalArgumentException("Sample has " + sample.size() + " values but the model has "
                    + featureNames.size() + " main features");
        }
    }

    /**
     * Value range covered by a continuous bin: [lower edge, upper edge].
     */
    public double[] binRange(int featureIndex, int bin) {
        double[] edges = fullBinEdges[featureIndex];
        if (edges == null) {
            throw new IllegalArgumentException("Feature '" + featureNames.get(featureIndex) + "' is not continuous");
        }
        return new double[]{edges[bin], edges[bin + 1]};
    }

    public int featureIndex(String name) {
        Integer index = indexByName.get(name);
        if (index == null) {
            throw new IllegalArgumentException("Unknown feature '" + name + "'");
        }
        return index;
    }

    public boolean hasFeature(String name) {
        return indexByName.containsKey(name);
    }

    public List<String> getFeatureNames() {
        return featureNames;
    }

    public int getFeatureCount() {
        return featureNames.size();
    }

    public String getFeatureName(int featureIndex) {
        return featureNames.get(featureIndex);
    }

    public FeatureType getFeatureType(int featureIndex) {
        return featureTypes[featureIndex];
    }

    public FeatureConfig getFeatureConfig(int featureIndex) {
        return featureConfigs[featureIndex];
    }

    public double[] getBinEdges(int featureIndex) {
        return binEdges[featureIndex].clone();
    }

    public double[] getFullBinEdges(int featureIndex) {
        return fullBinEdges[featureIndex] == null ? null : fullBinEdges[featureIndex].clone();
    }

    public double[] getScores(int featureIndex) {
        return scores[featureIndex].clone();
    }

    public int getBinCount(int featureIndex) {
        return scores[featureIndex].length;
    }

    public List<InteractionTerm> getInteractions() {
        return interactions;
    }

    public List<InteractionTerm> interactionsOf(int featureIndex) {
        return interactionsByFeature.get(featureIndex);
    }

    public LabelEncoder getLabelEncoder() {
        return labelEncoder;
    }

    public double getIntercept() {
        return intercept;
    }

    public boolean isClassifier() {
        return classifier;
    }

    public ModelDescription getDescription() {
        return description;
    }
}
