package ebm;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A {@link ScoringModel} bound to one sample. Per-term contributions are
 * cached so that changing a single feature only recomputes that feature's
 * main effect and the interaction terms that reference it.
 */
public class LocalScoringModel {
    private final ScoringModel model;
    private Sample sample;
    private final double[] encoded;
    private final int[] mainBins;
    private final double[] mainScores;
    private final double[] interactionScores;
    private double score;

    public LocalScoringModel(ScoringModel model, Sample sample) {
        model.checkLength(sample);
        this.model = model;
        this.sample = sample;
        this.encoded = model.encode(sample);

        int n = model.getFeatureCount();
        this.mainBins = new int[n];
        this.mainScores = new double[n];
        double total = model.getIntercept();
        for (int i = 0; i < n; i++) {
            mainBins[i] = model.mainBin(i, encoded[i]);
            mainScores[i] = model.mainScore(i, mainBins[i]);
            total += mainScores[i];
        }

        List<InteractionTerm> terms = model.getInteractions();
        this.interactionScores = new double[terms.size()];
        for (InteractionTerm term : terms) {
            interactionScores[term.getIndex()] = model.interactionScore(term, encoded);
            total += interactionScores[term.getIndex()];
        }
        this.score = total;
    }

    /**
     * Hypothetically set one feature to a new raw value.
     */
    public void updateFeature(String featureName, Object value) {
        int i = model.featureIndex(featureName);
        sample = sample.with(i, value);
        encoded[i] = model.encode(i, value);

        double delta = -mainScores[i];
        mainBins[i] = model.mainBin(i, encoded[i]);
        mainScores[i] = model.mainScore(i, mainBins[i]);
        delta += mainScores[i];

        for (InteractionTerm term : model.interactionsOf(i)) {
            double updated = model.interactionScore(term, encoded);
            delta += updated - interactionScores[term.getIndex()];
            interactionScores[term.getIndex()] = updated;
        }
        score += delta;
    }

    /** Same layout as {@link ScoringModel#countScore(Sample)}. */
    public Map<String, Double> countScore() {
        Map<String, Double> contributions = new LinkedHashMap<>();
        for (int i = 0; i < mainScores.length; i++) {
            contributions.put(model.getFeatureName(i), mainScores[i]);
        }
        for (InteractionTerm term : model.getInteractions()) {
            contributions.put(term.getName(), interactionScores[term.getIndex()]);
        }
        return contributions;
    }

    /** Raw score: log-odds for a classifier, the prediction for a regressor. */
    public double getScore() {
        return score;
    }

    public double getPredProb() {
        return model.isClassifier() ? ScoringModel.sigmoid(score) : score;
    }

    public double getPred() {
        return model.isClassifier() ? ScoringModel.label(getPredProb()) : score;
    }

    public Sample getSample() {
        return sample;
    }

    public ScoringModel getModel() {
        return model;
    }

    public double getEncodedValue(int featureIndex) {
        return encoded[featureIndex];
    }

    public int getMainBin(int featureIndex) {
        return mainBins[featureIndex];
    }

    public double getMainScore(int featureIndex) {
        return mainScores[featureIndex];
    }

    public double getInteractionScore(InteractionTerm term) {
        return interactionScores[term.getIndex()];
    }

    /** Current bin of a feature along an interaction's axis. */
    public int getInteractionBin(InteractionTerm term, int featureIndex) {
        return term.binOf(featureIndex, encoded[featureIndex]);
    }
}
