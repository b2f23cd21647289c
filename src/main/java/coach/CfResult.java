package coach;

import ebm.Sample;
import optimization.VariableId;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one batch: the counterfactuals found, in order, and the state
 * needed to ask for more.
 */
public final class CfResult {
    private final List<Counterfactual> counterfactuals;
    private final boolean successful;
    private final List<Integer> failedIndexes;
    private final ResumeState resumeState;

    public CfResult(List<Counterfactual> counterfactuals, boolean successful, List<Integer> failedIndexes,
                    ResumeState resumeState) {
        this.counterfactuals = Collections.unmodifiableList(new ArrayList<>(counterfactuals));
        this.successful = successful;
        this.failedIndexes = Collections.unmodifiableList(new ArrayList<>(failedIndexes));
        this.resumeState = resumeState;
    }

    public List<Counterfactual> getCounterfactuals() {
        return counterfactuals;
    }

    public boolean isSuccessful() {
        return successful;
    }

    /** Positions (0-based, within the requested batch) that found nothing. */
    public List<Integer> getFailedIndexes() {
        return failedIndexes;
    }

    public ResumeState getResumeState() {
        return resumeState;
    }

    public List<Sample> getData() {
        List<Sample> data = new ArrayList<>();
        for (Counterfactual cf : counterfactuals) {
            data.add(cf.getData());
        }
        return data;
    }

    public List<Double> getDistances() {
        List<Double> distances = new ArrayList<>();
        for (Counterfactual cf : counterfactuals) {
            distances.add(cf.getDistance());
        }
        return distances;
    }

    /** Per counterfactual, feature name to bin range (double[]) or new level label. */
    public List<Map<String, Object>> getTargetRanges() {
        List<Map<String, Object>> ranges = new ArrayList<>();
        for (Counterfactual cf : counterfactuals) {
            Map<String, Object> perFeature = new LinkedHashMap<>();
            for (FeatureChange change : cf.getChanges()) {
                perFeature.put(change.getFeatureName(), change.getTargetRange());
            }
            ranges.add(perFeature);
        }
        return ranges;
    }

    /** Per counterfactual, the score gain of each changed feature. */
    public List<List<Double>> getScoreGains() {
        List<List<Double>> gains = new ArrayList<>();
        for (Counterfactual cf : counterfactuals) {
            List<Double> perFeature = new ArrayList<>();
            for (FeatureChange change : cf.getChanges()) {
                perFeature.add(change.getScoreGain());
            }
            gains.add(perFeature);
        }
        return gains;
    }

    public List<List<VariableId>> getActiveVariables() {
        List<List<VariableId>> active = new ArrayList<>();
        for (Counterfactual cf : counterfactuals) {
            active.add(cf.getActiveVariables());
        }
        return active;
    }
}
