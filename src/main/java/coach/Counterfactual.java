package coach;

import ebm.Sample;
import optimization.VariableId;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A modified sample together with what was changed and at which cost.
 */
public final class Counterfactual {
    private final Sample data;
    private final double distance;
    private final List<FeatureChange> changes;
    private final List<VariableId> activeVariables;
    private final double totalScoreGain;

    public Counterfactual(Sample data, double distance, List<FeatureChange> changes,
                          List<VariableId> activeVariables, double totalScoreGain) {
        this.data = data;
        this.distance = distance;
        this.changes = Collections.unmodifiableList(new ArrayList<>(changes));
        this.activeVariables = Collections.unmodifiableList(new ArrayList<>(activeVariables));
        this.totalScoreGain = totalScoreGain;
    }

    public Sample getData() {
        return data;
    }

    public double getDistance() {
        return distance;
    }

    public List<FeatureChange> getChanges() {
        return changes;
    }

    /** Selected main-effect variables, in feature order. */
    public List<VariableId> getActiveVariables() {
        return activeVariables;
    }

    /** Gain of the selected options, interaction corrections included. */
    public double getTotalScoreGain() {
        return totalScoreGain;
    }

    @Override
    public String toString() {
        return "Counterfactual{" + changes + ", distance=" + distance + "}";
    }
}
