package coach;

import ebm.Sample;
import optimization.VariableId;
import options.Direction;
import options.OptionSet;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Everything needed to continue a diverse search later: the problem inputs
 * and the variables earlier solutions already used. Immutable.
 */
public final class ResumeState {
    private final Sample sample;
    private final Direction direction;
    private final double scoreThreshold;
    private final Set<Integer> featuresToVary;
    private final OptionSet options;
    private final Integer maxNumFeaturesToVary;
    private final Set<VariableId> usedVariables;

    public ResumeState(Sample sample, Direction direction, double scoreThreshold, Set<Integer> featuresToVary,
                       OptionSet options, Integer maxNumFeaturesToVary, Set<VariableId> usedVariables) {
        this.sample = sample;
        this.direction = direction;
        this.scoreThreshold = scoreThreshold;
        this.featuresToVary = Collections.unmodifiableSet(new LinkedHashSet<>(featuresToVary));
        this.options = options;
        this.maxNumFeaturesToVary = maxNumFeaturesToVary;
        this.usedVariables = Collections.unmodifiableSet(new LinkedHashSet<>(usedVariables));
    }

    /** Same state with more variables excluded from later solutions. */
    public ResumeState withUsed(Collection<VariableId> newlyUsed) {
        Set<VariableId> used = new LinkedHashSet<>(usedVariables);
        used.addAll(newlyUsed);
        return new ResumeState(sample, direction, scoreThreshold, featuresToVary, options,
                maxNumFeaturesToVary, used);
    }

    public Sample getSample() {
        return sample;
    }

    public Direction getDirection() {
        return direction;
    }

    public double getScoreThreshold() {
        return scoreThreshold;
    }

    public Set<Integer> getFeaturesToVary() {
        return featuresToVary;
    }

    public OptionSet getOptions() {
        return options;
    }

    public Integer getMaxNumFeaturesToVary() {
        return maxNumFeaturesToVary;
    }

    public Set<VariableId> getUsedVariables() {
        return usedVariables;
    }
}
