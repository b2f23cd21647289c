package coach;

import optimization.VariableId;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One solve of a diverse search: the variables it switched on, or a failure.
 */
public final class SearchStep {
    private final boolean found;
    private final List<VariableId> mainVariables;
    private final List<VariableId> interactionVariables;
    private final double objectiveValue;
    private final ResumeState nextState;

    private SearchStep(boolean found, List<VariableId> mainVariables, List<VariableId> interactionVariables,
                       double objectiveValue, ResumeState nextState) {
        this.found = found;
        this.mainVariables = Collections.unmodifiableList(new ArrayList<>(mainVariables));
        this.interactionVariables = Collections.unmodifiableList(new ArrayList<>(interactionVariables));
        this.objectiveValue = objectiveValue;
        this.nextState = nextState;
    }

    static SearchStep found(List<VariableId> mainVariables, List<VariableId> interactionVariables,
                            double objectiveValue, ResumeState nextState) {
        return new SearchStep(true, mainVariables, interactionVariables, objectiveValue, nextState);
    }

    static SearchStep failed(ResumeState state) {
        return new SearchStep(false, Collections.emptyList(), Collections.emptyList(), Double.NaN, state);
    }

    public boolean isFound() {
        return found;
    }

    public List<VariableId> getMainVariables() {
        return mainVariables;
    }

    public List<VariableId> getInteractionVariables() {
        return interactionVariables;
    }

    public double getObjectiveValue() {
        return objectiveValue;
    }

    /** State after this step; unchanged on failure. */
    public ResumeState getNextState() {
        return nextState;
    }
}
