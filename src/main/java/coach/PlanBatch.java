package coach;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Plans produced by {@link PlanGenerator}, in order, with the positions that
 * could not be filled.
 */
public final class PlanBatch {
    private final List<Counterfactual> plans;
    private final Set<Integer> failedPlans;
    private final ResumeState resumeState;

    public PlanBatch(List<Counterfactual> plans, Set<Integer> failedPlans, ResumeState resumeState) {
        this.plans = Collections.unmodifiableList(new ArrayList<>(plans));
        this.failedPlans = Collections.unmodifiableSet(new LinkedHashSet<>(failedPlans));
        this.resumeState = resumeState;
    }

    public List<Counterfactual> getPlans() {
        return plans;
    }

    public Set<Integer> getFailedPlans() {
        return failedPlans;
    }

    public ResumeState getResumeState() {
        return resumeState;
    }
}
