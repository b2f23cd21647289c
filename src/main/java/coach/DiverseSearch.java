package coach;

import optimization.BuiltModel;
import optimization.OptimizationModelBuilder;
import optimization.VariableId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import solver.Solver;
import solver.SolverResult;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Mute-and-resolve loop. Every solution's main-effect variables are excluded
 * from the following solves, so consecutive counterfactuals never reuse a
 * (feature, bin) choice. The sequence is lazy and ends after the first
 * failed solve.
 */
public class DiverseSearch implements Iterable<SearchStep> {
    private static final Logger logger = LoggerFactory.getLogger(DiverseSearch.class);

    private final List<String> featureNames;
    private final Solver solver;
    private final ResumeState start;

    public DiverseSearch(List<String> featureNames, Solver solver, ResumeState start) {
        this.featureNames = featureNames;
        this.solver = solver;
        this.start = start;
    }

    /** Solves once with the state's exclusions. */
    public SearchStep next(ResumeState state) {
        OptimizationModelBuilder builder = new OptimizationModelBuilder(featureNames, state.getDirection(),
                state.getScoreThreshold(), state.getFeaturesToVary(), state.getOptions(),
                state.getMaxNumFeaturesToVary());
        BuiltModel built = builder.build(state.getUsedVariables());
        if (!built.hasMainVariables()) {
            logger.info("No selectable options left after muting {} variables", state.getUsedVariables().size());
            return SearchStep.failed(state);
        }

        SolverResult result = solver.solve(built.getProblem());
        if (!result.isOptimal()) {
            logger.info("Solver returned {}, no further counterfactuals", result.getStatus());
            return SearchStep.failed(state);
        }

        List<VariableId> main = new ArrayList<>();
        List<VariableId> interactions = new ArrayList<>();
        for (Map.Entry<VariableId, String> variable : built.getVariables().entrySet()) {
            if (result.valueOf(variable.getValue()) <= 0.5) {
                continue;
            }
            if (variable.getKey().isMain()) {
                main.add(variable.getKey());
            } else {
                interactions.add(variable.getKey());
            }
        }
        if (main.isEmpty()) {
            // the empty selection can only be optimal if the threshold is already met
            logger.warn("Solver picked no option; treating the solve as a failure");
            return SearchStep.failed(state);
        }
        main.sort(null);
        logger.debug("Solution {} with objective {}", main, result.getObjectiveValue());
        return SearchStep.found(main, interactions, result.getObjectiveValue(), state.withUsed(main));
    }

    @Override
    public Iterator<SearchStep> iterator() {
        return new Iterator<SearchStep>() {
            private ResumeState state = start;
            private boolean done;

            @Override
            public boolean hasNext() {
                return !done;
            }

            @Override
            public SearchStep next() {
                if (done) {
                    throw new NoSuchElementException();
                }
                SearchStep step = DiverseSearch.this.next(state);
                if (step.isFound()) {
                    state = step.getNextState();
                } else {
                    done = true;
                }
                return step;
            }
        };
    }
}
