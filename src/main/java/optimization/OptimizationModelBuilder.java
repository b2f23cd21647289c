package optimization;

import optimization.OptimizationProblem.Constraint;
import optimization.OptimizationProblem.Objective;
import optimization.OptimizationProblem.RowBounds;
import optimization.OptimizationProblem.Sense;
import optimization.OptimizationProblem.Term;
import optimization.OptimizationProblem.VariableBounds;
import options.Direction;
import options.InteractionOption;
import options.MainEffectOption;
import options.Option;
import options.OptionSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns an option set into a binary program.
 *
 * <ul>
 *   <li>one binary per non-muted (feature, bin) option, at most one per feature;</li>
 *   <li>optionally, at most maxNumFeaturesToVary binaries overall;</li>
 *   <li>one [0, 1] auxiliary z per interaction option whose parents x1, x2 are
 *       both present, tied to their AND by z &lt;= x1, z &lt;= x2, x1 + x2 - z &lt;= 1;</li>
 *   <li>total gain (main and auxiliary) &gt;= threshold when increasing,
 *       &lt;= threshold when decreasing;</li>
 *   <li>minimise the summed distance of the selected main-effect options.</li>
 * </ul>
 */
public class OptimizationModelBuilder {
    private static final Logger logger = LoggerFactory.getLogger(OptimizationModelBuilder.class);

    private final List<String> featureNames;
    private final Direction direction;
    private final double scoreThreshold;
    private final Set<Integer> featuresToVary;
    private final OptionSet options;
    private final Integer maxNumFeaturesToVary;

    public OptimizationModelBuilder(List<String> featureNames, Direction direction, double scoreThreshold,
                                    Set<Integer> featuresToVary, OptionSet options, Integer maxNumFeaturesToVary) {
        this.featureNames = featureNames;
        this.direction = direction;
        this.scoreThreshold = scoreThreshold;
        this.featuresToVary = Collections.unmodifiableSet(new LinkedHashSet<>(featuresToVary));
        this.options = options;
        this.maxNumFeaturesToVary = maxNumFeaturesToVary;
    }

    public BuiltModel build(Set<VariableId> muted) {
        Map<VariableId, String> names = new LinkedHashMap<>();
        Map<VariableId, Option> optionsById = new LinkedHashMap<>();
        List<Term> objectiveTerms = new ArrayList<>();
        List<Term> gainTerms = new ArrayList<>();
        List<Term> capTerms = new ArrayList<>();
        List<Constraint> rows = new ArrayList<>();
        List<String> binaries = new ArrayList<>();
        List<VariableBounds> bounds = new ArrayList<>();

        for (Map.Entry<Integer, List<MainEffectOption>> entry : options.getMainOptions().entrySet()) {
            int feature = entry.getKey();
            if (!featuresToVary.contains(feature)) {
                continue;
            }
            List<Term> selection = new ArrayList<>();
            for (MainEffectOption option : entry.getValue()) {
                VariableId id = VariableId.main(feature, option.getBinIndex());
                if (muted.contains(id)) {
                    continue;
                }
                String name = id.render(featureNames);
                names.put(id, name);
                optionsById.put(id, option);
                binaries.add(name);
                objectiveTerms.add(new Term(name, option.getDistance()));
                gainTerms.add(new Term(name, option.getScoreGain()));
                selection.add(new Term(name, 1.0));
                capTerms.add(new Term(name, 1.0));
            }
            if (!selection.isEmpty()) {
                rows.add(new Constraint("select " + featureNames.get(feature), selection, RowBounds.atMost(1)));
            }
        }

        if (maxNumFeaturesToVary != null && !capTerms.isEmpty()) {
            rows.add(new Constraint("max features to vary", capTerms, RowBounds.atMost(maxNumFeaturesToVary)));
        }

        int auxiliaries = 0;
        for (List<InteractionOption> termOptions : options.getInteractionOptions().values()) {
            for (InteractionOption option : termOptions) {
                VariableId first = VariableId.main(option.getFirstFeature(), option.getFirstBin());
                VariableId second = VariableId.main(option.getSecondFeature(), option.getSecondBin());
                String x1 = names.get(first);
                String x2 = names.get(second);
                if (x1 == null || x2 == null) {
                    continue;
                }
                VariableId id = VariableId.interaction(option.getFirstFeature(), option.getFirstBin(),
                        option.getSecondFeature(), option.getSecondBin());
                String z = id.render(featureNames);
                names.put(id, z);
                optionsById.put(id, option);
                bounds.add(new VariableBounds(z, 0.0, 1.0));
                gainTerms.add(new Term(z, option.getScoreGain()));

                rows.add(new Constraint(z + " <= first",
                        List.of(new Term(z, 1.0), new Term(x1, -1.0)), RowBounds.atMost(0)));
                rows.add(new Constraint(z + " <= second",
                        List.of(new Term(z, 1.0), new Term(x2, -1.0)), RowBounds.atMost(0)));
                rows.add(new Constraint(z + " >= both",
                        List.of(new Term(x1, 1.0), new Term(x2, 1.0), new Term(z, -1.0)), RowBounds.atMost(1)));
                auxiliaries++;
            }
        }

        RowBounds gainBounds = direction == Direction.INCREASE
                ? RowBounds.atLeast(scoreThreshold)
                : RowBounds.atMost(scoreThreshold);
        rows.add(new Constraint("score gain", gainTerms, gainBounds));

        OptimizationProblem problem = new OptimizationProblem("counterfactual",
                new Objective(Sense.MINIMIZE, "distance", objectiveTerms), rows, binaries, bounds);
        logger.debug("Built model with {} binaries, {} auxiliaries and {} rows ({} muted)",
                binaries.size(), auxiliaries, rows.size(), muted.size());
        return new BuiltModel(problem, names, optionsById);
    }

    public Direction getDirection() {
        return direction;
    }

    public double getScoreThreshold() {
        return scoreThreshold;
    }
}
