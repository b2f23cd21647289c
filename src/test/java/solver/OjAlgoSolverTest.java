package solver;

import ebm.DistanceTables;
import ebm.LocalScoringModel;
import ebm.Sample;
import ebm.ScoringModel;
import optimization.BuiltModel;
import optimization.OptimizationModelBuilder;
import optimization.OptimizationProblem;
import optimization.OptimizationProblem.Constraint;
import optimization.OptimizationProblem.Objective;
import optimization.OptimizationProblem.RowBounds;
import optimization.OptimizationProblem.Sense;
import optimization.OptimizationProblem.Term;
import optimization.OptimizationProblem.VariableBounds;
import options.Direction;
import options.InteractionOption;
import options.MainEffectOption;
import options.OptionGenerator;
import options.OptionSet;
import org.junit.jupiter.api.Test;
import org.ojalgo.optimisation.Optimisation;
import testing.ExhaustiveSolver;
import testing.ToyModels;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class OjAlgoSolverTest {

    @Test
    void testCheapestCover() {
        // pick at least two of a, b, c as cheaply as possible
        OptimizationProblem problem = new OptimizationProblem("cover",
                new Objective(Sense.MINIMIZE, "cost", List.of(new Term("a", 3), new Term("b", 1), new Term("c", 2))),
                List.of(new Constraint("two", List.of(new Term("a", 1), new Term("b", 1), new Term("c", 1)),
                        RowBounds.atLeast(2))),
                List.of("a", "b", "c"), List.of());
        SolverResult result = new OjAlgoSolver().solve(problem);

        assertEquals(SolverStatus.OPTIMAL, result.getStatus());
        assertEquals(3.0, result.getObjectiveValue(), 1e-6);
        assertEquals(0.0, result.valueOf("a"));
        assertEquals(1.0, result.valueOf("b"));
        assertEquals(1.0, result.valueOf("c"));
    }

    @Test
    void testMaximiseWithBoundedContinuousVariable() {
        OptimizationProblem problem = new OptimizationProblem("max",
                new Objective(Sense.MAXIMIZE, "value", List.of(new Term("x", 1), new Term("z", 2))),
                List.of(new Constraint("z <= x", List.of(new Term("z", 1), new Term("x", -1)), RowBounds.atMost(0))),
                List.of("x"), List.of(new VariableBounds("z", 0.0, 0.5)));
        SolverResult result = new OjAlgoSolver().solve(problem);

        assertTrue(result.isOptimal());
        assertEquals(2.0, result.getObjectiveValue(), 1e-6);
        assertEquals(0.5, result.valueOf("z"), 1e-6);
    }

    @Test
    void testInfeasibleProblemIsNotOptimal() {
        OptimizationProblem problem = new OptimizationProblem("impossible",
                new Objective(Sense.MINIMIZE, "cost", List.of(new Term("a", 1))),
                List.of(new Constraint("too many", List.of(new Term("a", 1), new Term("b", 1)), RowBounds.atLeast(3))),
                List.of("a", "b"), List.of());
        SolverResult result = new OjAlgoSolver().solve(problem);

        assertFalse(result.isOptimal());
        assertTrue(result.getVariableAssignment().isEmpty());
    }

    @Test
    void testStatusMapping() {
        assertEquals(SolverStatus.OPTIMAL, OjAlgoSolver.statusOf(Optimisation.State.OPTIMAL));
        assertEquals(SolverStatus.INFEASIBLE, OjAlgoSolver.statusOf(Optimisation.State.INFEASIBLE));
        assertEquals(SolverStatus.UNBOUNDED, OjAlgoSolver.statusOf(Optimisation.State.UNBOUNDED));
        assertEquals(SolverStatus.FEASIBLE, OjAlgoSolver.statusOf(Optimisation.State.FEASIBLE));
        assertEquals(SolverStatus.FAILED, OjAlgoSolver.statusOf(Optimisation.State.FAILED));
    }

    @Test
    void testAgreesWithExhaustiveSearchOnToyModel() {
        ScoringModel model = ToyModels.classifier();
        LocalScoringModel local = new LocalScoringModel(model, Sample.of(25, 15000, "rent"));
        OptionGenerator generator = new OptionGenerator(local, DistanceTables.fromDescription(model.getDescription()));
        Map<Integer, List<MainEffectOption>> main = new LinkedHashMap<>();
        main.put(0, new ArrayList<>(generator.generateContinuousOptions(Direction.INCREASE, 0, 0.0, null, false, false)));
        main.put(1, new ArrayList<>(generator.generateContinuousOptions(Direction.INCREASE, 1, 0.0, null, true, false)));
        main.put(2, new ArrayList<>(generator.generateCategoricalOptions(Direction.INCREASE, 2, null, false)));
        Map<Integer, List<InteractionOption>> interactions = new LinkedHashMap<>();
        interactions.put(0, generator.generateInteractionOptions(model.getInteractions().get(0), main.get(0), main.get(1)));

        for (Integer cap : new Integer[]{null, 2}) {
            BuiltModel built = new OptimizationModelBuilder(model.getFeatureNames(), Direction.INCREASE,
                    -local.getScore(), Set.of(0, 1, 2), new OptionSet(main, interactions), cap).build(Set.of());
            SolverResult expected = new ExhaustiveSolver().solve(built.getProblem());
            SolverResult actual = new OjAlgoSolver().solve(built.getProblem());

            assertTrue(actual.isOptimal());
            assertEquals(expected.getObjectiveValue(), actual.getObjectiveValue(), 1e-6);
            for (String binary : built.getProblem().getBinaries()) {
                assertEquals(expected.valueOf(binary), actual.valueOf(binary), binary);
            }
        }
    }
}
