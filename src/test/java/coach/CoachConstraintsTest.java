package coach;

import ebm.ModelDescription;
import ebm.Sample;
import ebm.ScoringModel;
import org.junit.jupiter.api.Test;
import testing.ExhaustiveSolver;
import testing.ToyModels;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class CoachConstraintsTest {

    private ScoringModel constrained() {
        return new ScoringModel(ToyModels.description("toy-constrained"));
    }

    @Test
    void testDefaultsForUnconfiguredModel() {
        ScoringModel model = ToyModels.classifier();
        CoachConstraints constraints = new CoachConstraints(model, Sample.of(25, 15000, "rent"));

        assertEquals(List.of("age", "income", "home"), constraints.featuresToVary());
        assertTrue(constraints.featureWeightMultipliers().isEmpty());
        assertTrue(constraints.getAcceptableRanges().isEmpty());
        assertEquals(List.of("income"), constraints.getContinuousIntegerFeatures());
        assertEquals(CoachConstraints.DEFAULT_MAX_NUM_FEATURES_TO_VARY, constraints.getMaxNumFeaturesToVary());
    }

    @Test
    void testModelConfigSeedsConstraints() {
        CoachConstraints constraints = new CoachConstraints(constrained(), Sample.of(5, 2, "low"));

        // x2 is locked
        assertEquals(List.of("x1", "grade"), constraints.featuresToVary());
        assertEquals(Map.of("x1", 2.0, "grade", 0.5), constraints.featureWeightMultipliers());

        // an explicit range wins over requiresIncreasing
        FeatureRange x1 = constraints.getAcceptableRanges().get("x1");
        assertEquals(0.0, x1.getMin());
        assertEquals(35.0, x1.getMax());
        assertEquals(Set.of(1, 2), constraints.getAcceptableRanges().get("grade").getLevels());
    }

    @Test
    void testMonotonicConfigWithoutRangeBoundsOneSide() {
        String json = "{\"featureNames\":[\"up\",\"down\"],\"features\":["
                + "{\"name\":\"up\",\"type\":\"continuous\",\"binEdge\":[0,10,20],\"additive\":[0,1],"
                + "\"config\":{\"requiresIncreasing\":true}},"
                + "{\"name\":\"down\",\"type\":\"continuous\",\"binEdge\":[0,10,20],\"additive\":[1,0],"
                + "\"config\":{\"requiresDecreasing\":true}}],"
                + "\"intercept\":0,\"isClassifier\":false}";
        ScoringModel model = new ScoringModel(ModelDescription.fromJson(json));
        CoachConstraints constraints = new CoachConstraints(model, Sample.of(4, 12));

        FeatureRange up = constraints.getAcceptableRanges().get("up");
        assertEquals(4.0, up.getMin());
        assertEquals(20.0, up.getMax());
        FeatureRange down = constraints.getAcceptableRanges().get("down");
        assertEquals(0.0, down.getMin());
        assertEquals(12.0, down.getMax());
    }

    @Test
    void testUserEditsOverrideModelConfig() {
        CoachConstraints constraints = new CoachConstraints(constrained(), Sample.of(5, 2, "low"))
                .setDifficulty("x2", Difficulty.VERY_EASY)
                .setDifficulty("x1", Difficulty.NEUTRAL)
                .setAcceptableRange("grade", null)
                .setMaxNumFeaturesToVary(2);

        assertEquals(List.of("x1", "x2", "grade"), constraints.featuresToVary());
        assertEquals(Map.of("x2", 0.1, "grade", 0.5), constraints.featureWeightMultipliers());
        assertFalse(constraints.getAcceptableRanges().containsKey("grade"));
        assertEquals(2, constraints.toConfig().build().getMaxNumFeaturesToVary());
        assertThrows(IllegalArgumentException.class, () -> constraints.setDifficulty("x9", Difficulty.HARD));
    }

    @Test
    void testConstraintsDriveTheSearch() {
        ScoringModel model = constrained();
        Sample sample = Sample.of(5, 2, "low");
        // 1 + 0.5 + 0 + 3.5
        assertEquals(5.0, model.score(sample), 1e-9);

        CfConfig config = new CoachConstraints(model, sample).toConfig()
                .targetRange(8, Double.POSITIVE_INFINITY)
                .totalCfs(3)
                .build();
        CfResult result = new CounterfactualCoach(model, new ExhaustiveSolver()).generateCfs(config);

        assertFalse(result.getCounterfactuals().isEmpty());
        for (Counterfactual cf : result.getCounterfactuals()) {
            assertEquals(2.0, cf.getData().get(1));
            assertNotEquals("high", cf.getData().get(2));
            double x1 = cf.getData().getNumber(0);
            assertTrue(x1 >= 5 && x1 <= 35, "x1 = " + x1);
            assertTrue(model.score(cf.getData()) >= 8 - 1e-9);
        }
    }

    @Test
    void testDifficultyCodes() {
        assertEquals(Difficulty.LOCK, Difficulty.ofCode(6));
        assertEquals(10.0, Difficulty.VERY_HARD.getWeightMultiplier());
        assertThrows(IllegalArgumentException.class, () -> Difficulty.ofCode(9));
    }
}
