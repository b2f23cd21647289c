package coach;

import ebm.ModelDescription;
import ebm.Sample;
import ebm.ScoringModel;
import optimization.VariableId;
import org.junit.jupiter.api.Test;
import testing.ExhaustiveSolver;
import testing.ToyModels;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class CounterfactualCoachTest {
    // score -2.7, predicted 0
    private static final Sample REJECTED = Sample.of(25, 15000, "rent");

    private final ScoringModel classifier = ToyModels.classifier();
    private final ExhaustiveSolver solver = new ExhaustiveSolver();
    private final CounterfactualCoach coach = new CounterfactualCoach(classifier, solver);

    @Test
    void testCounterfactualFlipsPrediction() {
        CfResult result = coach.generateCfs(CfConfig.builder(REJECTED).build());

        assertTrue(result.isSuccessful());
        assertEquals(1, result.getCounterfactuals().size());
        Counterfactual cf = result.getCounterfactuals().get(0);
        assertEquals(Sample.of(30, 50000, "own"), cf.getData());
        assertArrayEquals(new double[]{1}, classifier.predict(List.of(cf.getData()), false));
        assertEquals(List.of(VariableId.main(0, 1), VariableId.main(1, 2), VariableId.main(2, 2)),
                cf.getActiveVariables());
        // home distances are scaled by mean continuous / mean categorical distance
        assertEquals(0.5 + 1.75 + 0.7 * (12.25 / 6 / 0.65), cf.getDistance(), 1e-9);
        assertEquals(2.9, cf.getTotalScoreGain(), 1e-9);
    }

    @Test
    void testChangesDescribeTargets() {
        Counterfactual cf = coach.generateCfs(CfConfig.builder(REJECTED).build()).getCounterfactuals().get(0);
        List<FeatureChange> changes = cf.getChanges();

        assertEquals(3, changes.size());
        assertEquals("age", changes.get(0).getFeatureName());
        assertEquals(25.0, changes.get(0).getOriginalValue());
        assertArrayEquals(new double[]{30, 45}, changes.get(0).getBinRange());
        assertArrayEquals(new double[]{50000, 100000}, changes.get(1).getBinRange());
        assertTrue(changes.get(2).isCategorical());
        assertEquals("own", changes.get(2).getNewValue());
        assertEquals("own", changes.get(2).getTargetRange());
        assertEquals("rent", changes.get(2).getOriginalValue());
    }

    @Test
    void testScoreGainsMatchRescoring() {
        CfResult result = coach.generateCfs(CfConfig.builder(REJECTED).totalCfs(2).build());
        double base = classifier.score(REJECTED);
        for (Counterfactual cf : result.getCounterfactuals()) {
            assertEquals(classifier.score(cf.getData()) - base, cf.getTotalScoreGain(), 1e-9);
            assertTrue(classifier.score(cf.getData()) >= 0);
        }
        assertEquals(result.getScoreGains().size(), result.getDistances().size());
        // per-feature gains leave out the pair corrections
        List<Double> first = result.getScoreGains().get(0);
        assertEquals(3, first.size());
        assertEquals(0.6 + 1.2 + 1.1, first.get(0) + first.get(1) + first.get(2), 1e-9);
    }

    @Test
    void testDiverseBatchNeverReusesAVariable() {
        CfResult result = coach.generateCfs(CfConfig.builder(REJECTED).totalCfs(3).build());

        // the third solve has nothing left that reaches the threshold
        assertFalse(result.isSuccessful());
        assertEquals(List.of(2), result.getFailedIndexes());
        assertEquals(2, result.getCounterfactuals().size());
        assertEquals(Sample.of(45, 100000, "rent"), result.getData().get(1));

        Set<VariableId> seen = new HashSet<>();
        for (List<VariableId> active : result.getActiveVariables()) {
            for (VariableId id : active) {
                assertTrue(seen.add(id), "reused " + id);
            }
        }
        assertEquals(seen, result.getResumeState().getUsedVariables());
        assertEquals(2, result.getTargetRanges().get(1).size());
    }

    @Test
    void testAtMostOneOptionPerFeature() {
        CfResult result = coach.generateCfs(CfConfig.builder(REJECTED).totalCfs(2).build());
        for (Counterfactual cf : result.getCounterfactuals()) {
            Set<Integer> features = new HashSet<>();
            for (VariableId id : cf.getActiveVariables()) {
                assertTrue(features.add(id.getFeatureIndex()));
            }
        }
    }

    @Test
    void testSingleFeatureCapCannotFlip() {
        CfResult result = coach.generateCfs(CfConfig.builder(REJECTED).maxNumFeaturesToVary(1).totalCfs(2).build());

        assertFalse(result.isSuccessful());
        assertTrue(result.getCounterfactuals().isEmpty());
        assertEquals(List.of(0, 1), result.getFailedIndexes());
    }

    @Test
    void testCapIsRespected() {
        CfResult result = coach.generateCfs(CfConfig.builder(REJECTED).maxNumFeaturesToVary(2).totalCfs(2).build());

        assertTrue(result.isSuccessful());
        assertEquals(Sample.of(60, 50000, "rent"), result.getData().get(0));
        for (Counterfactual cf : result.getCounterfactuals()) {
            assertTrue(cf.getChanges().size() <= 2);
        }
    }

    @Test
    void testOnlyListedFeaturesVary() {
        CfConfig config = CfConfig.builder(REJECTED).featuresToVary(List.of("age", "income")).build();
        Counterfactual cf = coach.generateCfs(config).getCounterfactuals().get(0);
        assertEquals("rent", cf.getData().get(2));
        assertEquals(Sample.of(60, 50000, "rent"), cf.getData());
    }

    @Test
    void testFeatureRangeExcludesLevels() {
        CfConfig config = CfConfig.builder(REJECTED)
                .featureRange("home", FeatureRange.levels(1, 2))
                .totalCfs(2)
                .build();
        CfResult result = coach.generateCfs(config);
        assertFalse(result.getCounterfactuals().isEmpty());
        for (Counterfactual cf : result.getCounterfactuals()) {
            assertNotEquals("own", cf.getData().get(2));
        }
    }

    @Test
    void testFeatureRangeBoundsContinuousTargets() {
        CfConfig config = CfConfig.builder(REJECTED)
                .featureRange("income", FeatureRange.interval(0, 60000))
                .totalCfs(3)
                .build();
        for (Counterfactual cf : coach.generateCfs(config).getCounterfactuals()) {
            assertTrue(cf.getData().getNumber(1) <= 60000);
        }
    }

    @Test
    void testHeavyCategoricalWeightAvoidsHome() {
        CfConfig config = CfConfig.builder(REJECTED).categoricalWeight(10.0).build();
        assertEquals(Sample.of(60, 50000, "rent"), coach.generateCfs(config).getData().get(0));
    }

    @Test
    void testFeatureWeightMultiplierAvoidsFeature() {
        CfConfig config = CfConfig.builder(REJECTED).featureWeightMultiplier("age", 100).build();
        Counterfactual cf = coach.generateCfs(config).getCounterfactuals().get(0);
        assertEquals(Sample.of(25, 100000, "own"), cf.getData());
    }

    @Test
    void testDecreasingAnApprovedSample() {
        Sample approved = Sample.of(50, 60000, "own");
        assertEquals(1.0, classifier.score(approved), 1e-9);

        Counterfactual cf = coach.generateCfs(CfConfig.builder(approved).build()).getCounterfactuals().get(0);
        assertTrue(cf.getTotalScoreGain() <= -1.0 + 1e-9);
        assertEquals(classifier.score(approved) + cf.getTotalScoreGain(), classifier.score(cf.getData()), 1e-9);
    }

    @Test
    void testLandingOnTheBoundaryDoesNotFlip() {
        // the only option brings the log-odds from 1 to exactly 0, which still predicts 1
        ScoringModel edge = singleFeatureClassifier(0.0);
        CfResult result = new CounterfactualCoach(edge, solver).generateCfs(CfConfig.builder(Sample.of(15)).build());

        assertFalse(result.isSuccessful());
        assertTrue(result.getCounterfactuals().isEmpty());
        assertEquals(List.of(0), result.getFailedIndexes());
    }

    @Test
    void testDecreasePastTheBoundaryFlips() {
        ScoringModel model = singleFeatureClassifier(-0.5);
        assertArrayEquals(new double[]{1}, model.predict(List.of(Sample.of(15)), false));

        CfResult result = new CounterfactualCoach(model, solver).generateCfs(CfConfig.builder(Sample.of(15)).build());

        assertTrue(result.isSuccessful());
        Counterfactual cf = result.getCounterfactuals().get(0);
        assertEquals(-1.5, cf.getTotalScoreGain(), 1e-9);
        assertArrayEquals(new double[]{0}, model.predict(List.of(cf.getData()), false));
    }

    private static ScoringModel singleFeatureClassifier(double lowBinScore) {
        String json = "{\"featureNames\":[\"x\"],\"features\":[{\"name\":\"x\",\"type\":\"continuous\","
                + "\"binEdge\":[0,10,20],\"additive\":[" + lowBinScore + ",1]}],"
                + "\"intercept\":0,\"isClassifier\":true,\"contMads\":{\"x\":1}}";
        return new ScoringModel(ModelDescription.fromJson(json));
    }

    @Test
    void testUnknownFeatureIsRejected() {
        CfConfig config = CfConfig.builder(REJECTED).featuresToVary(List.of("zip")).build();
        assertThrows(IllegalArgumentException.class, () -> coach.generateCfs(config));
    }

    @Test
    void testSubCfsContinueTheSameSearch() {
        CfResult first = coach.generateCfs(CfConfig.builder(REJECTED).build());
        CfResult second = coach.generateSubCfs(first.getResumeState());

        assertTrue(second.isSuccessful());
        assertEquals(Sample.of(45, 100000, "rent"), second.getData().get(0));
        // the earlier state is untouched
        assertEquals(3, first.getResumeState().getUsedVariables().size());
        assertEquals(5, second.getResumeState().getUsedVariables().size());

        CfResult third = coach.generateSubCfs(second.getResumeState());
        assertFalse(third.isSuccessful());
        assertEquals(List.of(0), third.getFailedIndexes());
    }

    @Test
    void testNothingLeftSkipsTheSolver() {
        CfResult first = coach.generateCfs(CfConfig.builder(REJECTED).featuresToVary(List.of("home")).build());
        assertFalse(first.isSuccessful());
        int calls = solver.getCalls();

        ResumeState state = first.getResumeState();
        ResumeState allUsed = state.withUsed(List.of(VariableId.main(2, 1), VariableId.main(2, 2)));
        CfResult result = coach.generateSubCfs(allUsed);

        assertFalse(result.isSuccessful());
        assertEquals(calls, solver.getCalls());
    }

    @Test
    void testRegressionIncrease() {
        ScoringModel regressor = ToyModels.regressor();
        CounterfactualCoach regressionCoach = new CounterfactualCoach(regressor, new ExhaustiveSolver());
        CfConfig config = CfConfig.builder(Sample.of(5, 2)).targetRange(10, Double.POSITIVE_INFINITY).build();
        Counterfactual cf = regressionCoach.generateCfs(config).getCounterfactuals().get(0);

        assertEquals(Sample.of(20, 10), cf.getData());
        assertEquals(23.0, cf.getDistance(), 1e-9);
        assertEquals(10.5, regressor.score(cf.getData()), 1e-9);
    }

    @Test
    void testRegressionDecrease() {
        ScoringModel regressor = ToyModels.regressor();
        CounterfactualCoach regressionCoach = new CounterfactualCoach(regressor, new ExhaustiveSolver());
        Sample sample = Sample.of(25, 12);
        assertEquals(10.5, regressor.score(sample), 1e-9);

        CfConfig config = CfConfig.builder(sample).targetRange(Double.NEGATIVE_INFINITY, 6.2).build();
        Counterfactual cf = regressionCoach.generateCfs(config).getCounterfactuals().get(0);

        assertEquals(6.0, regressor.score(cf.getData()), 1e-9);
        assertEquals(20 - 1e-6, cf.getData().getNumber(0), 1e-9);
        assertEquals(5 - 1e-6, cf.getData().getNumber(1), 1e-9);
    }

    @Test
    void testRegressionTargetIsValidated() {
        CounterfactualCoach regressionCoach = new CounterfactualCoach(ToyModels.regressor(), new ExhaustiveSolver());
        Sample sample = Sample.of(5, 2);

        assertThrows(IllegalArgumentException.class,
                () -> regressionCoach.generateCfs(CfConfig.builder(sample).build()));
        assertThrows(IllegalArgumentException.class,
                () -> regressionCoach.generateCfs(CfConfig.builder(sample).targetRange(4, 6).build()));
        assertThrows(IllegalArgumentException.class, () -> CfConfig.builder(sample).targetRange(6, 4));
    }

    @Test
    void testTargetRangesPerCounterfactual() {
        CfResult result = coach.generateCfs(CfConfig.builder(REJECTED).build());
        Map<String, Object> ranges = result.getTargetRanges().get(0);
        assertArrayEquals(new double[]{30, 45}, (double[]) ranges.get("age"));
        assertEquals("own", ranges.get("home"));
    }
}
