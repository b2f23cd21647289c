package io;

import coach.CfConfig;
import coach.CfResult;
import coach.CounterfactualCoach;
import coach.ResumeState;
import com.google.gson.JsonParseException;
import ebm.Sample;
import ebm.ScoringModel;
import optimization.VariableId;
import org.junit.jupiter.api.Test;
import testing.ExhaustiveSolver;
import testing.ToyModels;

import static org.junit.jupiter.api.Assertions.*;

public class ResumeStateJsonTest {

    @Test
    void testSearchResumesFromJson() {
        ScoringModel model = ToyModels.classifier();
        CounterfactualCoach coach = new CounterfactualCoach(model, new ExhaustiveSolver());
        CfResult first = coach.generateCfs(CfConfig.builder(Sample.of(25, 15000, "rent")).build());

        String json = ResumeStateJson.toJson(first.getResumeState());
        ResumeState restored = ResumeStateJson.fromJson(json);

        assertEquals(first.getResumeState().getSample(), restored.getSample());
        assertEquals(first.getResumeState().getUsedVariables(), restored.getUsedVariables());
        assertTrue(restored.getUsedVariables().contains(VariableId.main(2, 2)));
        assertEquals(first.getResumeState().getOptions().size(), restored.getOptions().size());

        // continuing from the copy gives the same next counterfactual as continuing directly
        CfResult direct = coach.generateSubCfs(first.getResumeState());
        CfResult resumed = coach.generateSubCfs(restored);
        assertEquals(direct.getData(), resumed.getData());
        assertEquals(direct.getDistances().get(0), resumed.getDistances().get(0), 1e-12);
    }

    @Test
    void testIncompleteJsonIsRejected() {
        assertThrows(JsonParseException.class, () -> ResumeStateJson.fromJson("{\"direction\": 1}"));
    }
}
