package ebm;

import org.junit.jupiter.api.Test;
import testing.ToyModels;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class DistanceTablesTest {

    @Test
    void testTablesFromModelJson() {
        DistanceTables tables = DistanceTables.fromDescription(ToyModels.description("toy-classifier"));
        assertEquals(10.0, tables.mad("age"));
        assertEquals(20000.0, tables.mad("income"));
        assertEquals(0.7, tables.levelDistance("home", 3));
    }

    @Test
    void testMissingEntriesFallBack() {
        DistanceTables tables = DistanceTables.fromDescription(ToyModels.description("toy-regressor"));
        // no MAD disables scaling, no level table costs the default
        assertEquals(0.0, tables.mad("x1"));
        assertEquals(DistanceTables.DEFAULT_LEVEL_DISTANCE, tables.levelDistance("home", 2));
    }

    @Test
    void testTablesFromReferenceData() {
        ScoringModel model = ToyModels.classifier();
        List<Sample> samples = List.of(
                Sample.of(20, 30000, "rent"),
                Sample.of(30, 30000, "rent"),
                Sample.of(40, 30000, "own"),
                Sample.of(50, 30000, "mortgage"),
                Sample.of(90, 30000, "rent"));
        DistanceTables tables = DistanceTables.fromReferenceData(model, samples);

        assertTrue(tables.mad("age") > 0);
        // constant column
        assertEquals(0.0, tables.mad("income"));
        assertEquals(0.4, tables.levelDistance("home", 1), 1e-12);
        assertEquals(0.8, tables.levelDistance("home", 2), 1e-12);
        assertEquals(0.8, tables.levelDistance("home", 3), 1e-12);
    }

    @Test
    void testEmptyReferenceDataIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> DistanceTables.fromReferenceData(ToyModels.classifier(), List.of()));
    }

    @Test
    void testNonNumericLevelCodeIsModelError() {
        ModelDescription description = ModelDescription.fromJson(
                "{\"catDistances\": {\"home\": {\"rent\": 0.5}}}");
        assertThrows(ModelFormatException.class, () -> DistanceTables.fromDescription(description));
    }

    @Test
    void testExplicitTables() {
        DistanceTables tables = new DistanceTables(Map.of("a", 2.5), Map.of("b", Map.of(4, 0.25)));
        assertEquals(2.5, tables.mad("a"));
        assertEquals(0.25, tables.levelDistance("b", 4));
    }
}
