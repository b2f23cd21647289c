package ebm;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class LabelEncoderTest {

    private LabelEncoder encoder() {
        return new LabelEncoder(Map.of("home", Map.of("1", "rent", "2", "mortgage", "3.0", "own")));
    }

    @Test
    void testEncodeAndDecode() {
        LabelEncoder encoder = encoder();
        assertEquals(1, encoder.encode("home", "rent"));
        assertEquals(3, encoder.encode("home", "own"));
        assertEquals("mortgage", encoder.decode("home", 2));
        assertEquals(3, encoder.levels("home").size());
    }

    @Test
    void testUnseenLabelGetsUnseenCode() {
        assertEquals(LabelEncoder.UNSEEN_CODE, encoder().encode("home", "castle"));
    }

    @Test
    void testFeatureWithoutEncoderUsesNumericValue() {
        LabelEncoder encoder = encoder();
        assertFalse(encoder.hasFeature("zone"));
        assertEquals(4, encoder.encode("zone", "4"));
        assertEquals(7, encoder.encode("zone", 7.0));
        assertEquals("5", encoder.decode("zone", 5));
        assertTrue(encoder.levels("zone").isEmpty());
    }

    @Test
    void testNonNumericCodeIsModelError() {
        assertThrows(ModelFormatException.class,
                () -> new LabelEncoder(Map.of("home", Map.of("a", "rent"))));
    }
}
