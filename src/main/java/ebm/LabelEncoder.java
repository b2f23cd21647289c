package ebm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bidirectional mapping between categorical level labels and the numeric
 * level codes the additive scores are indexed by.
 */
public class LabelEncoder {
    private static final Logger logger = LoggerFactory.getLogger(LabelEncoder.class);

    /** Code given to labels the model has never seen; no bin carries it. */
    public static final int UNSEEN_CODE = 0;

    private final Map<String, Map<String, Integer>> encoders = new HashMap<>();
    private final Map<String, Map<Integer, String>> decoders = new HashMap<>();

    /**
     * @param codeToLabel per feature, level code (as written in the model JSON) to label
     */
    public LabelEncoder(Map<String, Map<String, String>> codeToLabel) {
        for (Map.Entry<String, Map<String, String>> feature : codeToLabel.entrySet()) {
            Map<String, Integer> encoder = new LinkedHashMap<>();
            Map<Integer, String> decoder = new LinkedHashMap<>();
            for (Map.Entry<String, String> level : feature.getValue().entrySet()) {
                int code;
                try {
                    code = (int) Double.parseDouble(level.getKey());
                } catch (NumberFormatException e) {
                    throw new ModelFormatException("Level code '" + level.getKey() + "' of feature '"
                            + feature.getKey() + "' is not a number", e);
                }
                encoder.put(level.getValue(), code);
                decoder.put(code, level.getValue());
            }
            encoders.put(feature.getKey(), encoder);
            decoders.put(feature.getKey(), decoder);
        }
    }

    public boolean hasFeature(String featureName) {
        return encoders.containsKey(featureName);
    }

    /**
     * Code of a categorical value. Unknown labels degrade to {@link #UNSEEN_CODE}.
     * Features without an encoder entry take the value itself as the code.
     */
    public int encode(String featureName, Object value) {
        Map<String, Integer> encoder = encoders.get(featureName);
        if (encoder == null) {
            return numericCode(featureName, value);
        }
        Integer code = encoder.get(labelOf(value));
        if (code == null) {
            logger.warn("Unseen level '{}' for feature '{}', scoring it as 0", value, featureName);
            return UNSEEN_CODE;
        }
        return code;
    }

    public String decode(String featureName, int code) {
        Map<Integer, String> decoder = decoders.get(featureName);
        if (decoder == null) {
            return Integer.toString(code);
        }
        String label = decoder.get(code);
        return label == null ? Integer.toString(code) : label;
    }

    public Map<Integer, String> levels(String featureName) {
        Map<Integer, String> decoder = decoders.get(featureName);
        return decoder == null ? Collections.emptyMap() : Collections.unmodifiableMap(decoder);
    }

    private static String labelOf(Object value) {
        if (value instanceof Double) {
            double d = (Double) value;
            if (d == Math.rint(d) && !Double.isInfinite(d)) {
                return Long.toString((long) d);
            }
        }
        return String.valueOf(value);
    }

    private static int numericCode(String featureName, Object value) {
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        try {
            return (int) Double.parseDouble(String.valueOf(value));
        } catch (NumberFormatException e) {
            logger.warn("Feature '{}' has no label encoder and value '{}' is not a code, scoring it as 0",
                    featureName, value);
            return UNSEEN_CODE;
        }
    }
}
