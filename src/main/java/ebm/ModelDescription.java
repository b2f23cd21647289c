package ebm;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Trained additive model as exported to JSON.
 *
 * labelEncoder maps, per categorical feature, level code (as a string) to
 * level label. contMads and catDistances are optional distance tables.
 */
public class ModelDescription {
    private static final Gson GSON = new Gson();

    private List<String> featureNames;
    private List<FeatureType> featureTypes;
    private List<FeatureDescription> features;
    private Map<String, Map<String, String>> labelEncoder;
    private double intercept;
    private boolean isClassifier;
    private ModelInfo modelInfo;
    private Map<String, Double> contMads;
    private Map<String, Map<String, Double>> catDistances;

    public static ModelDescription fromJson(Reader reader) {
        try {
            ModelDescription description = GSON.fromJson(reader, ModelDescription.class);
            if (description == null) {
                throw new ModelFormatException("Model description is empty");
            }
            return description;
        } catch (JsonParseException e) {
            throw new ModelFormatException("Model description is not valid JSON: " + e.getMessage(), e);
        }
    }

    public static ModelDescription fromJson(String json) {
        return fromJson(new StringReader(json));
    }

    public static ModelDescription fromFile(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return fromJson(reader);
        }
    }

    public List<String> getFeatureNames() {
        return featureNames == null ? Collections.emptyList() : Collections.unmodifiableList(featureNames);
    }

    public List<FeatureType> getFeatureTypes() {
        return featureTypes == null ? Collections.emptyList() : Collections.unmodifiableList(featureTypes);
    }

    public List<FeatureDescription> getFeatures() {
        return features == null ? Collections.emptyList() : Collections.unmodifiableList(features);
    }

    public Map<String, Map<String, String>> getLabelEncoder() {
        return labelEncoder == null ? Collections.emptyMap() : Collections.unmodifiableMap(labelEncoder);
    }

    public double getIntercept() {
        return intercept;
    }

    public boolean isClassifier() {
        return isClassifier;
    }

    public ModelInfo getModelInfo() {
        return modelInfo == null ? new ModelInfo() : modelInfo;
    }

    public Map<String, Double> getContMads() {
        return contMads == null ? Collections.emptyMap() : Collections.unmodifiableMap(contMads);
    }

    public Map<String, Map<String, Double>> getCatDistances() {
        return catDistances == null ? Collections.emptyMap() : Collections.unmodifiableMap(catDistances);
    }
}
