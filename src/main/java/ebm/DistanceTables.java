package ebm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import smile.math.MathEx;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Normalisers for option distances: the median absolute deviation of each
 * continuous feature and, per categorical feature, the cost of moving to
 * each level.
 */
public class DistanceTables {
    private static final Logger logger = LoggerFactory.getLogger(DistanceTables.class);

    public static final double DEFAULT_LEVEL_DISTANCE = 1.0;

    private final Map<String, Double> contMads;
    private final Map<String, Map<Integer, Double>> catDistances;

    public DistanceTables(Map<String, Double> contMads, Map<String, Map<Integer, Double>> catDistances) {
        this.contMads = Collections.unmodifiableMap(new HashMap<>(contMads));
        Map<String, Map<Integer, Double>> copy = new HashMap<>();
        catDistances.forEach((k, v) -> copy.put(k, Collections.unmodifiableMap(new HashMap<>(v))));
        this.catDistances = Collections.unmodifiableMap(copy);
    }

    /**
     * Tables shipped inside the model JSON (contMads, catDistances).
     */
    public static DistanceTables fromDescription(ModelDescription description) {
        Map<String, Map<Integer, Double>> cat = new HashMap<>();
        for (Map.Entry<String, Map<String, Double>> feature : description.getCatDistances().entrySet()) {
            Map<Integer, Double> levels = new HashMap<>();
            for (Map.Entry<String, Double> level : feature.getValue().entrySet()) {
                try {
                    levels.put((int) Double.parseDouble(level.getKey()), level.getValue());
                } catch (NumberFormatException e) {
                    throw new ModelFormatException("catDistances of '" + feature.getKey()
                            + "' uses non-numeric level code '" + level.getKey() + "'", e);
                }
            }
            cat.put(feature.getKey(), levels);
        }
        return new DistanceTables(description.getContMads(), cat);
    }

    /**
     * Tables computed from a reference dataset: MAD per continuous feature,
     * and 1 - relative frequency per categorical level.
     */
    public static DistanceTables fromReferenceData(ScoringModel model, List<Sample> samples) {
        if (samples.isEmpty()) {
            throw new IllegalArgumentException("Reference data is empty");
        }
        Map<String, Double> mads = new LinkedHashMap<>();
        Map<String, Map<Integer, Double>> cat = new LinkedHashMap<>();

        for (int i = 0; i < model.getFeatureCount(); i++) {
            String name = model.getFeatureName(i);
            if (model.getFeatureType(i) == FeatureType.CONTINUOUS) {
                double[] column = new double[samples.size()];
                for (int r = 0; r < samples.size(); r++) {
                    column[r] = model.encode(i, samples.get(r).get(i));
                }
                // MathEx.mad reorders its argument
                mads.put(name, MathEx.mad(column));
            } else {
                Map<Integer, Integer> counts = new HashMap<>();
                for (Sample sample : samples) {
                    int code = (int) model.encode(i, sample.get(i));
                    counts.merge(code, 1, Integer::sum);
                }
                Map<Integer, Double> levels = new LinkedHashMap<>();
                for (double code : model.getBinEdges(i)) {
                    int count = counts.getOrDefault((int) code, 0);
                    levels.put((int) code, 1.0 - (double) count / samples.size());
                }
                cat.put(name, levels);
            }
        }
        logger.info("Computed distance tables from {} reference samples", samples.size());
        return new DistanceTables(mads, cat);
    }

    /**
     * MAD of a continuous feature; 0 when unknown, which disables scaling.
     */
    public double mad(String featureName) {
        Double mad = contMads.get(featureName);
        return mad == null ? 0.0 : mad;
    }

    public double levelDistance(String featureName, int levelCode) {
        Map<Integer, Double> levels = catDistances.get(featureName);
        Double distance = levels == null ? null : levels.get(levelCode);
        if (distance == null) {
            logger.warn("No categorical distance for level {} of '{}', using {}",
                    levelCode, featureName, DEFAULT_LEVEL_DISTANCE);
            return DEFAULT_LEVEL_DISTANCE;
        }
        return distance;
    }
}
