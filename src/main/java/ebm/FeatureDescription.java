package ebm;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;

/**
 * One entry of the model's "features" list. Main effects carry either
 * binEdge (continuous, including the trailing upper edge) or binLabel
 * (categorical level codes) plus a 1-D additive array; interactions carry
 * the two parent indexes in id, one axis per parent and a 2-D additive grid.
 */
public class FeatureDescription {
    private static final Gson GSON = new Gson();

    private String name;
    private FeatureType type;
    private double[] binEdge;
    private double[] binLabel;
    private JsonElement additive;
    private int[] id;
    private double[] binLabel1;
    private double[] binLabel2;
    private FeatureConfig config;

    public String getName() {
        return name;
    }

    public FeatureType getType() {
        return type;
    }

    public double[] getBinEdge() {
        return binEdge;
    }

    public double[] getBinLabel() {
        return binLabel;
    }

    public int[] getId() {
        return id;
    }

    public double[] getBinLabel1() {
        return binLabel1;
    }

    public double[] getBinLabel2() {
        return binLabel2;
    }

    public FeatureConfig getConfig() {
        return config == null ? new FeatureConfig() : config;
    }

    public double[] getMainScores() {
        if (additive == null || !additive.isJsonArray()) {
            throw new ModelFormatException("Feature '" + name + "' has no additive scores");
        }
        try {
            return GSON.fromJson(additive, double[].class);
        } catch (JsonParseException | IllegalStateException | NumberFormatException e) {
            throw new ModelFormatException("Feature '" + name + "' must carry a 1-D additive array", e);
        }
    }

    public double[][] getInteractionScores() {
        if (additive == null || !additive.isJsonArray()) {
            throw new ModelFormatException("Interaction '" + name + "' has no additive scores");
        }
        try {
            return GSON.fromJson(additive, double[][].class);
        } catch (JsonParseException | IllegalStateException | NumberFormatException e) {
            throw new ModelFormatException("Interaction '" + name + "' must carry a 2-D additive grid", e);
        }
    }
}
