package ebm;

/**
 * User-facing configuration shipped with each main feature.
 *
 * acceptableRange holds [min, max] for continuous features and a list of
 * level codes for categorical ones. Difficulty runs from 1 (very easy) to
 * 6 (locked), 3 being neutral.
 */
public class FeatureConfig {
    public static final int NEUTRAL_DIFFICULTY = 3;

    private double[] acceptableRange;
    private boolean requiresIncreasing;
    private boolean requiresDecreasing;
    private int difficulty = NEUTRAL_DIFFICULTY;
    private String usesTransform;
    private boolean requiresInt;

    public FeatureConfig() {
    }

    public FeatureConfig(double[] acceptableRange, boolean requiresIncreasing, boolean requiresDecreasing,
                         int difficulty, String usesTransform, boolean requiresInt) {
        this.acceptableRange = acceptableRange;
        this.requiresIncreasing = requiresIncreasing;
        this.requiresDecreasing = requiresDecreasing;
        this.difficulty = difficulty;
        this.usesTransform = usesTransform;
        this.requiresInt = requiresInt;
    }

    public double[] getAcceptableRange() {
        return acceptableRange == null ? null : acceptableRange.clone();
    }

    public boolean isRequiresIncreasing() {
        return requiresIncreasing;
    }

    public boolean isRequiresDecreasing() {
        return requiresDecreasing;
    }

    public int getDifficulty() {
        return difficulty;
    }

    public String getUsesTransform() {
        return usesTransform;
    }

    public boolean isRequiresInt() {
        return requiresInt;
    }
}
