package coach;

/**
 * How hard a user finds changing a feature. Harder features get their
 * option distances multiplied up; locked features are not varied at all.
 */
public enum Difficulty {
    VERY_EASY(1, 0.1),
    EASY(2, 0.5),
    NEUTRAL(3, 1.0),
    HARD(4, 2.0),
    VERY_HARD(5, 10.0),
    LOCK(6, Double.NaN);

    private final int code;
    private final double weightMultiplier;

    Difficulty(int code, double weightMultiplier) {
        this.code = code;
        this.weightMultiplier = weightMultiplier;
    }

    public int getCode() {
        return code;
    }

    /** Distance multiplier; undefined for {@link #LOCK}. */
    public double getWeightMultiplier() {
        return weightMultiplier;
    }

    public static Difficulty ofCode(int code) {
        for (Difficulty difficulty : values()) {
            if (difficulty.code == code) {
                return difficulty;
            }
        }
        throw new IllegalArgumentException("Unknown difficulty code " + code);
    }
}
