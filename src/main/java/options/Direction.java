package options;

/**
 * Which way the total score has to move.
 */
public enum Direction {
    INCREASE(1),
    DECREASE(-1);

    private final int sign;

    Direction(int sign) {
        this.sign = sign;
    }

    public int sign() {
        return sign;
    }

    public static Direction of(int sign) {
        if (sign == 1) return INCREASE;
        if (sign == -1) return DECREASE;
        throw new IllegalArgumentException("Direction must be +1 or -1, got " + sign);
    }

    /** True when the gain moves the score this way. */
    public boolean isTowards(double scoreGain) {
        return scoreGain * sign > 0;
    }

    /** True when the gain goes past the opposite bound. */
    public boolean overshoots(double scoreGain, double bound) {
        return sign > 0 ? scoreGain > bound : scoreGain < bound;
    }
}
