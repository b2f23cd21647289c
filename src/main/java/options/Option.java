package options;

/**
 * A candidate change and the score gain it brings.
 */
public abstract class Option {
    private final double scoreGain;

    protected Option(double scoreGain) {
        this.scoreGain = scoreGain;
    }

    public double getScoreGain() {
        return scoreGain;
    }

    public abstract OptionKind getKind();
}
