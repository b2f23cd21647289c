package options;

/**
 * Correction applied when both parents of an interaction term change at
 * once. It has no distance of its own: the gain is what the pair adds on
 * top of the two parents' individual gains.
 */
public final class InteractionOption extends Option {
    private final int interactionIndex;
    private final String interactionName;
    private final int firstFeature;
    private final int firstBin;
    private final double firstTarget;
    private final int secondFeature;
    private final int secondBin;
    private final double secondTarget;

    public InteractionOption(int interactionIndex, String interactionName,
                             MainEffectOption first, MainEffectOption second, double scoreGain) {
        super(scoreGain);
        this.interactionIndex = interactionIndex;
        this.interactionName = interactionName;
        this.firstFeature = first.getFeatureIndex();
        this.firstBin = first.getBinIndex();
        this.firstTarget = first.getEncodedTarget();
        this.secondFeature = second.getFeatureIndex();
        this.secondBin = second.getBinIndex();
        this.secondTarget = second.getEncodedTarget();
    }

    public InteractionOption(int interactionIndex, String interactionName,
                             int firstFeature, int firstBin, double firstTarget,
                             int secondFeature, int secondBin, double secondTarget, double scoreGain) {
        super(scoreGain);
        this.interactionIndex = interactionIndex;
        this.interactionName = interactionName;
        this.firstFeature = firstFeature;
        this.firstBin = firstBin;
        this.firstTarget = firstTarget;
        this.secondFeature = secondFeature;
        this.secondBin = secondBin;
        this.secondTarget = secondTarget;
    }

    public int getInteractionIndex() {
        return interactionIndex;
    }

    public String getInteractionName() {
        return interactionName;
    }

    public int getFirstFeature() {
        return firstFeature;
    }

    public int getFirstBin() {
        return firstBin;
    }

    public double getFirstTarget() {
        return firstTarget;
    }

    public int getSecondFeature() {
        return secondFeature;
    }

    public int getSecondBin() {
        return secondBin;
    }

    public double getSecondTarget() {
        return secondTarget;
    }

    @Override
    public OptionKind getKind() {
        return OptionKind.INTERACTION;
    }

    @Override
    public String toString() {
        return String.format("InteractionOption{%s: bins (%d, %d), gain=%.5f}",
                interactionName, firstBin, secondBin, getScoreGain());
    }
}
