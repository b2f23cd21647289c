package ebm;

/**
 * A pairwise interaction: two main-feature indexes, one bin axis per
 * feature and the score grid indexed [bin on first axis][bin on second axis].
 */
public final class InteractionTerm {
    private final int index;
    private final String name;
    private final int firstFeature;
    private final int secondFeature;
    private final FeatureType firstType;
    private final FeatureType secondType;
    private final double[] firstAxis;
    private final double[] secondAxis;
    private final double[][] scores;

    InteractionTerm(int index, String name, int firstFeature, int secondFeature,
                    FeatureType firstType, FeatureType secondType,
                    double[] firstAxis, double[] secondAxis, double[][] scores) {
        this.index = index;
        this.name = name;
        this.firstFeature = firstFeature;
        this.secondFeature = secondFeature;
        this.firstType = firstType;
        this.secondType = secondType;
        this.firstAxis = firstAxis;
        this.secondAxis = secondAxis;
        this.scores = scores;
    }

    /** Position among the model's interaction terms. */
    public int getIndex() {
        return index;
    }

    public String getName() {
        return name;
    }

    public int getFirstFeature() {
        return firstFeature;
    }

    public int getSecondFeature() {
        return secondFeature;
    }

    public boolean involves(int featureIndex) {
        return firstFeature == featureIndex || secondFeature == featureIndex;
    }

    public int otherFeature(int featureIndex) {
        return featureIndex == firstFeature ? secondFeature : firstFeature;
    }

    public boolean isFirst(int featureIndex) {
        return featureIndex == firstFeature;
    }

    /** Bin along the axis of the given parent feature for an encoded value. */
    public int binOf(int featureIndex, double encodedValue) {
        if (featureIndex == firstFeature) {
            return BinSearch.locate(firstType, firstAxis, encodedValue);
        }
        return BinSearch.locate(secondType, secondAxis, encodedValue);
    }

    /** Grid score; a missing categorical bin (-1) contributes nothing. */
    public double score(int firstBin, int secondBin) {
        if (firstBin < 0 || secondBin < 0) {
            return 0.0;
        }
        return scores[firstBin][secondBin];
    }

    /**
     * Score with the given parent feature in bin featureBin and the other
     * parent in otherBin.
     */
    public double scoreFor(int featureIndex, int featureBin, int otherBin) {
        return featureIndex == firstFeature ? score(featureBin, otherBin) : score(otherBin, featureBin);
    }
}
