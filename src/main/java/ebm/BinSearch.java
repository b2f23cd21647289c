package ebm;

/**
 * Bin lookups shared by the scoring engine and the option generator.
 */
public final class BinSearch {

    private BinSearch() {
    }

    /**
     * Index of the bin whose lower edge is the largest edge not above value.
     * Values below the first edge clamp to bin 0, values past the last edge to
     * the last bin.
     *
     * @param lowerEdges ascending bin lower edges (trailing upper edge removed)
     */
    public static int lowerBoundIndex(double[] lowerEdges, double value) {
        if (lowerEdges.length == 0) {
            return -1;
        }
        if (value < lowerEdges[0]) {
            return 0;
        }
        if (value >= lowerEdges[lowerEdges.length - 1]) {
            return lowerEdges.length - 1;
        }
        int lo = 0;
        int hi = lowerEdges.length - 1;
        // invariant: lowerEdges[lo] <= value < lowerEdges[hi]
        while (hi - lo > 1) {
            int mid = (lo + hi) >>> 1;
            if (lowerEdges[mid] <= value) {
                lo = mid;
            } else {
                hi = mid;
            }
        }
        return lo;
    }

    /**
     * Position of an exact level code, or -1.
     */
    public static int exactIndex(double[] levels, double code) {
        for (int i = 0; i < levels.length; i++) {
            if (levels[i] == code) {
                return i;
            }
        }
        return -1;
    }

    public static int locate(FeatureType type, double[] edgesOrLevels, double value) {
        return type == FeatureType.CATEGORICAL
                ? exactIndex(edgesOrLevels, value)
                : lowerBoundIndex(edgesOrLevels, value);
    }
}
