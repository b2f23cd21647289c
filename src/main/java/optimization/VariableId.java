package optimization;

import java.util.List;
import java.util.Objects;

/**
 * Typed identifier of a decision variable: a main-effect (feature, bin)
 * selection, or the auxiliary variable standing for two such selections
 * being made together.
 */
public final class VariableId implements Comparable<VariableId> {

    public enum Kind {
        MAIN,
        INTERACTION
    }

    private final Kind kind;
    private final int featureIndex;
    private final int binIndex;
    private final int secondFeatureIndex;
    private final int secondBinIndex;

    private VariableId(Kind kind, int featureIndex, int binIndex, int secondFeatureIndex, int secondBinIndex) {
        this.kind = kind;
        this.featureIndex = featureIndex;
        this.binIndex = binIndex;
        this.secondFeatureIndex = secondFeatureIndex;
        this.secondBinIndex = secondBinIndex;
    }

    public static VariableId main(int featureIndex, int binIndex) {
        return new VariableId(Kind.MAIN, featureIndex, binIndex, -1, -1);
    }

    public static VariableId interaction(int firstFeature, int firstBin, int secondFeature, int secondBin) {
        return new VariableId(Kind.INTERACTION, firstFeature, firstBin, secondFeature, secondBin);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isMain() {
        return kind == Kind.MAIN;
    }

    public int getFeatureIndex() {
        return featureIndex;
    }

    public int getBinIndex() {
        return binIndex;
    }

    public int getSecondFeatureIndex() {
        return secondFeatureIndex;
    }

    public int getSecondBinIndex() {
        return secondBinIndex;
    }

    public VariableId firstParent() {
        return main(featureIndex, binIndex);
    }

    public VariableId secondParent() {
        if (kind != Kind.INTERACTION) {
            throw new IllegalStateException("Main-effect variables have no second parent");
        }
        return main(secondFeatureIndex, secondBinIndex);
    }

    /**
     * Solver-facing name, e.g. "age:3" or "age:3 x income:1".
     */
    public String render(List<String> featureNames) {
        String first = featureNames.get(featureIndex) + ":" + binIndex;
        if (kind == Kind.MAIN) {
            return first;
        }
        return first + " x " + featureNames.get(secondFeatureIndex) + ":" + secondBinIndex;
    }

    @Override
    public int compareTo(VariableId o) {
        int c = kind.compareTo(o.kind);
        if (c != 0) return c;
        c = Integer.compare(featureIndex, o.featureIndex);
        if (c != 0) return c;
        c = Integer.compare(binIndex, o.binIndex);
        if (c != 0) return c;
        c = Integer.compare(secondFeatureIndex, o.secondFeatureIndex);
        if (c != 0) return c;
        return Integer.compare(secondBinIndex, o.secondBinIndex);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VariableId)) return false;
        VariableId that = (VariableId) o;
        return kind == that.kind
                && featureIndex == that.featureIndex
                && binIndex == that.binIndex
                && secondFeatureIndex == that.secondFeatureIndex
                && secondBinIndex == that.secondBinIndex;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, featureIndex, binIndex, secondFeatureIndex, secondBinIndex);
    }

    @Override
    public String toString() {
        if (kind == Kind.MAIN) {
            return "f" + featureIndex + ":" + binIndex;
        }
        return "f" + featureIndex + ":" + binIndex + " x f" + secondFeatureIndex + ":" + secondBinIndex;
    }
}
