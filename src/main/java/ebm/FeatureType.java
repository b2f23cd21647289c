package ebm;

import com.google.gson.annotations.SerializedName;

public enum FeatureType {
    @SerializedName("continuous")
    CONTINUOUS,

    @SerializedName("categorical")
    CATEGORICAL,

    @SerializedName("interaction")
    INTERACTION;

    public boolean isMainEffect() {
        return this != INTERACTION;
    }
}
