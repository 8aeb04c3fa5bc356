package org.dma.gbdt4j.algo.gbdt.metadata;

import com.google.common.base.Preconditions;

import java.io.Serializable;
import java.util.Arrays;

/**
 * Per-feature metadata: whether a feature is numeric or categorical and,
 * for categorical features, how many categories it has. Categorical values
 * are expected to be encoded as 0, 1, ..., numCategories - 1.
 */
public class FeatureInfo implements Serializable {
    private final FeatureType[] types;
    private final int[] numCategories;

    public FeatureInfo(FeatureType[] types, int[] numCategories) {
        Preconditions.checkArgument(types.length == numCategories.length,
                "%s feature types but %s category counts", types.length, numCategories.length);
        for (int fid = 0; fid < types.length; fid++) {
            Preconditions.checkArgument(types[fid] != FeatureType.CATEGORICAL || numCategories[fid] > 0,
                    "categorical feature %s should have at least one category", fid);
        }
        this.types = types;
        this.numCategories = numCategories;
    }

    public static FeatureInfo allNumeric(int numFeature) {
        FeatureType[] types = new FeatureType[numFeature];
        Arrays.fill(types, FeatureType.NUMERIC);
        return new FeatureInfo(types, new int[numFeature]);
    }

    public int getNumFeature() {
        return types.length;
    }

    public FeatureType getType(int fid) {
        return types[fid];
    }

    public boolean isCategorical(int fid) {
        return types[fid] == FeatureType.CATEGORICAL;
    }

    public int getNumCategories(int fid) {
        return numCategories[fid];
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("FeatureInfo[");
        for (int fid = 0; fid < types.length; fid++) {
            if (fid > 0) sb.append(", ");
            sb.append(fid).append(':').append(types[fid]);
            if (isCategorical(fid)) sb.append('(').append(numCategories[fid]).append(')');
        }
        return sb.append(']').toString();
    }
}
