package org.dma.gbdt4j.tree.param;

import org.dma.gbdt4j.exception.InvalidParamException;

import java.io.Serializable;

public abstract class TreeParam implements Serializable {
    public int numFeature;  // number of features
    public int maxDepth = 6;  // maximum depth, 1 means a single leaf
    public int minLeafSize = 1;  // minimum number of instances in a child
    public double featSampleRatio = 1.0;  // subsample ratio for features
    public long seed = 42L;  // seed of feature sampling

    /**
     * Check the parameters before any data is touched.
     *
     * @throws InvalidParamException if a parameter is out of its legal range
     */
    public void validate() {
        if (maxDepth < 1)
            throw new InvalidParamException(String.format(
                    "maximum depth should be at least 1, got %d", maxDepth));
        if (minLeafSize < 1)
            throw new InvalidParamException(String.format(
                    "minimum leaf size should be at least 1, got %d", minLeafSize));
        if (!(featSampleRatio > 0.0 && featSampleRatio <= 1.0))
            throw new InvalidParamException(String.format(
                    "feature sample ratio should be in (0, 1], got %f", featSampleRatio));
    }
}
