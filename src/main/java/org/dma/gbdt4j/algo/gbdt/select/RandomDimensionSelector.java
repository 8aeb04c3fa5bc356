package org.dma.gbdt4j.algo.gbdt.select;

import com.google.common.base.Preconditions;
import org.dma.gbdt4j.util.Maths;

import java.util.Arrays;
import java.util.Random;

/**
 * Examines a random subset of the features at every node, drawn without
 * replacement and in random order.
 */
public class RandomDimensionSelector implements DimensionSelector {
    private final int numFeature;
    private final int numSample;
    private final Random random;

    public RandomDimensionSelector(int numFeature, double ratio, long seed) {
        Preconditions.checkArgument(ratio > 0.0 && ratio <= 1.0,
                "sample ratio should be in (0, 1], got %s", ratio);
        this.numFeature = numFeature;
        this.numSample = Math.max(1, (int) Math.ceil(ratio * numFeature));
        this.random = new Random(seed);
    }

    @Override
    public int[] select() {
        int[] fset = Maths.range(numFeature);
        Maths.shuffle(fset, random);
        return numSample >= numFeature ? fset : Arrays.copyOf(fset, numSample);
    }

    @Override
    public int getNumFeature() {
        return numFeature;
    }

    public int getNumSample() {
        return Math.min(numSample, numFeature);
    }
}
