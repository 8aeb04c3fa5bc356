package org.dma.gbdt4j.algo.gbdt.select;

import com.google.common.base.Preconditions;
import org.dma.gbdt4j.util.Maths;

public class AllDimensionSelector implements DimensionSelector {
    private final int[] fset;

    public AllDimensionSelector(int numFeature) {
        Preconditions.checkArgument(numFeature >= 0, "negative number of features: %s", numFeature);
        this.fset = Maths.range(numFeature);
    }

    @Override
    public int[] select() {
        return fset.clone();
    }

    @Override
    public int getNumFeature() {
        return fset.length;
    }
}
