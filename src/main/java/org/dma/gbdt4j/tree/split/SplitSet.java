package org.dma.gbdt4j.tree.split;

import org.dma.gbdt4j.exception.DataMismatchException;

/**
 * Multi-way split on a categorical feature with one child per category.
 */
public class SplitSet extends SplitEntry {
    private final int numCategories;

    public SplitSet(int fid, int numCategories, double gain) {
        super(fid, gain);
        this.numCategories = numCategories;
    }

    @Override
    public int flowTo(double x) {
        int category = (int) x;
        if (category != x || category < 0 || category >= numCategories)
            throw new DataMismatchException(String.format(
                    "feature[%d] value %f is not a category in [0, %d)", fid, x, numCategories));
        return category;
    }

    @Override
    public int numChildren() {
        return numCategories;
    }

    @Override
    public SplitType splitType() {
        return SplitType.SPLIT_SET;
    }

    public int getNumCategories() {
        return numCategories;
    }

    @Override
    public String toString() {
        return String.format("%s fid[%d] numCategories[%d] gain[%f]",
                this.splitType(), fid, numCategories, gain);
    }
}
