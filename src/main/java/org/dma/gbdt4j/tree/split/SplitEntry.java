package org.dma.gbdt4j.tree.split;

import java.io.Serializable;

/**
 * Split parameters of an internal node: which feature is used, the gain of
 * the split, and how a feature value flows to one of the children.
 */
public abstract class SplitEntry implements Serializable {
    protected int fid;  // feature index used to split
    protected double gain;  // count-weighted gain of the children

    public SplitEntry(int fid, double gain) {
        this.fid = fid;
        this.gain = gain;
    }

    /**
     * Index of the child a feature value flows to.
     */
    public abstract int flowTo(double x);

    public abstract int numChildren();

    public abstract SplitType splitType();

    public boolean needReplace(double newGain) {
        return newGain > this.gain;
    }

    public int getFid() {
        return fid;
    }

    public double getGain() {
        return gain;
    }

    public enum SplitType {
        SPLIT_POINT, SPLIT_SET
    }
}
