package org.dma.gbdt4j.tree.split;

/**
 * Binary split on a numeric feature: values not greater than the
 * threshold flow to child 0, the others to child 1.
 */
public class SplitPoint extends SplitEntry {
    private final double fvalue;  // feature value used to split

    public SplitPoint(int fid, double fvalue, double gain) {
        super(fid, gain);
        this.fvalue = fvalue;
    }

    @Override
    public int flowTo(double x) {
        return x <= fvalue ? 0 : 1;
    }

    @Override
    public int numChildren() {
        return 2;
    }

    @Override
    public SplitType splitType() {
        return SplitType.SPLIT_POINT;
    }

    public double getFvalue() {
        return fvalue;
    }

    @Override
    public String toString() {
        return String.format("%s fid[%d] fvalue[%f] gain[%f]",
                this.splitType(), fid, fvalue, gain);
    }
}
