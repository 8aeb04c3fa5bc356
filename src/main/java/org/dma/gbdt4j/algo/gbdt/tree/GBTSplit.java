package org.dma.gbdt4j.algo.gbdt.tree;

import org.dma.gbdt4j.objective.gain.LabelStat;
import org.dma.gbdt4j.tree.split.SplitEntry;

import java.io.Serializable;

/**
 * Result of a split search. An empty split, i.e. one without split entry,
 * means that no candidate beat the gain to improve on.
 */
public class GBTSplit implements Serializable {
    private static final GBTSplit EMPTY = new GBTSplit(null, null);

    private final SplitEntry splitEntry;
    private final LabelStat[] childStats;  // label stats of each child

    public GBTSplit(SplitEntry splitEntry, LabelStat[] childStats) {
        this.splitEntry = splitEntry;
        this.childStats = childStats;
    }

    public static GBTSplit empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return splitEntry == null;
    }

    public boolean needReplace(GBTSplit split) {
        if (this.splitEntry != null)
            return split.splitEntry != null && this.splitEntry.needReplace(split.splitEntry.getGain());
        else
            return split.splitEntry != null;
    }

    public SplitEntry getSplitEntry() {
        return splitEntry;
    }

    public LabelStat[] getChildStats() {
        return childStats;
    }

    public double getGain() {
        return splitEntry.getGain();
    }

    @Override
    public String toString() {
        return isEmpty() ? "EMPTY" : splitEntry.toString();
    }
}
