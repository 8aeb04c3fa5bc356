package org.dma.gbdt4j.algo.gbdt.splitter;

import org.dma.gbdt4j.algo.gbdt.metadata.FeatureInfo;
import org.dma.gbdt4j.algo.gbdt.tree.GBTSplit;
import org.dma.gbdt4j.data.DataMatrix;
import org.dma.gbdt4j.objective.gain.GainFunction;
import org.dma.gbdt4j.tree.split.SplitEntry;

/**
 * Split search on a single feature of a given type.
 */
public interface FeatureSplitter {
    /**
     * Search the best split of instances [from, to) on one feature.
     *
     * @param fid          feature to split on
     * @param data         data matrix, not modified
     * @param from         start position, inclusive
     * @param to           end position, exclusive
     * @param featureInfo  feature metadata
     * @param bestGain     gain to improve on
     * @param minLeafSize  minimum number of instances in each child
     * @param minSplitGain minimum improvement over bestGain
     * @param gainFunc     gain function
     * @return the best split, or an empty split if none beats bestGain
     */
    GBTSplit splitIfBetter(int fid, DataMatrix data, int from, int to, FeatureInfo featureInfo,
                           double bestGain, int minLeafSize, double minSplitGain,
                           GainFunction gainFunc);

    int numChildren(SplitEntry splitEntry);

    int calculateDirection(double value, SplitEntry splitEntry);
}
