package org.dma.gbdt4j.algo.gbdt.splitter;

import org.dma.gbdt4j.algo.gbdt.metadata.FeatureInfo;
import org.dma.gbdt4j.algo.gbdt.metadata.FeatureType;
import org.dma.gbdt4j.algo.gbdt.tree.GBTSplit;
import org.dma.gbdt4j.data.DataMatrix;
import org.dma.gbdt4j.objective.gain.GainFunction;
import org.dma.gbdt4j.tree.param.RegTParam;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class SplitFinder {
    private static final Logger LOG = LoggerFactory.getLogger(SplitFinder.class);

    private final RegTParam param;
    private final GainFunction gainFunc;

    public SplitFinder(RegTParam param, GainFunction gainFunc) {
        this.param = param;
        this.gainFunc = gainFunc;
    }

    public static FeatureSplitter getSplitter(FeatureType type) {
        switch (type) {
            case CATEGORICAL:
                return CategoricalSplitter.getInstance();
            case NUMERIC:
                return NumericSplitter.getInstance();
            default:
                throw new IllegalArgumentException("Unrecognizable feature type: " + type);
        }
    }

    /**
     * Examine the features in order and keep the split with the highest gain.
     * Each feature has to beat the best gain found so far; the search stops
     * once a pure split (gain 0) is found.
     *
     * @param fset        features to examine
     * @param data        data matrix
     * @param from        start position, inclusive
     * @param to          end position, exclusive
     * @param featureInfo feature metadata
     * @param nodeGain    gain of the node if it is not split
     * @return the best split, empty if no feature improves on nodeGain
     */
    public GBTSplit findBestSplit(int[] fset, DataMatrix data, int from, int to,
                                  FeatureInfo featureInfo, double nodeGain) {
        GBTSplit bestSplit = GBTSplit.empty();
        double bestGain = nodeGain;
        for (int fid : fset) {
            FeatureSplitter splitter = getSplitter(featureInfo.getType(fid));
            GBTSplit split = splitter.splitIfBetter(fid, data, from, to, featureInfo,
                    bestGain, param.minLeafSize, param.minSplitGain, gainFunc);
            if (split.isEmpty())
                continue;
            if (bestSplit.needReplace(split)) {
                bestSplit = split;
                bestGain = split.getGain();
            }
            if (bestGain >= 0.0)
                break;
        }
        if (LOG.isDebugEnabled())
            LOG.debug(String.format("Best split of pos[%d, %d): %s, node gain[%f]",
                    from, to, bestSplit, nodeGain));
        return bestSplit;
    }

    public RegTParam getParam() {
        return param;
    }

    public GainFunction getGainFunc() {
        return gainFunc;
    }
}
