package org.dma.gbdt4j.algo.gbdt.splitter;

import org.dma.gbdt4j.algo.gbdt.metadata.FeatureInfo;
import org.dma.gbdt4j.algo.gbdt.tree.GBTSplit;
import org.dma.gbdt4j.data.DataMatrix;
import org.dma.gbdt4j.objective.gain.GainFunction;
import org.dma.gbdt4j.objective.gain.LabelStat;
import org.dma.gbdt4j.tree.split.SplitEntry;
import org.dma.gbdt4j.tree.split.SplitSet;
import org.dma.gbdt4j.util.Maths;

import javax.inject.Singleton;

/**
 * Split of a categorical feature with one child per category.
 */
@Singleton
public class CategoricalSplitter implements FeatureSplitter {
    private static CategoricalSplitter instance;

    private CategoricalSplitter() {}

    @Override
    public GBTSplit splitIfBetter(int fid, DataMatrix data, int from, int to, FeatureInfo featureInfo,
                                  double bestGain, int minLeafSize, double minSplitGain,
                                  GainFunction gainFunc) {
        int numCategories = featureInfo.getNumCategories(fid);
        double[] values = data.getFeature(fid);
        double[] labels = data.getLabels();
        double[] weights = data.getWeights();

        LabelStat[] childStats = new LabelStat[numCategories];
        for (int i = 0; i < numCategories; i++)
            childStats[i] = gainFunc.newStat();
        for (int pos = from; pos < to; pos++)
            childStats[(int) values[pos]].plusBy(labels[pos], weights == null ? 1.0 : weights[pos]);

        // every child, empty ones included, needs enough instances
        for (LabelStat stat : childStats) {
            if (stat.getCount() < minLeafSize)
                return GBTSplit.empty();
        }

        int count = to - from;
        double gain = 0.0;
        for (LabelStat stat : childStats)
            gain += (double) stat.getCount() / count * stat.calcGain();

        if (gain > bestGain + minSplitGain + Maths.EPSILON)
            return new GBTSplit(new SplitSet(fid, numCategories, gain), childStats);
        return GBTSplit.empty();
    }

    @Override
    public int numChildren(SplitEntry splitEntry) {
        return ((SplitSet) splitEntry).numChildren();
    }

    @Override
    public int calculateDirection(double value, SplitEntry splitEntry) {
        return ((SplitSet) splitEntry).flowTo(value);
    }

    public static CategoricalSplitter getInstance() {
        if (instance == null)
            instance = new CategoricalSplitter();
        return instance;
    }
}
