package org.dma.gbdt4j.algo.gbdt.splitter;

import org.dma.gbdt4j.algo.gbdt.metadata.FeatureInfo;
import org.dma.gbdt4j.algo.gbdt.tree.GBTSplit;
import org.dma.gbdt4j.data.DataMatrix;
import org.dma.gbdt4j.objective.gain.GainFunction;
import org.dma.gbdt4j.objective.gain.LabelStat;
import org.dma.gbdt4j.tree.split.SplitEntry;
import org.dma.gbdt4j.tree.split.SplitPoint;
import org.dma.gbdt4j.util.Maths;

import javax.inject.Singleton;

/**
 * Best binary split of a numeric feature. Candidates are the midpoints
 * between consecutive distinct values.
 */
@Singleton
public class NumericSplitter implements FeatureSplitter {
    private static NumericSplitter instance;

    private NumericSplitter() {}

    @Override
    public GBTSplit splitIfBetter(int fid, DataMatrix data, int from, int to, FeatureInfo featureInfo,
                                  double bestGain, int minLeafSize, double minSplitGain,
                                  GainFunction gainFunc) {
        int count = to - from;
        if (count < 2 * minLeafSize)
            return GBTSplit.empty();
        // nothing beats a pure node
        if (bestGain >= 0.0)
            return GBTSplit.empty();

        double[] values = data.getFeature(fid);
        double[] labels = data.getLabels();
        double[] weights = data.getWeights();
        int[] sorted = Maths.argsort(values, from, to);
        if (values[sorted[0]] == values[sorted[count - 1]])
            return GBTSplit.empty();

        LabelStat leftStat = gainFunc.newStat();
        LabelStat rightStat = gainFunc.newStat();
        for (int pos : sorted)
            rightStat.plusBy(labels[pos], weights == null ? 1.0 : weights[pos]);

        double bestFoundGain = bestGain + minSplitGain;
        double bestFvalue = Double.NaN;
        LabelStat bestLeftStat = null, bestRightStat = null;
        // index is the size of the left child
        for (int index = 1; index <= count - minLeafSize; index++) {
            int pos = sorted[index - 1];
            double w = weights == null ? 1.0 : weights[pos];
            leftStat.plusBy(labels[pos], w);
            rightStat.subtractBy(labels[pos], w);
            if (index < minLeafSize)
                continue;
            double prev = values[sorted[index - 1]], next = values[sorted[index]];
            if (prev == next)
                continue;
            double gain = (double) index / count * leftStat.calcGain()
                    + (double) (count - index) / count * rightStat.calcGain();
            if (gain > bestFoundGain) {
                if (gain >= 0.0) {
                    // pure split, cannot be improved
                    return new GBTSplit(new SplitPoint(fid, threshold(prev, next), gain),
                            new LabelStat[]{leftStat.copy(), rightStat.copy()});
                }
                bestFoundGain = gain;
                bestFvalue = threshold(prev, next);
                bestLeftStat = leftStat.copy();
                bestRightStat = rightStat.copy();
            }
        }
        if (bestLeftStat == null)
            return GBTSplit.empty();
        return new GBTSplit(new SplitPoint(fid, bestFvalue, bestFoundGain),
                new LabelStat[]{bestLeftStat, bestRightStat});
    }

    /**
     * Midpoint of two consecutive distinct values, kept in [prev, next) so
     * that prev flows left and next flows right.
     */
    static double threshold(double prev, double next) {
        double t = prev / 2.0 + next / 2.0;
        if (!(t >= prev && t < next))
            t = prev;
        return t;
    }

    @Override
    public int numChildren(SplitEntry splitEntry) {
        return ((SplitPoint) splitEntry).numChildren();
    }

    @Override
    public int calculateDirection(double value, SplitEntry splitEntry) {
        return ((SplitPoint) splitEntry).flowTo(value);
    }

    public static NumericSplitter getInstance() {
        if (instance == null)
            instance = new NumericSplitter();
        return instance;
    }
}
