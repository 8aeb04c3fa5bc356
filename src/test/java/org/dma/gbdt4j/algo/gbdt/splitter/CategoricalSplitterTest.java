package org.dma.gbdt4j.algo.gbdt.splitter;

import org.dma.gbdt4j.algo.gbdt.metadata.FeatureInfo;
import org.dma.gbdt4j.algo.gbdt.metadata.FeatureType;
import org.dma.gbdt4j.algo.gbdt.tree.GBTSplit;
import org.dma.gbdt4j.data.DataMatrix;
import org.dma.gbdt4j.exception.DataMismatchException;
import org.dma.gbdt4j.objective.gain.MSEGain;
import org.dma.gbdt4j.tree.split.SplitSet;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class CategoricalSplitterTest {
    private static final FeatureInfo INFO = new FeatureInfo(
            new FeatureType[]{FeatureType.CATEGORICAL}, new int[]{3});

    private final CategoricalSplitter splitter = CategoricalSplitter.getInstance();
    private final MSEGain gainFunc = MSEGain.getInstance();

    private GBTSplit split(double[] values, double[] labels, int minLeafSize) {
        DataMatrix data = new DataMatrix(new double[][]{values}, labels);
        double nodeGain = gainFunc.evaluate(labels, null, 0, labels.length);
        return splitter.splitIfBetter(0, data, 0, labels.length, INFO,
                nodeGain, minLeafSize, 0.0, gainFunc);
    }

    @Test
    public void testOneChildPerCategory() {
        GBTSplit split = split(new double[]{0, 1, 2, 0, 1, 2}, new double[]{1, 2, 3, 1, 2, 3}, 1);
        assertFalse(split.isEmpty());
        SplitSet splitSet = (SplitSet) split.getSplitEntry();
        assertEquals(3, splitSet.getNumCategories());
        assertEquals(3, splitter.numChildren(splitSet));
        assertEquals(0.0, split.getGain(), 0.0);
        for (int i = 0; i < 3; i++)
            assertEquals(2, split.getChildStats()[i].getCount());
    }

    @Test
    public void testMissingCategoryPreventsSplit() {
        assertTrue(split(new double[]{0, 0, 1, 1}, new double[]{1, 1, 5, 5}, 1).isEmpty());
    }

    @Test
    public void testMinLeafSize() {
        double[] values = {0, 1, 2, 0, 1, 2};
        double[] labels = {1, 2, 3, 1, 2, 3};
        assertFalse(split(values, labels, 2).isEmpty());
        assertTrue(split(values, labels, 3).isEmpty());
    }

    @Test
    public void testNoImprovement() {
        assertTrue(split(new double[]{0, 1, 2, 0, 1, 2}, new double[]{1, 1, 1, 3, 3, 3}, 1).isEmpty());
    }

    @Test
    public void testDirection() {
        SplitSet splitSet = new SplitSet(0, 3, -1.0);
        assertEquals(0, splitter.calculateDirection(0.0, splitSet));
        assertEquals(2, splitter.calculateDirection(2.0, splitSet));
    }

    @Test(expected = DataMismatchException.class)
    public void testUnknownCategory() {
        splitter.calculateDirection(3.0, new SplitSet(0, 3, -1.0));
    }

    @Test(expected = DataMismatchException.class)
    public void testNonIntegralCategory() {
        splitter.calculateDirection(1.5, new SplitSet(0, 3, -1.0));
    }
}
