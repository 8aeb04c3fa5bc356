package org.dma.gbdt4j.algo.gbdt.splitter;

import org.dma.gbdt4j.algo.gbdt.metadata.FeatureInfo;
import org.dma.gbdt4j.algo.gbdt.tree.GBTSplit;
import org.dma.gbdt4j.data.DataMatrix;
import org.dma.gbdt4j.objective.gain.MSEGain;
import org.dma.gbdt4j.tree.split.SplitPoint;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class NumericSplitterTest {
    private static final FeatureInfo INFO = FeatureInfo.allNumeric(1);

    private final NumericSplitter splitter = NumericSplitter.getInstance();
    private final MSEGain gainFunc = MSEGain.getInstance();

    private static DataMatrix data(double[] values, double[] labels) {
        return new DataMatrix(new double[][]{values}, labels);
    }

    private GBTSplit split(DataMatrix data, int minLeafSize, double minSplitGain) {
        double[] labels = data.getLabels();
        double nodeGain = gainFunc.evaluate(labels, null, 0, labels.length);
        return splitter.splitIfBetter(0, data, 0, labels.length, INFO,
                nodeGain, minLeafSize, minSplitGain, gainFunc);
    }

    @Test
    public void testSplitAtLargestGap() {
        double[] values = {1, 2, 3, 100, 101, 102};
        GBTSplit split = split(data(values, values.clone()), 1, 0.0);
        assertFalse(split.isEmpty());
        SplitPoint splitPoint = (SplitPoint) split.getSplitEntry();
        assertEquals(0, splitPoint.getFid());
        assertEquals(51.5, splitPoint.getFvalue(), 1e-12);
        assertEquals(-2.0 / 3.0, split.getGain(), 1e-9);
        assertEquals(3, split.getChildStats()[0].getCount());
        assertEquals(3, split.getChildStats()[1].getCount());
    }

    @Test
    public void testUnsortedInput() {
        double[] values = {101, 3, 100, 1, 102, 2};
        GBTSplit split = split(data(values, values.clone()), 1, 0.0);
        assertEquals(51.5, ((SplitPoint) split.getSplitEntry()).getFvalue(), 1e-12);
    }

    @Test
    public void testPureSplit() {
        GBTSplit split = split(data(new double[]{1, 2, 3, 4}, new double[]{5, 5, 7, 7}), 1, 0.0);
        assertEquals(0.0, split.getGain(), 0.0);
        assertEquals(2.5, ((SplitPoint) split.getSplitEntry()).getFvalue(), 1e-12);
    }

    @Test
    public void testMinLeafSize() {
        double[] values = {1, 2, 3, 4, 5, 6};
        double[] labels = {0, 10, 10, 10, 10, 10};
        GBTSplit unconstrained = split(data(values, labels), 1, 0.0);
        assertEquals(1.5, ((SplitPoint) unconstrained.getSplitEntry()).getFvalue(), 1e-12);

        GBTSplit constrained = split(data(values, labels), 2, 0.0);
        assertFalse(constrained.isEmpty());
        assertTrue(constrained.getChildStats()[0].getCount() >= 2);
        assertTrue(constrained.getChildStats()[1].getCount() >= 2);

        assertTrue(split(data(values, labels), 4, 0.0).isEmpty());
    }

    @Test
    public void testMinSplitGain() {
        double[] values = {1, 2, 3, 100, 101, 102};
        assertTrue(split(data(values, values.clone()), 1, 1e6).isEmpty());
        assertFalse(split(data(values, values.clone()), 1, 100.0).isEmpty());
    }

    @Test
    public void testConstantFeature() {
        assertTrue(split(data(new double[]{3, 3, 3}, new double[]{1, 2, 3}), 1, 0.0).isEmpty());
    }

    @Test
    public void testNothingBeatsPureNode() {
        DataMatrix data = data(new double[]{1, 2, 3}, new double[]{4, 4, 4});
        assertTrue(splitter.splitIfBetter(0, data, 0, 3, INFO, 0.0, 1, 0.0, gainFunc).isEmpty());
    }

    @Test
    public void testMustBeatGivenGain() {
        double[] values = {1, 2, 3, 100, 101, 102};
        DataMatrix data = data(values, values.clone());
        assertTrue(splitter.splitIfBetter(0, data, 0, 6, INFO, -0.5, 1, 0.0, gainFunc).isEmpty());
    }

    @Test
    public void testSubRange() {
        double[] values = {50, 1, 2, 10, 11, -50};
        double[] labels = {0, 1, 1, 9, 9, 0};
        DataMatrix data = data(values, labels);
        double nodeGain = gainFunc.evaluate(labels, null, 1, 5);
        GBTSplit split = splitter.splitIfBetter(0, data, 1, 5, INFO, nodeGain, 1, 0.0, gainFunc);
        assertEquals(6.0, ((SplitPoint) split.getSplitEntry()).getFvalue(), 1e-12);
        assertEquals(0.0, split.getGain(), 0.0);
    }

    private void assertSeparates(double low, double high) {
        GBTSplit split = split(data(new double[]{high, low}, new double[]{1, 0}), 1, 0.0);
        assertFalse(split.isEmpty());
        SplitPoint splitPoint = (SplitPoint) split.getSplitEntry();
        assertTrue(Double.isFinite(splitPoint.getFvalue()));
        assertEquals(0, splitter.calculateDirection(low, splitPoint));
        assertEquals(1, splitter.calculateDirection(high, splitPoint));
        assertEquals(1, split.getChildStats()[0].getCount());
        assertEquals(1, split.getChildStats()[1].getCount());
    }

    @Test
    public void testThresholdBetweenAdjacentDoubles() {
        double low = Math.nextUp(1.0);
        assertSeparates(low, Math.nextUp(low));
        assertSeparates(-Double.MIN_VALUE, 0.0);
        assertSeparates(Double.MIN_VALUE, 2 * Double.MIN_VALUE);
    }

    @Test
    public void testThresholdBetweenHugeValues() {
        assertSeparates(1e308, 1.7e308);
        assertSeparates(Math.nextDown(Double.MAX_VALUE), Double.MAX_VALUE);
        assertSeparates(-Double.MAX_VALUE, Double.MAX_VALUE);
    }

    @Test
    public void testLargeLabelOffset() {
        int n = 200;
        double[] values = new double[n];
        double[] alternating = new double[n];
        double[] stepped = new double[n];
        for (int i = 0; i < n; i++) {
            values[i] = i;
            alternating[i] = 1e9 + (i % 2);
            stepped[i] = 1e9 + (i < 100 ? 0 : 1);
        }

        // no threshold separates alternating labels, so no split may look pure
        GBTSplit split = split(data(values, alternating), 1, 0.0);
        assertFalse(split.isEmpty());
        assertTrue(split.getGain() < -0.2);
        int left = split.getChildStats()[0].getCount();
        double expected = (double) left / n * gainFunc.evaluate(alternating, null, 0, left)
                + (double) (n - left) / n * gainFunc.evaluate(alternating, null, left, n);
        assertEquals(expected, split.getGain(), 1e-9);

        GBTSplit step = split(data(values, stepped), 1, 0.0);
        assertEquals(0.0, step.getGain(), 0.0);
        assertEquals(99.5, ((SplitPoint) step.getSplitEntry()).getFvalue(), 1e-12);
    }

    @Test
    public void testDirection() {
        SplitPoint splitPoint = new SplitPoint(0, 51.5, -1.0);
        assertEquals(2, splitter.numChildren(splitPoint));
        assertEquals(0, splitter.calculateDirection(51.5, splitPoint));
        assertEquals(0, splitter.calculateDirection(-3.0, splitPoint));
        assertEquals(1, splitter.calculateDirection(51.6, splitPoint));
    }
}
