package org.dma.gbdt4j.algo.gbdt.tree;

import org.apache.spark.ml.linalg.Vector;
import org.dma.gbdt4j.algo.gbdt.importance.FeatureImportance;
import org.dma.gbdt4j.algo.gbdt.metadata.FeatureInfo;
import org.dma.gbdt4j.algo.gbdt.select.AllDimensionSelector;
import org.dma.gbdt4j.algo.gbdt.select.DimensionSelector;
import org.dma.gbdt4j.algo.gbdt.select.RandomDimensionSelector;
import org.dma.gbdt4j.data.DataMatrix;
import org.dma.gbdt4j.exception.DataMismatchException;
import org.dma.gbdt4j.objective.gain.GainFunction;
import org.dma.gbdt4j.objective.gain.MSEGain;
import org.dma.gbdt4j.tree.basic.Tree;
import org.dma.gbdt4j.tree.param.GBDTParam;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class GBTTree extends Tree<GBDTParam, GBTNode> {
    private static final Logger LOG = LoggerFactory.getLogger(GBTTree.class);

    private final long seed;  // seed of feature sampling for this tree
    private FeatureImportance featureImportance;

    public GBTTree(GBDTParam param) {
        this(param, param.seed);
    }

    public GBTTree(GBDTParam param, long seed) {
        super(param);
        this.seed = seed;
        this.root = new GBTNode();
    }

    /**
     * Grow the tree on a copy of the data, so the caller's buffers keep
     * their order, then prune it if a prune threshold is set.
     *
     * @param data        training data
     * @param featureInfo feature metadata
     * @return this tree
     */
    public GBTTree fit(DataMatrix data, FeatureInfo featureInfo) {
        return fit(data, featureInfo, MSEGain.getInstance());
    }

    public GBTTree fit(DataMatrix data, FeatureInfo featureInfo, GainFunction gainFunc) {
        DataMatrix copy = data.copy();
        return fit(copy, featureInfo, gainFunc, createSelector(featureInfo.getNumFeature()));
    }

    /**
     * Grow the tree directly on the given data, which is reordered in place.
     * The parameters are not modified; if numFeature is set it must agree
     * with the feature metadata.
     */
    public GBTTree fit(DataMatrix data, FeatureInfo featureInfo, GainFunction gainFunc,
                       DimensionSelector selector) {
        if (param.numFeature > 0 && param.numFeature != featureInfo.getNumFeature())
            throw new DataMismatchException(String.format(
                    "parameters declare %d features but feature info describes %d",
                    param.numFeature, featureInfo.getNumFeature()));
        featureImportance = new FeatureImportance();
        long startTime = System.currentTimeMillis();
        root.train(data, 0, data.getNumInstance(), featureInfo, param, selector,
                gainFunc, featureImportance);
        LOG.info(String.format("Tree grown on %d instances in %d ms: depth[%d] nodes[%d] leaves[%d]",
                data.getNumInstance(), System.currentTimeMillis() - startTime,
                getDepth(), getNumNodes(), getNumLeaves()));
        if (param.needPrune())
            prune(param.pruneThreshold);
        return this;
    }

    private DimensionSelector createSelector(int numFeature) {
        if (param.featSampleRatio < 1.0)
            return new RandomDimensionSelector(numFeature, param.featSampleRatio, seed);
        else
            return new AllDimensionSelector(numFeature);
    }

    public double predict(double[] x) {
        return root.predict(x);
    }

    public double predict(Vector x) {
        return root.predict(x);
    }

    /**
     * Prune nodes whose gain is below threshold. The root itself is never
     * removed.
     */
    public void prune(double threshold) {
        int numNodes = getNumNodes();
        root.prune(threshold);
        LOG.info(String.format("Pruned with threshold[%f]: nodes %d -> %d",
                threshold, numNodes, getNumNodes()));
    }

    /**
     * Importance gathered by the last fit, null before the tree is fitted.
     */
    public FeatureImportance getFeatureImportance() {
        return featureImportance;
    }

    public long getSeed() {
        return seed;
    }
}
