package org.dma.gbdt4j.algo.gbdt.tree;

import com.google.common.base.Preconditions;
import org.apache.spark.ml.linalg.Vector;
import org.dma.gbdt4j.algo.gbdt.importance.FeatureImportance;
import org.dma.gbdt4j.algo.gbdt.metadata.FeatureInfo;
import org.dma.gbdt4j.algo.gbdt.metadata.FeatureType;
import org.dma.gbdt4j.algo.gbdt.select.DimensionSelector;
import org.dma.gbdt4j.algo.gbdt.splitter.FeatureSplitter;
import org.dma.gbdt4j.algo.gbdt.splitter.SplitFinder;
import org.dma.gbdt4j.data.DataMatrix;
import org.dma.gbdt4j.exception.DataMismatchException;
import org.dma.gbdt4j.exception.UntrainedNodeException;
import org.dma.gbdt4j.objective.gain.GainFunction;
import org.dma.gbdt4j.objective.gain.LabelStat;
import org.dma.gbdt4j.tree.basic.NodeContent;
import org.dma.gbdt4j.tree.basic.TNode;
import org.dma.gbdt4j.tree.param.RegTParam;
import org.dma.gbdt4j.tree.split.SplitEntry;

import java.util.ArrayList;
import java.util.List;

/**
 * Node of a regression tree grown greedily on gain.
 * <p>
 * A trained node is either a leaf holding its prediction, or an internal
 * node holding a split and one child per branch of the split. The gain of
 * a leaf is the gain of its labels; the gain of an internal node is the
 * count-weighted gain of its children.
 */
public class GBTNode extends TNode<GBTNode> {
    private double weight;  // leaf value of the instances this node was trained on

    public GBTNode() {
        this(-1);
    }

    private GBTNode(int branch) {
        super(branch);
    }

    /**
     * Grow the subtree rooted at this node on instances [begin, begin + count).
     * Instances of the range are reordered in place so that the instances of
     * each child are contiguous. Previous children are discarded.
     *
     * @param data        data matrix, reordered in place
     * @param begin       first instance of the node
     * @param count       number of instances of the node
     * @param featureInfo feature metadata
     * @param param       tree parameters, maxDepth is the remaining depth
     * @param selector    features to examine at each node
     * @param gainFunc    gain function
     * @param featImp     feature importance to update, may be null
     * @return loss of the node, i.e. the negated node gain
     * @throws org.dma.gbdt4j.exception.InvalidParamException if a parameter is illegal
     * @throws DataMismatchException                           if the data disagree with the metadata
     */
    public double train(DataMatrix data, int begin, int count, FeatureInfo featureInfo,
                        RegTParam param, DimensionSelector selector, GainFunction gainFunc,
                        FeatureImportance featImp) {
        param.validate();
        checkData(data, begin, count, featureInfo, selector);
        SplitFinder splitFinder = new SplitFinder(param, gainFunc);
        return grow(data, begin, count, featureInfo, param.maxDepth, splitFinder, selector, featImp);
    }

    private double grow(DataMatrix data, int begin, int count, FeatureInfo featureInfo,
                        int maxDepth, SplitFinder splitFinder, DimensionSelector selector,
                        FeatureImportance featImp) {
        this.children = new ArrayList<>();
        this.content = null;

        int end = begin + count;
        GainFunction gainFunc = splitFinder.getGainFunc();
        double[] labels = data.getLabels();
        double[] weights = data.getWeights();
        double baseGain = gainFunc.evaluate(labels, weights, begin, end);
        this.weight = gainFunc.outputLeafValue(labels, weights, begin, end);

        GBTSplit bestSplit = GBTSplit.empty();
        if (maxDepth > 1)
            bestSplit = splitFinder.findBestSplit(selector.select(), data, begin, end,
                    featureInfo, baseGain);

        double bestGain;
        if (!bestSplit.isEmpty()) {
            SplitEntry splitEntry = bestSplit.getSplitEntry();
            int fid = splitEntry.getFid();
            FeatureType type = featureInfo.getType(fid);
            FeatureSplitter splitter = SplitFinder.getSplitter(type);
            this.content = new NodeContent.Internal(type, splitEntry);

            int numChildren = splitter.numChildren(splitEntry);
            int[] childCounts = partition(data, begin, count, splitter, splitEntry, numChildren);
            LabelStat[] childStats = bestSplit.getChildStats();
            for (int i = 0; i < numChildren; i++) {
                Preconditions.checkState(childCounts[i] == childStats[i].getCount(),
                        "child[%s] of feature[%s] has %s instances, expected %s",
                        i, fid, childCounts[i], childStats[i].getCount());
            }

            if (featImp != null) {
                featImp.increaseFeatureFrequency(fid, 1);
                featImp.increaseFeatureCover(fid, bestSplit.getGain() - baseGain);
            }

            bestGain = 0.0;
            int childBegin = begin;
            List<GBTNode> trained = new ArrayList<>(numChildren);
            for (int i = 0; i < numChildren; i++) {
                GBTNode child = new GBTNode(i);
                double childLoss = child.grow(data, childBegin, childCounts[i], featureInfo,
                        maxDepth - 1, splitFinder, selector, featImp);
                bestGain += (double) childCounts[i] / count * (-childLoss);
                trained.add(child);
                childBegin += childCounts[i];
            }
            this.children = trained;
        } else {
            this.content = new NodeContent.Leaf(weight);
            bestGain = baseGain;
        }

        this.nodeGain = bestGain;
        return -bestGain;
    }

    /**
     * Stable partition of [begin, begin + count) by branch: instances of
     * branch i come before those of branch i + 1 and keep their relative order.
     *
     * @return number of instances of each branch
     */
    private static int[] partition(DataMatrix data, int begin, int count, FeatureSplitter splitter,
                                   SplitEntry splitEntry, int numChildren) {
        double[] values = data.getFeature(splitEntry.getFid());
        int[] directions = new int[count];
        int[] childCounts = new int[numChildren];
        for (int i = 0; i < count; i++) {
            directions[i] = splitter.calculateDirection(values[begin + i], splitEntry);
            childCounts[directions[i]]++;
        }
        int[] offsets = new int[numChildren];
        for (int i = 1; i < numChildren; i++)
            offsets[i] = offsets[i - 1] + childCounts[i - 1];
        int[] order = new int[count];
        for (int i = 0; i < count; i++)
            order[offsets[directions[i]]++] = begin + i;
        data.reorder(begin, order);
        return childCounts;
    }

    private static void checkData(DataMatrix data, int begin, int count, FeatureInfo featureInfo,
                                  DimensionSelector selector) {
        if (data.getNumFeature() != featureInfo.getNumFeature())
            throw new DataMismatchException(String.format(
                    "data has %d features but feature info describes %d",
                    data.getNumFeature(), featureInfo.getNumFeature()));
        if (selector.getNumFeature() != featureInfo.getNumFeature())
            throw new DataMismatchException(String.format(
                    "dimension selector covers %d features but feature info describes %d",
                    selector.getNumFeature(), featureInfo.getNumFeature()));
        if (count <= 0)
            throw new DataMismatchException("cannot train a node on an empty instance range");
        if (begin < 0 || begin + count > data.getNumInstance())
            throw new DataMismatchException(String.format(
                    "instance range [%d, %d) out of [0, %d)", begin, begin + count, data.getNumInstance()));
        for (int fid = 0; fid < featureInfo.getNumFeature(); fid++) {
            if (!featureInfo.isCategorical(fid))
                continue;
            int numCategories = featureInfo.getNumCategories(fid);
            double[] values = data.getFeature(fid);
            for (int pos = begin; pos < begin + count; pos++) {
                double v = values[pos];
                if (v != (int) v || v < 0 || v >= numCategories)
                    throw new DataMismatchException(String.format(
                            "feature[%d] of instance[%d] is %f, not a category in [0, %d)",
                            fid, pos, v, numCategories));
            }
        }
    }

    /**
     * Predict one instance. Leaves return their cached prediction; internal
     * nodes route the instance to the child of its branch. If that branch
     * was pruned away, the leaf value of this node is returned.
     *
     * @param x feature values of the instance
     * @return prediction
     * @throws UntrainedNodeException if the node has not been trained
     * @throws DataMismatchException  if x is too short for a split feature
     */
    public double predict(double[] x) {
        if (content == null)
            throw new UntrainedNodeException("cannot predict with an untrained node");
        if (content.isLeaf())
            return ((NodeContent.Leaf) content).getPrediction();

        NodeContent.Internal internal = (NodeContent.Internal) content;
        int fid = internal.getSplitDimension();
        if (fid >= x.length)
            throw new DataMismatchException(String.format(
                    "split on feature[%d] but the instance has %d features", fid, x.length));
        FeatureSplitter splitter = SplitFinder.getSplitter(internal.getDimensionType());
        int direction = splitter.calculateDirection(x[fid], internal.getSplitEntry());
        GBTNode child = getChildOfBranch(direction, splitter.numChildren(internal.getSplitEntry()));
        return child == null ? weight : child.predict(x);
    }

    public double predict(Vector x) {
        return predict(x.toArray());
    }

    private GBTNode getChildOfBranch(int branch, int numBranch) {
        if (children.size() == numBranch)
            return children.get(branch);
        for (GBTNode child : children) {
            if (child.getBranch() == branch)
                return child;
        }
        return null;
    }

    /**
     * Prune the subtree bottom-up. Children that report removal are dropped
     * and the survivors keep their order; a node left without children turns
     * into a leaf predicting its own leaf value.
     *
     * @param threshold minimum node gain to keep a node
     * @return true if this node should be removed by its parent, i.e. its
     * node gain, as computed when it was trained, is below threshold
     */
    public boolean prune(double threshold) {
        if (content == null)
            throw new UntrainedNodeException("cannot prune an untrained node");
        if (!children.isEmpty()) {
            List<GBTNode> survivors = new ArrayList<>(children.size());
            for (GBTNode child : children) {
                if (!child.prune(threshold))
                    survivors.add(child);
            }
            this.children = survivors;
            if (survivors.isEmpty())
                this.content = new NodeContent.Leaf(weight);
        }
        return nodeGain < threshold;
    }

    public double getWeight() {
        return weight;
    }

    @Override
    public String toString() {
        return String.format("%s nodeGain[%f] children[%d]", content, nodeGain, children.size());
    }
}
