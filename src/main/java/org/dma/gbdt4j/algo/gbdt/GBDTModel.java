package org.dma.gbdt4j.algo.gbdt;

import org.apache.spark.ml.linalg.Vector;
import org.dma.gbdt4j.algo.gbdt.importance.FeatureImportance;
import org.dma.gbdt4j.algo.gbdt.tree.GBTTree;
import org.dma.gbdt4j.tree.param.GBDTParam;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An ensemble of regression trees: the prediction is the initial score
 * plus the shrunk output of every tree.
 */
public class GBDTModel implements Serializable {
    private final GBDTParam param;
    private final double initScore;
    private final List<GBTTree> trees;
    private final FeatureImportance featureImportance;

    public GBDTModel(GBDTParam param, double initScore) {
        this.param = param;
        this.initScore = initScore;
        this.trees = new ArrayList<>();
        this.featureImportance = new FeatureImportance();
    }

    public void addTree(GBTTree tree) {
        trees.add(tree);
        featureImportance.merge(tree.getFeatureImportance());
    }

    public double predict(double[] x) {
        double pred = initScore;
        for (GBTTree tree : trees)
            pred += param.learningRate * tree.predict(x);
        return pred;
    }

    public double predict(Vector x) {
        return predict(x.toArray());
    }

    public GBDTParam getParam() {
        return param;
    }

    public double getInitScore() {
        return initScore;
    }

    public List<GBTTree> getTrees() {
        return Collections.unmodifiableList(trees);
    }

    public int getNumTree() {
        return trees.size();
    }

    public FeatureImportance getFeatureImportance() {
        return featureImportance;
    }
}
