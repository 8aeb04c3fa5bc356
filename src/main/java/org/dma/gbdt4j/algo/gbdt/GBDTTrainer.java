package org.dma.gbdt4j.algo.gbdt;

import org.dma.gbdt4j.algo.gbdt.metadata.FeatureInfo;
import org.dma.gbdt4j.algo.gbdt.tree.GBTTree;
import org.dma.gbdt4j.data.DataMatrix;
import org.dma.gbdt4j.exception.DataMismatchException;
import org.dma.gbdt4j.objective.ObjectiveFactory;
import org.dma.gbdt4j.objective.loss.BinaryLoss;
import org.dma.gbdt4j.objective.metric.EvalMetric;
import org.dma.gbdt4j.tree.param.GBDTParam;
import org.dma.gbdt4j.util.Maths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Gradient boosting driver: every round fits one tree to the negative
 * gradient of the loss at the current predictions.
 */
public class GBDTTrainer {
    private static final Logger LOG = LoggerFactory.getLogger(GBDTTrainer.class);

    private final GBDTParam param;
    private final BinaryLoss loss;
    private final EvalMetric[] evalMetrics;

    public GBDTTrainer(GBDTParam param) {
        param.validate();
        this.param = param;
        this.loss = (BinaryLoss) ObjectiveFactory.getLoss(param.lossFunc);
        this.evalMetrics = ObjectiveFactory.getEvalMetrics(param.evalMetrics);
    }

    public GBDTModel train(DataMatrix data, FeatureInfo featureInfo) {
        if (data.getNumInstance() == 0)
            throw new DataMismatchException("cannot train on an empty data set");
        if (data.getNumFeature() != featureInfo.getNumFeature())
            throw new DataMismatchException(String.format(
                    "data has %d features but feature info describes %d",
                    data.getNumFeature(), featureInfo.getNumFeature()));
        param.numFeature = featureInfo.getNumFeature();
        LOG.info("Start to train GBDT with " + param);

        double[] labels = data.getLabels();
        int numInstance = data.getNumInstance();
        double initScore = Maths.mean(labels, 0, numInstance);
        GBDTModel model = new GBDTModel(param, initScore);

        double[] preds = new double[numInstance];
        Arrays.fill(preds, initScore);
        double[] residuals = new double[numInstance];
        for (int round = 0; round < param.numTree; round++) {
            for (int i = 0; i < numInstance; i++)
                residuals[i] = -loss.firOrderGrad(preds[i], labels[i]);
            // each round draws its own sequence of feature subsets
            GBTTree tree = new GBTTree(param, param.seed + round)
                    .fit(data.withLabels(residuals), featureInfo);
            model.addTree(tree);
            for (int i = 0; i < numInstance; i++)
                preds[i] += param.learningRate * tree.predict(data.getRow(i));
            for (EvalMetric metric : evalMetrics) {
                LOG.info(String.format("Round[%d] train %s[%f]",
                        round, metric.getKind(), metric.eval(preds, labels)));
            }
        }
        LOG.info(String.format("Feature importance:%n%s", model.getFeatureImportance()));
        return model;
    }

    public GBDTParam getParam() {
        return param;
    }
}
