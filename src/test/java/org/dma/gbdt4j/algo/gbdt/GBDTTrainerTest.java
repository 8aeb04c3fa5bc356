package org.dma.gbdt4j.algo.gbdt;

import org.apache.spark.ml.linalg.Vectors;
import org.dma.gbdt4j.DataFixtures;
import org.dma.gbdt4j.algo.gbdt.metadata.FeatureInfo;
import org.dma.gbdt4j.data.DataMatrix;
import org.dma.gbdt4j.exception.DataMismatchException;
import org.dma.gbdt4j.exception.InvalidParamException;
import org.dma.gbdt4j.objective.metric.RMSEMetric;
import org.dma.gbdt4j.tree.param.GBDTParam;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class GBDTTrainerTest {

    private static GBDTParam param(int numTree) {
        GBDTParam param = new GBDTParam();
        param.numTree = numTree;
        param.maxDepth = 4;
        param.learningRate = 0.3;
        return param;
    }

    private static double rmse(GBDTModel model, DataMatrix data) {
        double[] preds = new double[data.getNumInstance()];
        for (int i = 0; i < preds.length; i++)
            preds[i] = model.predict(data.getRow(i));
        return RMSEMetric.getInstance().eval(preds, data.getLabels());
    }

    @Test
    public void testMoreTreesFitBetter() {
        DataMatrix data = DataFixtures.mixedData(300, 42L);
        GBDTModel few = new GBDTTrainer(param(2)).train(data, DataFixtures.MIXED_INFO);
        GBDTModel many = new GBDTTrainer(param(20)).train(data, DataFixtures.MIXED_INFO);

        assertEquals(2, few.getNumTree());
        assertEquals(20, many.getNumTree());
        assertTrue(rmse(many, data) < rmse(few, data));
        assertTrue(rmse(many, data) < 2.0);
    }

    @Test
    public void testInitScoreIsMeanLabel() {
        double[] labels = {1, 2, 3, 6};
        DataMatrix data = new DataMatrix(new double[][]{{0, 0, 0, 0}}, labels);
        GBDTModel model = new GBDTTrainer(param(3)).train(data, FeatureInfo.allNumeric(1));
        assertEquals(3.0, model.getInitScore(), 1e-12);
        // a constant feature cannot be split, every tree is a leaf predicting ~0
        assertEquals(3.0, model.predict(new double[]{0}), 1e-9);
    }

    @Test
    public void testFeatureImportanceCoversAllTrees() {
        DataMatrix data = DataFixtures.mixedData(200, 7L);
        GBDTModel model = new GBDTTrainer(param(5)).train(data, DataFixtures.MIXED_INFO);
        long splits = 0;
        for (int t = 0; t < model.getNumTree(); t++)
            splits += model.getTrees().get(t).getNumNodes() - model.getTrees().get(t).getNumLeaves();
        long counted = 0;
        for (int fid = 0; fid < 3; fid++)
            counted += model.getFeatureImportance().getFrequency(fid);
        assertEquals(splits, counted);
        assertTrue(model.getFeatureImportance().getFrequency(0) > 0);
    }

    @Test
    public void testPredictVector() throws Exception {
        DataMatrix data = DataFixtures.mixedData(100, 9L);
        GBDTModel model = new GBDTTrainer(param(3)).train(data, DataFixtures.MIXED_INFO);
        double[] x = {5.0, 3.0, 2.0};
        assertEquals(model.predict(x), model.predict(Vectors.dense(x)), 0.0);

        GBDTModel copy = DataFixtures.deepCopy(model);
        assertEquals(model.predict(x), copy.predict(x), 0.0);
    }

    @Test
    public void testEachTreeSamplesWithItsOwnSeed() {
        GBDTParam param = param(4);
        param.featSampleRatio = 0.5;
        param.seed = 100L;
        GBDTModel model = new GBDTTrainer(param).train(DataFixtures.mixedData(100, 5L),
                DataFixtures.MIXED_INFO);
        for (int t = 0; t < model.getNumTree(); t++)
            assertEquals(100L + t, model.getTrees().get(t).getSeed());
        assertEquals(100L, param.seed);
        assertEquals(3, param.numFeature);
    }

    @Test(expected = InvalidParamException.class)
    public void testIllegalNumTree() {
        new GBDTTrainer(param(0));
    }

    @Test(expected = InvalidParamException.class)
    public void testUnknownLoss() {
        GBDTParam param = param(1);
        param.lossFunc = "hinge";
        new GBDTTrainer(param);
    }

    @Test(expected = DataMismatchException.class)
    public void testFeatureInfoMismatch() {
        new GBDTTrainer(param(1)).train(DataFixtures.mixedData(10, 1L), FeatureInfo.allNumeric(2));
    }
}
