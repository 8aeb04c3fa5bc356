package org.dma.gbdt4j.tree.param;

import org.dma.gbdt4j.exception.InvalidParamException;
import org.dma.gbdt4j.objective.loss.Loss;
import org.dma.gbdt4j.objective.metric.EvalMetric;

public class GBDTParam extends RegTParam {
    public int numTree = 10;  // number of trees
    public String lossFunc = Loss.Kind.RMSE.toString();  // name of loss function
    public String[] evalMetrics = {EvalMetric.Kind.RMSE.toString()};  // name of eval metrics

    @Override
    public void validate() {
        super.validate();
        if (numTree < 1)
            throw new InvalidParamException(String.format(
                    "number of trees should be positive, got %d", numTree));
        Loss.Kind.fromString(lossFunc);
        for (String metric : evalMetrics)
            EvalMetric.Kind.fromString(metric);
    }

    @Override
    public String toString() {
        return String.format("numFeature[%d] numTree[%d] maxDepth[%d] minLeafSize[%d] "
                        + "minSplitGain[%f] learningRate[%f] featSampleRatio[%f] loss[%s]",
                numFeature, numTree, maxDepth, minLeafSize,
                minSplitGain, learningRate, featSampleRatio, lossFunc);
    }
}
