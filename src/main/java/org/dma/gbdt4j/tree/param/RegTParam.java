package org.dma.gbdt4j.tree.param;

import org.dma.gbdt4j.exception.InvalidParamException;

public class RegTParam extends TreeParam {
    public double learningRate = 0.1;  // step size of one tree
    public double minSplitGain = 0.0;  // minimum loss gain required for a split
    public double pruneThreshold = -Double.MAX_VALUE;  // nodes whose gain is below are pruned

    @Override
    public void validate() {
        super.validate();
        if (!(minSplitGain >= 0.0))
            throw new InvalidParamException(String.format(
                    "minimum split gain should be non-negative, got %f", minSplitGain));
        if (!(learningRate > 0.0))
            throw new InvalidParamException(String.format(
                    "learning rate should be positive, got %f", learningRate));
    }

    public boolean needPrune() {
        return pruneThreshold > -Double.MAX_VALUE;
    }
}
