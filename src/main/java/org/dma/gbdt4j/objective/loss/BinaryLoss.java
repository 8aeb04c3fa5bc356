package org.dma.gbdt4j.objective.loss;

public interface BinaryLoss extends Loss {
    double firOrderGrad(double pred, double label);

    double secOrderGrad(double pred, double label);
}
