package org.dma.gbdt4j.objective.loss;

import org.dma.gbdt4j.objective.metric.EvalMetric;

import javax.inject.Singleton;

@Singleton
public class RMSELoss implements BinaryLoss {
    private static RMSELoss instance;

    private RMSELoss() {}

    @Override
    public Kind getKind() {
        return Kind.RMSE;
    }

    @Override
    public EvalMetric.Kind defaultEvalMetric() {
        return EvalMetric.Kind.RMSE;
    }

    @Override
    public double firOrderGrad(double pred, double label) {
        return pred - label;
    }

    @Override
    public double secOrderGrad(double pred, double label) {
        return 1.0;
    }

    public static RMSELoss getInstance() {
        if (instance == null)
            instance = new RMSELoss();
        return instance;
    }

    private Object readResolve() {
        return getInstance();
    }
}
