package org.dma.gbdt4j.objective.metric;

import com.google.common.base.Preconditions;

import javax.inject.Singleton;

@Singleton
public class RMSEMetric implements EvalMetric {
    private static RMSEMetric instance;

    private RMSEMetric() {}

    @Override
    public Kind getKind() {
        return Kind.RMSE;
    }

    @Override
    public double sum(double[] preds, double[] labels) {
        Preconditions.checkArgument(preds.length == labels.length,
                "%s predictions for %s labels", preds.length, labels.length);
        double errSum = 0.0;
        for (int i = 0; i < labels.length; i++) {
            errSum += evalOne(preds[i], labels[i]);
        }
        return errSum;
    }

    @Override
    public double avg(double sum, int num) {
        return Math.sqrt(sum / num);
    }

    @Override
    public double eval(double[] preds, double[] labels) {
        return avg(sum(preds, labels), labels.length);
    }

    @Override
    public double evalOne(double pred, double label) {
        double diff = pred - label;
        return diff * diff;
    }

    public static RMSEMetric getInstance() {
        if (instance == null)
            instance = new RMSEMetric();
        return instance;
    }

    private Object readResolve() {
        return getInstance();
    }
}
