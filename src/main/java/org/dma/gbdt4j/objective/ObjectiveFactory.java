package org.dma.gbdt4j.objective;

import org.dma.gbdt4j.objective.loss.Loss;
import org.dma.gbdt4j.objective.loss.RMSELoss;
import org.dma.gbdt4j.objective.metric.EvalMetric;
import org.dma.gbdt4j.objective.metric.RMSEMetric;

public class ObjectiveFactory {

    private ObjectiveFactory() {}

    public static Loss getLoss(String lossFunc) {
        Loss.Kind kind = Loss.Kind.fromString(lossFunc);
        switch (kind) {
            case RMSE:
                return RMSELoss.getInstance();
            default:
                throw new IllegalArgumentException("Unsupported loss function: " + kind);
        }
    }

    public static EvalMetric getEvalMetric(String metric) {
        EvalMetric.Kind kind = EvalMetric.Kind.fromString(metric);
        switch (kind) {
            case RMSE:
                return RMSEMetric.getInstance();
            default:
                throw new IllegalArgumentException("Unsupported eval metric: " + kind);
        }
    }

    public static EvalMetric[] getEvalMetrics(String[] metrics) {
        EvalMetric[] res = new EvalMetric[metrics.length];
        for (int i = 0; i < metrics.length; i++)
            res[i] = getEvalMetric(metrics[i]);
        return res;
    }
}
