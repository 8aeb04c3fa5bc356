package org.dma.gbdt4j.objective.gain;

import org.dma.gbdt4j.util.Maths;

import javax.inject.Singleton;

/**
 * Negative mean squared error around the mean label. Weights are ignored.
 */
@Singleton
public class MSEGain implements GainFunction {
    private static MSEGain instance;

    private MSEGain() {}

    @Override
    public double evaluate(double[] labels, double[] weights, int from, int to) {
        double mean = Maths.mean(labels, from, to);
        double mse = 0.0;
        for (int i = from; i < to; i++)
            mse += Maths.sqr(labels[i] - mean);
        return -mse / (to - from);
    }

    @Override
    public double outputLeafValue(double[] labels, double[] weights, int from, int to) {
        return Maths.mean(labels, from, to);
    }

    @Override
    public LabelStat newStat() {
        return new MSEStat();
    }

    public static MSEGain getInstance() {
        if (instance == null)
            instance = new MSEGain();
        return instance;
    }

    private Object readResolve() {
        return getInstance();
    }
}
