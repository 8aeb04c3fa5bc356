package org.dma.gbdt4j.objective.gain;

import java.io.Serializable;

/**
 * Scores how homogeneous a range of labels is and what a leaf covering
 * that range should predict. Higher scores are better, 0 is the best.
 */
public interface GainFunction extends Serializable {
    /**
     * Gain of labels[from, to).
     *
     * @param labels  label (response) values
     * @param weights instance weights, may be null
     * @param from    start position, inclusive
     * @param to      end position, exclusive
     * @return gain, 0 if all labels are equal
     */
    double evaluate(double[] labels, double[] weights, int from, int to);

    /**
     * Prediction of a leaf covering labels[from, to).
     */
    double outputLeafValue(double[] labels, double[] weights, int from, int to);

    /**
     * An empty accumulator used to score candidate splits incrementally.
     */
    LabelStat newStat();
}
