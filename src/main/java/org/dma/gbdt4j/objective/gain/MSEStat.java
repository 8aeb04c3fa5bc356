package org.dma.gbdt4j.objective.gain;

import java.io.Serializable;

/**
 * Count and moments of labels. Sums are kept relative to the first label
 * added, so labels with a large common offset keep their precision.
 */
public class MSEStat implements LabelStat, Serializable {
    private int count;
    private double shift;
    private double sum;  // sum of (label - shift)
    private double sumSqr;  // sum of (label - shift)^2

    public MSEStat() {}

    private MSEStat(int count, double shift, double sum, double sumSqr) {
        this.count = count;
        this.shift = shift;
        this.sum = sum;
        this.sumSqr = sumSqr;
    }

    @Override
    public void plusBy(double label, double weight) {
        if (count == 0) {
            shift = label;
            sum = 0.0;
            sumSqr = 0.0;
        }
        double d = label - shift;
        this.count++;
        this.sum += d;
        this.sumSqr += d * d;
    }

    @Override
    public void subtractBy(double label, double weight) {
        double d = label - shift;
        this.count--;
        this.sum -= d;
        this.sumSqr -= d * d;
    }

    @Override
    public int getCount() {
        return count;
    }

    @Override
    public double calcGain() {
        if (count == 0)
            return 0.0;
        double mean = sum / count;
        // rounding may push the variance of a pure range slightly below 0
        return Math.min(0.0, mean * mean - sumSqr / count);
    }

    @Override
    public LabelStat copy() {
        return new MSEStat(count, shift, sum, sumSqr);
    }

    @Override
    public String toString() {
        return "(" + count + ", " + shift + ", " + sum + ", " + sumSqr + ")";
    }
}
