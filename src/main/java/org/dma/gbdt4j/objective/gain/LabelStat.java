package org.dma.gbdt4j.objective.gain;

public interface LabelStat {
    void plusBy(double label, double weight);

    void subtractBy(double label, double weight);

    int getCount();

    double calcGain();

    LabelStat copy();
}
