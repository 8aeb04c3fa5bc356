package org.dma.gbdt4j.tree.basic;

import org.dma.gbdt4j.algo.gbdt.metadata.FeatureType;
import org.dma.gbdt4j.tree.split.SplitEntry;

import java.io.Serializable;

/**
 * What a trained node holds: either a leaf prediction or the split that
 * routes instances to its children.
 */
public abstract class NodeContent implements Serializable {

    public abstract boolean isLeaf();

    public static final class Leaf extends NodeContent {
        private final double prediction;

        public Leaf(double prediction) {
            this.prediction = prediction;
        }

        @Override
        public boolean isLeaf() {
            return true;
        }

        public double getPrediction() {
            return prediction;
        }

        @Override
        public String toString() {
            return String.format("leaf[%f]", prediction);
        }
    }

    public static final class Internal extends NodeContent {
        private final FeatureType dimensionType;
        private final SplitEntry splitEntry;

        public Internal(FeatureType dimensionType, SplitEntry splitEntry) {
            this.dimensionType = dimensionType;
            this.splitEntry = splitEntry;
        }

        @Override
        public boolean isLeaf() {
            return false;
        }

        public int getSplitDimension() {
            return splitEntry.getFid();
        }

        public FeatureType getDimensionType() {
            return dimensionType;
        }

        public SplitEntry getSplitEntry() {
            return splitEntry;
        }

        @Override
        public String toString() {
            return String.format("%s %s", dimensionType, splitEntry);
        }
    }
}
