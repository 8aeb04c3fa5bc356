package org.dma.gbdt4j.algo.gbdt.metadata;

public enum FeatureType {
    NUMERIC,
    CATEGORICAL
}
