package org.dma.gbdt4j.algo.gbdt.select;

/**
 * Chooses the features examined at a tree node. Each call starts a new
 * sequence, so one selector can serve every node of a tree.
 */
public interface DimensionSelector {
    /**
     * @return feature indices to examine, in examination order
     */
    int[] select();

    int getNumFeature();
}
