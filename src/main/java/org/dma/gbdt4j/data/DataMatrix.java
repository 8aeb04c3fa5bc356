package org.dma.gbdt4j.data;

import org.dma.gbdt4j.exception.DataMismatchException;

import java.io.Serializable;

/**
 * Feature values stored feature by feature, i.e. features[fid][insId],
 * together with the labels and optional weights of the instances.
 * Tree growth reorders instances in place, so an instance is identified
 * by its current position only.
 */
public class DataMatrix implements Serializable {
    private final double[][] features;
    private final double[] labels;
    private final double[] weights;

    public DataMatrix(double[][] features, double[] labels) {
        this(features, labels, null);
    }

    public DataMatrix(double[][] features, double[] labels, double[] weights) {
        if (features == null || labels == null)
            throw new DataMismatchException("features and labels should not be null");
        for (int fid = 0; fid < features.length; fid++) {
            if (features[fid].length != labels.length)
                throw new DataMismatchException(String.format(
                        "feature[%d] has %d values but there are %d labels",
                        fid, features[fid].length, labels.length));
        }
        if (weights != null && weights.length != labels.length)
            throw new DataMismatchException(String.format(
                    "%d weights but %d labels", weights.length, labels.length));
        this.features = features;
        this.labels = labels;
        this.weights = weights;
    }

    /**
     * Build a matrix from instance rows, i.e. rows[insId][fid].
     */
    public static DataMatrix fromRows(double[][] rows, double[] labels) {
        if (rows.length != labels.length)
            throw new DataMismatchException(String.format(
                    "%d rows but %d labels", rows.length, labels.length));
        int numFeature = rows.length == 0 ? 0 : rows[0].length;
        double[][] features = new double[numFeature][rows.length];
        for (int insId = 0; insId < rows.length; insId++) {
            if (rows[insId].length != numFeature)
                throw new DataMismatchException(String.format(
                        "row[%d] has %d features, expected %d", insId, rows[insId].length, numFeature));
            for (int fid = 0; fid < numFeature; fid++)
                features[fid][insId] = rows[insId][fid];
        }
        return new DataMatrix(features, labels);
    }

    public DataMatrix copy() {
        double[][] featuresCopy = new double[features.length][];
        for (int fid = 0; fid < features.length; fid++)
            featuresCopy[fid] = features[fid].clone();
        return new DataMatrix(featuresCopy, labels.clone(),
                weights == null ? null : weights.clone());
    }

    /**
     * Copy of this matrix with its labels replaced, e.g. by the residuals
     * of a boosting round.
     */
    public DataMatrix withLabels(double[] newLabels) {
        DataMatrix res = copy();
        if (newLabels.length != labels.length)
            throw new DataMismatchException(String.format(
                    "%d new labels but %d instances", newLabels.length, labels.length));
        System.arraycopy(newLabels, 0, res.labels, 0, newLabels.length);
        return res;
    }

    public int getNumFeature() {
        return features.length;
    }

    public int getNumInstance() {
        return labels.length;
    }

    public double get(int fid, int insId) {
        return features[fid][insId];
    }

    public double[] getFeature(int fid) {
        return features[fid];
    }

    public double[] getLabels() {
        return labels;
    }

    public double[] getWeights() {
        return weights;
    }

    /**
     * Feature values of one instance.
     */
    public double[] getRow(int insId) {
        double[] row = new double[features.length];
        for (int fid = 0; fid < features.length; fid++)
            row[fid] = features[fid][insId];
        return row;
    }

    /**
     * Reorder instances in [from, from + order.length) so that the instance
     * previously at position order[i] ends up at position from + i.
     *
     * @param from  start position of the range
     * @param order source positions, a permutation of the range
     */
    public void reorder(int from, int[] order) {
        for (double[] feature : features)
            permute(feature, from, order);
        permute(labels, from, order);
        if (weights != null)
            permute(weights, from, order);
    }

    private static void permute(double[] values, int from, int[] order) {
        double[] buf = new double[order.length];
        for (int i = 0; i < order.length; i++)
            buf[i] = values[order[i]];
        System.arraycopy(buf, 0, values, from, buf.length);
    }
}
