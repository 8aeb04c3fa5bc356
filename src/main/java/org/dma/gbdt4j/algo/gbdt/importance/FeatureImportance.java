package org.dma.gbdt4j.algo.gbdt.importance;

import com.google.common.collect.ImmutableSortedMap;

import java.io.Serializable;
import java.util.Map;
import java.util.TreeMap;

/**
 * Per-feature split frequency and cover (sum of gain improvements),
 * accumulated while trees grow. Not thread-safe.
 */
public class FeatureImportance implements Serializable {
    private final TreeMap<Integer, Long> frequency = new TreeMap<>();
    private final TreeMap<Integer, Double> cover = new TreeMap<>();

    public void increaseFeatureFrequency(int fid, long n) {
        frequency.merge(fid, n, Long::sum);
    }

    public void increaseFeatureCover(int fid, double gain) {
        cover.merge(fid, gain, Double::sum);
    }

    /**
     * Add the counts of another ledger, e.g. the one of a single tree.
     */
    public void merge(FeatureImportance other) {
        for (Map.Entry<Integer, Long> e : other.frequency.entrySet())
            increaseFeatureFrequency(e.getKey(), e.getValue());
        for (Map.Entry<Integer, Double> e : other.cover.entrySet())
            increaseFeatureCover(e.getKey(), e.getValue());
    }

    public long getFrequency(int fid) {
        return frequency.getOrDefault(fid, 0L);
    }

    public double getCover(int fid) {
        return cover.getOrDefault(fid, 0.0);
    }

    public boolean isEmpty() {
        return frequency.isEmpty();
    }

    /**
     * Read-only copy of the current counts, ordered by feature index.
     */
    public ImmutableSortedMap<Integer, Entry> snapshot() {
        ImmutableSortedMap.Builder<Integer, Entry> builder = ImmutableSortedMap.naturalOrder();
        for (Integer fid : frequency.keySet())
            builder.put(fid, new Entry(getFrequency(fid), getCover(fid)));
        return builder.build();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<Integer, Entry> e : snapshot().entrySet())
            sb.append(String.format("feature[%d] %s%n", e.getKey(), e.getValue()));
        return sb.toString();
    }

    public static final class Entry implements Serializable {
        private final long frequency;
        private final double cover;

        public Entry(long frequency, double cover) {
            this.frequency = frequency;
            this.cover = cover;
        }

        public long getFrequency() {
            return frequency;
        }

        public double getCover() {
            return cover;
        }

        @Override
        public String toString() {
            return String.format("frequency[%d] cover[%f]", frequency, cover);
        }
    }
}
