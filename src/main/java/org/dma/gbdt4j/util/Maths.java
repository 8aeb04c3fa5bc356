package org.dma.gbdt4j.util;

import java.util.Arrays;
import java.util.Comparator;
import java.util.Random;

public class Maths {
    public static final double EPSILON = 1e-7;

    public static double sqr(double x) {
        return x * x;
    }

    public static double mean(double[] values, int from, int to) {
        double sum = 0.0;
        for (int i = from; i < to; i++)
            sum += values[i];
        return sum / (to - from);
    }

    /**
     * Indices of values[from, to) sorted by value in ascending order.
     * Ties keep their original order.
     *
     * @param values values to sort
     * @param from   start position, inclusive
     * @param to     end position, exclusive
     * @return positions in [from, to) ordered by value
     */
    public static int[] argsort(final double[] values, int from, int to) {
        Integer[] boxed = new Integer[to - from];
        for (int i = from; i < to; i++)
            boxed[i - from] = i;
        Arrays.sort(boxed, Comparator.comparingDouble(i -> values[i]));
        int[] res = new int[boxed.length];
        for (int i = 0; i < res.length; i++)
            res[i] = boxed[i];
        return res;
    }

    public static void shuffle(int[] array, Random random) {
        int index, temp;
        for (int i = array.length - 1; i > 0; i--) {
            index = random.nextInt(i + 1);
            temp = array[index];
            array[index] = array[i];
            array[i] = temp;
        }
    }

    public static int[] range(int n) {
        int[] res = new int[n];
        for (int i = 0; i < n; i++)
            res[i] = i;
        return res;
    }
}
