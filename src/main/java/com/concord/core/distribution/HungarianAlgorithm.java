package com.concord.core.distribution;

import java.util.Arrays;

/**
 * Minimum-cost perfect matching on a square cost matrix (Kuhn-Munkres with row and
 * column potentials, O(n^3)). Deterministic for a given matrix.
 */
final class HungarianAlgorithm {

    private HungarianAlgorithm() {}

    /**
     * @param cost square matrix, {@code cost[row][col]}
     * @return {@code result[row]} = column assigned to that row
     */
    static int[] solve(double[][] cost) {
        int n = cost.length;
        if (n == 0) {
            return new int[0];
        }
        for (double[] row : cost) {
            if (row.length != n) {
                throw new IllegalArgumentException("Cost matrix must be square");
            }
        }
        // 1-based indices, column 0 is the virtual start column
        double[] u = new double[n + 1];
        double[] v = new double[n + 1];
        int[] match = new int[n + 1];
        int[] way = new int[n + 1];

        for (int i = 1; i <= n; i++) {
            match[0] = i;
            int j0 = 0;
            double[] minv = new double[n + 1];
            boolean[] used = new boolean[n + 1];
            Arrays.fill(minv, Double.POSITIVE_INFINITY);
            do {
                used[j0] = true;
                int i0 = match[j0];
                double delta = Double.POSITIVE_INFINITY;
                int j1 = 0;
                for (int j = 1; j <= n; j++) {
                    if (used[j]) {
                        continue;
                    }
                    double reduced = cost[i0 - 1][j - 1] - u[i0] - v[j];
                    if (reduced < minv[j]) {
                        minv[j] = reduced;
                        way[j] = j0;
                    }
                    if (minv[j] < delta) {
                        delta = minv[j];
                        j1 = j;
                    }
                }
                for (int j = 0; j <= n; j++) {
                    if (used[j]) {
                        u[match[j]] += delta;
                        v[j] -= delta;
                    } else {
                        minv[j] -= delta;
                    }
                }
                j0 = j1;
            } while (match[j0] != 0);
            do {
                int j1 = way[j0];
                match[j0] = match[j1];
                j0 = j1;
            } while (j0 != 0);
        }

        int[] result = new int[n];
        for (int j = 1; j <= n; j++) {
            result[match[j] - 1] = j - 1;
        }
        return result;
    }
}
