package com.concord.core.distribution;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class HungarianAlgorithmTest {

    @Test
    @DisplayName("finds the minimum-cost matching of a small matrix")
    void solvesKnownMatrix() {
        double[][] cost = {
                {4, 1, 3},
                {2, 0, 5},
                {3, 2, 2}
        };
        int[] match = HungarianAlgorithm.solve(cost);
        assertArrayEquals(new int[]{1, 0, 2}, match);
        assertEquals(5.0, total(cost, match));
    }

    @Test
    @DisplayName("matches brute force on random matrices")
    void matchesBruteForce() {
        var random = new Random(7);
        for (int trial = 0; trial < 50; trial++) {
            int n = 1 + random.nextInt(6);
            double[][] cost = new double[n][n];
            for (double[] row : cost) {
                for (int c = 0; c < n; c++) {
                    row[c] = random.nextInt(100);
                }
            }
            int[] match = HungarianAlgorithm.solve(cost);
            assertEquals(n, Arrays.stream(match).distinct().count(), "each column used once");
            assertEquals(bruteForce(cost, 0, new boolean[n]), total(cost, match), 1e-9);
        }
    }

    @Test
    @DisplayName("handles empty and rejects non-square matrices")
    void edgeCases() {
        assertEquals(0, HungarianAlgorithm.solve(new double[0][0]).length);
        assertThrows(IllegalArgumentException.class, () -> HungarianAlgorithm.solve(new double[][]{{1, 2}}));
    }

    private static double total(double[][] cost, int[] match) {
        double sum = 0;
        for (int r = 0; r < match.length; r++) {
            sum += cost[r][match[r]];
        }
        return sum;
    }

    private static double bruteForce(double[][] cost, int row, boolean[] used) {
        if (row == cost.length) {
            return 0;
        }
        double best = Double.POSITIVE_INFINITY;
        for (int c = 0; c < cost.length; c++) {
            if (!used[c]) {
                used[c] = true;
                best = Math.min(best, cost[row][c] + bruteForce(cost, row + 1, used));
                used[c] = false;
            }
        }
        return best;
    }
}
