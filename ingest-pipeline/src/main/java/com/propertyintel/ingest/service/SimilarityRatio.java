package com.propertyintel.ingest.service;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Locale;

/**
 * Gestalt (Ratcliff/Obershelp) similarity: twice the number of matching characters
 * divided by the combined length. 1.0 for identical strings, 0.0 for nothing in common.
 */
final class SimilarityRatio {

    private SimilarityRatio() {
    }

    static double ratio(String a, String b) {
        int total = a.length() + b.length();
        if (total == 0) {
            return 1.0;
        }
        return 2.0 * matchingCharacters(a, b) / total;
    }

    static double ratioIgnoreCase(String a, String b) {
        return ratio(a.toLowerCase(Locale.ROOT), b.toLowerCase(Locale.ROOT));
    }

    private static int matchingCharacters(String a, String b) {
        int matches = 0;
        Deque<int[]> ranges = new ArrayDeque<>();
        ranges.push(new int[]{0, a.length(), 0, b.length()});

        while (!ranges.isEmpty()) {
            int[] r = ranges.pop();
            int[] block = longestMatch(a, b, r[0], r[1], r[2], r[3]);
            int i = block[0], j = block[1], size = block[2];
            if (size == 0) {
                continue;
            }
            matches += size;
            if (r[0] < i && r[2] < j) {
                ranges.push(new int[]{r[0], i, r[2], j});
            }
            if (i + size < r[1] && j + size < r[3]) {
                ranges.push(new int[]{i + size, r[1], j + size, r[3]});
            }
        }
        return matches;
    }

    /**
     * Longest common substring of a[alo..ahi) and b[blo..bhi); ties go to the
     * earliest position in a, then in b.
     */
    private static int[] longestMatch(String a, String b, int alo, int ahi, int blo, int bhi) {
        int bestI = alo, bestJ = blo, bestSize = 0;
        int[] prev = new int[bhi - blo + 1];
        for (int i = alo; i < ahi; i++) {
            int[] curr = new int[bhi - blo + 1];
            for (int j = blo; j < bhi; j++) {
                if (a.charAt(i) == b.charAt(j)) {
                    int k = prev[j - blo] + 1;
                    curr[j - blo + 1] = k;
                    if (k > bestSize) {
                        bestI = i - k + 1;
                        bestJ = j - k + 1;
                        bestSize = k;
                    }
                }
            }
            prev = curr;
        }
        return new int[]{bestI, bestJ, bestSize};
    }
}
