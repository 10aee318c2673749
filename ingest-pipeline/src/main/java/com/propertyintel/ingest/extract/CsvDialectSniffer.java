package com.propertyintel.ingest.extract;

import java.util.ArrayList;
import java.util.List;

/**
 * Guesses the column delimiter from a text sample. The winner is the candidate
 * that appears the same non-zero number of times on every sampled line, most
 * occurrences first; failing that, the most frequent one; failing that, a comma.
 */
final class CsvDialectSniffer {

    static final char[] CANDIDATES = {',', ';', '\t', '|'};
    private static final int MAX_LINES = 20;

    private CsvDialectSniffer() {
    }

    static char sniff(String sample) {
        List<String> lines = completeLines(sample);
        if (lines.isEmpty()) {
            return ',';
        }

        char consistent = 0;
        int consistentCount = 0;
        char frequent = ',';
        int frequentTotal = 0;

        for (char candidate : CANDIDATES) {
            int first = countOutsideQuotes(lines.get(0), candidate);
            boolean same = first > 0;
            int total = 0;
            for (String line : lines) {
                int n = countOutsideQuotes(line, candidate);
                total += n;
                if (n != first) same = false;
            }
            if (same && first > consistentCount) {
                consistent = candidate;
                consistentCount = first;
            }
            if (total > frequentTotal) {
                frequent = candidate;
                frequentTotal = total;
            }
        }
        return consistentCount > 0 ? consistent : frequent;
    }

    /** Drops blank lines and the trailing line when the sample may have cut it short. */
    private static List<String> completeLines(String sample) {
        String[] split = sample.split("\r?\n", -1);
        int usable = sample.endsWith("\n") ? split.length : split.length - 1;
        if (usable == 0 && split.length == 1) {
            usable = 1;
        }
        List<String> lines = new ArrayList<>();
        for (int i = 0; i < usable && lines.size() < MAX_LINES; i++) {
            if (!split[i].isBlank()) {
                lines.add(split[i]);
            }
        }
        return lines;
    }

    private static int countOutsideQuotes(String line, char delimiter) {
        int count = 0;
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '"') {
                quoted = !quoted;
            } else if (c == delimiter && !quoted) {
                count++;
            }
        }
        return count;
    }
}
