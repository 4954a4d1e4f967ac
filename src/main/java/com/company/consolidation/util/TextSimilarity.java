package com.company.consolidation.util;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Dice coefficient over character bigrams.
 *
 * Strings are lower-cased and stripped of whitespace before comparison;
 * bigrams are counted as a multiset so repeated pairs only match as often
 * as they occur in both strings.
 */
public class TextSimilarity {

    public static double textSimilarity(String a, String b) {
        if (a == null || b == null) return 0.0;

        String first = normalize(a);
        String second = normalize(b);

        if (first.isEmpty() || second.isEmpty()) return 0.0;
        if (first.equals(second)) return 1.0;
        if (first.length() < 2 || second.length() < 2) return 0.0;

        Map<String, Integer> firstBigrams = new HashMap<>();
        for (int i = 0; i < first.length() - 1; i++) {
            firstBigrams.merge(first.substring(i, i + 2), 1, Integer::sum);
        }

        int intersection = 0;
        for (int i = 0; i < second.length() - 1; i++) {
            String bigram = second.substring(i, i + 2);
            int count = firstBigrams.getOrDefault(bigram, 0);
            if (count > 0) {
                firstBigrams.put(bigram, count - 1);
                intersection++;
            }
        }

        return (2.0 * intersection) / (first.length() + second.length() - 2);
    }

    private static String normalize(String value) {
        return value.replaceAll("\\s+", "").toLowerCase(Locale.ROOT);
    }
}
