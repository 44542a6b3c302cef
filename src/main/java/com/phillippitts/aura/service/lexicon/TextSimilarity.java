package com.phillippitts.aura.service.lexicon;

import java.util.Locale;

/**
 * Edit-distance based string similarity used by the lexicon matcher.
 *
 * <p>Similarity rules:
 * <ul>
 *   <li>{@link #ratio(String, String)}: {@code 1 - levenshtein / max(length)}</li>
 *   <li>{@link #similarity(String, String)}: the better of the plain ratio and the best
 *       ratio of the reference phrase against any equal-length window of a longer text, so
 *       a qualifier that contains a reference phrase scores 1.0</li>
 * </ul>
 */
public final class TextSimilarity {

    private TextSimilarity() {
        // Prevent instantiation
    }

    /**
     * Lower-cases, trims and collapses internal whitespace. Null becomes "".
     */
    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        return text.toLowerCase(Locale.ROOT).trim().replaceAll("\\s+", " ");
    }

    /**
     * Similarity between a (normalized) free-text value and a (normalized) reference phrase.
     *
     * @return score in [0,1]
     */
    public static double similarity(String text, String phrase) {
        double best = ratio(text, phrase);
        if (best >= 1.0 || phrase.isEmpty() || phrase.length() >= text.length()) {
            return best;
        }
        int window = phrase.length();
        for (int i = 0; i + window <= text.length(); i++) {
            best = Math.max(best, ratio(text.substring(i, i + window), phrase));
            if (best >= 1.0) {
                break;
            }
        }
        return best;
    }

    /**
     * Normalized Levenshtein ratio: 1.0 for identical strings, 0.0 for fully different ones.
     */
    public static double ratio(String a, String b) {
        int max = Math.max(a.length(), b.length());
        if (max == 0) {
            return 1.0;
        }
        return 1.0 - (double) levenshtein(a, b) / max;
    }

    /**
     * Classic two-row Levenshtein distance (insert, delete, substitute all cost 1).
     */
    static int levenshtein(String a, String b) {
        int[] prev = new int[b.length() + 1];
        int[] cur = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            prev[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            cur[0] = i;
            char ca = a.charAt(i - 1);
            for (int j = 1; j <= b.length(); j++) {
                int cost = ca == b.charAt(j - 1) ? 0 : 1;
                cur[j] = Math.min(Math.min(prev[j] + 1, cur[j - 1] + 1), prev[j - 1] + cost);
            }
            int[] tmp = prev;
            prev = cur;
            cur = tmp;
        }
        return prev[b.length()];
    }
}
