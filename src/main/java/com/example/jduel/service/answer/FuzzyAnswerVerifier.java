package com.example.jduel.service.answer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Typo-tolerant matching. Both sides are normalized (lower case, punctuation stripped,
 * whitespace collapsed); numeric answers must then match exactly, anything else needs an
 * indel similarity ratio of at least {@value #THRESHOLD} (0..100).
 */
@Component
public class FuzzyAnswerVerifier implements AnswerVerifier {

    private static final Logger log = LoggerFactory.getLogger(FuzzyAnswerVerifier.class);

    static final int THRESHOLD = 85;

    private static final Pattern PUNCTUATION = Pattern.compile("[^\\p{L}\\p{N}_\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NUMBER = Pattern.compile("-?\\d+(\\.\\d+)?");

    @Override
    public boolean isCorrect(String candidate, String canonical) {
        if (candidate == null || canonical == null) return false;
        String given = normalize(candidate);
        String expected = normalize(canonical);
        if (given.isEmpty()) return false;

        if (NUMBER.matcher(expected).matches()) {
            return given.equals(expected);
        }

        double score = ratio(given, expected);
        log.debug("Answer check: given='{}' expected='{}' ratio={}", candidate, canonical, score);
        return score >= THRESHOLD;
    }

    static String normalize(String text) {
        String s = text.toLowerCase(Locale.ROOT).trim();
        s = PUNCTUATION.matcher(s).replaceAll("");
        s = WHITESPACE.matcher(s).replaceAll(" ");
        return s.trim();
    }

    /** 100 * (1 - indelDistance / (|a| + |b|)), i.e. 200 * LCS / (|a| + |b|). */
    static double ratio(String a, String b) {
        int total = a.length() + b.length();
        if (total == 0) return 100.0;
        return 200.0 * longestCommonSubsequence(a, b) / total;
    }

    private static int longestCommonSubsequence(String a, String b) {
        int[] prev = new int[b.length() + 1];
        int[] curr = new int[b.length() + 1];
        for (int i = 1; i <= a.length(); i++) {
            for (int j = 1; j <= b.length(); j++) {
                if (a.charAt(i - 1) == b.charAt(j - 1)) {
                    curr[j] = prev[j - 1] + 1;
                } else {
                    curr[j] = Math.max(prev[j], curr[j - 1]);
                }
            }
            int[] tmp = prev;
            prev = curr;
            curr = tmp;
        }
        return prev[b.length()];
    }
}
