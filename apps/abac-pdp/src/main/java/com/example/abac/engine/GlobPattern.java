package com.example.abac.engine;

import java.util.Arrays;

/**
 * Wildcard pattern used by the {@code matchesPattern} operator.
 *
 * <p>{@code *} matches any run of characters, {@code ?} matches exactly one, and {@code \} makes the
 * next character literal. Matching is case-sensitive and runs in O(pattern * input) time at worst,
 * backtracking only to the most recent {@code *}. Inputs longer than {@link #MAX_INPUT_LENGTH} never match.
 */
public final class GlobPattern {

    public static final int MAX_INPUT_LENGTH = 4096;

    private static final int ANY_ONE = -1;
    private static final int ANY_RUN = -2;

    private final String source;
    private final int[] tokens;

    private GlobPattern(String source, int[] tokens) {
        this.source = source;
        this.tokens = tokens;
    }

    public static GlobPattern compile(String pattern) {
        int[] tokens = new int[pattern.length()];
        int count = 0;
        for (int i = 0; i < pattern.length(); i++) {
            char c = pattern.charAt(i);
            if (c == '\\' && i + 1 < pattern.length()) {
                tokens[count++] = pattern.charAt(++i);
            } else if (c == '*') {
                // collapse consecutive stars
                if (count == 0 || tokens[count - 1] != ANY_RUN) {
                    tokens[count++] = ANY_RUN;
                }
            } else if (c == '?') {
                tokens[count++] = ANY_ONE;
            } else {
                tokens[count++] = c;
            }
        }
        return new GlobPattern(pattern, Arrays.copyOf(tokens, count));
    }

    public static boolean matches(String pattern, CharSequence input) {
        return compile(pattern).matches(input);
    }

    public boolean matches(CharSequence input) {
        if (input == null || input.length() > MAX_INPUT_LENGTH) {
            return false;
        }
        int p = 0;
        int i = 0;
        int starToken = -1;
        int starInput = -1;
        int n = input.length();

        while (i < n) {
            if (p < tokens.length && (tokens[p] == ANY_ONE || tokens[p] == input.charAt(i))) {
                p++;
                i++;
            } else if (p < tokens.length && tokens[p] == ANY_RUN) {
                starToken = p++;
                starInput = i;
            } else if (starToken >= 0) {
                p = starToken + 1;
                i = ++starInput;
            } else {
                return false;
            }
        }
        while (p < tokens.length && tokens[p] == ANY_RUN) {
            p++;
        }
        return p == tokens.length;
    }

    @Override
    public String toString() {
        return source;
    }
}
