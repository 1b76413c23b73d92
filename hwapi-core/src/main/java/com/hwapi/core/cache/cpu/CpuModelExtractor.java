package com.hwapi.core.cache.cpu;

import java.util.Arrays;
import java.util.Optional;

/**
 * Picks the model token out of a CPU name.
 *
 * <p>Given {@code "Intel(R) Core(TM) i5-9400F CPU @ 2.90GHz"} the model token is
 * {@code "i5-9400F"}: tokens with digits score up, tokens with punctuation that model
 * numbers never contain score down.
 */
public final class CpuModelExtractor {

    private CpuModelExtractor() {
        // Utility class
    }

    /**
     * Scores how likely a single token is to be a model number.
     *
     * <p>+2 per ASCII digit, -4 per {@code '.'}, {@code '('} or {@code ')'}.
     *
     * @param token space-free token
     * @return score, higher is more model-like
     */
    public static int calculateModelScore(String token) {
        int score = 0;
        for (int i = 0; i < token.length(); i++) {
            char c = token.charAt(i);
            if (c >= '0' && c <= '9') {
                score += 2;
            }
            if (c == '.' || c == '(' || c == ')') {
                score -= 4;
            }
        }
        return score;
    }

    /**
     * Returns the model token of a CPU name.
     *
     * <p>The highest scoring token wins, the earliest one on ties. The result is then
     * rewritten by the first of these rules that applies:
     * <ol>
     *   <li>Intel name whose token starts with {@code 14}: {@code "i7 processor 14700K"}
     *       becomes {@code "i7-14700K"}.</li>
     *   <li>AMD name mentioning {@code PRO}: {@code "4650G"} becomes {@code "PRO 4650G"}.</li>
     *   <li>Intel mobile name of the form {@code "i7 CPU M 620"}: becomes {@code "i7-620M"}.</li>
     * </ol>
     *
     * @param name full CPU name
     * @return model token, possibly rewritten
     */
    public static String findModel(String name) {
        String[] tokens = name.split(" ", -1);
        String best = tokens[0];
        int bestScore = calculateModelScore(best);
        for (int i = 1; i < tokens.length; i++) {
            int score = calculateModelScore(tokens[i]);
            if (score > bestScore) {
                best = tokens[i];
                bestScore = score;
            }
        }

        boolean intel = name.contains("Intel");
        if (intel && best.startsWith("14")) {
            Optional<String> family = familyTag(tokens);
            if (family.isPresent()) {
                return family.get() + "-" + best;
            }
        }
        if (name.contains("AMD") && name.contains("PRO")) {
            return "PRO " + best;
        }
        if (intel && name.contains(" M ") && best.length() == 3) {
            Optional<String> family = familyTag(tokens);
            if (family.isPresent()) {
                return family.get() + "-" + best + "M";
            }
        }
        return best;
    }

    /**
     * First two-character token starting with {@code i}, such as {@code i7}.
     */
    private static Optional<String> familyTag(String[] tokens) {
        return Arrays.stream(tokens)
            .filter(token -> token.length() == 2 && token.charAt(0) == 'i')
            .findFirst();
    }
}
