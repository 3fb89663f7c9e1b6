package com.speaker.standardization.similarity;

import java.text.Normalizer;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Blocking key strategy that reduces a name to a single alphanumeric token.
 *
 * <p>The name is decomposed (NFKD), combining marks are dropped, letters without a
 * decomposition are folded through a small table, the result is lower-cased and
 * every character that is not a letter or digit is removed. {@code "Jane Smith"},
 * {@code "JANE   smith!!"} and {@code "jane-smith"} all yield {@code janesmith}.</p>
 */
public class NameFingerprinter implements BlockingKeyStrategy {

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^\\p{L}\\p{N}]+");

    private static final Map<Character, String> FOLDS = Map.of(
            'ß', "ss",
            'æ', "ae",
            'ø', "o",
            'ł', "l",
            'đ', "d",
            'þ', "th",
            'œ', "oe",
            'ı', "i"
    );

    @Override
    public String generateKey(String name) {
        return fingerprint(name);
    }

    /**
     * Computes the fingerprint of a name.
     *
     * @return the fingerprint, or {@link #NO_KEY} for null, blank or symbol-only input
     */
    public String fingerprint(String name) {
        if (name == null || name.isBlank()) {
            return NO_KEY;
        }

        String decomposed = Normalizer.normalize(name, Normalizer.Form.NFKD);
        String lowered = COMBINING_MARKS.matcher(decomposed).replaceAll("").toLowerCase(Locale.ROOT);

        StringBuilder folded = new StringBuilder(lowered.length());
        for (int i = 0; i < lowered.length(); i++) {
            char c = lowered.charAt(i);
            String replacement = FOLDS.get(c);
            if (replacement != null) {
                folded.append(replacement);
            } else {
                folded.append(c);
            }
        }

        return NON_ALPHANUMERIC.matcher(folded).replaceAll("");
    }
}
