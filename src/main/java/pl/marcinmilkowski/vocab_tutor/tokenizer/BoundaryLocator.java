package pl.marcinmilkowski.vocab_tutor.tokenizer;

import java.util.Optional;

/**
 * Finds the first occurrence of a target word in a sentence and widens it to whole-word boundaries.
 *
 * Matching is a case-insensitive substring search, so the hit may sit inside a longer token.
 * The span is then grown in both directions over letters and apostrophes, which means searching
 * "resilient" in "I am resiliently confident." yields the token "resiliently" and downstream
 * classification sees the real token rather than a partial match.
 */
public final class BoundaryLocator {

    private static final char APOSTROPHE = '\'';

    private BoundaryLocator() {
    }

    /**
     * Locate the target word.
     *
     * @param sentence   the learner's sentence
     * @param targetWord the word to look for (already trimmed)
     * @return span of the full token containing the first match, or empty if the word does not occur
     */
    public static Optional<TokenSpan> locate(String sentence, String targetWord) {
        if (sentence == null || targetWord == null || targetWord.isEmpty()) {
            return Optional.empty();
        }

        int hit = indexOfIgnoreCase(sentence, targetWord);
        if (hit < 0) {
            return Optional.empty();
        }

        int start = expandBackward(sentence, hit);
        int end = expandForward(sentence, hit + targetWord.length());
        return Optional.of(new TokenSpan(start, end));
    }

    // regionMatches keeps indices aligned with the original string, toLowerCase() may not
    private static int indexOfIgnoreCase(String text, String needle) {
        int last = text.length() - needle.length();
        for (int i = 0; i <= last; i++) {
            if (text.regionMatches(true, i, needle, 0, needle.length())) {
                return i;
            }
        }
        return -1;
    }

    private static int expandBackward(String text, int index) {
        int i = index;
        while (i > 0) {
            int cp = text.codePointBefore(i);
            if (!isWordChar(cp)) {
                break;
            }
            i -= Character.charCount(cp);
        }
        return i;
    }

    private static int expandForward(String text, int index) {
        int i = index;
        while (i < text.length()) {
            int cp = text.codePointAt(i);
            if (!isWordChar(cp)) {
                break;
            }
            i += Character.charCount(cp);
        }
        return i;
    }

    static boolean isWordChar(int codePoint) {
        return Character.isLetter(codePoint) || codePoint == APOSTROPHE;
    }
}
