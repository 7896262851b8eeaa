package pl.marcinmilkowski.vocab_tutor.tokenizer;

/**
 * Half-open character range [start, end) of one word occurrence inside a sentence.
 */
public record TokenSpan(int start, int end) {

    public TokenSpan {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid token span [" + start + ", " + end + ")");
        }
    }

    public int length() {
        return end - start;
    }

    /**
     * Get the covered text of the given sentence.
     */
    public String textOf(String sentence) {
        return sentence.substring(start, end);
    }
}
