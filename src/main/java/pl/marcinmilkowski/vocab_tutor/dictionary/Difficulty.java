package pl.marcinmilkowski.vocab_tutor.dictionary;

import java.util.Locale;
import java.util.Optional;

/**
 * Learner level a word is suited for.
 */
public enum Difficulty {
    BEGINNER("Beginner"),
    INTERMEDIATE("Intermediate"),
    ADVANCED("Advanced");

    private final String label;

    Difficulty(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Infer difficulty from word length: up to 5 characters is beginner, 6 to 9 intermediate,
     * 10 or more advanced.
     */
    public static Difficulty fromLength(String word) {
        int length = word.codePointCount(0, word.length());
        if (length <= 5) return BEGINNER;
        if (length <= 9) return INTERMEDIATE;
        return ADVANCED;
    }

    public static Optional<Difficulty> fromLabel(String label) {
        if (label == null) return Optional.empty();
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        for (Difficulty d : values()) {
            if (d.label.toLowerCase(Locale.ROOT).equals(normalized)) {
                return Optional.of(d);
            }
        }
        return Optional.empty();
    }
}
