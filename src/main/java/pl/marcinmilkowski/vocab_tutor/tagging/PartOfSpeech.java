package pl.marcinmilkowski.vocab_tutor.tagging;

import java.util.Locale;

/**
 * Broad grammatical role of a word. OTHER is the safe default when nothing more specific is known.
 */
public enum PartOfSpeech {
    NOUN,
    VERB,
    ADJECTIVE,
    ADVERB,
    OTHER;

    /**
     * Name used in learner-facing messages.
     */
    public String readableName() {
        return switch (this) {
            case NOUN -> "noun";
            case VERB -> "verb";
            case ADJECTIVE -> "adjective";
            case ADVERB -> "adverb";
            case OTHER -> "word";
        };
    }

    /**
     * Readable name preceded by the matching indefinite article ("a noun", "an adverb").
     */
    public String withArticle() {
        String name = readableName();
        char first = name.charAt(0);
        boolean vowel = "aeiou".indexOf(first) >= 0;
        return (vowel ? "an " : "a ") + name;
    }

    /**
     * Map a Penn Treebank tag to a broad part of speech.
     *
     * @param tag tag such as "NN", "VBZ", "JJ" or "RB"; null maps to OTHER
     */
    public static PartOfSpeech fromPennTag(String tag) {
        if (tag == null || tag.isEmpty()) return OTHER;
        switch (Character.toUpperCase(tag.charAt(0))) {
            case 'N': return NOUN;
            case 'V': return VERB;
            case 'J': return ADJECTIVE;
            case 'R': return ADVERB;
            default: return OTHER;
        }
    }

    /**
     * Parse a loose label ("noun", "Adjective", "adj", "ADV") as delivered by dictionary sources.
     */
    public static PartOfSpeech fromLabel(String label) {
        if (label == null) return OTHER;
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "noun":
            case "n":
                return NOUN;
            case "verb":
            case "v":
                return VERB;
            case "adjective":
            case "adj":
                return ADJECTIVE;
            case "adverb":
            case "adv":
                return ADVERB;
            default:
                return OTHER;
        }
    }
}
