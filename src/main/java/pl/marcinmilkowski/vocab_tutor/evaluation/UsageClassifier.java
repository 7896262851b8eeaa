package pl.marcinmilkowski.vocab_tutor.evaluation;

import pl.marcinmilkowski.vocab_tutor.tagging.PartOfSpeech;
import pl.marcinmilkowski.vocab_tutor.tokenizer.TokenSpan;

import java.util.Locale;
import java.util.Set;

/**
 * Judges whether a located word is used in its expected role and sounds natural.
 *
 * Naturalness looks only at the single whitespace-separated word right before the token:
 * adjectives want a linking verb, verbs a subject pronoun, nouns a determiner. Other roles
 * are unconstrained.
 */
public class UsageClassifier {

    static final Set<String> LINKING_VERBS = Set.of(
        "is", "am", "are", "was", "were", "feel", "seem", "become", "looks", "look");

    static final Set<String> SUBJECT_PRONOUNS = Set.of(
        "i", "we", "they", "she", "he", "you", "it");

    static final Set<String> DETERMINERS = Set.of(
        "a", "an", "the", "my", "his", "her", "their");

    public UsageAssessment classify(String sentence, TokenSpan span, PartOfSpeech actual, PartOfSpeech expected) {
        boolean roleMatches = actual == expected;
        return new UsageAssessment(roleMatches, isNatural(sentence, span, actual));
    }

    static boolean isNatural(String sentence, TokenSpan span, PartOfSpeech pos) {
        String previous = precedingWord(sentence, span);
        return switch (pos) {
            case ADJECTIVE -> previous != null && LINKING_VERBS.contains(previous);
            case VERB -> previous != null && SUBJECT_PRONOUNS.contains(previous);
            case NOUN -> previous != null && DETERMINERS.contains(previous);
            case ADVERB, OTHER -> true;
        };
    }

    /**
     * The word right before the span, lower-cased, or null if the span opens the sentence.
     */
    static String precedingWord(String sentence, TokenSpan span) {
        String before = sentence.substring(0, span.start()).strip();
        if (before.isEmpty()) {
            return null;
        }
        String[] words = before.split("\\s+");
        return words[words.length - 1].toLowerCase(Locale.ROOT);
    }
}
