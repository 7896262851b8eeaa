package pl.marcinmilkowski.vocab_tutor.evaluation;

import pl.marcinmilkowski.vocab_tutor.tagging.PartOfSpeech;

/**
 * Short model sentences that show a word in a given role.
 */
public final class CorrectionTemplates {

    private CorrectionTemplates() {
    }

    public static String simpleSentence(String word, PartOfSpeech pos) {
        return switch (pos) {
            case ADJECTIVE -> "I am " + word + ".";
            case VERB -> "I " + word + " every day.";
            case NOUN -> "This is a " + word + ".";
            case ADVERB -> "She did it " + word + ".";
            case OTHER -> "I know the word " + word + ".";
        };
    }
}
