package pl.marcinmilkowski.vocab_tutor.tagging;

import pl.marcinmilkowski.vocab_tutor.tokenizer.TokenSpan;

import java.util.Optional;

/**
 * Interface for taggers that classify one token of a sentence.
 */
public interface GrammaticalTagger {

    /**
     * Tag the token covered by {@code span}.
     *
     * @param text the full sentence, so implementations may look at context
     * @param span the token to classify
     * @return the part of speech, or empty when the tagger has no confident answer
     */
    Optional<PartOfSpeech> tag(String text, TokenSpan span);

    /**
     * Get the name of this tagger.
     */
    String getName();
}
