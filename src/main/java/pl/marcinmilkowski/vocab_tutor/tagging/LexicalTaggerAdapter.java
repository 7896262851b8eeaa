package pl.marcinmilkowski.vocab_tutor.tagging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.vocab_tutor.tokenizer.TokenSpan;

import java.util.Objects;
import java.util.Optional;

/**
 * Wraps a {@link GrammaticalTagger} so callers always get a classification.
 *
 * If the tagger has no answer, or fails, the part of speech expected from the dictionary entry
 * is used instead.
 */
public class LexicalTaggerAdapter {

    private static final Logger logger = LoggerFactory.getLogger(LexicalTaggerAdapter.class);

    private final GrammaticalTagger tagger;

    public LexicalTaggerAdapter(GrammaticalTagger tagger) {
        this.tagger = Objects.requireNonNull(tagger, "tagger");
    }

    public PartOfSpeech classify(String sentence, TokenSpan span, PartOfSpeech expected) {
        Optional<PartOfSpeech> tag;
        try {
            tag = tagger.tag(sentence, span);
        } catch (RuntimeException e) {
            logger.warn("Tagger {} failed on token '{}', using expected role {}",
                tagger.getName(), span.textOf(sentence), expected, e);
            return expected;
        }
        if (tag == null || tag.isEmpty()) {
            logger.debug("No tag from {} for '{}', using expected role {}",
                tagger.getName(), span.textOf(sentence), expected);
            return expected;
        }
        return tag.get();
    }
}
