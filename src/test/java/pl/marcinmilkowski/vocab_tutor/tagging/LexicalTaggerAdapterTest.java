package pl.marcinmilkowski.vocab_tutor.tagging;

import org.junit.jupiter.api.Test;
import pl.marcinmilkowski.vocab_tutor.tokenizer.TokenSpan;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for LexicalTaggerAdapter.
 */
class LexicalTaggerAdapterTest {

    private static final String SENTENCE = "I am resilient.";
    private static final TokenSpan SPAN = new TokenSpan(5, 14);

    private static GrammaticalTagger fixed(Optional<PartOfSpeech> answer) {
        return new GrammaticalTagger() {
            @Override
            public Optional<PartOfSpeech> tag(String text, TokenSpan span) {
                return answer;
            }

            @Override
            public String getName() {
                return "fixed";
            }
        };
    }

    @Test
    void testUsesTaggerAnswer() {
        LexicalTaggerAdapter adapter = new LexicalTaggerAdapter(fixed(Optional.of(PartOfSpeech.NOUN)));
        assertEquals(PartOfSpeech.NOUN, adapter.classify(SENTENCE, SPAN, PartOfSpeech.ADJECTIVE));
    }

    @Test
    void testFallsBackToExpectedWhenNoTag() {
        LexicalTaggerAdapter adapter = new LexicalTaggerAdapter(fixed(Optional.empty()));
        assertEquals(PartOfSpeech.ADJECTIVE, adapter.classify(SENTENCE, SPAN, PartOfSpeech.ADJECTIVE));
    }

    @Test
    void testFallsBackToExpectedWhenTaggerFails() {
        GrammaticalTagger broken = new GrammaticalTagger() {
            @Override
            public Optional<PartOfSpeech> tag(String text, TokenSpan span) {
                throw new IllegalStateException("model not loaded");
            }

            @Override
            public String getName() {
                return "broken";
            }
        };
        LexicalTaggerAdapter adapter = new LexicalTaggerAdapter(broken);
        assertEquals(PartOfSpeech.VERB, adapter.classify(SENTENCE, SPAN, PartOfSpeech.VERB));
    }
}
