package pl.marcinmilkowski.vocab_tutor.evaluation;

import org.junit.jupiter.api.Test;
import pl.marcinmilkowski.vocab_tutor.tagging.PartOfSpeech;

import static org.junit.jupiter.api.Assertions.*;

class CorrectionTemplatesTest {

    @Test
    void testTemplates() {
        assertEquals("I am resilient.", CorrectionTemplates.simpleSentence("resilient", PartOfSpeech.ADJECTIVE));
        assertEquals("I improve every day.", CorrectionTemplates.simpleSentence("improve", PartOfSpeech.VERB));
        assertEquals("This is a table.", CorrectionTemplates.simpleSentence("table", PartOfSpeech.NOUN));
        assertEquals("She did it quickly.", CorrectionTemplates.simpleSentence("quickly", PartOfSpeech.ADVERB));
        assertEquals("I know the word hello.", CorrectionTemplates.simpleSentence("hello", PartOfSpeech.OTHER));
    }

    @Test
    void testEveryRoleContainsWord() {
        for (PartOfSpeech pos : PartOfSpeech.values()) {
            String sentence = CorrectionTemplates.simpleSentence("serendipity", pos);
            assertTrue(sentence.contains("serendipity"), pos + ": " + sentence);
        }
    }
}
