package pl.marcinmilkowski.vocab_tutor.api;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONObject;
import org.junit.jupiter.api.Test;
import pl.marcinmilkowski.vocab_tutor.dictionary.Difficulty;
import pl.marcinmilkowski.vocab_tutor.evaluation.EvaluationResult;
import pl.marcinmilkowski.vocab_tutor.evaluation.EvaluationResult.SentenceFeedback;
import pl.marcinmilkowski.vocab_tutor.evaluation.EvaluationResult.WordAnalysis;
import pl.marcinmilkowski.vocab_tutor.evaluation.UsageVerdict;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for TutorResponseWriter.
 */
class TutorResponseWriterTest {

    private static final EvaluationResult RESULT = new EvaluationResult(
        new WordAnalysis(Difficulty.INTERMEDIATE, "Able to recover quickly.", List.of("Stay resilient."), List.of("tough")),
        new SentenceFeedback(UsageVerdict.MOSTLY_CORRECT, "Could sound more natural.", "I am resilient."));

    @Test
    void testFieldSetAndNesting() {
        JSONObject root = JSON.parseObject(TutorResponseWriter.toJson(RESULT));
        assertEquals(2, root.size());

        JSONObject word = root.getJSONObject("wordAnalysis");
        assertEquals(4, word.size());
        assertEquals("Intermediate", word.getString("difficulty"));
        assertEquals("Able to recover quickly.", word.getString("meaning"));
        assertEquals(List.of("Stay resilient."), word.getJSONArray("examples").toJavaList(String.class));
        assertEquals(List.of("tough"), word.getJSONArray("synonyms").toJavaList(String.class));

        JSONObject sentence = root.getJSONObject("sentenceFeedback");
        assertEquals(3, sentence.size());
        assertEquals("Mostly correct", sentence.getString("status"));
        assertEquals("Could sound more natural.", sentence.getString("explanation"));
        assertEquals("I am resilient.", sentence.getString("correctedSentence"));
    }

    @Test
    void testKeysSortedAndIndented() {
        String json = TutorResponseWriter.toJson(RESULT);
        assertTrue(json.indexOf("\"sentenceFeedback\"") < json.indexOf("\"wordAnalysis\""));
        assertTrue(json.indexOf("\"correctedSentence\"") < json.indexOf("\"explanation\""));
        assertTrue(json.indexOf("\"explanation\"") < json.indexOf("\"status\""));
        assertTrue(json.indexOf("\"difficulty\"") < json.indexOf("\"examples\""));
        assertTrue(json.indexOf("\"meaning\"") < json.indexOf("\"synonyms\""));
        assertTrue(json.contains("\n"));
    }

    @Test
    void testEmptyListsStayArrays() {
        EvaluationResult empty = new EvaluationResult(
            new WordAnalysis(Difficulty.BEGINNER, "No word provided.", List.of(), List.of()),
            new SentenceFeedback(UsageVerdict.INCORRECT, "You did not provide a word to analyse.", ""));
        JSONObject word = JSON.parseObject(TutorResponseWriter.toJson(empty)).getJSONObject("wordAnalysis");
        assertTrue(word.getJSONArray("examples").isEmpty());
        assertTrue(word.getJSONArray("synonyms").isEmpty());
    }

    @Test
    void testEncodingFailureYieldsErrorPayload() {
        EvaluationResult broken = new EvaluationResult(null, null);
        assertEquals(TutorResponseWriter.ENCODING_ERROR, TutorResponseWriter.toJson(broken));
        assertEquals("Failed to encode response", JSON.parseObject(TutorResponseWriter.ENCODING_ERROR).getString("error"));
    }
}
