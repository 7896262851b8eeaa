package pl.marcinmilkowski.vocab_tutor.api;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.vocab_tutor.evaluation.EvaluationResult;
import pl.marcinmilkowski.vocab_tutor.evaluation.EvaluationResult.SentenceFeedback;
import pl.marcinmilkowski.vocab_tutor.evaluation.EvaluationResult.WordAnalysis;

import java.util.Map;
import java.util.TreeMap;

/**
 * Encodes tutor responses as pretty-printed JSON with sorted keys.
 *
 * {
 *   "sentenceFeedback": {"correctedSentence": ..., "explanation": ..., "status": ...},
 *   "wordAnalysis": {"difficulty": ..., "examples": [...], "meaning": ..., "synonyms": [...]}
 * }
 */
public final class TutorResponseWriter {

    private static final Logger logger = LoggerFactory.getLogger(TutorResponseWriter.class);

    public static final String ENCODING_ERROR = "{ \"error\": \"Failed to encode response\" }";

    private TutorResponseWriter() {
    }

    /**
     * Encode {@code result}; on any encoding failure return {@link #ENCODING_ERROR} instead.
     */
    public static String toJson(EvaluationResult result) {
        try {
            return JSON.toJSONString(toMap(result), JSONWriter.Feature.PrettyFormat, JSONWriter.Feature.MapSortField);
        } catch (RuntimeException e) {
            logger.error("Failed to encode tutor response", e);
            return ENCODING_ERROR;
        }
    }

    static Map<String, Object> toMap(EvaluationResult result) {
        WordAnalysis analysis = result.wordAnalysis();
        Map<String, Object> word = new TreeMap<>();
        word.put("difficulty", analysis.difficulty().label());
        word.put("meaning", analysis.meaning());
        word.put("examples", analysis.examples());
        word.put("synonyms", analysis.synonyms());

        SentenceFeedback feedback = result.sentenceFeedback();
        Map<String, Object> sentence = new TreeMap<>();
        sentence.put("status", feedback.status().label());
        sentence.put("explanation", feedback.explanation());
        sentence.put("correctedSentence", feedback.correctedSentence());

        Map<String, Object> root = new TreeMap<>();
        root.put("wordAnalysis", word);
        root.put("sentenceFeedback", sentence);
        return root;
    }
}
