package pl.marcinmilkowski.vocab_tutor.evaluation;

import pl.marcinmilkowski.vocab_tutor.dictionary.Difficulty;
import pl.marcinmilkowski.vocab_tutor.dictionary.WordEntry;

import java.util.List;

/**
 * Full tutor response: what the word means and how well the learner used it.
 */
public record EvaluationResult(WordAnalysis wordAnalysis, SentenceFeedback sentenceFeedback) {

    /**
     * Descriptive part of the response, flattened from {@link WordEntry} without the part of speech.
     */
    public record WordAnalysis(Difficulty difficulty, String meaning, List<String> examples, List<String> synonyms) {

        public WordAnalysis {
            examples = examples == null ? List.of() : List.copyOf(examples);
            synonyms = synonyms == null ? List.of() : List.copyOf(synonyms);
        }

        public static WordAnalysis of(WordEntry entry) {
            return new WordAnalysis(entry.difficulty(), entry.meaning(), entry.examples(), entry.synonyms());
        }
    }

    /**
     * Verdict on the sentence. An empty corrected sentence means there is nothing to correct.
     */
    public record SentenceFeedback(UsageVerdict status, String explanation, String correctedSentence) {

        public SentenceFeedback {
            correctedSentence = correctedSentence == null ? "" : correctedSentence;
        }
    }
}
