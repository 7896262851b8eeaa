package pl.marcinmilkowski.vocab_tutor.evaluation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.vocab_tutor.dictionary.Difficulty;
import pl.marcinmilkowski.vocab_tutor.dictionary.WordEntry;
import pl.marcinmilkowski.vocab_tutor.evaluation.EvaluationResult.SentenceFeedback;
import pl.marcinmilkowski.vocab_tutor.evaluation.EvaluationResult.WordAnalysis;
import pl.marcinmilkowski.vocab_tutor.tagging.LexicalTaggerAdapter;
import pl.marcinmilkowski.vocab_tutor.tagging.PartOfSpeech;
import pl.marcinmilkowski.vocab_tutor.tokenizer.BoundaryLocator;
import pl.marcinmilkowski.vocab_tutor.tokenizer.TokenSpan;

import java.util.List;
import java.util.Optional;

/**
 * Turns a resolved entry and the learner's sentence into the final response.
 *
 * Verdicts, in order of precedence:
 * - word not found in the sentence: INCORRECT, with a model sentence for the expected role;
 * - found, expected role and natural context: CORRECT, no correction;
 * - found otherwise: MOSTLY_CORRECT, with a model sentence for the expected role.
 */
public class FeedbackComposer {

    private static final Logger logger = LoggerFactory.getLogger(FeedbackComposer.class);

    static final String NO_WORD_MEANING = "No word provided.";
    static final String NO_WORD_EXPLANATION = "You did not provide a word to analyse.";
    static final String WORD_NOT_USED =
        "You did not use the target word in your sentence. Try to include it in a short, simple sentence.";
    static final String COULD_BE_MORE_NATURAL =
        "You used the word, but the sentence could sound more natural. Try the suggestion.";

    private final LexicalTaggerAdapter taggerAdapter;
    private final UsageClassifier classifier;

    public FeedbackComposer(LexicalTaggerAdapter taggerAdapter, UsageClassifier classifier) {
        this.taggerAdapter = taggerAdapter;
        this.classifier = classifier;
    }

    /**
     * Fixed response for an empty or blank target word.
     */
    public static EvaluationResult noWordProvided() {
        return new EvaluationResult(
            new WordAnalysis(Difficulty.BEGINNER, NO_WORD_MEANING, List.of(), List.of()),
            new SentenceFeedback(UsageVerdict.INCORRECT, NO_WORD_EXPLANATION, ""));
    }

    public EvaluationResult compose(String word, String sentence, WordEntry entry) {
        WordAnalysis analysis = WordAnalysis.of(entry);
        PartOfSpeech expected = entry.partOfSpeech();

        Optional<TokenSpan> located = BoundaryLocator.locate(sentence, word);
        if (located.isEmpty()) {
            logger.debug("Target word '{}' not found in sentence", word);
            return new EvaluationResult(analysis, new SentenceFeedback(
                UsageVerdict.INCORRECT, WORD_NOT_USED, CorrectionTemplates.simpleSentence(word, expected)));
        }

        TokenSpan span = located.get();
        PartOfSpeech actual = taggerAdapter.classify(sentence, span, expected);
        UsageAssessment assessment = classifier.classify(sentence, span, actual, expected);
        logger.debug("Token '{}' read as {} (expected {}): {}", span.textOf(sentence), actual, expected, assessment);

        if (assessment.isCorrect()) {
            return new EvaluationResult(analysis, new SentenceFeedback(
                UsageVerdict.CORRECT, "Great! You used “" + word + "” correctly in the sentence.", ""));
        }

        String explanation = assessment.matchesExpectedRole()
            ? COULD_BE_MORE_NATURAL
            : roleMismatch(expected, actual);
        return new EvaluationResult(analysis, new SentenceFeedback(
            UsageVerdict.MOSTLY_CORRECT, explanation, CorrectionTemplates.simpleSentence(word, expected)));
    }

    static String roleMismatch(PartOfSpeech expected, PartOfSpeech actual) {
        return "You used the word, but it usually works as " + expected.withArticle()
            + ". In your sentence it looks like " + actual.withArticle() + ". See the suggestion.";
    }
}
