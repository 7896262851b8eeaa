package pl.marcinmilkowski.vocab_tutor.evaluation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.vocab_tutor.dictionary.EntryResolver;
import pl.marcinmilkowski.vocab_tutor.dictionary.WordEntry;
import pl.marcinmilkowski.vocab_tutor.tagging.GrammaticalTagger;
import pl.marcinmilkowski.vocab_tutor.tagging.LexicalTaggerAdapter;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Entry point of the tutor: evaluates one (word, sentence) pair.
 *
 * Holds only immutable collaborators, so one instance can serve concurrent requests.
 * The only blocking step is the optional external dictionary lookup, which is time-bounded.
 */
public class TutorEngine {

    private static final Logger logger = LoggerFactory.getLogger(TutorEngine.class);

    private final EntryResolver resolver;
    private final FeedbackComposer composer;

    public TutorEngine(EntryResolver resolver, GrammaticalTagger tagger) {
        this(resolver, new FeedbackComposer(new LexicalTaggerAdapter(tagger), new UsageClassifier()));
    }

    public TutorEngine(EntryResolver resolver, FeedbackComposer composer) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.composer = Objects.requireNonNull(composer, "composer");
    }

    /**
     * Evaluate the learner's use of {@code word} in {@code sentence}. Never throws for bad input;
     * every degraded path still yields a complete result.
     *
     * @param word              target word; surrounding whitespace is ignored
     * @param sentence          the learner's sentence
     * @param useExternalSource whether the external dictionary may be consulted
     */
    public EvaluationResult evaluate(String word, String sentence, boolean useExternalSource) {
        String trimmed = word == null ? "" : word.strip();
        if (trimmed.isEmpty()) {
            logger.info("Evaluation requested without a target word");
            return FeedbackComposer.noWordProvided();
        }

        WordEntry entry = resolver.resolve(trimmed, useExternalSource);
        EvaluationResult result = composer.compose(trimmed, sentence == null ? "" : sentence, entry);
        logger.info("Evaluated '{}': {}", trimmed, result.sentenceFeedback().status());
        return result;
    }

    /**
     * Run {@link #evaluate} as one unit of work on {@code executor}.
     */
    public CompletableFuture<EvaluationResult> evaluateAsync(String word, String sentence,
                                                             boolean useExternalSource, Executor executor) {
        return CompletableFuture.supplyAsync(() -> evaluate(word, sentence, useExternalSource), executor);
    }
}
