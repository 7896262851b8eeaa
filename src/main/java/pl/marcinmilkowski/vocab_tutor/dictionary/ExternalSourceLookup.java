package pl.marcinmilkowski.vocab_tutor.dictionary;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous access to an external dictionary.
 *
 * Implementations may complete exceptionally or never complete; callers bound the wait and
 * cancel the returned future when they stop waiting.
 */
public interface ExternalSourceLookup {

    CompletableFuture<Optional<ExternalEntry>> fetch(String word);
}
