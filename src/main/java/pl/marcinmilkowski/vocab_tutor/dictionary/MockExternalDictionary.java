package pl.marcinmilkowski.vocab_tutor.dictionary;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Stand-in for a remote dictionary service. Answers every word with a demo entry after a
 * simulated network latency.
 */
public class MockExternalDictionary implements ExternalSourceLookup {

    private final Duration latency;

    public MockExternalDictionary(Duration latency) {
        this.latency = latency;
    }

    @Override
    public CompletableFuture<Optional<ExternalEntry>> fetch(String word) {
        Executor delayed = CompletableFuture.delayedExecutor(latency.toMillis(), TimeUnit.MILLISECONDS);
        return CompletableFuture.supplyAsync(() -> Optional.of(mockEntry(word)), delayed);
    }

    static ExternalEntry mockEntry(String word) {
        return new ExternalEntry(
            "Intermediate",
            "A mock meaning for " + word + ". (This is a demo fallback.)",
            "adjective",
            List.of("This is a mock example using " + word + ".", "Another mock sentence with " + word + "."),
            List.of("sample", "demo")
        );
    }
}
