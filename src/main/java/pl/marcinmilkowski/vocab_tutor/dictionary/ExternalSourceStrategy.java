package pl.marcinmilkowski.vocab_tutor.dictionary;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Resolves entries through an {@link ExternalSourceLookup}, waiting at most {@code timeout}.
 *
 * Failure, timeout and interruption all count as "no result". The pending lookup is
 * cancelled whenever the wait ends without a value. No retries.
 */
public class ExternalSourceStrategy implements EntryStrategy {

    private static final Logger logger = LoggerFactory.getLogger(ExternalSourceStrategy.class);

    private final ExternalSourceLookup lookup;
    private final Duration timeout;

    public ExternalSourceStrategy(ExternalSourceLookup lookup, Duration timeout) {
        this.lookup = Objects.requireNonNull(lookup, "lookup");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("External lookup timeout must be positive: " + timeout);
        }
    }

    @Override
    public Optional<WordEntry> tryResolve(String word) {
        CompletableFuture<Optional<ExternalEntry>> pending;
        try {
            pending = lookup.fetch(word);
        } catch (RuntimeException e) {
            logger.warn("External lookup for '{}' could not be started", word, e);
            return Optional.empty();
        }
        if (pending == null) {
            return Optional.empty();
        }

        try {
            Optional<ExternalEntry> result = pending.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (result == null || result.isEmpty()) {
                logger.info("External source has no entry for '{}'", word);
                return Optional.empty();
            }
            return result.get().toWordEntry(word);
        } catch (TimeoutException e) {
            pending.cancel(true);
            logger.warn("External lookup for '{}' timed out after {} ms", word, timeout.toMillis());
            return Optional.empty();
        } catch (InterruptedException e) {
            pending.cancel(true);
            Thread.currentThread().interrupt();
            logger.info("External lookup for '{}' abandoned by caller", word);
            return Optional.empty();
        } catch (ExecutionException e) {
            logger.warn("External lookup for '{}' failed: {}", word, e.getCause() == null ? e : e.getCause().toString());
            return Optional.empty();
        } catch (RuntimeException e) {
            // CancellationException, or a malformed entry rejected by WordEntry
            logger.warn("External lookup for '{}' produced no usable entry", word, e);
            return Optional.empty();
        }
    }

    @Override
    public String getName() {
        return "external";
    }
}
