package pl.marcinmilkowski.vocab_tutor.dictionary;

import java.util.Optional;

/**
 * One step of entry resolution. Returns empty when the strategy has nothing for the word.
 */
public interface EntryStrategy {

    Optional<WordEntry> tryResolve(String word);

    /**
     * Short name used in log messages.
     */
    String getName();
}
