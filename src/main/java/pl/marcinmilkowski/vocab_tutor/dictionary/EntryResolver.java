package pl.marcinmilkowski.vocab_tutor.dictionary;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves descriptive metadata for a word: local table, then the external source (only when
 * requested), then the heuristic builder. The first strategy with an answer wins.
 */
public class EntryResolver {

    private static final Logger logger = LoggerFactory.getLogger(EntryResolver.class);

    private final EntryStrategy local;
    private final EntryStrategy external;
    private final HeuristicEntryBuilder heuristic;

    /**
     * @param local     curated entries
     * @param external  external-source strategy, or null when no source is wired in
     * @param heuristic final fallback
     */
    public EntryResolver(EntryStrategy local, EntryStrategy external, HeuristicEntryBuilder heuristic) {
        this.local = local;
        this.external = external;
        this.heuristic = Objects.requireNonNull(heuristic, "heuristic");
    }

    /**
     * Resolve an entry for {@code word}. Never fails; the heuristic builder answers every word.
     *
     * @param word              trimmed, non-empty word
     * @param useExternalSource whether to consult the external source
     */
    public WordEntry resolve(String word, boolean useExternalSource) {
        for (EntryStrategy strategy : strategies(useExternalSource)) {
            Optional<WordEntry> entry = strategy.tryResolve(word);
            if (entry.isPresent()) {
                logger.debug("Resolved '{}' via {} strategy", word, strategy.getName());
                return entry.get();
            }
        }
        // a subclassed builder may decline
        return heuristic.build(word);
    }

    List<EntryStrategy> strategies(boolean useExternalSource) {
        List<EntryStrategy> ordered = new ArrayList<>(3);
        if (local != null) {
            ordered.add(local);
        }
        if (useExternalSource && external != null) {
            ordered.add(external);
        }
        ordered.add(heuristic);
        return ordered;
    }
}
