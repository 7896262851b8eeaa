package pl.marcinmilkowski.vocab_tutor.dictionary;

import pl.marcinmilkowski.vocab_tutor.tagging.PartOfSpeech;

import java.util.List;
import java.util.Optional;

/**
 * Raw entry as delivered by an external dictionary source, before validation.
 */
public record ExternalEntry(
    String difficulty,
    String meaning,
    String partOfSpeech,
    List<String> examples,
    List<String> synonyms
) {
    /**
     * Adapt to a {@link WordEntry}. An unknown difficulty label is replaced by the length-based
     * estimate; a missing meaning makes the entry unusable.
     */
    public Optional<WordEntry> toWordEntry(String word) {
        if (meaning == null || meaning.isBlank()) {
            return Optional.empty();
        }
        Difficulty level = Difficulty.fromLabel(difficulty).orElseGet(() -> Difficulty.fromLength(word));
        return Optional.of(new WordEntry(level, meaning, PartOfSpeech.fromLabel(partOfSpeech), examples, synonyms));
    }
}
