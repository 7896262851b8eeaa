package pl.marcinmilkowski.vocab_tutor.dictionary;

import pl.marcinmilkowski.vocab_tutor.tagging.PartOfSpeech;

import java.util.List;
import java.util.Objects;

/**
 * Immutable descriptive metadata for one word.
 *
 * The meaning is never blank; examples and synonyms are never null (absence is an empty list).
 */
public record WordEntry(
    Difficulty difficulty,
    String meaning,
    PartOfSpeech partOfSpeech,
    List<String> examples,
    List<String> synonyms
) {
    public WordEntry {
        Objects.requireNonNull(difficulty, "difficulty");
        Objects.requireNonNull(partOfSpeech, "partOfSpeech");
        if (meaning == null || meaning.isBlank()) {
            throw new IllegalArgumentException("Word entry must carry a meaning");
        }
        examples = examples == null ? List.of() : List.copyOf(examples);
        synonyms = synonyms == null ? List.of() : List.copyOf(synonyms);
    }
}
