package pl.marcinmilkowski.vocab_tutor.dictionary;

import pl.marcinmilkowski.vocab_tutor.tagging.PartOfSpeech;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Builds an entry for any word from its spelling alone: part of speech from the ending,
 * difficulty from the length, templated meaning and examples.
 *
 * Always produces an entry, so it is the last strategy of the resolver.
 */
public class HeuristicEntryBuilder implements EntryStrategy {

    private record SuffixRule(String suffix, PartOfSpeech pos) {}

    // checked longest suffix first
    private static final List<SuffixRule> SUFFIX_RULES = List.of(
            new SuffixRule("ly", PartOfSpeech.ADVERB),
            new SuffixRule("ing", PartOfSpeech.VERB),
            new SuffixRule("ed", PartOfSpeech.VERB),
            new SuffixRule("ion", PartOfSpeech.NOUN),
            new SuffixRule("ment", PartOfSpeech.NOUN),
            new SuffixRule("ness", PartOfSpeech.NOUN),
            new SuffixRule("able", PartOfSpeech.ADJECTIVE),
            new SuffixRule("ous", PartOfSpeech.ADJECTIVE),
            new SuffixRule("ful", PartOfSpeech.ADJECTIVE),
            new SuffixRule("less", PartOfSpeech.ADJECTIVE),
            new SuffixRule("ive", PartOfSpeech.ADJECTIVE),
            new SuffixRule("al", PartOfSpeech.ADJECTIVE))
        .stream()
        .sorted(Comparator.comparingInt((SuffixRule r) -> r.suffix().length()).reversed())
        .toList();

    @Override
    public Optional<WordEntry> tryResolve(String word) {
        return Optional.of(build(word));
    }

    public WordEntry build(String word) {
        PartOfSpeech pos = inferPartOfSpeech(word);
        return new WordEntry(
            Difficulty.fromLength(word),
            meaning(word, pos),
            pos,
            examples(word, pos),
            List.of()
        );
    }

    /**
     * Guess the part of speech from the word ending; defaults to ADJECTIVE.
     */
    public static PartOfSpeech inferPartOfSpeech(String word) {
        String lower = word.toLowerCase(Locale.ROOT);
        for (SuffixRule rule : SUFFIX_RULES) {
            if (lower.endsWith(rule.suffix())) {
                return rule.pos();
            }
        }
        return PartOfSpeech.ADJECTIVE;
    }

    static String meaning(String word, PartOfSpeech pos) {
        String head = capitalize(word);
        return switch (pos) {
            case NOUN -> head + " — a thing, person, or idea. (Simple explanation)";
            case VERB -> head + " — to do or perform the action named by this word. (Simple explanation)";
            case ADJECTIVE -> head + " — a word that describes a person, place, thing, or feeling. (Simple explanation)";
            case ADVERB -> head + " — a word that describes how an action is done. (Simple explanation)";
            case OTHER -> head + " — a simple description of the word.";
        };
    }

    static List<String> examples(String word, PartOfSpeech pos) {
        return switch (pos) {
            case ADJECTIVE -> List.of("She is " + word + ".", "It was a " + word + " day.");
            case VERB -> List.of("I " + word + " every day.", "They " + word + " the problem together.");
            case NOUN -> List.of("The " + word + " was on the table.", "She found a " + word + ".");
            case ADVERB -> List.of("He moved " + word + ".", "She spoke " + word + ".");
            case OTHER -> List.of("I know the word " + word + ".", "This sentence uses " + word + ".");
        };
    }

    private static String capitalize(String word) {
        if (word.isEmpty()) return word;
        int first = word.codePointAt(0);
        return new String(Character.toChars(Character.toTitleCase(first))) + word.substring(Character.charCount(first));
    }

    @Override
    public String getName() {
        return "heuristic";
    }
}
