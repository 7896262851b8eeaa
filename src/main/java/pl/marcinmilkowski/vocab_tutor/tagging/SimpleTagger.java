package pl.marcinmilkowski.vocab_tutor.tagging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.vocab_tutor.tokenizer.TokenSpan;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.regex.Pattern;

/**
 * Simple rule-based English tagger.
 *
 * Uses a lookup table of closed-class and common words, a couple of context cues and strong
 * suffix patterns. Unlike a full tagger it stays silent when it is not reasonably sure, so
 * the caller falls back to the role the dictionary expects.
 */
public class SimpleTagger implements GrammaticalTagger {

    private static final Logger logger = LoggerFactory.getLogger(SimpleTagger.class);

    private static final Set<String> DETERMINERS = new HashSet<>(Arrays.asList(
        "the", "a", "an", "this", "that", "these", "those",
        "my", "your", "his", "her", "its", "our", "their"
    ));

    private static final Set<String> PRONOUNS = new HashSet<>(Arrays.asList(
        "i", "you", "he", "she", "it", "we", "they",
        "me", "him", "us", "them"
    ));

    private static final Set<String> MODALS = new HashSet<>(Arrays.asList(
        "will", "would", "shall", "should", "can", "could", "may", "might", "must", "to"
    ));

    private static final Set<String> FUNCTION_WORDS = new HashSet<>(Arrays.asList(
        "of", "in", "for", "with", "on", "at", "by", "from", "about", "into", "over", "under",
        "and", "but", "or", "nor", "yet", "so", "because", "if", "when", "while", "although"
    ));

    private static final Pattern ADV_SUFFIXES = Pattern.compile(".*(ly|wards|wise)$");
    private static final Pattern NOUN_SUFFIXES = Pattern.compile(".*(tion|sion|ness|ment|ity|ship|ism)$");
    private static final Pattern ADJ_SUFFIXES = Pattern.compile(".*(able|ible|ous|ful|less|ive)$");

    private final Map<String, String> lexicon;

    public SimpleTagger() {
        this.lexicon = new HashMap<>();
        // adjectives
        for (String w : List.of("big", "small", "happy", "sad", "good", "bad", "new", "old",
                "young", "strong", "quiet", "early", "lovely", "friendly", "ugly", "silly")) {
            lexicon.put(w, "JJ");
        }
        // nouns
        for (String w : List.of("house", "dog", "cat", "park", "teacher", "lesson", "book",
                "school", "friend", "job", "day", "table", "family")) {
            lexicon.put(w, "NN");
        }
        // verbs
        for (String w : List.of("is", "am", "are", "was", "were", "be", "been", "have", "has",
                "had", "do", "does", "did", "run", "walk", "read", "improve", "learn", "study",
                "practice", "feel", "seem", "become", "look", "looks")) {
            lexicon.put(w, "VB");
        }
        // adverbs without the -ly ending
        for (String w : List.of("very", "often", "always", "never", "soon", "well", "fast")) {
            lexicon.put(w, "RB");
        }
    }

    /**
     * Create a simple tagger with the built-in lexicon.
     */
    public static SimpleTagger create() {
        return new SimpleTagger();
    }

    /**
     * Create a simple tagger with a custom lexicon file.
     */
    public static SimpleTagger create(Path lexiconFile) throws IOException {
        SimpleTagger tagger = new SimpleTagger();
        tagger.loadLexicon(lexiconFile);
        return tagger;
    }

    /**
     * Load words from a lexicon file (one word per line, format: word tag).
     */
    public void loadLexicon(Path file) throws IOException {
        for (String raw : Files.readAllLines(file)) {
            String line = raw.trim();
            if (line.isEmpty() || line.startsWith("#")) continue;
            String[] parts = line.split("\\s+", 2);
            if (parts.length >= 2) {
                lexicon.put(parts[0].toLowerCase(Locale.ROOT), parts[1].trim());
            }
        }
        logger.info("Loaded {} entries into lexicon from {}", lexicon.size(), file);
    }

    @Override
    public Optional<PartOfSpeech> tag(String text, TokenSpan span) {
        String word = span.textOf(text).toLowerCase(Locale.ROOT);
        if (word.isEmpty()) {
            return Optional.empty();
        }

        String known = lexicon.get(word);
        if (known != null) {
            return Optional.of(PartOfSpeech.fromPennTag(known));
        }

        if (DETERMINERS.contains(word) || PRONOUNS.contains(word)
                || MODALS.contains(word) || FUNCTION_WORDS.contains(word)) {
            return Optional.of(PartOfSpeech.OTHER);
        }

        // "can improve", "to learn"
        String previous = previousWord(text, span);
        if (previous != null && MODALS.contains(previous)) {
            return Optional.of(PartOfSpeech.VERB);
        }

        if (ADV_SUFFIXES.matcher(word).matches()) {
            return Optional.of(PartOfSpeech.ADVERB);
        }
        if (NOUN_SUFFIXES.matcher(word).matches()) {
            return Optional.of(PartOfSpeech.NOUN);
        }
        if (ADJ_SUFFIXES.matcher(word).matches()) {
            return Optional.of(PartOfSpeech.ADJECTIVE);
        }

        return Optional.empty();
    }

    private static String previousWord(String text, TokenSpan span) {
        String[] before = text.substring(0, span.start()).trim().split("\\s+");
        String last = before[before.length - 1].replaceAll("[^\\p{L}']", "");
        return last.isEmpty() ? null : last.toLowerCase(Locale.ROOT);
    }

    @Override
    public String getName() {
        return "Simple Tagger (Rule-based)";
    }
}
