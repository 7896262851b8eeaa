package pl.marcinmilkowski.vocab_tutor.dictionary;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.vocab_tutor.tagging.PartOfSpeech;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Curated word entries, looked up by exact case-insensitive match.
 *
 * Expected JSON structure:
 * {
 *   "version": "1.0",
 *   "entries": [
 *     {
 *       "word": "resilient",
 *       "difficulty": "Intermediate",
 *       "meaning": "...",
 *       "pos": "adjective",
 *       "examples": ["..."],
 *       "synonyms": ["..."]
 *     }
 *   ]
 * }
 */
public class LocalDictionary implements EntryStrategy {

    private static final Logger logger = LoggerFactory.getLogger(LocalDictionary.class);

    public static final String DEFAULT_RESOURCE = "dictionary/local-entries.json";

    private final Map<String, WordEntry> entries;

    public LocalDictionary(Map<String, WordEntry> entries) {
        Map<String, WordEntry> normalized = new HashMap<>();
        for (Map.Entry<String, WordEntry> e : entries.entrySet()) {
            normalized.put(normalize(e.getKey()), e.getValue());
        }
        this.entries = Collections.unmodifiableMap(normalized);
    }

    /**
     * Load the curated entries bundled with the application.
     */
    public static LocalDictionary createDefault() {
        try {
            return fromResource(DEFAULT_RESOURCE);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load default dictionary: " + DEFAULT_RESOURCE, e);
        }
    }

    /**
     * Load entries from a classpath resource.
     *
     * @throws IOException if the resource is missing or unreadable
     * @throws IllegalArgumentException if the content is invalid
     */
    public static LocalDictionary fromResource(String resource) throws IOException {
        try (InputStream in = LocalDictionary.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IOException("Dictionary resource not found: " + resource);
            }
            String content = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            return new LocalDictionary(parse(content, resource));
        }
    }

    /**
     * Load entries from a file.
     */
    public static LocalDictionary fromFile(Path file) throws IOException {
        if (!Files.exists(file)) {
            throw new IOException("Dictionary file not found: " + file);
        }
        return new LocalDictionary(parse(Files.readString(file), file.toString()));
    }

    /**
     * Return a dictionary holding these entries plus those in {@code file}; file entries win on conflict.
     */
    public LocalDictionary withEntriesFrom(Path file) throws IOException {
        Map<String, WordEntry> merged = new HashMap<>(entries);
        merged.putAll(fromFile(file).entries);
        return new LocalDictionary(merged);
    }

    static Map<String, WordEntry> parse(String content, String source) {
        JSONObject root = JSON.parseObject(content);
        if (root == null) {
            throw new IllegalArgumentException("Empty dictionary: " + source);
        }

        String version = root.getString("version");
        if (version == null || version.isBlank()) {
            throw new IllegalArgumentException("Missing 'version' field in dictionary " + source);
        }

        JSONArray array = root.getJSONArray("entries");
        if (array == null) {
            throw new IllegalArgumentException("Missing 'entries' array in dictionary " + source);
        }

        Map<String, WordEntry> loaded = new LinkedHashMap<>();
        for (int i = 0; i < array.size(); i++) {
            JSONObject obj = array.getJSONObject(i);
            if (obj == null) {
                throw new IllegalArgumentException("Invalid entry at index " + i + " in " + source);
            }

            String word = obj.getString("word");
            if (word == null || word.isBlank()) {
                throw new IllegalArgumentException("Missing 'word' for entry at index " + i + " in " + source);
            }

            String meaning = obj.getString("meaning");
            if (meaning == null || meaning.isBlank()) {
                throw new IllegalArgumentException("Entry '" + word + "' has no meaning");
            }

            String difficultyLabel = obj.getString("difficulty");
            Difficulty difficulty = Difficulty.fromLabel(difficultyLabel)
                .orElseThrow(() -> new IllegalArgumentException(
                    "Entry '" + word + "' has unknown difficulty: " + difficultyLabel));

            String key = normalize(word);
            if (loaded.containsKey(key)) {
                throw new IllegalArgumentException("Duplicate dictionary word: " + word);
            }

            loaded.put(key, new WordEntry(
                difficulty,
                meaning,
                PartOfSpeech.fromLabel(obj.getString("pos")),
                stringList(obj.getJSONArray("examples")),
                stringList(obj.getJSONArray("synonyms"))
            ));
        }

        logger.info("Loaded dictionary version {}: {} entries from {}", version, loaded.size(), source);
        return loaded;
    }

    private static List<String> stringList(JSONArray array) {
        if (array == null) {
            return List.of();
        }
        return array.toJavaList(String.class);
    }

    private static String normalize(String word) {
        return word.trim().toLowerCase(Locale.ROOT);
    }

    @Override
    public Optional<WordEntry> tryResolve(String word) {
        return Optional.ofNullable(entries.get(normalize(word)));
    }

    public int size() {
        return entries.size();
    }

    @Override
    public String getName() {
        return "local";
    }
}
