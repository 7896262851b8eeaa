package pl.marcinmilkowski.vocab_tutor.config;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Application settings loaded from JSON.
 *
 * Expected JSON structure:
 * {
 *   "version": "1.0",
 *   "external_lookup_timeout_ms": 2000,
 *   "mock_latency_ms": 400,
 *   "server_port": 8080,
 *   "credential_file": "~/.vocab-tutor/credentials.properties",
 *   "local_dictionary": "dictionary/local-entries.json",
 *   "extra_dictionary_file": "~/.vocab-tutor/my-words.json",
 *   "tagger_lexicon": "~/.vocab-tutor/lexicon.txt"
 * }
 *
 * Only "version" is required. {@code extraDictionaryFile} and {@code taggerLexicon} are null
 * when not configured.
 */
public record TutorConfig(
    String version,
    Duration externalLookupTimeout,
    Duration mockLatency,
    int serverPort,
    Path credentialFile,
    String localDictionary,
    Path extraDictionaryFile,
    Path taggerLexicon
) {
    private static final Logger logger = LoggerFactory.getLogger(TutorConfig.class);

    public static final String DEFAULT_RESOURCE = "tutor-config.json";

    static final long DEFAULT_TIMEOUT_MS = 2000;
    static final long DEFAULT_MOCK_LATENCY_MS = 400;
    static final int DEFAULT_PORT = 8080;
    static final String DEFAULT_CREDENTIAL_FILE = "~/.vocab-tutor/credentials.properties";
    static final String DEFAULT_DICTIONARY = "dictionary/local-entries.json";

    /**
     * Load configuration from the specified path.
     *
     * @throws IOException if the file cannot be read
     * @throws IllegalArgumentException if the file is invalid
     */
    public static TutorConfig load(Path configPath) throws IOException {
        if (!Files.exists(configPath)) {
            throw new IOException("Tutor config file not found: " + configPath);
        }
        return parse(Files.readString(configPath), configPath.toString());
    }

    /**
     * Load the configuration bundled on the classpath.
     */
    public static TutorConfig loadDefault() {
        try (InputStream in = TutorConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Default config resource missing: " + DEFAULT_RESOURCE);
            }
            return parse(new String(in.readAllBytes(), StandardCharsets.UTF_8), DEFAULT_RESOURCE);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load default config: " + DEFAULT_RESOURCE, e);
        }
    }

    static TutorConfig parse(String content, String source) {
        JSONObject root = JSON.parseObject(content);
        if (root == null) {
            throw new IllegalArgumentException("Empty tutor config: " + source);
        }

        String version = root.getString("version");
        if (version == null || version.isBlank()) {
            throw new IllegalArgumentException("Missing 'version' field in tutor config");
        }

        long timeoutMs = root.getLongValue("external_lookup_timeout_ms", DEFAULT_TIMEOUT_MS);
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("'external_lookup_timeout_ms' must be positive, got " + timeoutMs);
        }

        long latencyMs = root.getLongValue("mock_latency_ms", DEFAULT_MOCK_LATENCY_MS);
        if (latencyMs < 0) {
            throw new IllegalArgumentException("'mock_latency_ms' must not be negative, got " + latencyMs);
        }

        int port = root.getIntValue("server_port", DEFAULT_PORT);
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("'server_port' out of range: " + port);
        }

        String credentialFile = optionalString(root, "credential_file", DEFAULT_CREDENTIAL_FILE);
        String dictionary = optionalString(root, "local_dictionary", DEFAULT_DICTIONARY);
        String extraDictionary = optionalString(root, "extra_dictionary_file", null);
        String lexicon = optionalString(root, "tagger_lexicon", null);

        TutorConfig config = new TutorConfig(
            version,
            Duration.ofMillis(timeoutMs),
            Duration.ofMillis(latencyMs),
            port,
            expandHome(credentialFile),
            dictionary,
            extraDictionary != null ? expandHome(extraDictionary) : null,
            lexicon != null ? expandHome(lexicon) : null);
        logger.info("Loaded tutor config version {} from {}", version, source);
        return config;
    }

    /**
     * Copy of this config listening on another port.
     */
    public TutorConfig withServerPort(int port) {
        return new TutorConfig(version, externalLookupTimeout, mockLatency, port, credentialFile, localDictionary,
            extraDictionaryFile, taggerLexicon);
    }

    // absent key -> fallback; present key must hold a non-blank string
    private static String optionalString(JSONObject root, String key, String fallback) {
        if (!root.containsKey(key)) {
            return fallback;
        }
        String value = root.getString(key);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("'" + key + "' must be a non-empty string");
        }
        return value;
    }

    static Path expandHome(String path) {
        if (path.equals("~") || path.startsWith("~/")) {
            return Path.of(System.getProperty("user.home") + path.substring(1));
        }
        return Path.of(path);
    }
}
