package pl.marcinmilkowski.vocab_tutor;

import com.alibaba.fastjson2.JSONObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import pl.marcinmilkowski.vocab_tutor.config.TutorConfig;
import pl.marcinmilkowski.vocab_tutor.credentials.FileCredentialProvider;
import pl.marcinmilkowski.vocab_tutor.evaluation.EvaluationResult;
import pl.marcinmilkowski.vocab_tutor.evaluation.TutorEngine;
import pl.marcinmilkowski.vocab_tutor.evaluation.UsageVerdict;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for command wiring in Main.
 */
class MainTest {

    @TempDir
    Path tempDir;

    private Path writeConfig(JSONObject extra) throws IOException {
        JSONObject config = new JSONObject();
        config.put("version", "1.0");
        config.put("credential_file", tempDir.resolve("custom.properties").toString());
        config.putAll(extra);
        Path file = tempDir.resolve("tutor.json");
        Files.writeString(file, config.toString());
        return file;
    }

    @Test
    void testCredentialCommandUsesConfiguredFile() throws IOException {
        String configFile = writeConfig(new JSONObject()).toString();
        Path store = tempDir.resolve("custom.properties");

        Main.main(new String[]{"credential", "set", "secret", "--config", configFile});
        assertEquals(Optional.of("secret"), new FileCredentialProvider(store).get());

        Main.main(new String[]{"credential", "--config", configFile, "clear"});
        assertFalse(Files.exists(store));
    }

    @Test
    void testExtraDictionaryFileIsMerged() throws IOException {
        Path extra = tempDir.resolve("extra.json");
        Files.writeString(extra, "{\"version\": \"1.0\", \"entries\": [{\"word\": \"zephyr\", "
            + "\"difficulty\": \"Advanced\", \"meaning\": \"A soft, gentle breeze.\", \"pos\": \"noun\"}]}");
        JSONObject keys = new JSONObject();
        keys.put("extra_dictionary_file", extra.toString());

        TutorEngine engine = Main.createEngine(TutorConfig.load(writeConfig(keys)));

        EvaluationResult zephyr = engine.evaluate("zephyr", "The zephyr was cool.", false);
        assertEquals("A soft, gentle breeze.", zephyr.wordAnalysis().meaning());
        // bundled entries are still there
        assertEquals("Feeling good and joyful.",
            engine.evaluate("happy", "I feel happy.", false).wordAnalysis().meaning());
    }

    @Test
    void testTaggerLexiconOverridesBuiltInRules() throws IOException {
        Path lexicon = tempDir.resolve("lexicon.txt");
        Files.writeString(lexicon, "# custom tags\nresilient RB\n");
        JSONObject keys = new JSONObject();
        keys.put("tagger_lexicon", lexicon.toString());

        TutorEngine custom = Main.createEngine(TutorConfig.load(writeConfig(keys)));
        TutorEngine plain = Main.createEngine(TutorConfig.load(writeConfig(new JSONObject())));

        assertEquals(UsageVerdict.CORRECT,
            plain.evaluate(Main.SAMPLE_WORD, Main.SAMPLE_SENTENCE, false).sentenceFeedback().status());
        assertEquals(UsageVerdict.MOSTLY_CORRECT,
            custom.evaluate(Main.SAMPLE_WORD, Main.SAMPLE_SENTENCE, false).sentenceFeedback().status());
    }
}
