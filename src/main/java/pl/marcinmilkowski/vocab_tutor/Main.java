package pl.marcinmilkowski.vocab_tutor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.vocab_tutor.api.TutorApiServer;
import pl.marcinmilkowski.vocab_tutor.api.TutorResponseWriter;
import pl.marcinmilkowski.vocab_tutor.config.TutorConfig;
import pl.marcinmilkowski.vocab_tutor.credentials.CredentialProvider;
import pl.marcinmilkowski.vocab_tutor.credentials.FileCredentialProvider;
import pl.marcinmilkowski.vocab_tutor.dictionary.EntryResolver;
import pl.marcinmilkowski.vocab_tutor.dictionary.ExternalSourceStrategy;
import pl.marcinmilkowski.vocab_tutor.dictionary.HeuristicEntryBuilder;
import pl.marcinmilkowski.vocab_tutor.dictionary.LocalDictionary;
import pl.marcinmilkowski.vocab_tutor.dictionary.MockExternalDictionary;
import pl.marcinmilkowski.vocab_tutor.evaluation.EvaluationResult;
import pl.marcinmilkowski.vocab_tutor.evaluation.TutorEngine;
import pl.marcinmilkowski.vocab_tutor.tagging.SimpleTagger;

import java.io.IOException;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Main entry point for the vocabulary tutor.
 *
 * Commands:
 *   evaluate --word resilient --sentence "I am resilient when I feel sad."
 *   server --port 8080
 *   credential set|show|clear
 */
public class Main {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    static final String SAMPLE_WORD = "resilient";
    static final String SAMPLE_SENTENCE = "I am resilient when I feel sad.";

    public static void main(String[] args) {
        if (args.length == 0) {
            showUsage();
            return;
        }

        try {
            String command = args[0].toLowerCase();

            switch (command) {
                case "evaluate":
                    handleEvaluateCommand(args);
                    break;
                case "server":
                    handleServerCommand(args);
                    break;
                case "credential":
                    handleCredentialCommand(args);
                    break;
                case "help":
                    showUsage();
                    break;
                default:
                    logger.error("Unknown command: " + command);
                    showUsage();
            }
        } catch (Exception e) {
            logger.error("Application error", e);
            System.err.println("Error: " + e.getMessage());
            System.err.println("Use 'help' command for usage information.");
        }
    }

    private static void showUsage() {
        System.out.println("Usage: java -jar vocab-tutor.jar <command> [options]");
        System.out.println();
        System.out.println("Commands:");
        System.out.println("  evaluate [--word <word>] [--sentence <text>] [--external | --no-external]");
        System.out.println("      Evaluate how a word is used in a sentence and print JSON feedback");
        System.out.println("      Without --external/--no-external the external dictionary is used");
        System.out.println("      only when an API key is stored");
        System.out.println();
        System.out.println("  server [--port <port>]");
        System.out.println("      Start REST API server");
        System.out.println();
        System.out.println("  credential set <key> | show | clear");
        System.out.println("      Manage the external dictionary API key");
        System.out.println();
        System.out.println("Global options:");
        System.out.println("  --config <file>   Tutor configuration JSON (default: bundled tutor-config.json)");
        System.out.println();
        System.out.println("Examples:");
        System.out.println("  java -jar vocab-tutor.jar evaluate --word resilient \\");
        System.out.println("    --sentence \"I am resilient when I feel sad.\"");
        System.out.println();
        System.out.println("  curl 'http://localhost:8080/api/evaluate?word=happy&sentence=I%20feel%20happy'");
    }

    private static void handleEvaluateCommand(String[] args) throws IOException {
        String word = SAMPLE_WORD;
        String sentence = SAMPLE_SENTENCE;
        Boolean external = null;
        String configPath = null;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--word":
                case "-w":
                    word = args[++i];
                    break;
                case "--sentence":
                case "-s":
                    sentence = args[++i];
                    break;
                case "--external":
                    external = true;
                    break;
                case "--no-external":
                    external = false;
                    break;
                case "--config":
                    configPath = args[++i];
                    break;
                default:
                    System.err.println("Unknown option: " + args[i]);
            }
        }

        TutorConfig config = loadConfig(configPath);
        CredentialProvider credentials = new FileCredentialProvider(config.credentialFile());
        boolean useExternal = external != null ? external : credentials.get().isPresent();

        EvaluationResult result = createEngine(config).evaluate(word, sentence, useExternal);
        System.out.println(TutorResponseWriter.toJson(result));
    }

    private static void handleServerCommand(String[] args) throws IOException {
        Integer port = null;
        String configPath = null;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--port":
                case "-p":
                    port = Integer.parseInt(args[++i]);
                    break;
                case "--config":
                    configPath = args[++i];
                    break;
                default:
                    System.err.println("Unknown option: " + args[i]);
            }
        }

        TutorConfig config = loadConfig(configPath);
        if (port != null) {
            config = config.withServerPort(port);
        }

        TutorApiServer server = TutorApiServer.builder()
            .withEngine(createEngine(config))
            .withCredentials(new FileCredentialProvider(config.credentialFile()))
            .withPort(config.serverPort())
            .build();
        server.start();
        Runtime.getRuntime().addShutdownHook(new Thread(server::stop));

        System.out.println("Tutor API listening on http://localhost:" + server.getPort());
        System.out.println("Press Ctrl+C to stop.");
    }

    private static void handleCredentialCommand(String[] args) throws IOException {
        List<String> positional = new ArrayList<>();
        String configPath = null;

        for (int i = 1; i < args.length; i++) {
            if (args[i].equals("--config")) {
                configPath = args[++i];
            } else {
                positional.add(args[i]);
            }
        }

        if (positional.isEmpty()) {
            System.err.println("Error: credential requires one of: set <key>, show, clear");
            return;
        }

        TutorConfig config = loadConfig(configPath);
        CredentialProvider credentials = new FileCredentialProvider(config.credentialFile());

        switch (positional.get(0)) {
            case "set":
                if (positional.size() < 2) {
                    System.err.println("Error: credential set requires a key");
                    return;
                }
                System.out.println(credentials.set(positional.get(1)) ? "API key stored." : "API key rejected.");
                break;
            case "show":
                System.out.println(credentials.get().isPresent() ? "An API key is stored." : "No API key stored.");
                break;
            case "clear":
                credentials.clear();
                System.out.println("API key removed.");
                break;
            default:
                System.err.println("Unknown credential action: " + positional.get(0));
        }
    }

    private static TutorConfig loadConfig(String configPath) throws IOException {
        return configPath != null ? TutorConfig.load(Paths.get(configPath)) : TutorConfig.loadDefault();
    }

    static TutorEngine createEngine(TutorConfig config) throws IOException {
        LocalDictionary local = LocalDictionary.fromResource(config.localDictionary());
        if (config.extraDictionaryFile() != null) {
            local = local.withEntriesFrom(config.extraDictionaryFile());
        }
        SimpleTagger tagger = config.taggerLexicon() != null
            ? SimpleTagger.create(config.taggerLexicon())
            : SimpleTagger.create();

        EntryResolver resolver = new EntryResolver(
            local,
            new ExternalSourceStrategy(new MockExternalDictionary(config.mockLatency()), config.externalLookupTimeout()),
            new HeuristicEntryBuilder());
        return new TutorEngine(resolver, tagger);
    }
}
