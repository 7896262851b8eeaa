package pl.marcinmilkowski.vocab_tutor.api;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import pl.marcinmilkowski.vocab_tutor.credentials.InMemoryCredentialProvider;
import pl.marcinmilkowski.vocab_tutor.dictionary.EntryResolver;
import pl.marcinmilkowski.vocab_tutor.dictionary.ExternalSourceStrategy;
import pl.marcinmilkowski.vocab_tutor.dictionary.HeuristicEntryBuilder;
import pl.marcinmilkowski.vocab_tutor.dictionary.LocalDictionary;
import pl.marcinmilkowski.vocab_tutor.dictionary.MockExternalDictionary;
import pl.marcinmilkowski.vocab_tutor.evaluation.TutorEngine;
import pl.marcinmilkowski.vocab_tutor.tagging.SimpleTagger;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TutorApiServer running on an ephemeral port.
 */
class TutorApiServerTest {

    private TutorApiServer server;
    private InMemoryCredentialProvider credentials;
    private final HttpClient client = HttpClient.newHttpClient();

    @BeforeEach
    void setUp() throws IOException {
        EntryResolver resolver = new EntryResolver(
            LocalDictionary.createDefault(),
            new ExternalSourceStrategy(new MockExternalDictionary(Duration.ZERO), Duration.ofSeconds(5)),
            new HeuristicEntryBuilder());
        credentials = new InMemoryCredentialProvider();
        server = TutorApiServer.builder()
            .withEngine(new TutorEngine(resolver, SimpleTagger.create()))
            .withCredentials(credentials)
            .withPort(0)
            .build();
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    private HttpResponse<String> send(HttpRequest.Builder request) throws IOException, InterruptedException {
        return client.send(request.build(), HttpResponse.BodyHandlers.ofString());
    }

    private HttpRequest.Builder request(String pathAndQuery) {
        return HttpRequest.newBuilder(URI.create("http://localhost:" + server.getPort() + pathAndQuery));
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    @Test
    void testHealth() throws Exception {
        HttpResponse<String> response = send(request("/health"));
        assertEquals(200, response.statusCode());
        assertEquals("ok", JSON.parseObject(response.body()).getString("status"));
    }

    @Test
    void testEvaluate() throws Exception {
        HttpResponse<String> response = send(request("/api/evaluate?word=resilient&sentence="
            + encode("I am resilient when I feel sad.")));
        assertEquals(200, response.statusCode());

        JSONObject feedback = JSON.parseObject(response.body()).getJSONObject("sentenceFeedback");
        assertEquals("Correct", feedback.getString("status"));
        assertEquals("", feedback.getString("correctedSentence"));
    }

    @Test
    void testMissingSentence() throws Exception {
        HttpResponse<String> response = send(request("/api/evaluate?word=resilient"));
        assertEquals(400, response.statusCode());
        assertTrue(JSON.parseObject(response.body()).getString("error").contains("sentence"));
    }

    @Test
    void testStoredCredentialEnablesExternalSource() throws Exception {
        String query = "/api/evaluate?word=zephyr&sentence=" + encode("A zephyr blew.");

        JSONObject offline = JSON.parseObject(send(request(query)).body()).getJSONObject("wordAnalysis");
        assertTrue(offline.getString("meaning").startsWith("Zephyr — "));

        HttpResponse<String> stored = send(request("/api/credential")
            .POST(HttpRequest.BodyPublishers.ofString("secret-key")));
        assertEquals(200, stored.statusCode());
        assertEquals("secret-key", credentials.get().orElseThrow());

        JSONObject online = JSON.parseObject(send(request(query)).body()).getJSONObject("wordAnalysis");
        assertEquals("A mock meaning for zephyr. (This is a demo fallback.)", online.getString("meaning"));

        // explicit flag wins over the stored key
        JSONObject forced = JSON.parseObject(send(request(query + "&external=false")).body()).getJSONObject("wordAnalysis");
        assertTrue(forced.getString("meaning").startsWith("Zephyr — "));
    }

    @Test
    void testCredentialLifecycle() throws Exception {
        assertFalse(JSON.parseObject(send(request("/api/credential")).body()).getBooleanValue("stored"));

        HttpResponse<String> blank = send(request("/api/credential").POST(HttpRequest.BodyPublishers.ofString(" ")));
        assertEquals(400, blank.statusCode());

        send(request("/api/credential").POST(HttpRequest.BodyPublishers.ofString("k")));
        assertTrue(JSON.parseObject(send(request("/api/credential")).body()).getBooleanValue("stored"));

        HttpResponse<String> deleted = send(request("/api/credential").DELETE());
        assertEquals(200, deleted.statusCode());
        assertTrue(credentials.get().isEmpty());
    }

    @Test
    void testQueryParamParsing() {
        var params = TutorApiServer.parseQueryParams("word=caf%C3%A9&sentence=a+b&broken&x=%zz");
        assertEquals("café", params.get("word"));
        assertEquals("a b", params.get("sentence"));
        assertFalse(params.containsKey("broken"));
        assertFalse(params.containsKey("x"));
    }
}
