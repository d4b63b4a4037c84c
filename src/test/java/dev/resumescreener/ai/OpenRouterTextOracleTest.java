package dev.resumescreener.ai;

import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.*;
import reactor.test.StepVerifier;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class OpenRouterTextOracleTest {

    private MockWebServer mockWebServer;
    private OpenRouterTextOracle oracle;

    @BeforeEach
    void setUp() throws IOException {
        mockWebServer = new MockWebServer();
        mockWebServer.start();

        String baseUrl = mockWebServer.url("/api/v1").toString();
        oracle = new OpenRouterTextOracle("test-api-key", "google/gemini-2.0-flash-001", baseUrl);
    }

    @AfterEach
    void tearDown() throws IOException {
        mockWebServer.shutdown();
    }

    @Test
    @DisplayName("Should send a chat completion and return the first choice")
    void shouldReturnFirstChoice() throws InterruptedException {
        mockWebServer.enqueue(new MockResponse()
                .setBody("""
                        {"choices": [{"message": {"role": "assistant", "content": "[\\"Java\\"]"}}]}
                        """)
                .setHeader("Content-Type", "application/json"));

        StepVerifier.create(oracle.invoke("Which skills match?", 500))
                .assertNext(text -> assertThat(text).isEqualTo("[\"Java\"]"))
                .verifyComplete();

        RecordedRequest request = mockWebServer.takeRequest();
        assertThat(request.getPath()).isEqualTo("/api/v1/chat/completions");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer test-api-key");
        assertThat(request.getBody().readUtf8()).contains("\"max_tokens\":500")
                .contains("\"model\":\"google/gemini-2.0-flash-001\"");
    }

    @Test
    @DisplayName("Should map provider outages to a throttled error")
    void shouldMapOutageToThrottled() {
        mockWebServer.enqueue(new MockResponse().setResponseCode(503));

        StepVerifier.create(oracle.invoke("prompt", 100))
                .expectError(OracleThrottledException.class)
                .verify();
    }

    @Test
    @DisplayName("Should treat an empty message as a parse error")
    void shouldTreatEmptyMessageAsParseError() {
        mockWebServer.enqueue(new MockResponse()
                .setBody("{\"choices\": [{\"message\": {\"content\": \"\"}}]}")
                .setHeader("Content-Type", "application/json"));

        StepVerifier.create(oracle.invoke("prompt", 100))
                .expectError(OracleParseException.class)
                .verify();
    }

    @Test
    @DisplayName("Should be disabled without an API key")
    void shouldBeDisabledWithoutKey() {
        OpenRouterTextOracle noKey = new OpenRouterTextOracle("", "model", "http://localhost");

        assertThat(noKey.isEnabled()).isFalse();
        assertThat(noKey.getName()).isEqualTo("openrouter");
    }
}
