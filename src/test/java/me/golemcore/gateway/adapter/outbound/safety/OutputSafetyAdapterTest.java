package me.golemcore.gateway.adapter.outbound.safety;

import me.golemcore.gateway.domain.model.CollaboratorException;
import me.golemcore.gateway.domain.model.Deadline;
import me.golemcore.gateway.domain.model.HandlingPath;
import me.golemcore.gateway.domain.model.RiskLevel;
import me.golemcore.gateway.domain.model.SafetyReview;
import me.golemcore.gateway.infrastructure.config.GatewayConfiguration;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.infrastructure.http.FeignClientFactory;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class OutputSafetyAdapterTest {

    private static final String CONTENT_TYPE = "Content-Type";
    private static final String APPLICATION_JSON = "application/json";

    private MockWebServer mockServer;
    private OutputSafetyAdapter adapter;

    @BeforeEach
    void setUp() throws IOException {
        mockServer = new MockWebServer();
        mockServer.start();

        GatewayProperties properties = new GatewayProperties();
        properties.getSafety().setUrl(mockServer.url("").toString().replaceAll("/$", ""));
        properties.getSafety().setTimeout(Duration.ofMillis(500));

        FeignClientFactory factory = new FeignClientFactory(new OkHttpClient(), GatewayConfiguration.objectMapper());
        adapter = new OutputSafetyAdapter(properties, factory);
    }

    @AfterEach
    void tearDown() throws IOException {
        mockServer.shutdown();
    }

    private static Deadline deadline() {
        return Deadline.after(Clock.systemUTC(), Duration.ofSeconds(10));
    }

    private MockResponse json(String body) {
        return new MockResponse().setBody(body).setHeader(CONTENT_TYPE, APPLICATION_JSON);
    }

    @Test
    void shouldSendReviewRequestAndParseVerdict() throws Exception {
        mockServer.enqueue(json("{\"final_answer\":\"Safe answer\",\"was_modified\":true,"
                + "\"reason_flags\":[\"pii_removed\"]}"));

        SafetyReview review = adapter.review("Email me at EMAIL_TOKEN_1", "draft", RiskLevel.HIGH,
                List.of("prompt_injection"), HandlingPath.SLOW, deadline());

        assertEquals("Safe answer", review.getFinalAnswer());
        assertTrue(review.isWasModified());
        assertEquals(List.of("pii_removed"), review.getReasonFlags());

        RecordedRequest request = mockServer.takeRequest();
        assertEquals("POST", request.getMethod());
        assertEquals("/v1/output-safety", request.getPath());
        String body = request.getBody().readUtf8();
        assertTrue(body.contains("\"user_prompt\":\"Email me at EMAIL_TOKEN_1\""));
        assertTrue(body.contains("\"draft_answer\":\"draft\""));
        assertTrue(body.contains("\"risk_level\":\"HIGH\""));
        assertTrue(body.contains("\"flags\":[\"prompt_injection\"]"));
        assertTrue(body.contains("\"mode\":\"slow\""));
    }

    @Test
    void shouldDefaultMissingFieldsOfVerdict() {
        mockServer.enqueue(json("{\"final_answer\":\"ok\"}"));

        SafetyReview review = adapter.review("q", "ok", RiskLevel.LOW, List.of(), HandlingPath.FAST, deadline());

        assertEquals("ok", review.getFinalAnswer());
        assertFalse(review.isWasModified());
        assertTrue(review.getReasonFlags().isEmpty());
    }

    @Test
    void shouldFailWithoutFinalAnswer() {
        mockServer.enqueue(json("{\"was_modified\":false}"));

        assertThrows(CollaboratorException.class,
                () -> adapter.review("q", "d", RiskLevel.LOW, List.of(), HandlingPath.FAST, deadline()));
    }

    @Test
    void shouldFailOnServerError() {
        mockServer.enqueue(new MockResponse().setResponseCode(503));

        assertThrows(CollaboratorException.class,
                () -> adapter.review("q", "d", RiskLevel.LOW, List.of(), HandlingPath.FAST, deadline()));
    }

    @Test
    void shouldFailWhenServiceIsSlowerThanTimeout() {
        mockServer.enqueue(json("{\"final_answer\":\"late\"}").setHeadersDelay(3, TimeUnit.SECONDS));

        assertThrows(CollaboratorException.class,
                () -> adapter.review("q", "d", RiskLevel.LOW, List.of(), HandlingPath.FAST, deadline()));
    }

    @Test
    void shouldNotCallServiceAfterDeadline() {
        Deadline expired = Deadline.after(Clock.systemUTC(), Duration.ZERO);

        assertThrows(CollaboratorException.class,
                () -> adapter.review("q", "d", RiskLevel.LOW, List.of(), HandlingPath.FAST, expired));
        assertEquals(0, mockServer.getRequestCount());
    }
}
