package com.abba.pillnow.infrastructure.verifier;

import com.abba.pillnow.domain.model.DetectedClass;
import com.abba.pillnow.domain.model.PillConfig;
import com.abba.pillnow.domain.model.VerificationResponse;
import com.abba.pillnow.domain.service.VerifierUnavailableException;
import com.abba.pillnow.infrastructure.config.VerifierProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpPillVerifierTest {

    private MockWebServer server;
    private HttpPillVerifier verifier;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        VerifierProperties properties = new VerifierProperties();
        properties.setUrl(server.url("/verify").toString());
        properties.setTimeoutSeconds(2);
        verifier = new HttpPillVerifier(properties, new ObjectMapper());
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void postsImageAndExpectedAsMultipart() throws InterruptedException {
        server.enqueue(new MockResponse()
                .setHeader("Content-Type", "application/json")
                .setBody("""
                        {"pass_": false, "count": 1,
                         "classesDetected": [{"label": "Aspirin", "n": 1}],
                         "confidence": 0.91, "annotatedImagePath": "annotated/a.jpg"}
                        """));

        VerificationResponse response = verifier.verify(new byte[]{1, 2, 3}, null, new PillConfig(2, "Aspirin"));

        assertThat(response.pass()).isFalse();
        assertThat(response.count()).isEqualTo(1);
        assertThat(response.classesDetected()).containsExactly(new DetectedClass("Aspirin", 1));
        assertThat(response.confidence()).isEqualTo(0.91);
        assertThat(response.annotatedImagePath()).isEqualTo("annotated/a.jpg");

        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getHeader("Content-Type")).startsWith("multipart/form-data");
        String body = request.getBody().readUtf8();
        assertThat(body)
                .contains("name=\"image\"; filename=\"capture.jpg\"")
                .contains("Content-Type: image/jpeg")
                .contains("name=\"expected\"")
                .contains("{\"count\":2,\"label\":\"Aspirin\"}");
    }

    @Test
    void missingVerdictIsLeftToTheCaller() {
        server.enqueue(new MockResponse().setBody("{\"count\": 2, \"confidence\": 0.5}"));

        VerificationResponse response = verifier.verify(new byte[]{1}, "image/png", PillConfig.empty());

        assertThat(response.pass()).isNull();
        assertThat(response.classesOrEmpty()).isEmpty();
    }

    @Test
    void errorStatusMeansUnreachable() {
        server.enqueue(new MockResponse().setResponseCode(500).setBody("model not loaded"));

        assertThatThrownBy(() -> verifier.verify(new byte[]{1}, null, PillConfig.empty()))
                .isInstanceOf(VerifierUnavailableException.class)
                .hasMessageContaining("500");
    }

    @Test
    void unreadableBodyMeansUnreachable() {
        server.enqueue(new MockResponse().setBody("<html>gateway</html>"));

        assertThatThrownBy(() -> verifier.verify(new byte[]{1}, null, PillConfig.empty()))
                .isInstanceOf(VerifierUnavailableException.class);
    }

    @Test
    void connectionFailureMeansUnreachable() throws IOException {
        server.shutdown();

        assertThatThrownBy(() -> verifier.verify(new byte[]{1}, null, PillConfig.empty()))
                .isInstanceOf(VerifierUnavailableException.class);
    }
}
