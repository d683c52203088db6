package com.abba.pillnow.infrastructure.verifier;

import com.abba.pillnow.domain.model.DetectedClass;
import com.abba.pillnow.domain.model.PillConfig;
import com.abba.pillnow.domain.model.VerificationResponse;
import com.abba.pillnow.domain.service.PillVerifier;
import com.abba.pillnow.domain.service.VerifierUnavailableException;
import com.abba.pillnow.infrastructure.config.VerifierProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.MediaType;
import okhttp3.MultipartBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

@Component
public class HttpPillVerifier implements PillVerifier {

    private static final Logger log = LoggerFactory.getLogger(HttpPillVerifier.class);
    private static final String DEFAULT_CONTENT_TYPE = "image/jpeg";

    private final VerifierProperties properties;
    private final ObjectMapper objectMapper;
    private final OkHttpClient client;

    public HttpPillVerifier(VerifierProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.client = new OkHttpClient.Builder()
                .connectTimeout(properties.getTimeoutSeconds(), TimeUnit.SECONDS)
                .readTimeout(properties.getTimeoutSeconds(), TimeUnit.SECONDS)
                .writeTimeout(properties.getTimeoutSeconds(), TimeUnit.SECONDS)
                .build();
    }

    @Override
    public VerificationResponse verify(byte[] image, String contentType, PillConfig expected) {
        String mediaType = contentType == null || contentType.isBlank() ? DEFAULT_CONTENT_TYPE : contentType;
        RequestBody body;
        try {
            body = new MultipartBody.Builder()
                    .setType(MultipartBody.FORM)
                    .addFormDataPart("image", "capture.jpg", RequestBody.create(image, MediaType.parse(mediaType)))
                    .addFormDataPart("expected", objectMapper.writeValueAsString(expected == null ? PillConfig.empty() : expected))
                    .build();
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot serialize expected pill config", e);
        }

        Request request = new Request.Builder()
                .url(properties.getUrl())
                .post(body)
                .build();

        try (Response response = client.newCall(request).execute()) {
            String responseBody = response.body() != null ? response.body().string() : "";
            if (!response.isSuccessful()) {
                log.warn("Verifier answered status={} body={}", response.code(), abbreviate(responseBody));
                throw new VerifierUnavailableException("Verifier returned status " + response.code());
            }
            return parse(objectMapper.readTree(responseBody));
        } catch (IOException e) {
            log.warn("Verifier call to {} failed: {}", properties.getUrl(), e.getMessage());
            throw new VerifierUnavailableException("Verifier unreachable: " + e.getMessage(), e);
        }
    }

    private VerificationResponse parse(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new VerifierUnavailableException("Verifier returned an unreadable body");
        }
        JsonNode passNode = root.has("pass_") ? root.get("pass_") : root.get("pass");
        Boolean pass = passNode == null || passNode.isNull() ? null : passNode.asBoolean();

        List<DetectedClass> classes = new ArrayList<>();
        for (JsonNode node : root.path("classesDetected")) {
            classes.add(new DetectedClass(node.path("label").asText(null), node.path("n").asInt(0)));
        }
        return new VerificationResponse(
                pass,
                root.path("count").asInt(0),
                classes,
                root.path("confidence").asDouble(0.0),
                root.path("annotatedImagePath").asText(null)
        );
    }

    private static String abbreviate(String value) {
        return value.length() > 200 ? value.substring(0, 200) + "..." : value;
    }
}
