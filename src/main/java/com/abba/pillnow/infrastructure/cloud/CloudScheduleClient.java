package com.abba.pillnow.infrastructure.cloud;

import com.abba.pillnow.domain.model.CloudScheduleRow;
import com.abba.pillnow.domain.service.CloudScheduleGateway;
import com.abba.pillnow.domain.service.CloudSyncException;
import com.abba.pillnow.infrastructure.config.CloudProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

@Component
public class CloudScheduleClient implements CloudScheduleGateway {

    private static final Logger log = LoggerFactory.getLogger(CloudScheduleClient.class);

    private final CloudProperties properties;
    private final ObjectMapper objectMapper;
    private final OkHttpClient client;

    public CloudScheduleClient(CloudProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.client = new OkHttpClient.Builder()
                .connectTimeout(properties.getTimeoutSeconds(), TimeUnit.SECONDS)
                .readTimeout(properties.getTimeoutSeconds(), TimeUnit.SECONDS)
                .build();
    }

    @Override
    public List<CloudScheduleRow> fetchSchedules(String elderId) {
        JsonNode rows = dataArray(get("/api/medication_schedules"));
        List<CloudScheduleRow> result = new ArrayList<>();
        for (JsonNode row : rows) {
            if (elderId != null && !elderId.isBlank() && !belongsTo(row, elderId.trim())) {
                continue;
            }
            result.add(new CloudScheduleRow(
                    firstText(row, "_id", "scheduleId"),
                    scalar(row.get("container")),
                    row.path("date").asText(null),
                    row.path("time").asText(null),
                    firstText(row, "medication", "medicationId"),
                    row.hasNonNull("pillCount") ? row.get("pillCount").asInt() : null,
                    row.path("status").asText(null)
            ));
        }
        log.debug("Fetched {} cloud schedule row(s) elderId={}", result.size(), elderId);
        return result;
    }

    @Override
    public Optional<String> findMedicationLabel(String medicationId) {
        if (medicationId == null || medicationId.isBlank()) {
            return Optional.empty();
        }
        for (JsonNode medication : dataArray(get("/api/medications"))) {
            if (medicationId.equals(firstText(medication, "medId", "_id"))) {
                String name = medication.path("name").asText(null);
                return name == null || name.isBlank() ? Optional.empty() : Optional.of(name);
            }
        }
        return Optional.empty();
    }

    private JsonNode get(String path) {
        HttpUrl url = HttpUrl.parse(properties.getBaseUrl() + path);
        if (url == null) {
            throw new CloudSyncException("Invalid cloud base URL: " + properties.getBaseUrl());
        }
        Request.Builder builder = new Request.Builder()
                .url(url)
                .get()
                .addHeader("Cache-Control", "no-cache");
        if (properties.getToken() != null && !properties.getToken().isBlank()) {
            builder.addHeader("Authorization", "Bearer " + properties.getToken());
        }

        try (Response response = client.newCall(builder.build()).execute()) {
            String body = response.body() != null ? response.body().string() : "";
            if (!response.isSuccessful()) {
                throw new CloudSyncException("Cloud request " + path + " failed. status=" + response.code());
            }
            return objectMapper.readTree(body);
        } catch (IOException e) {
            log.error("Error calling cloud database {}", path, e);
            throw new CloudSyncException("Cloud database unreachable", e);
        }
    }

    private static JsonNode dataArray(JsonNode root) {
        if (root == null) {
            return MissingNode.getInstance();
        }
        return root.isArray() ? root : root.path("data");
    }

    private static boolean belongsTo(JsonNode row, String elderId) {
        return Objects.equals(elderId, firstText(row, "user", "elderId"));
    }

    private static Object scalar(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        return node.isNumber() ? (Object) node.asLong() : node.asText();
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && !value.isNull() && !value.asText().isBlank()) {
                return value.asText();
            }
        }
        return null;
    }
}
