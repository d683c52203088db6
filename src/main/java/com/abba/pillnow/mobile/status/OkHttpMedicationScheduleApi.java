package com.abba.pillnow.mobile.status;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Slf4j
public class OkHttpMedicationScheduleApi implements MedicationScheduleApi {

    public static final String DEFAULT_BASE_URL = "https://pillnow-database.onrender.com";
    private static final String PATH = "/api/medication_schedules";
    private static final MediaType JSON = MediaType.get("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String token;

    public OkHttpMedicationScheduleApi(String baseUrl, String token, OkHttpClient httpClient, ObjectMapper objectMapper) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.token = token;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean patchStatus(String scheduleId, String status) throws IOException {
        byte[] body = objectMapper.writeValueAsBytes(Map.of("status", status));
        return execute(request(PATH + "/" + scheduleId).patch(RequestBody.create(body, JSON)).build());
    }

    @Override
    public boolean putSchedule(String scheduleId, CachedSchedule schedule) throws IOException {
        byte[] body = objectMapper.writeValueAsBytes(schedule);
        return execute(request(PATH + "/" + scheduleId).put(RequestBody.create(body, JSON)).build());
    }

    @Override
    public List<CachedSchedule> listSchedules() throws IOException {
        try (Response response = httpClient.newCall(request(PATH).get().build()).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                throw new IOException("Schedule listing failed with code: " + response.code());
            }
            JsonNode root = objectMapper.readTree(body.byteStream());
            JsonNode rows = root.isArray() ? root : root.path("data");
            List<CachedSchedule> schedules = new ArrayList<>();
            for (JsonNode row : rows) {
                schedules.add(objectMapper.treeToValue(row, CachedSchedule.class));
            }
            return schedules;
        }
    }

    private Request.Builder request(String path) {
        Request.Builder builder = new Request.Builder().url(baseUrl + path);
        if (token != null && !token.isBlank()) {
            builder.header("Authorization", "Bearer " + token.trim());
        }
        return builder;
    }

    private boolean execute(Request request) throws IOException {
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                log.warn("{} {} returned {}", request.method(), request.url().encodedPath(), response.code());
            }
            return response.isSuccessful();
        }
    }
}
