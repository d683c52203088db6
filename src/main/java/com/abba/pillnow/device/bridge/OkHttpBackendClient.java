package com.abba.pillnow.device.bridge;

import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.time.Duration;

@Slf4j
public class OkHttpBackendClient implements BackendClient {

    private static final MediaType JSON = MediaType.get("application/json");

    private final OkHttpClient httpClient;
    private final String baseUrl;

    public OkHttpBackendClient(String baseUrl) {
        this(baseUrl, new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(8))
                .readTimeout(Duration.ofSeconds(8))
                .build());
    }

    public OkHttpBackendClient(String baseUrl, OkHttpClient httpClient) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.httpClient = httpClient;
    }

    @Override
    public boolean alarmStopped(String containerId) {
        Request request = new Request.Builder()
                .url(baseUrl + "/alarm/stopped/" + containerId)
                .post(RequestBody.create("{}", JSON))
                .build();
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful()) {
                log.warn("Backend rejected alarm-stopped for {}: {}", containerId, response.code());
                return false;
            }
            log.info("Backend alarm-stopped response for {}: {}", containerId, body == null ? "" : body.string());
            return true;
        } catch (IOException e) {
            log.error("Failed to call backend alarm-stopped for {}", containerId, e);
            return false;
        }
    }
}
