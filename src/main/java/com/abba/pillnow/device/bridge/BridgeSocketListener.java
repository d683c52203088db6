package com.abba.pillnow.device.bridge;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;

import java.io.IOException;

@Slf4j
public class BridgeSocketListener extends WebSocketListener {

    private final SerialBridge bridge;
    private final ObjectMapper objectMapper;

    public BridgeSocketListener(SerialBridge bridge, ObjectMapper objectMapper) {
        this.bridge = bridge;
        this.objectMapper = objectMapper;
    }

    public static WebSocket connect(OkHttpClient client, String wsBaseUrl, BridgeSocketListener listener) {
        Request request = new Request.Builder()
                .url(wsBaseUrl + "/ws/device?deviceId=*")
                .build();
        return client.newWebSocket(request, listener);
    }

    @Override
    public void onOpen(WebSocket webSocket, Response response) {
        log.info("Bridge connected to device channel");
    }

    @Override
    public void onMessage(WebSocket webSocket, String text) {
        JsonNode frame;
        try {
            frame = objectMapper.readTree(text);
        } catch (IOException e) {
            log.warn("Dropping malformed frame: {}", e.getMessage());
            return;
        }
        String topic = frame.path("topic").asText("");
        if (topic.endsWith("/cmd")) {
            log.info("Received command on {}", topic);
            bridge.onCommand(frame.path("payload").toString());
        }
    }

    @Override
    public void onClosing(WebSocket webSocket, int code, String reason) {
        log.info("Device channel closing: {} {}", code, reason);
        webSocket.close(code, reason);
    }

    @Override
    public void onFailure(WebSocket webSocket, Throwable t, Response response) {
        log.error("Device channel failure", t);
    }
}
