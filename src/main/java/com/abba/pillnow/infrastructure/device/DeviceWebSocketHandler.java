package com.abba.pillnow.infrastructure.device;

import com.abba.pillnow.domain.service.DeviceChannel;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class DeviceWebSocketHandler extends TextWebSocketHandler implements DeviceChannel {

    public static final String BRIDGE_ID = "*";

    private static final Logger log = LoggerFactory.getLogger(DeviceWebSocketHandler.class);
    private static final int SEND_TIME_LIMIT_MS = 5_000;
    private static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final ObjectMapper objectMapper;
    private final DeviceStatusRegistry statusRegistry;

    private final Map<String, WebSocketSession> sessionsById = new ConcurrentHashMap<>();
    private final Map<String, String> deviceBySession = new ConcurrentHashMap<>();
    private final Map<String, String> retained = new ConcurrentHashMap<>();

    public DeviceWebSocketHandler(ObjectMapper objectMapper, DeviceStatusRegistry statusRegistry) {
        this.objectMapper = objectMapper;
        this.statusRegistry = statusRegistry;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        String deviceId = deviceIdOf(session);
        if (deviceId == null) {
            log.warn("Rejecting device connection without deviceId session={}", session.getId());
            closeQuietly(session, CloseStatus.POLICY_VIOLATION);
            return;
        }
        WebSocketSession concurrent = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT);
        sessionsById.put(session.getId(), concurrent);
        deviceBySession.put(session.getId(), deviceId);
        log.info("Device connected device={} session={}", deviceId, session.getId());

        retained.forEach((topic, payload) -> {
            if (BRIDGE_ID.equals(deviceId) || deviceId.equals(deviceOfTopic(topic))) {
                deliver(concurrent, topic, payload);
            }
        });
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        String source = deviceBySession.get(session.getId());
        try {
            JsonNode frame = objectMapper.readTree(message.getPayload());
            String topic = frame.path("topic").asText("");
            if (topic.endsWith("/status")) {
                String deviceId = deviceOfTopic(topic);
                statusRegistry.update(deviceId != null ? deviceId : source, frame.path("payload"));
            } else {
                log.debug("Ignoring frame topic={} from device={}", topic, source);
            }
        } catch (IOException e) {
            log.warn("Dropping malformed frame from device={}: {}", source, e.getMessage());
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        sessionsById.remove(session.getId());
        String deviceId = deviceBySession.remove(session.getId());
        if (deviceId != null && !isConnected(deviceId)) {
            statusRegistry.markOffline(deviceId);
        }
        log.info("Device disconnected device={} status={}", deviceId, status);
    }

    @Override
    public boolean isConnected(String deviceId) {
        for (Map.Entry<String, String> entry : deviceBySession.entrySet()) {
            String connected = entry.getValue();
            if (connected.equals(deviceId) || BRIDGE_ID.equals(connected)) {
                WebSocketSession session = sessionsById.get(entry.getKey());
                if (session != null && session.isOpen()) {
                    return true;
                }
            }
        }
        return false;
    }

    @Override
    public boolean send(String topic, String payload) {
        String deviceId = deviceOfTopic(topic);
        boolean delivered = false;
        for (WebSocketSession session : recipients(deviceId)) {
            delivered |= deliver(session, topic, payload);
        }
        if (!delivered) {
            log.warn("No open session delivered topic={}", topic);
        }
        return delivered;
    }

    @Override
    public boolean retain(String topic, String payload) {
        retained.put(topic, payload);
        return send(topic, payload);
    }

    private List<WebSocketSession> recipients(String deviceId) {
        List<WebSocketSession> result = new ArrayList<>();
        deviceBySession.forEach((sessionId, connected) -> {
            if (connected.equals(deviceId) || BRIDGE_ID.equals(connected)) {
                WebSocketSession session = sessionsById.get(sessionId);
                if (session != null && session.isOpen()) {
                    result.add(session);
                }
            }
        });
        return result;
    }

    private boolean deliver(WebSocketSession session, String topic, String payload) {
        try {
            ObjectNode frame = objectMapper.createObjectNode();
            frame.put("topic", topic);
            frame.set("payload", objectMapper.readTree(payload));
            session.sendMessage(new TextMessage(objectMapper.writeValueAsString(frame)));
            return true;
        } catch (IOException | IllegalStateException e) {
            log.warn("Send failed topic={} session={}: {}", topic, session.getId(), e.getMessage());
            return false;
        }
    }

    static String deviceOfTopic(String topic) {
        if (topic == null) {
            return null;
        }
        String[] parts = topic.split("/");
        return parts.length >= 3 ? parts[parts.length - 2] : null;
    }

    private static String deviceIdOf(WebSocketSession session) {
        if (session.getUri() == null) {
            return null;
        }
        String deviceId = UriComponentsBuilder.fromUri(session.getUri()).build()
                .getQueryParams().getFirst("deviceId");
        return deviceId == null || deviceId.isBlank() ? null : deviceId.trim();
    }

    private static void closeQuietly(WebSocketSession session, CloseStatus status) {
        try {
            session.close(status);
        } catch (IOException e) {
            log.debug("Close failed session={}: {}", session.getId(), e.getMessage());
        }
    }
}
