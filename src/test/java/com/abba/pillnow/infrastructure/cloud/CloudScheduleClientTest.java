package com.abba.pillnow.infrastructure.cloud;

import com.abba.pillnow.domain.model.CloudScheduleRow;
import com.abba.pillnow.domain.service.CloudSyncException;
import com.abba.pillnow.infrastructure.config.CloudProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CloudScheduleClientTest {

    private MockWebServer server;
    private CloudProperties properties;
    private CloudScheduleClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        properties = new CloudProperties();
        String base = server.url("/").toString();
        properties.setBaseUrl(base.substring(0, base.length() - 1));
        properties.setTimeoutSeconds(2);
        client = new CloudScheduleClient(properties, new ObjectMapper());
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void readsDataArrayAndFiltersByElder() throws InterruptedException {
        properties.setToken("secret");
        server.enqueue(new MockResponse().setBody("""
                {"success": true, "data": [
                  {"_id": "s1", "user": "elder-1", "container": 2, "date": "2026-10-18T00:00:00.000Z",
                   "time": "08:00", "medication": "m1", "pillCount": 2, "status": "Pending"},
                  {"_id": "s2", "user": "elder-2", "container": "container1", "time": "09:00"},
                  {"scheduleId": "s3", "elderId": "elder-1", "container": "morning", "time": "07:30"}
                ]}
                """));

        List<CloudScheduleRow> rows = client.fetchSchedules("elder-1");

        assertThat(rows).extracting(CloudScheduleRow::id).containsExactly("s1", "s3");
        CloudScheduleRow first = rows.get(0);
        assertThat(first.container()).isEqualTo(2L);
        assertThat(first.medicationId()).isEqualTo("m1");
        assertThat(first.pillCount()).isEqualTo(2);
        assertThat(rows.get(1).container()).isEqualTo("morning");
        assertThat(rows.get(1).pillCount()).isNull();

        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/api/medication_schedules");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer secret");
    }

    @Test
    void acceptsRootArrayWithoutFilter() {
        server.enqueue(new MockResponse().setBody("[{\"_id\": \"s1\", \"container\": \"3\", \"time\": \"21:00\"}]"));

        assertThat(client.fetchSchedules(null)).singleElement()
                .satisfies(row -> assertThat(row.container()).isEqualTo("3"));
    }

    @Test
    void findsMedicationLabel() {
        server.enqueue(new MockResponse().setBody("""
                [{"medId": "m1", "name": "Losartan"}, {"_id": "m2", "name": "Aspirin"}]
                """));
        server.enqueue(new MockResponse().setBody("""
                [{"medId": "m1", "name": "Losartan"}, {"_id": "m2", "name": "Aspirin"}]
                """));

        assertThat(client.findMedicationLabel("m2")).contains("Aspirin");
        assertThat(client.findMedicationLabel("m9")).isEmpty();
    }

    @Test
    void failedRequestRaisesCloudSyncException() {
        server.enqueue(new MockResponse().setResponseCode(503));

        assertThatThrownBy(() -> client.fetchSchedules(null))
                .isInstanceOf(CloudSyncException.class)
                .hasMessageContaining("503");
    }
}
