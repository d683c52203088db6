package com.abba.pillnow.infrastructure.web;

import com.abba.pillnow.application.dto.IngestOutcome;
import com.abba.pillnow.application.dto.IngestRequest;
import com.abba.pillnow.domain.model.DetectedClass;
import com.abba.pillnow.domain.model.PillConfig;
import com.abba.pillnow.domain.model.VerificationResult;
import com.abba.pillnow.domain.service.IngestService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(IngestController.class)
class IngestControllerTest {

    private static final MockMultipartFile IMAGE =
            new MockMultipartFile("image", "capture.jpg", "image/jpeg", new byte[]{(byte) 0xFF, (byte) 0xD8, 1});

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private IngestService ingestService;

    @Test
    void mismatchIsReportedWithAlertFlag() throws Exception {
        VerificationResult result = VerificationResult.builder()
                .containerId(2)
                .deviceId("container2")
                .pass(false)
                .detectedCount(1)
                .detectedClasses(List.of(new DetectedClass("Aspirin", 1)))
                .expected(new PillConfig(2, "Aspirin"))
                .build();
        when(ingestService.ingest(any(IngestRequest.class))).thenReturn(IngestOutcome.verified(result, true));

        mockMvc.perform(multipart("/ingest/container2/container2")
                        .file(IMAGE)
                        .param("meta", "{\"expected\": {\"count\": 2, \"label\": \"Aspirin\"}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.status").value("verified"))
                .andExpect(jsonPath("$.result.pass").value(false))
                .andExpect(jsonPath("$.alertPublished").value(true));

        ArgumentCaptor<IngestRequest> request = ArgumentCaptor.forClass(IngestRequest.class);
        verify(ingestService).ingest(request.capture());
        assertThat(request.getValue().deviceId()).isEqualTo("container2");
        assertThat(request.getValue().expected()).isEqualTo(new PillConfig(2, "Aspirin"));
        assertThat(request.getValue().contentType()).isEqualTo("image/jpeg");
    }

    @Test
    void unreadableMetaFallsBackToStoredConfig() throws Exception {
        when(ingestService.ingest(any(IngestRequest.class)))
                .thenReturn(IngestOutcome.verified(VerificationResult.builder().containerId(1).pass(true).build(), false));

        mockMvc.perform(multipart("/ingest/pillbox/1").file(IMAGE).param("meta", "not json"))
                .andExpect(status().isOk());

        ArgumentCaptor<IngestRequest> request = ArgumentCaptor.forClass(IngestRequest.class);
        verify(ingestService).ingest(request.capture());
        assertThat(request.getValue().expected()).isNull();
    }

    @Test
    void unreachableVerifierIsBadGateway() throws Exception {
        when(ingestService.ingest(any(IngestRequest.class)))
                .thenReturn(IngestOutcome.verifierUnreachable("Verifier unreachable: connection refused"));

        mockMvc.perform(multipart("/ingest/container1/container1").file(IMAGE))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.status").value("verifier_unreachable"));
    }

    @Test
    void missingImageIsBadRequest() throws Exception {
        mockMvc.perform(multipart("/ingest/container1/container1").param("meta", "{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false));

        verify(ingestService, never()).ingest(any());
    }

    @Test
    void latestVerificationIsNotFoundBeforeFirstIngest() throws Exception {
        when(ingestService.getVerification(3)).thenReturn(Optional.empty());

        mockMvc.perform(get("/containers/container3/verification"))
                .andExpect(status().isNotFound());
    }
}
