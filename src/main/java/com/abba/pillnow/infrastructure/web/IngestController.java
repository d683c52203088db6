package com.abba.pillnow.infrastructure.web;

import com.abba.pillnow.application.dto.IngestOutcome;
import com.abba.pillnow.application.dto.IngestRequest;
import com.abba.pillnow.domain.model.ContainerIds;
import com.abba.pillnow.domain.model.PillConfig;
import com.abba.pillnow.domain.model.VerificationResult;
import com.abba.pillnow.domain.service.IngestService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@Slf4j
@RequiredArgsConstructor
public class IngestController {

    private final IngestService ingestService;
    private final ObjectMapper objectMapper;

    @PostMapping(value = "/ingest/{deviceId}/{container}", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<Map<String, Object>> ingest(@PathVariable String deviceId,
                                                      @PathVariable String container,
                                                      @RequestPart(value = "image", required = false) MultipartFile image,
                                                      @RequestParam(value = "meta", required = false) String meta) throws IOException {
        if (image == null || image.isEmpty()) {
            return ResponseEntity.badRequest()
                    .body(Map.of("success", false, "message", "Missing image file under field name \"image\""));
        }
        IngestOutcome outcome = ingestService.ingest(new IngestRequest(
                deviceId, container, image.getBytes(), image.getContentType(), readExpected(meta)));

        if (!outcome.isVerified()) {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("success", false);
            body.put("status", "verifier_unreachable");
            body.put("message", outcome.message());
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(body);
        }
        Map<String, Object> body = toBody(outcome.result());
        body.put("alertPublished", outcome.alertPublished());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/containers/{containerId}/verification")
    public ResponseEntity<Map<String, Object>> verification(@PathVariable String containerId) {
        int id = ContainerIds.normalize(containerId);
        return ingestService.getVerification(id)
                .map(result -> ResponseEntity.ok(toBody(result)))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(Map.of("success", false, "message", "No verification found")));
    }

    private Map<String, Object> toBody(VerificationResult result) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("status", "verified");
        body.put("result", result);
        return body;
    }

    private PillConfig readExpected(String meta) {
        if (meta == null || meta.isBlank()) {
            return null;
        }
        try {
            JsonNode expected = objectMapper.readTree(meta).get("expected");
            return expected == null || !expected.isObject() ? null : objectMapper.treeToValue(expected, PillConfig.class);
        } catch (IOException e) {
            log.warn("Ignoring unreadable ingest meta: {}", e.getMessage());
            return null;
        }
    }
}
