package com.abba.pillnow.infrastructure.storage;

import com.abba.pillnow.infrastructure.config.VerifierProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Optional;

@Component
@Slf4j
@RequiredArgsConstructor
public class CaptureStorage {

    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS");

    private final VerifierProperties verifierProperties;
    private final Clock clock;

    public Optional<Path> save(String deviceId, int containerId, byte[] image) {
        if (!verifierProperties.isSaveCaptures() || image == null || image.length == 0) {
            return Optional.empty();
        }
        String fileName = "%s_container%d_%s.jpg".formatted(
                safe(deviceId), containerId, LocalDateTime.now(clock).format(STAMP));
        try {
            Path dir = Path.of(verifierProperties.getCaptureDir());
            Files.createDirectories(dir);
            Path target = dir.resolve(fileName);
            Files.write(target, image);
            log.debug("Saved capture {} ({} bytes)", target, image.length);
            return Optional.of(target);
        } catch (IOException e) {
            log.warn("Could not save capture {}: {}", fileName, e.getMessage());
            return Optional.empty();
        }
    }

    private static String safe(String value) {
        if (value == null || value.isBlank()) {
            return "unknown";
        }
        return value.replaceAll("[^A-Za-z0-9_-]", "_");
    }
}
