package com.abba.pillnow.domain.service;

import com.abba.pillnow.application.dto.IngestOutcome;
import com.abba.pillnow.application.dto.IngestRequest;
import com.abba.pillnow.domain.model.VerificationResult;

import java.util.Optional;

public interface IngestService {

    IngestOutcome ingest(IngestRequest request);

    Optional<VerificationResult> getVerification(int containerId);
}
