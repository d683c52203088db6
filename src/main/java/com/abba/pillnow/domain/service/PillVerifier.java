package com.abba.pillnow.domain.service;

import com.abba.pillnow.domain.model.PillConfig;
import com.abba.pillnow.domain.model.VerificationResponse;

public interface PillVerifier {

    VerificationResponse verify(byte[] image, String contentType, PillConfig expected);
}
