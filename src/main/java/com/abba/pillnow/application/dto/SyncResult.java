package com.abba.pillnow.application.dto;

import java.util.Map;

public record SyncResult(int rowsRead, int rowsSkipped, Map<Integer, Integer> dosesPerContainer) {
}
