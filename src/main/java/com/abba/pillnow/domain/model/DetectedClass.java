package com.abba.pillnow.domain.model;

public record DetectedClass(String label, int n) {
}
