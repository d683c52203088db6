package com.abba.pillnow.domain.model;

public record PillChange(String type, int before, int after, int change) {
}
