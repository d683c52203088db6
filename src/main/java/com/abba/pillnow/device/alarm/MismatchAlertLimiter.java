package com.abba.pillnow.device.alarm;

public class MismatchAlertLimiter {

    public static final long DEFAULT_COOLDOWN_MS = 15_000;

    private final long cooldownMillis;
    private long lastAlertAt;
    private boolean alerted;

    public MismatchAlertLimiter() {
        this(DEFAULT_COOLDOWN_MS);
    }

    public MismatchAlertLimiter(long cooldownMillis) {
        this.cooldownMillis = cooldownMillis;
    }

    public boolean tryAcquire(long nowMillis) {
        if (alerted && nowMillis - lastAlertAt < cooldownMillis) {
            return false;
        }
        alerted = true;
        lastAlertAt = nowMillis;
        return true;
    }
}
