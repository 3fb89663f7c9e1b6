package com.speaker.standardization.health;

import com.speaker.standardization.store.SpeakerStore;

/**
 * Health check for the unified speaker store.
 * Pings the store and measures latency.
 */
public class SpeakerStoreHealthCheck implements HealthCheck {

    private final SpeakerStore store;

    public SpeakerStoreHealthCheck(SpeakerStore store) {
        this.store = store;
    }

    @Override
    public String getName() {
        return "speaker-store";
    }

    @Override
    public HealthStatus check() {
        try {
            long startMs = System.currentTimeMillis();
            boolean connected = store.isConnected();
            long latencyMs = System.currentTimeMillis() - startMs;

            if (!connected) {
                return HealthStatus.down("Speaker store is not reachable")
                        .withDetail("store", store.getName());
            }
            return HealthStatus.up()
                    .withDetail("latencyMs", latencyMs)
                    .withDetail("store", store.getName());
        } catch (Exception e) {
            return HealthStatus.down("Speaker store check failed: " + e.getMessage())
                    .withDetail("error", e.getClass().getSimpleName());
        }
    }
}
