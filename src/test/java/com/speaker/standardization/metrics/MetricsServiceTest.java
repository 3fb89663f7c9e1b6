package com.speaker.standardization.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Nested
    @DisplayName("MicrometerMetricsService")
    class Micrometer {

        private SimpleMeterRegistry registry;
        private MicrometerMetricsService service;

        @BeforeEach
        void setUp() {
            registry = new SimpleMeterRegistry();
            service = new MicrometerMetricsService(registry);
        }

        @Test
        @DisplayName("Should count inserts and merges per source")
        void countsPerSource() {
            service.incrementSpeakerInserted("bigspeak");
            service.incrementSpeakerInserted("bigspeak");
            service.incrementSpeakerInserted("sessionize");
            service.incrementSpeakerMerged("bigspeak");
            service.incrementRecordSkipped("sessionize");

            assertEquals(2.0, registry.get("speaker.inserted").tag("source", "bigspeak").counter().count());
            assertEquals(1.0, registry.get("speaker.inserted").tag("source", "sessionize").counter().count());
            assertEquals(1.0, registry.get("speaker.merged").tag("source", "bigspeak").counter().count());
            assertEquals(1.0, registry.get("speaker.skipped").tag("source", "sessionize").counter().count());
        }

        @Test
        @DisplayName("Should record similarity scores and flush sizes")
        void summaries() {
            service.recordSimilarityScore(95.0);
            service.recordSimilarityScore(85.0);
            service.recordFlushSize(1000);

            assertEquals(2, registry.get("speaker.similarity.score").summary().count());
            assertEquals(90.0, registry.get("speaker.similarity.score").summary().mean(), 0.001);
            assertEquals(1000.0, registry.get("speaker.flush.size").summary().totalAmount(), 0.001);
        }

        @Test
        @DisplayName("Should time sources")
        void sourceDuration() {
            service.recordSourceDuration("bigspeak", Duration.ofSeconds(3));

            assertEquals(3.0, registry.get("speaker.source.duration").tag("source", "bigspeak")
                    .timer().totalTime(TimeUnit.SECONDS), 0.001);
        }
    }

    @Test
    @DisplayName("NoOpMetricsService should accept every call")
    void noOp() {
        MetricsService service = new NoOpMetricsService();

        assertDoesNotThrow(() -> {
            service.incrementSpeakerInserted("bigspeak");
            service.incrementSpeakerMerged("bigspeak");
            service.incrementRecordSkipped("bigspeak");
            service.recordSimilarityScore(99.0);
            service.recordFlushSize(10);
            service.recordSourceDuration("bigspeak", Duration.ZERO);
        });
    }
}
