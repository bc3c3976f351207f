package com.entity.extraction.metrics;

import com.entity.extraction.core.model.EntityType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            NoOpMetricsService noOp = new NoOpMetricsService();

            assertDoesNotThrow(() -> {
                noOp.incrementEntitiesExtracted("Pattern", EntityType.EMAIL, 2);
                noOp.incrementExtractorFailure("Pattern");
                noOp.incrementGroupsFormed("Name", 1);
                noOp.incrementCoreferenceLinks("Pronoun", 3);
                noOp.recordStageDuration("extract", Duration.ofMillis(5));
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Should count extracted entities per extractor and type")
        void extractedCounter() {
            metrics.incrementEntitiesExtracted("Pattern", EntityType.EMAIL, 2);
            metrics.incrementEntitiesExtracted("Pattern", EntityType.EMAIL, 3);
            metrics.incrementEntitiesExtracted("Dictionary", EntityType.SKILL, 1);

            Counter emails = registry.find("entity.extraction.count")
                    .tag("extractor", "Pattern")
                    .tag("entityType", "EMAIL")
                    .counter();
            Counter skills = registry.find("entity.extraction.count")
                    .tag("extractor", "Dictionary")
                    .counter();

            assertNotNull(emails);
            assertEquals(5.0, emails.count());
            assertNotNull(skills);
            assertEquals(1.0, skills.count());
        }

        @Test
        @DisplayName("Should count extractor failures")
        void failureCounter() {
            metrics.incrementExtractorFailure("RuleBased");

            Counter counter = registry.find("entity.extraction.failures").tag("extractor", "RuleBased").counter();
            assertNotNull(counter);
            assertEquals(1.0, counter.count());
        }

        @Test
        @DisplayName("Should count groups and coreference links")
        void groupAndLinkCounters() {
            metrics.incrementGroupsFormed("Context", 2);
            metrics.incrementCoreferenceLinks("OrganizationReference", 1);
            metrics.incrementCoreferenceLinks("OrganizationReference", 0);

            assertEquals(2.0, registry.find("entity.disambiguation.groups").tag("method", "Context")
                    .counter().count());
            assertEquals(1.0, registry.find("entity.coreference.links")
                    .tag("referenceType", "OrganizationReference").counter().count());
        }

        @Test
        @DisplayName("Should record stage durations as timers")
        void stageTimer() {
            metrics.recordStageDuration("extract", Duration.ofMillis(150));
            metrics.recordStageDuration("extract", Duration.ofMillis(250));

            Timer timer = registry.find("entity.pipeline.stage.duration").tag("stage", "extract").timer();
            assertNotNull(timer);
            assertEquals(2, timer.count());
        }
    }
}
