package io.mailq.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests:
 * - Bundled policy matches defaults
 * - Custom values are bound
 * - Missing, invalid and partial files fall back to defaults
 */
class PolicyConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void testDefaults() {
        TemporalPolicy policy = TemporalPolicy.defaults();

        assertTrue(policy.isValid());
        assertEquals(Duration.ofHours(1), policy.gracePeriod());
        assertEquals(Duration.ofHours(1), policy.activeWindow());
        assertEquals(Duration.ofDays(7), policy.upcomingHorizon());
        assertEquals(Duration.ofHours(24), policy.deliveryStaleAfter());
    }

    @Test
    @DisplayName("Bundled mailq-policy.yaml carries the default thresholds")
    void testBundledPolicy() {
        assertEquals(TemporalPolicy.defaults(), PolicyConfigLoader.loadFromClasspath(PolicyConfigLoader.DEFAULT_RESOURCE));
    }

    @Test
    void testCustomPolicy() {
        TemporalPolicy policy = PolicyConfigLoader.loadFromClasspath("policy-custom.yaml");

        assertEquals(Duration.ofHours(2), policy.gracePeriod());
        assertEquals(Duration.ofMinutes(30), policy.activeWindow());
        assertEquals(Duration.ofDays(3), policy.upcomingHorizon());
        assertEquals(Duration.ofHours(48), policy.deliveryStaleAfter());
    }

    @Test
    @DisplayName("Out-of-range values fall back to defaults")
    void testInvalidPolicyFallsBack() {
        assertEquals(TemporalPolicy.defaults(), PolicyConfigLoader.loadFromClasspath("policy-invalid.yaml"));
    }

    @Test
    void testMissingFileFallsBack() {
        assertEquals(TemporalPolicy.defaults(), PolicyConfigLoader.loadFromFile(tempDir.resolve("absent.yaml")));
        assertEquals(TemporalPolicy.defaults(), PolicyConfigLoader.loadFromClasspath("no-such-policy.yaml"));
    }

    @Test
    void testUnparseableFileFallsBack() throws IOException {
        Path file = tempDir.resolve("broken.yaml");
        Files.writeString(file, "temporal_decay: [not, a, map");

        assertEquals(TemporalPolicy.defaults(), PolicyConfigLoader.loadFromFile(file));
    }

    @Test
    @DisplayName("Partial config keeps defaults for missing keys")
    void testPartialFile() throws IOException {
        Path file = tempDir.resolve("partial.yaml");
        Files.writeString(file, "temporal_decay:\n  upcoming_horizon_days: 14\n  unknown_key: 3\n");

        TemporalPolicy policy = PolicyConfigLoader.loadFromFile(file);

        assertEquals(Duration.ofDays(14), policy.upcomingHorizon());
        assertEquals(Duration.ofHours(1), policy.gracePeriod());
        assertEquals(Duration.ofHours(24), policy.deliveryStaleAfter());
    }

    @Test
    void testValidation() {
        assertFalse(new TemporalPolicy(1.0, 1.0, 400.0, 24.0).isValid());
        assertFalse(new TemporalPolicy(Double.NaN, 1.0, 7.0, 24.0).isValid());
        assertFalse(new TemporalPolicy(null, 1.0, 7.0, 24.0).isValid());
        assertTrue(new TemporalPolicy(0.0, 0.0, 0.0, 0.0).isValid());
    }
}
