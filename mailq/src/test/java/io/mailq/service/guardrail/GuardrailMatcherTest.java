package io.mailq.service.guardrail;

import io.mailq.domain.model.GuardrailCategory;
import io.mailq.domain.model.Importance;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests:
 * - Bundled rules cover OTP, security, autopay and calendar responses
 * - Bucket precedence and declaration order
 * - Fail-open on missing/unparseable config
 * - Invalid regex rules are skipped
 */
class GuardrailMatcherTest {

    @TempDir
    Path tempDir;

    private GuardrailMatcher bundled;

    @BeforeEach
    void setUp() {
        bundled = GuardrailMatcher.fromClasspath(GuardrailMatcher.DEFAULT_RESOURCE);
    }

    @Test
    void testBundledRulesLoad() {
        Map<String, Integer> counts = bundled.ruleCounts();

        assertEquals(List.of("never_surface", "force_critical", "force_non_critical"), List.copyOf(counts.keySet()));
        assertTrue(counts.values().stream().allMatch(c -> c > 0), "Every bucket should have rules: " + counts);
    }

    @Test
    @DisplayName("Verification code is forced critical")
    void testVerificationCode() {
        GuardrailResult result = bundled.evaluate("Your verification code is 123456", "").orElseThrow();

        assertEquals(Importance.CRITICAL, result.importance());
        assertEquals(GuardrailCategory.FORCE_CRITICAL, result.category());
        assertEquals("verification_code", result.ruleName());
    }

    @Test
    void testSecurityAlert() {
        GuardrailResult result = bundled.evaluate("Security alert: data breach detected", "Reset your password").orElseThrow();

        assertEquals(Importance.CRITICAL, result.importance());
        assertEquals(GuardrailCategory.FORCE_CRITICAL, result.category());
    }

    @Test
    void testAutopayIsForcedRoutine() {
        GuardrailResult result = bundled
            .evaluate("Autopay scheduled for your bill", "Your automatic payment is scheduled.")
            .orElseThrow();

        assertEquals(Importance.ROUTINE, result.importance());
        assertEquals(GuardrailCategory.FORCE_NON_CRITICAL, result.category());
    }

    @Test
    void testCalendarResponseNeverSurfaces() {
        GuardrailResult result = bundled.evaluate("Accepted: Sync @ Tue Nov 18, 2025", "").orElseThrow();

        assertEquals(GuardrailCategory.NEVER_SURFACE, result.category());
        assertEquals(Importance.ROUTINE, result.importance());
    }

    @Test
    void testNewsletterHasNoGuardrail() {
        assertEquals(Optional.empty(), bundled.evaluate("Weekly newsletter from Tech Blog", "This week in tech"));
    }

    @Test
    @DisplayName("never_surface beats force_critical beats force_non_critical regardless of file order")
    void testPrecedence() {
        GuardrailMatcher matcher = GuardrailMatcher.fromClasspath("guardrails/precedence.yaml");

        GuardrailResult muted = matcher.evaluate("Billing issue", "muted").orElseThrow();
        assertEquals(GuardrailCategory.NEVER_SURFACE, muted.category());
        assertEquals("muted_billing", muted.ruleName());
        assertEquals("guardrail:never_surface:muted_billing", muted.reason());

        GuardrailResult urgent = matcher.evaluate("Billing issue", "").orElseThrow();
        assertEquals(GuardrailCategory.FORCE_CRITICAL, urgent.category());
        assertEquals("urgent_billing", urgent.ruleName(), "First declared rule wins within a bucket");
        assertEquals("Billing problems are urgent", urgent.reason());
    }

    @Test
    void testMissingFileFailsOpen() {
        GuardrailMatcher matcher = GuardrailMatcher.fromFile(tempDir.resolve("absent.yaml"));

        assertTrue(matcher.isEmpty());
        assertTrue(matcher.evaluate("Your verification code is 123456", "").isEmpty());
    }

    @Test
    void testMissingResourceFailsOpen() {
        assertTrue(GuardrailMatcher.fromClasspath("guardrails/absent.yaml").isEmpty());
    }

    @Test
    void testUnparseableFileFailsOpen() {
        assertTrue(GuardrailMatcher.fromClasspath("guardrails/malformed.yaml").isEmpty());
    }

    @Test
    void testInvalidRegexRuleIsSkipped() {
        GuardrailMatcher matcher = GuardrailMatcher.fromClasspath("guardrails/bad-regex.yaml");

        assertEquals(1, matcher.rules(GuardrailCategory.FORCE_CRITICAL).size());
        GuardrailResult result = matcher.evaluate("Pager duty", "").orElseThrow();
        assertEquals(GuardrailRule.DEFAULT_NAME, result.ruleName());
        assertEquals("guardrail:force_critical:guardrail", result.reason());
    }

    @Test
    void testLoadFromFile() throws IOException {
        Path file = tempDir.resolve("rules.yaml");
        Files.writeString(file, "guardrails:\n  force_critical:\n    - name: jury\n      subject_any: [\"jury duty\"]\n");

        GuardrailMatcher matcher = GuardrailMatcher.fromFile(file);

        assertEquals(1, matcher.ruleCounts().get("force_critical"));
        assertEquals(0, matcher.ruleCounts().get("never_surface"));
        assertTrue(matcher.evaluate("Jury Duty summons", null).isPresent());
    }

    @Test
    void testNullTextTreatedAsEmpty() {
        assertTrue(bundled.evaluate(null, null).isEmpty());
    }
}
