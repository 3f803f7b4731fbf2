package io.mailq.service.importance;

import io.mailq.domain.model.ClassifiedEmail;
import io.mailq.domain.model.DecisionSource;
import io.mailq.domain.model.GuardrailCategory;
import io.mailq.domain.model.Importance;
import io.mailq.infrastructure.metrics.EngineMetrics;
import io.mailq.service.guardrail.GuardrailMatcher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BridgeImportanceMapperTest {

    @Mock
    private EngineMetrics metrics;

    private BridgeImportanceMapper mapper;

    @BeforeEach
    void setUp() {
        mapper = new BridgeImportanceMapper(GuardrailMatcher.fromClasspath(GuardrailMatcher.DEFAULT_RESOURCE), metrics);
    }

    private static ClassifiedEmail email(String subject, String snippet, String importance) {
        return new ClassifiedEmail("msg-1", subject, snippet, importance, "notification");
    }

    @Test
    @DisplayName("OTP stored as routine is forced critical by the guardrail")
    void testOtpForcedCritical() {
        BridgeDecision decision = mapper.mapEmail(email("Your verification code is 123456", "", "routine"));

        assertEquals(Importance.CRITICAL, decision.importance());
        assertEquals(DecisionSource.GUARDRAIL, decision.source());
        assertEquals(GuardrailCategory.FORCE_CRITICAL, decision.guardrail());
        assertTrue(decision.isGuardrailOverride());
        verify(metrics).recordBridgeDecision(DecisionSource.GUARDRAIL, GuardrailCategory.FORCE_CRITICAL);
    }

    @Test
    @DisplayName("Autopay stored as critical is lowered to routine")
    void testAutopayLowered() {
        BridgeDecision decision = mapper.mapEmail(
            email("Autopay scheduled for your bill", "Your automatic payment is scheduled.", "critical"));

        assertEquals(Importance.ROUTINE, decision.importance());
        assertEquals(DecisionSource.GUARDRAIL, decision.source());
        assertEquals(GuardrailCategory.FORCE_NON_CRITICAL, decision.guardrail());
    }

    @Test
    void testModelImportanceUsedWithoutGuardrail() {
        BridgeDecision decision = mapper.mapEmail(email("Weekly newsletter from Tech Blog", "", "time_sensitive"));

        assertEquals(Importance.TIME_SENSITIVE, decision.importance());
        assertEquals(DecisionSource.GEMINI, decision.source());
        assertEquals("gemini importance: time_sensitive", decision.reason());
        assertNull(decision.guardrail());
        assertFalse(decision.isGuardrailOverride());
        verify(metrics).recordBridgeDecision(eq(DecisionSource.GEMINI), isNull());
    }

    @Test
    void testMissingImportanceDefaultsToRoutine() {
        BridgeDecision decision = mapper.mapEmail(email("Hello", "", null));

        assertEquals(Importance.ROUTINE, decision.importance());
        assertEquals("gemini importance: routine", decision.reason());
        verify(metrics, never()).recordImportanceCoerced();
    }

    @Test
    @DisplayName("Unrecognized importance is coerced to routine and counted")
    void testUnknownImportanceCoerced() {
        assertEquals(Importance.ROUTINE, mapper.coerceModelImportance(email("Hello", "", "urgent")));
        verify(metrics).recordImportanceCoerced();
    }

    @Test
    void testCoercionAcceptsKnownValues() {
        assertEquals(Importance.CRITICAL, mapper.coerceModelImportance(email("Hello", "", "critical")));
        verifyNoInteractions(metrics);
    }

    @Test
    @DisplayName("Case and padding variants are not wire values and coerce to routine")
    void testCoercionRejectsNonExactValues() {
        assertEquals(Importance.ROUTINE, mapper.coerceModelImportance(email("Hello", "", " CRITICAL ")));
        verify(metrics).recordImportanceCoerced();
    }

    @Test
    @DisplayName("Empty guardrails leave the model decision in charge")
    void testEmptyGuardrails() {
        BridgeImportanceMapper bare = new BridgeImportanceMapper(GuardrailMatcher.empty());

        BridgeDecision decision = bare.mapEmail(email("Your verification code is 123456", "", "routine"));

        assertEquals(Importance.ROUTINE, decision.importance());
        assertEquals(DecisionSource.GEMINI, decision.source());
    }
}
