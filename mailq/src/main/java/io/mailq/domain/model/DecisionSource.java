package io.mailq.domain.model;

/**
 * Origin of a pre-decay importance decision.
 */
public enum DecisionSource {
    GUARDRAIL("guardrail"),
    GEMINI("gemini");  // upstream model output

    private final String wireValue;

    DecisionSource(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    @Override
    public String toString() {
        return wireValue;
    }
}
