package io.mailq.service.guardrail;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Guardrail rule as declared in guardrails.yaml, before case-folding and regex compilation.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GuardrailRuleSpec(
    @JsonProperty("name") String name,
    @JsonProperty("description") String description,
    @JsonProperty("subject_any") List<String> subjectAny,
    @JsonProperty("snippet_any") List<String> snippetAny,
    @JsonProperty("snippet_none") List<String> snippetNone,       // exclusion terms
    @JsonProperty("subject_regex") List<String> subjectRegex,
    @JsonProperty("snippet_regex") List<String> snippetRegex
) {

    /**
     * Top-level layout of the rule file: {@code guardrails: {never_surface: [...], ...}}.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record File(@JsonProperty("guardrails") Map<String, List<GuardrailRuleSpec>> guardrails) {}
}
