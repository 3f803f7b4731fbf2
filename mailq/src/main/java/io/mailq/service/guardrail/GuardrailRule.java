package io.mailq.service.guardrail;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Immutable, case-folded guardrail rule.
 *
 * A rule matches iff every declared dimension is satisfied:
 * - subject contains one of subjectTerms
 * - snippet contains one of snippetTerms
 * - snippet contains none of snippetNoneTerms
 * - subject matches one of subjectPatterns
 * - snippet matches one of snippetPatterns
 * An empty list leaves its dimension unconstrained.
 */
public record GuardrailRule(
    String name,
    String description,
    List<String> subjectTerms,
    List<String> snippetTerms,
    List<String> snippetNoneTerms,
    List<Pattern> subjectPatterns,
    List<Pattern> snippetPatterns
) {
    public static final String DEFAULT_NAME = "guardrail";

    public GuardrailRule {
        name = name != null && !name.isBlank() ? name : DEFAULT_NAME;
        description = description != null ? description : "";
        subjectTerms = List.copyOf(subjectTerms);
        snippetTerms = List.copyOf(snippetTerms);
        snippetNoneTerms = List.copyOf(snippetNoneTerms);
        subjectPatterns = List.copyOf(subjectPatterns);
        snippetPatterns = List.copyOf(snippetPatterns);
    }

    /**
     * Build a rule from its declared form: lower-case terms, compile regexes case-insensitive.
     *
     * @throws java.util.regex.PatternSyntaxException if a regex does not compile
     */
    public static GuardrailRule fromSpec(GuardrailRuleSpec spec) {
        return new GuardrailRule(
            spec.name(),
            spec.description(),
            fold(spec.subjectAny()),
            fold(spec.snippetAny()),
            fold(spec.snippetNone()),
            compile(spec.subjectRegex()),
            compile(spec.snippetRegex())
        );
    }

    public boolean matches(String subject, String snippet) {
        String subjectText = subject != null ? subject : "";
        String snippetText = snippet != null ? snippet : "";
        String subjectLower = subjectText.toLowerCase(Locale.ROOT);
        String snippetLower = snippetText.toLowerCase(Locale.ROOT);

        if (!subjectTerms.isEmpty() && subjectTerms.stream().noneMatch(subjectLower::contains)) {
            return false;
        }

        if (!snippetTerms.isEmpty() && snippetTerms.stream().noneMatch(snippetLower::contains)) {
            return false;
        }

        // Exclusion: e.g. an authorized sign-in notice must not trip the security alert rule
        if (snippetNoneTerms.stream().anyMatch(snippetLower::contains)) {
            return false;
        }

        if (!subjectPatterns.isEmpty() && subjectPatterns.stream().noneMatch(p -> p.matcher(subjectText).find())) {
            return false;
        }

        return snippetPatterns.isEmpty() || snippetPatterns.stream().anyMatch(p -> p.matcher(snippetText).find());
    }

    private static List<String> fold(List<String> terms) {
        if (terms == null) {
            return List.of();
        }
        return terms.stream()
            .filter(t -> t != null && !t.isEmpty())
            .map(t -> t.toLowerCase(Locale.ROOT))
            .toList();
    }

    private static List<Pattern> compile(List<String> patterns) {
        if (patterns == null) {
            return List.of();
        }
        return patterns.stream()
            .filter(p -> p != null && !p.isEmpty())
            .map(p -> Pattern.compile(p, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE))
            .toList();
    }
}
