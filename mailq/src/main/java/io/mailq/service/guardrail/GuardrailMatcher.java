package io.mailq.service.guardrail;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.mailq.domain.model.ClassifiedEmail;
import io.mailq.domain.model.GuardrailCategory;
import io.mailq.util.Env;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.PatternSyntaxException;

/**
 * Guardrail Matcher - safety-critical overrides of the upstream importance.
 *
 * PRECEDENCE:
 * never_surface > force_critical > force_non_critical,
 * then declaration order within a bucket. First matching rule wins.
 *
 * FAIL-OPEN:
 * A missing or unparseable rule file loads zero rules (no overrides) and logs a warning.
 * A rule whose regex does not compile is skipped.
 *
 * Rules are immutable after construction; one instance can be shared across threads.
 */
public final class GuardrailMatcher {
    private static final Logger log = LoggerFactory.getLogger(GuardrailMatcher.class);
    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    public static final String GUARDRAILS_PATH_KEY = "MAILQ_GUARDRAILS_PATH";
    public static final String DEFAULT_RESOURCE = "guardrails.yaml";

    private final Map<GuardrailCategory, List<GuardrailRule>> rules;

    /**
     * Create a matcher from already-built rules.
     */
    public GuardrailMatcher(Map<GuardrailCategory, List<GuardrailRule>> rules) {
        Map<GuardrailCategory, List<GuardrailRule>> copy = new EnumMap<>(GuardrailCategory.class);
        for (GuardrailCategory category : GuardrailCategory.values()) {
            List<GuardrailRule> bucket = rules.get(category);
            copy.put(category, bucket != null ? List.copyOf(bucket) : List.of());
        }
        this.rules = Collections.unmodifiableMap(copy);
    }

    /**
     * Matcher with no rules: every email falls through to the upstream importance.
     */
    public static GuardrailMatcher empty() {
        return new GuardrailMatcher(Map.of());
    }

    /**
     * Load from MAILQ_GUARDRAILS_PATH if set, else from the bundled guardrails.yaml.
     */
    public static GuardrailMatcher load() {
        Path configured = Env.getPath(GUARDRAILS_PATH_KEY, null);
        if (configured != null) {
            return fromFile(configured);
        }
        return fromClasspath(DEFAULT_RESOURCE);
    }

    public static GuardrailMatcher fromFile(Path path) {
        if (!Files.exists(path)) {
            log.warn("[GuardrailMatcher] Guardrail config {} not found; guardrails disabled", path);
            return empty();
        }
        try (InputStream in = Files.newInputStream(path)) {
            return fromStream(in, path.toString());
        } catch (IOException e) {
            log.warn("[GuardrailMatcher] Failed to read guardrail config {}: {}; guardrails disabled",
                path, e.getMessage());
            return empty();
        }
    }

    public static GuardrailMatcher fromClasspath(String resource) {
        try (InputStream in = GuardrailMatcher.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                log.warn("[GuardrailMatcher] Guardrail resource {} not found; guardrails disabled", resource);
                return empty();
            }
            return fromStream(in, "classpath:" + resource);
        } catch (IOException e) {
            log.warn("[GuardrailMatcher] Failed to read classpath:{}: {}; guardrails disabled",
                resource, e.getMessage());
            return empty();
        }
    }

    private static GuardrailMatcher fromStream(InputStream in, String origin) {
        GuardrailRuleSpec.File file;
        try {
            file = YAML.readValue(in, GuardrailRuleSpec.File.class);
        } catch (IOException e) {
            log.warn("[GuardrailMatcher] Unparseable guardrail config {}: {}; guardrails disabled",
                origin, e.getMessage());
            return empty();
        }

        Map<GuardrailCategory, List<GuardrailRule>> loaded = new EnumMap<>(GuardrailCategory.class);
        Map<String, List<GuardrailRuleSpec>> declared = file != null && file.guardrails() != null
            ? file.guardrails()
            : Map.of();

        for (GuardrailCategory category : GuardrailCategory.values()) {
            List<GuardrailRuleSpec> specs = declared.get(category.key());
            List<GuardrailRule> bucket = new ArrayList<>();
            if (specs != null) {
                for (GuardrailRuleSpec spec : specs) {
                    if (spec == null) {
                        log.warn("[GuardrailMatcher] Skipping empty rule entry in {}", category.key());
                        continue;
                    }
                    try {
                        bucket.add(GuardrailRule.fromSpec(spec));
                    } catch (PatternSyntaxException e) {
                        log.warn("[GuardrailMatcher] Skipping rule {}/{} with invalid regex: {}",
                            category.key(), spec.name(), e.getDescription());
                    }
                }
            }
            loaded.put(category, bucket);
        }

        GuardrailMatcher matcher = new GuardrailMatcher(loaded);
        log.info("[GuardrailMatcher] Loaded guardrails from {} {}", origin, matcher.ruleCounts());
        return matcher;
    }

    /**
     * Evaluate an email against the guardrails.
     *
     * @return the first matching rule's verdict, or empty when no rule applies
     */
    public Optional<GuardrailResult> evaluate(String subject, String snippet) {
        String subjectText = subject != null ? subject : "";
        String snippetText = snippet != null ? snippet : "";

        for (GuardrailCategory category : GuardrailCategory.values()) {
            for (GuardrailRule rule : rules.get(category)) {
                if (rule.matches(subjectText, snippetText)) {
                    String reason = !rule.description().isEmpty()
                        ? rule.description()
                        : "guardrail:" + category.key() + ":" + rule.name();
                    return Optional.of(new GuardrailResult(category.importance(), reason, rule.name(), category));
                }
            }
        }
        return Optional.empty();
    }

    public Optional<GuardrailResult> evaluate(ClassifiedEmail email) {
        return evaluate(email.subject(), email.snippet());
    }

    /**
     * Rules per bucket, in evaluation order.
     */
    public Map<String, Integer> ruleCounts() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (GuardrailCategory category : GuardrailCategory.values()) {
            counts.put(category.key(), rules.get(category).size());
        }
        return counts;
    }

    public List<GuardrailRule> rules(GuardrailCategory category) {
        return rules.get(category);
    }

    public boolean isEmpty() {
        return rules.values().stream().allMatch(List::isEmpty);
    }
}
