package io.mailq.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.mailq.util.Env;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads the temporal decay policy from YAML.
 *
 * Resolution order:
 * 1. Explicit path
 * 2. MAILQ_POLICY_PATH (env var or system property)
 * 3. Classpath resource mailq-policy.yaml
 *
 * Never throws: a missing, unreadable or invalid file yields {@link TemporalPolicy#defaults()}.
 */
public final class PolicyConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(PolicyConfigLoader.class);
    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    public static final String POLICY_PATH_KEY = "MAILQ_POLICY_PATH";
    public static final String DEFAULT_RESOURCE = "mailq-policy.yaml";

    private PolicyConfigLoader() {}

    /**
     * Load from MAILQ_POLICY_PATH if set, else from the bundled resource.
     */
    public static TemporalPolicy load() {
        String configured = Env.get(POLICY_PATH_KEY, null);
        if (configured != null) {
            return loadFromFile(Path.of(configured));
        }
        return loadFromClasspath(DEFAULT_RESOURCE);
    }

    public static TemporalPolicy loadFromFile(Path path) {
        if (!Files.exists(path)) {
            log.warn("[PolicyConfigLoader] No policy file at {}, using defaults", path);
            return TemporalPolicy.defaults();
        }
        try (InputStream in = Files.newInputStream(path)) {
            return parse(in, path.toString());
        } catch (IOException e) {
            log.error("[PolicyConfigLoader] Failed to read {}, using defaults: {}", path, e.getMessage());
            return TemporalPolicy.defaults();
        }
    }

    public static TemporalPolicy loadFromClasspath(String resource) {
        try (InputStream in = PolicyConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                log.info("[PolicyConfigLoader] Resource {} not on classpath, using defaults", resource);
                return TemporalPolicy.defaults();
            }
            return parse(in, "classpath:" + resource);
        } catch (IOException e) {
            log.error("[PolicyConfigLoader] Failed to read classpath:{}, using defaults: {}", resource, e.getMessage());
            return TemporalPolicy.defaults();
        }
    }

    private static TemporalPolicy parse(InputStream in, String origin) {
        PolicyFile file;
        try {
            file = YAML.readValue(in, PolicyFile.class);
        } catch (IOException e) {
            log.error("[PolicyConfigLoader] Unparseable policy {}, using defaults: {}", origin, e.getMessage());
            return TemporalPolicy.defaults();
        }

        if (file == null || file.temporalDecay() == null) {
            log.info("[PolicyConfigLoader] No temporal_decay section in {}, using defaults", origin);
            return TemporalPolicy.defaults();
        }

        TemporalPolicy policy = file.temporalDecay().withDefaults();
        if (!policy.isValid()) {
            log.warn("[PolicyConfigLoader] Invalid temporal_decay values in {}: {}, using defaults", origin, policy);
            return TemporalPolicy.defaults();
        }

        log.info("[PolicyConfigLoader] Loaded temporal policy from {}: grace={}h active={}h horizon={}d delivery={}h",
            origin, policy.gracePeriodHours(), policy.activeWindowHours(),
            policy.upcomingHorizonDays(), policy.deliveryStaleHours());
        return policy;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record PolicyFile(@JsonProperty("temporal_decay") TemporalPolicy temporalDecay) {}
}
