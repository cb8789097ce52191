package ai.lineage;

import ai.lineage.hierarchy.ParentSelectionPolicy;
import ai.lineage.instructions.InstructionKeys;
import com.google.common.base.CaseFormat;
import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Tunables of a reconstruction pass. The key bound must be the same for registration and lookup within a corpus.
 *
 * <p>Values are read from {@code lineage.properties} on the classpath, then JVM system properties
 * ({@code lineage.maxKeyLength}), then environment variables ({@code LINEAGE_MAX_KEY_LENGTH}). Unparseable values
 * keep the previous value and log a warning.
 *
 * @param maxKeyLength canonical key bound.
 * @param minPrefixLength shortest shared prefix accepted for a non-exact match; 0 disables the floor.
 * @param registerFullTextFallback register a parent's whole instruction when no sub-instruction is found in it.
 * @param requireSameWorkspace reject parents whose known workspace differs from the child's.
 * @param parentSelectionPolicy tie-break among several validated parents.
 */
public record LineageConfig(
        int maxKeyLength,
        int minPrefixLength,
        boolean registerFullTextFallback,
        boolean requireSameWorkspace,
        ParentSelectionPolicy parentSelectionPolicy) {
    private static final Logger logger = LogManager.getLogger(LineageConfig.class);

    public static final String RESOURCE_NAME = "lineage.properties";
    static final String PREFIX = "lineage.";

    static final String MAX_KEY_LENGTH = "maxKeyLength";
    static final String MIN_PREFIX_LENGTH = "minPrefixLength";
    static final String REGISTER_FULL_TEXT_FALLBACK = "registerFullTextFallback";
    static final String REQUIRE_SAME_WORKSPACE = "requireSameWorkspace";
    static final String PARENT_SELECTION_POLICY = "parentSelectionPolicy";

    public LineageConfig {
        if (maxKeyLength < 1) {
            throw new IllegalArgumentException("maxKeyLength must be positive, got " + maxKeyLength);
        }
        if (minPrefixLength < 0) {
            throw new IllegalArgumentException("minPrefixLength must not be negative, got " + minPrefixLength);
        }
    }

    public static LineageConfig defaults() {
        return new LineageConfig(
                InstructionKeys.DEFAULT_MAX_LENGTH, 0, true, true, ParentSelectionPolicy.NEAREST_PRECEDING);
    }

    /** Loads the classpath defaults and applies system property and environment overrides. */
    public static LineageConfig load() {
        var props = new Properties();
        try (InputStream in = LineageConfig.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (in != null) {
                props.load(in);
            }
        } catch (IOException e) {
            logger.warn("Could not read {}: {}", RESOURCE_NAME, e.getMessage());
        }
        for (var name : System.getProperties().stringPropertyNames()) {
            if (name.startsWith(PREFIX)) {
                props.setProperty(name, System.getProperty(name));
            }
        }
        return from(props, System.getenv());
    }

    /** Resolves a configuration from explicit sources; {@code env} wins over {@code props}. */
    public static LineageConfig from(Properties props, Map<String, String> env) {
        var defaults = defaults();
        int maxKeyLength = parseInt(lookup(props, env, MAX_KEY_LENGTH), defaults.maxKeyLength(), MAX_KEY_LENGTH, 1);
        int minPrefixLength =
                parseInt(lookup(props, env, MIN_PREFIX_LENGTH), defaults.minPrefixLength(), MIN_PREFIX_LENGTH, 0);
        boolean fallback = parseBoolean(
                lookup(props, env, REGISTER_FULL_TEXT_FALLBACK),
                defaults.registerFullTextFallback(),
                REGISTER_FULL_TEXT_FALLBACK);
        boolean sameWorkspace = parseBoolean(
                lookup(props, env, REQUIRE_SAME_WORKSPACE), defaults.requireSameWorkspace(), REQUIRE_SAME_WORKSPACE);
        var policy = parsePolicy(lookup(props, env, PARENT_SELECTION_POLICY), defaults.parentSelectionPolicy());
        return new LineageConfig(maxKeyLength, minPrefixLength, fallback, sameWorkspace, policy);
    }

    static String envName(String key) {
        return "LINEAGE_" + CaseFormat.LOWER_CAMEL.to(CaseFormat.UPPER_UNDERSCORE, key);
    }

    private static @Nullable String lookup(Properties props, Map<String, String> env, String key) {
        var fromEnv = env.get(envName(key));
        if (fromEnv != null && !fromEnv.isBlank()) {
            return fromEnv.strip();
        }
        var fromProps = props.getProperty(PREFIX + key);
        return fromProps == null || fromProps.isBlank() ? null : fromProps.strip();
    }

    private static int parseInt(@Nullable String raw, int fallback, String key, int min) {
        if (raw == null) {
            return fallback;
        }
        try {
            int value = Integer.parseInt(raw);
            if (value < min) {
                logger.warn("Ignoring {}={}: must be at least {}", key, raw, min);
                return fallback;
            }
            return value;
        } catch (NumberFormatException e) {
            logger.warn("Ignoring {}={}: not an integer", key, raw);
            return fallback;
        }
    }

    private static boolean parseBoolean(@Nullable String raw, boolean fallback, String key) {
        if (raw == null) {
            return fallback;
        }
        return switch (raw.toLowerCase(Locale.ROOT)) {
            case "true", "yes", "1" -> true;
            case "false", "no", "0" -> false;
            default -> {
                logger.warn("Ignoring {}={}: not a boolean", key, raw);
                yield fallback;
            }
        };
    }

    private static ParentSelectionPolicy parsePolicy(@Nullable String raw, ParentSelectionPolicy fallback) {
        if (raw == null) {
            return fallback;
        }
        try {
            return ParentSelectionPolicy.valueOf(raw.toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            logger.warn("Ignoring {}={}: unknown policy", PARENT_SELECTION_POLICY, raw);
            return fallback;
        }
    }

    public LineageConfig withMaxKeyLength(int value) {
        return new LineageConfig(
                value, minPrefixLength, registerFullTextFallback, requireSameWorkspace, parentSelectionPolicy);
    }

    public LineageConfig withMinPrefixLength(int value) {
        return new LineageConfig(
                maxKeyLength, value, registerFullTextFallback, requireSameWorkspace, parentSelectionPolicy);
    }

    public LineageConfig withRegisterFullTextFallback(boolean value) {
        return new LineageConfig(maxKeyLength, minPrefixLength, value, requireSameWorkspace, parentSelectionPolicy);
    }

    public LineageConfig withRequireSameWorkspace(boolean value) {
        return new LineageConfig(
                maxKeyLength, minPrefixLength, registerFullTextFallback, value, parentSelectionPolicy);
    }

    public LineageConfig withParentSelectionPolicy(ParentSelectionPolicy value) {
        return new LineageConfig(
                maxKeyLength, minPrefixLength, registerFullTextFallback, requireSameWorkspace, value);
    }
}
