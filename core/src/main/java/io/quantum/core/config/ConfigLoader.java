package io.quantum.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads {@link RuntimeConfig} from a YAML file with an environment variable overlay.
 *
 * <pre>
 * cache:
 *   expression: { enabled: true, max-size: 10000 }
 *   ast: { enabled: true, max-size: 500 }
 * execution:
 *   max-call-depth: 64
 *   max-steps: 1000000
 *   max-wall-clock-ms: 30000
 *   max-loop-iterations: 100000
 * parser:
 *   strict-attributes: true
 * </pre>
 *
 * <p>Missing keys receive the defaults of {@link RuntimeConfig.Builder}; unknown keys are rejected.
 * Every key can be overridden by a {@code QUANTUM_*} environment variable, which takes precedence
 * over the YAML value. A variable counts as set only when its trimmed value is non-empty.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private static final Set<String> KNOWN_ROOT_KEYS = Set.of("cache", "execution", "parser");
    private static final Set<String> KNOWN_CACHE_KEYS = Set.of("expression", "ast");
    private static final Set<String> KNOWN_CACHE_ENTRY_KEYS = Set.of("enabled", "max-size");
    private static final Set<String> KNOWN_EXECUTION_KEYS =
            Set.of("max-call-depth", "max-steps", "max-wall-clock-ms", "max-loop-iterations");
    private static final Set<String> KNOWN_PARSER_KEYS = Set.of("strict-attributes");

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads configuration from a YAML file, applying overrides from {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing, unreadable or invalid
     */
    public static RuntimeConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads configuration from a YAML file, applying overrides from the supplied lookup. The lookup
     * returns {@code null} for an undefined variable.
     *
     * @throws ConfigLoadException if the file is missing, unreadable or invalid
     */
    public static RuntimeConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath);
        }
        try (InputStream in = Files.newInputStream(configPath)) {
            RuntimeConfig config = fromYaml(YAML_MAPPER.readTree(in), envLookup);
            LOG.info("Runtime configuration loaded from {}: {}", configPath, config);
            return config;
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid configuration in " + configPath + ": " + e.getMessage(), e);
        }
    }

    /** Builds configuration from the environment overlay alone. */
    public static RuntimeConfig fromEnvironment(Function<String, String> envLookup) {
        RuntimeConfig.Builder builder = RuntimeConfig.builder();
        try {
            applyEnvOverrides(builder, envLookup);
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid configuration in environment: " + e.getMessage(), e);
        }
    }

    private static RuntimeConfig fromYaml(JsonNode root, Function<String, String> envLookup) {
        RuntimeConfig.Builder builder = RuntimeConfig.builder();
        if (root != null && !root.isMissingNode() && !root.isNull()) {
            if (!root.isObject()) {
                throw new ConfigLoadException("Configuration root must be a mapping");
            }
            rejectUnknownKeys(root, KNOWN_ROOT_KEYS, "");

            JsonNode cache = root.path("cache");
            rejectUnknownKeys(cache, KNOWN_CACHE_KEYS, "cache.");
            JsonNode expression = cache.path("expression");
            rejectUnknownKeys(expression, KNOWN_CACHE_ENTRY_KEYS, "cache.expression.");
            if (expression.has("enabled")) {
                builder.expressionCacheEnabled(bool(expression, "enabled", "cache.expression"));
            }
            if (expression.has("max-size")) {
                builder.expressionCacheSize(integer(expression, "max-size", "cache.expression"));
            }
            JsonNode ast = cache.path("ast");
            rejectUnknownKeys(ast, KNOWN_CACHE_ENTRY_KEYS, "cache.ast.");
            if (ast.has("enabled")) {
                builder.astCacheEnabled(bool(ast, "enabled", "cache.ast"));
            }
            if (ast.has("max-size")) {
                builder.astCacheSize(integer(ast, "max-size", "cache.ast"));
            }

            JsonNode execution = root.path("execution");
            rejectUnknownKeys(execution, KNOWN_EXECUTION_KEYS, "execution.");
            if (execution.has("max-call-depth")) {
                builder.maxCallDepth(integer(execution, "max-call-depth", "execution"));
            }
            if (execution.has("max-steps")) {
                builder.maxSteps(longValue(execution, "max-steps", "execution"));
            }
            if (execution.has("max-wall-clock-ms")) {
                builder.maxWallClockMs(longValue(execution, "max-wall-clock-ms", "execution"));
            }
            if (execution.has("max-loop-iterations")) {
                builder.maxLoopIterations(longValue(execution, "max-loop-iterations", "execution"));
            }

            JsonNode parser = root.path("parser");
            rejectUnknownKeys(parser, KNOWN_PARSER_KEYS, "parser.");
            if (parser.has("strict-attributes")) {
                builder.strictAttributes(bool(parser, "strict-attributes", "parser"));
            }
        }
        applyEnvOverrides(builder, envLookup);
        return builder.build();
    }

    private static void applyEnvOverrides(RuntimeConfig.Builder builder, Function<String, String> envLookup) {
        envBool(envLookup, "QUANTUM_EXPRESSION_CACHE_ENABLED", builder::expressionCacheEnabled);
        envInt(envLookup, "QUANTUM_EXPRESSION_CACHE_SIZE", builder::expressionCacheSize);
        envBool(envLookup, "QUANTUM_AST_CACHE_ENABLED", builder::astCacheEnabled);
        envInt(envLookup, "QUANTUM_AST_CACHE_SIZE", builder::astCacheSize);
        envInt(envLookup, "QUANTUM_MAX_CALL_DEPTH", builder::maxCallDepth);
        envLong(envLookup, "QUANTUM_MAX_STEPS", builder::maxSteps);
        envLong(envLookup, "QUANTUM_MAX_WALL_CLOCK_MS", builder::maxWallClockMs);
        envLong(envLookup, "QUANTUM_MAX_LOOP_ITERATIONS", builder::maxLoopIterations);
        envBool(envLookup, "QUANTUM_STRICT_ATTRIBUTES", builder::strictAttributes);
    }

    private static void rejectUnknownKeys(JsonNode node, Set<String> known, String prefix) {
        if (node.isMissingNode()) {
            return;
        }
        if (!node.isObject()) {
            throw new ConfigLoadException("Configuration section '" + prefix + "' must be a mapping");
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            String key = fields.next().getKey();
            if (!known.contains(key)) {
                throw new ConfigLoadException("Unknown configuration key '" + prefix + key + "'. Known keys: "
                        + known.stream().sorted().toList());
            }
        }
    }

    private static boolean bool(JsonNode node, String field, String section) {
        JsonNode value = node.get(field);
        if (!value.isBoolean()) {
            throw new ConfigLoadException("'" + section + "." + field + "' must be a boolean, got: " + value);
        }
        return value.booleanValue();
    }

    private static int integer(JsonNode node, String field, String section) {
        JsonNode value = node.get(field);
        if (!value.canConvertToInt() || !value.isIntegralNumber()) {
            throw new ConfigLoadException("'" + section + "." + field + "' must be an integer, got: " + value);
        }
        return value.intValue();
    }

    private static long longValue(JsonNode node, String field, String section) {
        JsonNode value = node.get(field);
        if (!value.isIntegralNumber()) {
            throw new ConfigLoadException("'" + section + "." + field + "' must be an integer, got: " + value);
        }
        return value.longValue();
    }

    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(parseNumber(envLookup, envVar, Integer::parseInt));
        }
    }

    private static void envLong(Function<String, String> envLookup, String envVar, LongConsumer setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(parseNumber(envLookup, envVar, Long::parseLong));
        }
    }

    private static <T> T parseNumber(Function<String, String> envLookup, String envVar, Function<String, T> parser) {
        String raw = envLookup.apply(envVar).trim();
        try {
            return parser.apply(raw);
        } catch (NumberFormatException e) {
            throw new ConfigLoadException("Environment variable " + envVar + " must be a number, got: " + raw, e);
        }
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }
}
