package io.quantum.core.engine.exec;

import io.quantum.core.engine.ExecutionContext;
import io.quantum.core.engine.NodeExecutor;
import io.quantum.core.error.NodeExecutionException;
import io.quantum.core.model.ExecResult;
import io.quantum.core.model.LogNode;
import io.quantum.core.spi.LogService;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes an application log entry. Goes to the {@link LogService} collaborator when one is
 * configured, otherwise to the SLF4J logger {@code quantum.log}, with the context map appended.
 */
public final class LogExecutor implements NodeExecutor<LogNode> {

    static final String LOGGER_NAME = "quantum.log";

    private static final Logger APP_LOG = LoggerFactory.getLogger(LOGGER_NAME);

    @Override
    public ExecResult execute(LogNode node, ExecutionContext context) {
        String level = node.level() == null ? "info" : node.level().trim().toLowerCase(Locale.ROOT);
        String message = context.evaluator().interpolate(node.message(), context);
        Map<String, Object> fields = fields(node, context);
        Optional<LogService> service = context.collaborators().log();
        if (service.isPresent()) {
            Services.run("Log", node, context, () -> service.get().log(level, message, fields));
            return ExecResult.CONTINUE;
        }
        switch (level) {
            case "trace" -> APP_LOG.trace("{} {}", message, fields);
            case "debug" -> APP_LOG.debug("{} {}", message, fields);
            case "info" -> APP_LOG.info("{} {}", message, fields);
            case "warn", "warning" -> APP_LOG.warn("{} {}", message, fields);
            case "error", "critical" -> APP_LOG.error("{} {}", message, fields);
            default -> throw new NodeExecutionException(
                    "Unknown log level '" + node.level() + "'", node.location(), context.componentName());
        }
        return ExecResult.CONTINUE;
    }

    private static Map<String, Object> fields(LogNode node, ExecutionContext context) {
        Map<String, Object> fields = new LinkedHashMap<>();
        if (node.context() != null) {
            Object value = context.evaluator().evaluateValue(node.context(), context);
            if (value instanceof Map<?, ?> map) {
                map.forEach((k, v) -> fields.put(String.valueOf(k), v));
            } else if (value != null) {
                fields.put("context", value);
            }
        }
        return fields;
    }
}
