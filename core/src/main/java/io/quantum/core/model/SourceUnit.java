package io.quantum.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A parsed component or application. Created once per file version and immutable afterwards, so
 * a single instance is shared by every request that executes it.
 *
 * <p>Functions are hoisted: {@link #functions()} holds every top-level {@code q:function} so a
 * call may appear before the definition in document order.
 */
public record SourceUnit(
        String name,
        Kind kind,
        List<ParamNode> params,
        boolean requireAuth,
        String requireRole,
        boolean interactive,
        List<Node> body,
        Map<String, FunctionNode> functions,
        String sourcePath)
        implements HasBody {

    /** Root element of the source. */
    public enum Kind {
        COMPONENT,
        APPLICATION
    }

    public SourceUnit {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        params = List.copyOf(params);
        body = List.copyOf(body);
        functions = Collections.unmodifiableMap(new LinkedHashMap<>(functions));
    }

    /** Looks up a declared parameter by name. */
    public Optional<ParamNode> param(String paramName) {
        return params.stream().filter(p -> p.name().equals(paramName)).findFirst();
    }

    /** Looks up a hoisted function by name. */
    public Optional<FunctionNode> function(String functionName) {
        return Optional.ofNullable(functions.get(functionName));
    }

    @Override
    public List<Node> children() {
        return body;
    }

    @Override
    public String toString() {
        return "SourceUnit[" + kind + " " + name + ", params=" + params.size() + ", statements=" + body.size()
                + (sourcePath != null ? ", path=" + sourcePath : "") + "]";
    }
}
