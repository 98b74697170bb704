package io.quantum.core.engine;

import io.quantum.core.engine.expr.Markup;
import io.quantum.core.error.NodeExecutionException;
import io.quantum.core.model.ExecResult;
import io.quantum.core.model.FunctionNode;
import io.quantum.core.model.ParamNode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Calls a user-defined {@code q:function}. Arguments are bound like component parameters
 * (coerced, validated, defaults filled) into a fresh Local frame that hides the caller's locals.
 *
 * <p>Output the body emits is captured rather than written at the call site. The call's value is
 * the {@code q:return} value when the body returns one, otherwise the captured output as
 * {@link Markup}, or {@code null} when there was none.
 */
public final class FunctionInvoker {

    private FunctionInvoker() {}

    /** Expression call: arguments bind to parameters by position. Extra arguments are ignored. */
    public static Object invokePositional(FunctionNode function, List<Object> arguments, ExecutionContext context) {
        Map<String, Object> named = new LinkedHashMap<>();
        List<ParamNode> params = function.params();
        for (int i = 0; i < Math.min(params.size(), arguments.size()); i++) {
            named.put(params.get(i).name(), arguments.get(i));
        }
        ExecResult result = invoke(function, named, context);
        if (result.isRedirect()) {
            throw new NodeExecutionException(
                    "Function '" + function.name() + "' redirected while called from an expression; use q:invoke",
                    context.currentLocation(),
                    context.componentName());
        }
        return result.value();
    }

    /**
     * Calls the function with named arguments.
     *
     * @return a RETURN result carrying the call's value, or the REDIRECT the body produced
     */
    public static ExecResult invoke(FunctionNode function, Map<String, Object> arguments, ExecutionContext context) {
        Map<String, Object> bound =
                ParamBinder.bind(function.params(), arguments, "function '" + function.name() + "'", context);
        Map<String, Object> frame = context.enterFunction(function);
        frame.putAll(bound);
        context.beginCapture();
        ExecResult result;
        String output;
        try {
            result = context.executors().executeAll(function.body(), context);
        } finally {
            output = context.endCapture();
            context.exitFunction();
        }
        if (result.isRedirect()) {
            context.emit(output);
            return result;
        }
        if (result.isReturn()) {
            return ExecResult.returning(
                    ParamBinder.coerce(result.value(), function.returnType(), function.name(), context));
        }
        if (output.isEmpty()) {
            return ExecResult.returning(ParamBinder.coerce(null, function.returnType(), function.name(), context));
        }
        Object value = ParamBinder.coerce(output, function.returnType(), function.name(), context);
        return ExecResult.returning(value instanceof String text ? new Markup(text) : value);
    }
}
