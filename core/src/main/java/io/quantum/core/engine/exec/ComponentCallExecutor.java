package io.quantum.core.engine.exec;

import io.quantum.core.engine.ExecutionContext;
import io.quantum.core.engine.NodeExecutor;
import io.quantum.core.engine.ParamBinder;
import io.quantum.core.error.NodeExecutionException;
import io.quantum.core.model.ComponentCallNode;
import io.quantum.core.model.ExecResult;
import io.quantum.core.model.SourceUnit;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Renders another component in place.
 *
 * <ol>
 * <li>Attribute values are evaluated in the caller's context.</li>
 * <li>The call's children are rendered, also in the caller's context, into the slot content.</li>
 * <li>Values bind to the callee's declared parameters; a missing required one fails the call.</li>
 * <li>The callee runs in a new Component frame; its output lands where the call stands.</li>
 * </ol>
 *
 * <p>The callee is looked up among the caller's imports first, then through the
 * {@link io.quantum.core.spi.ComponentResolver}. A value returned by the callee is discarded; a
 * redirect propagates.
 */
public final class ComponentCallExecutor implements NodeExecutor<ComponentCallNode> {

    @Override
    public ExecResult execute(ComponentCallNode node, ExecutionContext context) {
        SourceUnit callee = resolve(node, context);

        Map<String, Object> arguments = new LinkedHashMap<>();
        node.attributes()
                .forEach((key, value) -> arguments.put(key, context.evaluator().evaluateValue(value, context)));

        String slotContent = null;
        if (!node.body().isEmpty()) {
            context.beginCapture();
            ExecResult bodyResult;
            try {
                bodyResult = context.executors().executeAll(node.body(), context);
            } finally {
                slotContent = context.endCapture();
            }
            if (!bodyResult.isContinue()) {
                context.emit(slotContent);
                return bodyResult;
            }
        }

        Map<String, Object> bound =
                ParamBinder.bind(callee.params(), arguments, "component '" + callee.name() + "'", context);
        context.enterComponent(callee, slotContent);
        try {
            bound.forEach((name, value) -> context.assign("component." + name, value));
            ExecResult result = context.executors().executeAll(callee.body(), context);
            return result.isRedirect() ? result : ExecResult.CONTINUE;
        } finally {
            context.exitComponent();
        }
    }

    private static SourceUnit resolve(ComponentCallNode node, ExecutionContext context) {
        Optional<SourceUnit> imported = context.importedComponent(node.component());
        if (imported.isPresent()) {
            return imported.get();
        }
        Optional<SourceUnit> resolved = context.collaborators()
                .resolver()
                .flatMap(resolver -> resolver.resolve(node.component(), null));
        return resolved.orElseThrow(() -> new NodeExecutionException(
                "Unknown component '" + node.component() + "'; import it with q:import",
                node.location(),
                context.componentName()));
    }
}
