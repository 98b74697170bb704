package io.quantum.core.engine.exec;

import io.quantum.core.engine.ExecutionContext;
import io.quantum.core.error.NodeExecutionException;
import io.quantum.core.error.QuantumException;
import io.quantum.core.model.Node;
import java.util.Optional;
import java.util.function.Supplier;

/** Collaborator access for executors: a missing service or a failing call becomes a located execution error. */
final class Services {

    private Services() {}

    static <S> S require(Optional<S> service, String what, Node node, ExecutionContext context) {
        return service.orElseThrow(() -> new NodeExecutionException(
                "No " + what + " configured", node.location(), context.componentName()));
    }

    static <T> T call(String action, Node node, ExecutionContext context, Supplier<T> call) {
        try {
            return call.get();
        } catch (QuantumException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new NodeExecutionException(
                    action + " failed: " + e.getMessage(), e, node.location(), context.componentName());
        }
    }

    static void run(String action, Node node, ExecutionContext context, Runnable call) {
        call(action, node, context, () -> {
            call.run();
            return null;
        });
    }
}
