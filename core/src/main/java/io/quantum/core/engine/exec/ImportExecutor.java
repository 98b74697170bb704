package io.quantum.core.engine.exec;

import io.quantum.core.engine.ExecutionContext;
import io.quantum.core.engine.NodeExecutor;
import io.quantum.core.error.NodeExecutionException;
import io.quantum.core.model.ExecResult;
import io.quantum.core.model.ImportNode;
import io.quantum.core.model.SourceUnit;
import io.quantum.core.spi.ComponentResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Resolves an imported component and makes it callable under its alias for the rest of the component. */
public final class ImportExecutor implements NodeExecutor<ImportNode> {

    private static final Logger LOG = LoggerFactory.getLogger(ImportExecutor.class);

    @Override
    public ExecResult execute(ImportNode node, ExecutionContext context) {
        ComponentResolver resolver = context.collaborators()
                .resolver()
                .orElseThrow(() -> new NodeExecutionException(
                        "Cannot import '" + node.component() + "': no component resolver configured",
                        node.location(),
                        context.componentName()));
        SourceUnit unit;
        try {
            unit = resolver.resolve(node.component(), node.from()).orElse(null);
        } catch (RuntimeException e) {
            throw new NodeExecutionException(
                    "Failed to resolve component '" + node.component() + "': " + e.getMessage(),
                    e,
                    node.location(),
                    context.componentName());
        }
        if (unit == null) {
            throw new NodeExecutionException(
                    "Component '" + node.component() + "' not found"
                            + (node.from() != null ? " at '" + node.from() + "'" : ""),
                    node.location(),
                    context.componentName());
        }
        context.registerImport(node.bindingName(), unit);
        LOG.debug("Imported {} as {}", unit.name(), node.bindingName());
        return ExecResult.CONTINUE;
    }
}
