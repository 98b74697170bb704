package io.quantum.core.engine.exec;

import io.quantum.core.engine.ExecutionContext;
import io.quantum.core.engine.NodeExecutor;
import io.quantum.core.model.ExecResult;
import io.quantum.core.model.FileNode;
import io.quantum.core.spi.FileService;

/** Reads a file into {@code name}, or writes the interpolated content, through the {@link FileService}. */
public final class FileExecutor implements NodeExecutor<FileNode> {

    @Override
    public ExecResult execute(FileNode node, ExecutionContext context) {
        FileService files = Services.require(context.collaborators().files(), "file service", node, context);
        String path = context.evaluator().interpolate(node.path(), context);
        if (node.action() == FileNode.Action.READ) {
            String content = Services.call("Read '" + path + "'", node, context, () -> files.read(path));
            context.assign(node.name(), content);
        } else {
            String content = context.evaluator().interpolate(node.content(), context);
            Services.run("Write '" + path + "'", node, context, () -> files.write(path, content));
        }
        return ExecResult.CONTINUE;
    }
}
