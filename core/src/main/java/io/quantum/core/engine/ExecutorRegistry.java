package io.quantum.core.engine;

import io.quantum.core.engine.exec.AgentExecutor;
import io.quantum.core.engine.exec.ComponentCallExecutor;
import io.quantum.core.engine.exec.DumpExecutor;
import io.quantum.core.engine.exec.FileExecutor;
import io.quantum.core.engine.exec.FlashExecutor;
import io.quantum.core.engine.exec.FunctionExecutor;
import io.quantum.core.engine.exec.HtmlExecutor;
import io.quantum.core.engine.exec.IfExecutor;
import io.quantum.core.engine.exec.ImportExecutor;
import io.quantum.core.engine.exec.InvokeExecutor;
import io.quantum.core.engine.exec.LlmExecutor;
import io.quantum.core.engine.exec.LogExecutor;
import io.quantum.core.engine.exec.LoopExecutor;
import io.quantum.core.engine.exec.MailExecutor;
import io.quantum.core.engine.exec.MessageExecutor;
import io.quantum.core.engine.exec.QueryExecutor;
import io.quantum.core.engine.exec.RedirectExecutor;
import io.quantum.core.engine.exec.ReturnExecutor;
import io.quantum.core.engine.exec.SetExecutor;
import io.quantum.core.engine.exec.SlotExecutor;
import io.quantum.core.engine.exec.TextExecutor;
import io.quantum.core.error.NodeExecutionException;
import io.quantum.core.error.QuantumException;
import io.quantum.core.model.AgentNode;
import io.quantum.core.model.ComponentCallNode;
import io.quantum.core.model.DumpNode;
import io.quantum.core.model.ExecResult;
import io.quantum.core.model.FileNode;
import io.quantum.core.model.FlashNode;
import io.quantum.core.model.FunctionNode;
import io.quantum.core.model.HtmlNode;
import io.quantum.core.model.IfNode;
import io.quantum.core.model.ImportNode;
import io.quantum.core.model.InvokeNode;
import io.quantum.core.model.LlmNode;
import io.quantum.core.model.LogNode;
import io.quantum.core.model.LoopNode;
import io.quantum.core.model.MailNode;
import io.quantum.core.model.MessageNode;
import io.quantum.core.model.Node;
import io.quantum.core.model.QueryNode;
import io.quantum.core.model.RedirectNode;
import io.quantum.core.model.ReturnNode;
import io.quantum.core.model.SetNode;
import io.quantum.core.model.SlotNode;
import io.quantum.core.model.SourceLocation;
import io.quantum.core.model.TextNode;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps node types to their executors. Registration and lookup are thread-safe; in practice the
 * registry is filled at startup and only read afterwards.
 *
 * <p>{@link #execute} is the single dispatch point: it records the node's location on the
 * context so errors raised anywhere below are attributed to it, and wraps unexpected runtime
 * failures in {@link NodeExecutionException}.
 */
public final class ExecutorRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(ExecutorRegistry.class);

    private final Map<Class<? extends Node>, Binding<?>> executors = new ConcurrentHashMap<>();

    /** A registry holding the executors for every built-in node type. */
    public static ExecutorRegistry withDefaults() {
        ExecutorRegistry registry = new ExecutorRegistry();
        registry.register(TextNode.class, new TextExecutor());
        registry.register(HtmlNode.class, new HtmlExecutor());
        registry.register(SetNode.class, new SetExecutor());
        registry.register(LoopNode.class, new LoopExecutor());
        registry.register(IfNode.class, new IfExecutor());
        registry.register(FunctionNode.class, new FunctionExecutor());
        registry.register(ReturnNode.class, new ReturnExecutor());
        registry.register(InvokeNode.class, new InvokeExecutor());
        registry.register(ImportNode.class, new ImportExecutor());
        registry.register(ComponentCallNode.class, new ComponentCallExecutor());
        registry.register(SlotNode.class, new SlotExecutor());
        registry.register(RedirectNode.class, new RedirectExecutor());
        registry.register(FlashNode.class, new FlashExecutor());
        registry.register(LogNode.class, new LogExecutor());
        registry.register(DumpNode.class, new DumpExecutor());
        registry.register(QueryNode.class, new QueryExecutor());
        registry.register(MailNode.class, new MailExecutor());
        registry.register(MessageNode.class, new MessageExecutor());
        registry.register(LlmNode.class, new LlmExecutor());
        registry.register(AgentNode.class, new AgentExecutor());
        registry.register(FileNode.class, new FileExecutor());
        return registry;
    }

    /**
     * Registers an executor. An existing registration for the same type is replaced with a
     * warning (last write wins).
     */
    public <N extends Node> void register(Class<N> nodeType, NodeExecutor<? super N> executor) {
        if (nodeType == null) {
            throw new NullPointerException("nodeType must not be null");
        }
        if (executor == null) {
            throw new NullPointerException("executor must not be null");
        }
        Binding<?> previous = executors.put(nodeType, new Binding<>(nodeType, executor));
        if (previous != null) {
            LOG.warn("Replaced executor for {}: {} -> {}",
                    nodeType.getSimpleName(),
                    previous.executor().getClass().getSimpleName(),
                    executor.getClass().getSimpleName());
        }
    }

    /**
     * Executes one node, counting one budget step.
     *
     * @throws NodeExecutionException if no executor is registered for the node's type, or the
     *     executor fails with an exception outside the Quantum hierarchy
     */
    public ExecResult execute(Node node, ExecutionContext context) {
        Binding<?> binding = executors.get(node.getClass());
        if (binding == null) {
            throw new NodeExecutionException(
                    "No executor registered for node type " + node.getClass().getSimpleName(),
                    node.location(),
                    context.componentName());
        }
        SourceLocation previous = context.enterLocation(node.location());
        try {
            context.step();
            return binding.run(node, context);
        } catch (QuantumException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new NodeExecutionException(
                    node.getClass().getSimpleName() + " failed: " + e.getMessage(),
                    e,
                    node.location(),
                    context.componentName());
        } finally {
            context.enterLocation(previous);
        }
    }

    /**
     * Executes a statement sequence in order. Stops at the first return or redirect and hands it
     * back.
     */
    public ExecResult executeAll(List<? extends Node> nodes, ExecutionContext context) {
        for (Node node : nodes) {
            ExecResult result = execute(node, context);
            if (!result.isContinue()) {
                return result;
            }
        }
        return ExecResult.CONTINUE;
    }

    /** Returns the number of registered executors. */
    public int size() {
        return executors.size();
    }

    /** Returns {@code true} if an executor is registered for exactly this node type. */
    public boolean hasExecutor(Class<? extends Node> nodeType) {
        return executors.containsKey(nodeType);
    }

    private record Binding<N extends Node>(Class<N> type, NodeExecutor<? super N> executor) {

        ExecResult run(Node node, ExecutionContext context) {
            return executor.execute(type.cast(node), context);
        }
    }
}
