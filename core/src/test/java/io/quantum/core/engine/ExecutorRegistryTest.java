package io.quantum.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.quantum.core.error.NodeExecutionException;
import io.quantum.core.error.ParamBindingException;
import io.quantum.core.model.ExecResult;
import io.quantum.core.model.HtmlNode;
import io.quantum.core.model.Node;
import io.quantum.core.model.SourceLocation;
import io.quantum.core.model.TextNode;
import io.quantum.core.parser.QuantumParser;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

/** Tests for {@link ExecutorRegistry}: dispatch, replacement, failure wrapping and sequencing. */
@DisplayName("ExecutorRegistryTest")
class ExecutorRegistryTest {

    private static final SourceLocation AT_LINE_3 = SourceLocation.of("Page.q", 3, 5);

    private ListAppender<ILoggingEvent> logAppender;
    private Logger registryLogger;
    private ExecutionContext context;

    @BeforeEach
    void setUp() {
        registryLogger = (Logger) LoggerFactory.getLogger(ExecutorRegistry.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        registryLogger.addAppender(logAppender);

        context = new ComponentRuntime().newContext(Scopes.isolated());
        context.enterComponent(new QuantumParser().parse("<q:component name=\"Page\"/>"), null);
    }

    @AfterEach
    void tearDown() {
        registryLogger.detachAppender(logAppender);
        logAppender.stop();
    }

    @Test
    @DisplayName("Defaults cover every built-in node type")
    void defaults() {
        ExecutorRegistry registry = ExecutorRegistry.withDefaults();

        assertThat(registry.size()).isEqualTo(21);
        assertThat(registry.hasExecutor(TextNode.class)).isTrue();
        assertThat(registry.hasExecutor(HtmlNode.class)).isTrue();
    }

    @Test
    @DisplayName("Replacing an executor → last registration wins, with a warning")
    void replacementWarns() {
        ExecutorRegistry registry = ExecutorRegistry.withDefaults();
        registry.register(TextNode.class, (node, ctx) -> {
            ctx.emit("[" + node.text() + "]");
            return ExecResult.CONTINUE;
        });

        registry.execute(new TextNode("hi", AT_LINE_3), context);

        assertThat(context.fragments()).containsExactly("[hi]");
        assertThat(logAppender.list)
                .anySatisfy(e -> {
                    assertThat(e.getLevel()).isEqualTo(Level.WARN);
                    assertThat(e.getFormattedMessage()).contains("Replaced executor for TextNode");
                });
    }

    @Test
    @DisplayName("An executor written for any node serves the type it is registered under")
    void supertypeExecutor() {
        ExecutorRegistry registry = new ExecutorRegistry();
        NodeExecutor<Node> named = (node, ctx) -> {
            ctx.emit(node.getClass().getSimpleName());
            return ExecResult.CONTINUE;
        };
        registry.register(TextNode.class, named);

        registry.execute(new TextNode("x", AT_LINE_3), context);

        assertThat(context.fragments()).containsExactly("TextNode");
        assertThat(registry.hasExecutor(HtmlNode.class)).isFalse();
    }

    @Test
    @DisplayName("Unregistered node type → NodeExecutionException")
    void unregistered() {
        ExecutorRegistry registry = new ExecutorRegistry();

        assertThatThrownBy(() -> registry.execute(new TextNode("x", AT_LINE_3), context))
                .isInstanceOf(NodeExecutionException.class)
                .hasMessageContaining("No executor registered for node type TextNode");
    }

    @Test
    @DisplayName("Foreign runtime failure → wrapped with the node's location and component")
    void wrapsForeignFailures() {
        ExecutorRegistry registry = new ExecutorRegistry();
        registry.register(TextNode.class, (node, ctx) -> {
            throw new IllegalStateException("boom");
        });

        assertThatThrownBy(() -> registry.execute(new TextNode("x", AT_LINE_3), context))
                .isInstanceOf(NodeExecutionException.class)
                .hasMessageContaining("TextNode failed: boom")
                .hasCauseInstanceOf(IllegalStateException.class)
                .satisfies(e -> {
                    NodeExecutionException failure = (NodeExecutionException) e;
                    assertThat(failure.location()).isEqualTo(AT_LINE_3);
                    assertThat(failure.component()).isEqualTo("Page");
                });
    }

    @Test
    @DisplayName("Quantum exceptions pass through unwrapped")
    void quantumExceptionsPassThrough() {
        ExecutorRegistry registry = new ExecutorRegistry();
        registry.register(TextNode.class, (node, ctx) -> {
            throw new ParamBindingException("bad", "p", ctx.currentLocation(), ctx.componentName());
        });

        assertThatThrownBy(() -> registry.execute(new TextNode("x", AT_LINE_3), context))
                .isExactlyInstanceOf(ParamBindingException.class)
                .satisfies(e -> assertThat(((ParamBindingException) e).location()).isEqualTo(AT_LINE_3));
    }

    @Test
    @DisplayName("executeAll stops at the first return and hands it back")
    void executeAllStopsAtReturn() {
        ExecutorRegistry registry = new ExecutorRegistry();
        registry.register(TextNode.class, (node, ctx) -> {
            if (node.text().equals("stop")) {
                return ExecResult.returning("done");
            }
            ctx.emit(node.text());
            return ExecResult.CONTINUE;
        });

        ExecResult result = registry.executeAll(
                List.of(
                        new TextNode("a", AT_LINE_3),
                        new TextNode("stop", AT_LINE_3),
                        new TextNode("b", AT_LINE_3)),
                context);

        assertThat(result.isReturn()).isTrue();
        assertThat(result.value()).isEqualTo("done");
        assertThat(context.fragments()).containsExactly("a");
        assertThat(context.steps()).isEqualTo(2);
    }

    @Test
    void locationIsRestoredAfterExecution() {
        ExecutorRegistry registry = ExecutorRegistry.withDefaults();

        registry.execute(new HtmlNode("br", Map.of(), Set.of(), List.of(), AT_LINE_3), context);

        assertThat(context.currentLocation()).isEqualTo(SourceLocation.UNKNOWN);
    }

    @Test
    void rejectsNullRegistration() {
        ExecutorRegistry registry = new ExecutorRegistry();

        assertThatThrownBy(() -> registry.register(TextNode.class, null))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("executor must not be null");
    }
}
