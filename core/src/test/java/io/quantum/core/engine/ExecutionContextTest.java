package io.quantum.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.quantum.core.config.RuntimeConfig;
import io.quantum.core.error.ExecutionBudgetExceededException;
import io.quantum.core.error.NodeExecutionException;
import io.quantum.core.model.FunctionNode;
import io.quantum.core.model.SourceUnit;
import io.quantum.core.parser.QuantumParser;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for {@link ExecutionContext}: scope resolution, assignment rules, frames, output and budget. */
@DisplayName("ExecutionContextTest")
class ExecutionContextTest {

    private static final SourceUnit UNIT = new QuantumParser().parse("""
            <q:component name="Scoped">
              <q:function name="helper"><q:return value="{1}"/></q:function>
            </q:component>
            """);

    private ScopeStore application;
    private ScopeStore session;
    private ExecutionContext context;

    @BeforeEach
    void setUp() {
        application = ScopeStore.application();
        session = ScopeStore.session("s-1");
        Scopes scopes = Scopes.builder()
                .application(application)
                .session(session)
                .request(Map.of("q", "search"))
                .build();
        context = new ComponentRuntime().newContext(scopes);
    }

    @Nested
    @DisplayName("Resolution")
    class Resolution {

        @Test
        @DisplayName("Unqualified read: Local before Component before Request")
        void innermostWins() {
            context.enterComponent(UNIT, null);
            context.assign("request.x", "request");
            assertThat(context.lookup("x")).isEqualTo("request");

            context.assign("component.x", "component");
            assertThat(context.lookup("x")).isEqualTo("component");

            context.pushLocal().put("x", "local");
            assertThat(context.lookup("x")).isEqualTo("local");

            context.popLocal();
            assertThat(context.lookup("x")).isEqualTo("component");
        }

        @Test
        @DisplayName("Unqualified read never reaches Session or Application")
        void sharedScopesNeedPrefix() {
            session.put("user", "ada");
            application.put("hits", 3L);
            context.enterComponent(UNIT, null);

            assertThat(context.isDefined("user")).isFalse();
            assertThat(context.lookup("hits")).isNull();
            assertThat(context.lookup("session.user")).isEqualTo("ada");
            assertThat(context.lookup("application.hits")).isEqualTo(3L);
        }

        @Test
        @DisplayName("Request attributes from the host are visible unqualified")
        void requestAttributes() {
            assertThat(context.lookup("q")).isEqualTo("search");
            assertThat(context.lookup("request.q")).isEqualTo("search");
        }

        @Test
        @DisplayName("A function call hides the caller's locals but not the component frame")
        void functionBoundary() {
            context.enterComponent(UNIT, null);
            context.assign("component.shared", "yes");
            context.pushLocal().put("loopVar", 1L);
            FunctionNode helper = UNIT.function("helper").orElseThrow();

            context.enterFunction(helper).put("arg", "a");

            assertThat(context.isDefined("loopVar")).isFalse();
            assertThat(context.lookup("arg")).isEqualTo("a");
            assertThat(context.lookup("shared")).isEqualTo("yes");

            context.exitFunction();
            assertThat(context.lookup("loopVar")).isEqualTo(1L);
            assertThat(context.isDefined("arg")).isFalse();
        }

        @Test
        @DisplayName("Dotted paths walk maps and lists; a missing segment is undefined")
        void nestedPaths() {
            context.enterComponent(UNIT, null);
            context.assign("order", Map.of("lines", List.of(Map.of("sku", "A-1"))));

            assertThat(context.lookup("order.lines.0.sku")).isEqualTo("A-1");
            assertThat(context.lookup("order.lines.length")).isEqualTo(1L);
            assertThat(context.resolve("order.customer")).isSameAs(ExecutionContext.UNDEFINED);
            assertThat(context.isDefined("order.lines.5")).isFalse();
        }

        @Test
        @DisplayName("A bare scope name yields a read-only snapshot of that scope")
        void bareScopeName() {
            session.put("cart", List.of("book"));

            Object view = context.lookup("session");

            assertThat(view).isEqualTo(Map.of("cart", List.of("book")));
            session.put("cart", List.of());
            assertThat(view).isEqualTo(Map.of("cart", List.of("book")));
        }
    }

    @Nested
    @DisplayName("Assignment")
    class Assignment {

        @Test
        @DisplayName("Unqualified write overwrites the nearest existing binding")
        void overwritesExisting() {
            context.enterComponent(UNIT, null);
            context.assign("total", 0L);
            context.pushLocal();

            context.assign("total", 5L);
            context.popLocal();

            assertThat(context.lookup("component.total")).isEqualTo(5L);
        }

        @Test
        @DisplayName("Unqualified write of a new name lands in the innermost Local frame")
        void newNameIsLocal() {
            context.enterComponent(UNIT, null);
            context.pushLocal();

            context.assign("temp", "x");
            assertThat(context.lookup("local.temp")).isEqualTo("x");

            context.popLocal();
            assertThat(context.isDefined("temp")).isFalse();
        }

        @Test
        @DisplayName("Without Local frames a new name lands in the Component frame")
        void newNameInComponent() {
            context.enterComponent(UNIT, null);

            context.assign("title", "Orders");

            assertThat(context.lookup("component.title")).isEqualTo("Orders");
        }

        @Test
        @DisplayName("Prefixed writes target their scope directly")
        void prefixedWrites() {
            context.enterComponent(UNIT, null);

            context.assign("session.user", "ada");
            context.assign("application.version", "1.2");
            context.assign("request.flag", true);

            assertThat(session.get("user")).isEqualTo("ada");
            assertThat(application.get("version")).isEqualTo("1.2");
            assertThat(context.lookup("flag")).isEqualTo(true);
        }

        @Test
        @DisplayName("Nested write into a shared store replaces the root with an updated copy")
        void nestedSharedWriteCopies() {
            Map<String, Object> original = new LinkedHashMap<>();
            original.put("theme", "light");
            session.put("prefs", original);

            context.assign("session.prefs.theme", "dark");

            assertThat(original).containsEntry("theme", "light");
            assertThat(session.get("prefs")).isEqualTo(Map.of("theme", "dark"));
        }

        @Test
        @DisplayName("Nested write creates intermediate maps")
        void nestedWriteCreatesMaps() {
            context.enterComponent(UNIT, null);

            context.assign("user.address.city", "Zagreb");

            assertThat(context.lookup("user")).isEqualTo(Map.of("address", Map.of("city", "Zagreb")));
        }

        @Test
        @DisplayName("Nested write to a variable holding a shared value copies it")
        void nestedWriteThroughAliasCopies() {
            context.enterComponent(UNIT, null);
            context.assign("application.cfg.mode", "prod");
            context.assign("mine", context.lookup("application.cfg"));

            context.assign("mine.mode", "hacked");

            assertThat(application.get("cfg")).isEqualTo(Map.of("mode", "prod"));
            assertThat(context.lookup("mine")).isEqualTo(Map.of("mode", "hacked"));
        }

        @Test
        @DisplayName("Nested write into a list copies it and leaves the original list untouched")
        void nestedListWriteCopies() {
            context.enterComponent(UNIT, null);
            List<Object> original = new ArrayList<>(List.of("a", "b"));
            context.assign("items", original);

            context.assign("items.1", "z");
            context.assign("items.2", "c");

            assertThat(original).containsExactly("a", "b");
            assertThat(context.lookup("items")).isEqualTo(List.of("a", "z", "c"));
            assertThatThrownBy(() -> context.assign("items.9", "x"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("past the end");
        }

        @Test
        void assigningAWholeScopeIsRejected() {
            assertThatThrownBy(() -> context.assign("session", Map.of()))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("cannot assign to the whole 'session' scope");
        }

        @Test
        void unsetRemovesBinding() {
            context.enterComponent(UNIT, null);
            context.assign("gone", 1L);
            context.assign("session.token", "t");

            context.unset("gone");
            context.unset("session.token");

            assertThat(context.isDefined("gone")).isFalse();
            assertThat(session.containsKey("token")).isFalse();
        }

        @Test
        @DisplayName("update applies a function to the current value under the store lock")
        void update() {
            context.update("application.counter", current -> current == null ? 1L : (Long) current + 1);
            context.update("application.counter", current -> (Long) current + 1);

            assertThat(application.get("counter")).isEqualTo(2L);
        }
    }

    @Nested
    @DisplayName("Frames and output")
    class FramesAndOutput {

        @Test
        @DisplayName("Hoisted functions are visible once the component is entered")
        void hoistedFunctions() {
            assertThat(context.hasFunction("helper")).isFalse();

            context.enterComponent(UNIT, null);

            assertThat(context.hasFunction("helper")).isTrue();
            assertThat(context.invokeFunction("helper", List.of())).isEqualTo(1L);
        }

        @Test
        @DisplayName("Call depth is limited")
        void callDepth() {
            ExecutionContext shallow = new ComponentRuntime(
                            RuntimeConfig.builder().maxCallDepth(2).build(), Collaborators.none())
                    .newContext(Scopes.isolated());
            shallow.enterComponent(UNIT, null);
            shallow.enterComponent(UNIT, null);

            assertThatThrownBy(() -> shallow.enterComponent(UNIT, null))
                    .isInstanceOf(NodeExecutionException.class)
                    .hasMessageContaining("Maximum call depth of 2 exceeded calling component 'Scoped'");
        }

        @Test
        @DisplayName("Capture diverts output until it ends; empty fragments are dropped")
        void capture() {
            context.emit("<p>");
            context.beginCapture();
            context.emit("inner");
            String captured = context.endCapture();
            context.emit("");
            context.emit("</p>");

            assertThat(captured).isEqualTo("inner");
            assertThat(context.fragments()).containsExactly("<p>", "</p>");
        }

        @Test
        void endCaptureWithoutBeginFails() {
            assertThatThrownBy(() -> context.endCapture()).isInstanceOf(IllegalStateException.class);
        }
    }

    @Nested
    @DisplayName("Budget")
    class Budget {

        @Test
        @DisplayName("Step budget → ExecutionBudgetExceededException")
        void stepBudget() {
            ExecutionContext limited = new ComponentRuntime(
                            RuntimeConfig.builder().maxSteps(3).build(), Collaborators.none())
                    .newContext(Scopes.isolated());
            limited.step();
            limited.step();
            limited.step();

            assertThatThrownBy(limited::step)
                    .isInstanceOf(ExecutionBudgetExceededException.class)
                    .hasMessageContaining("Step budget of 3 exceeded");
        }

        @Test
        @DisplayName("Cancel stops at the next step")
        void cancel() {
            context.step();
            context.cancel();

            assertThat(context.isCancelled()).isTrue();
            assertThatThrownBy(context::step)
                    .isInstanceOf(ExecutionBudgetExceededException.class)
                    .hasMessage("Execution cancelled");
        }
    }
}
