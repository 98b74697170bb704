package io.quantum.core.engine;

import static io.quantum.core.testkit.TestComponents.component;
import static io.quantum.core.testkit.TestComponents.render;
import static io.quantum.core.testkit.TestComponents.squish;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.quantum.core.config.RuntimeConfig;
import io.quantum.core.error.ExecutionBudgetExceededException;
import io.quantum.core.error.NodeExecutionException;
import io.quantum.core.error.ParamBindingException;
import io.quantum.core.error.SourceParseException;
import io.quantum.core.model.RenderedOutput;
import io.quantum.core.model.SourceUnit;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/** End-to-end behavior of {@link ComponentRuntime#executeComponent}. */
@DisplayName("ComponentRuntimeTest")
class ComponentRuntimeTest {

    private final ComponentRuntime runtime = new ComponentRuntime();

    @Nested
    @DisplayName("Access control")
    class Access {

        private final SourceUnit admin = runtime.parse("""
                <q:component name="Admin" require_auth="true" require_role="admin">
                  <p>secret</p>
                </q:component>
                """, "Admin.q");

        @Test
        @DisplayName("Anonymous request → authentication required")
        void anonymous() {
            assertThatThrownBy(() -> runtime.executeComponent(admin, Map.of(), Scopes.isolated()))
                    .isInstanceOf(NodeExecutionException.class)
                    .hasMessageContaining("Component 'Admin': authentication required");
        }

        @Test
        @DisplayName("Authenticated without the role → role required")
        void missingRole() {
            Scopes user = Scopes.builder().authenticated(true).roles(Set.of("editor")).build();

            assertThatThrownBy(() -> runtime.executeComponent(admin, Map.of(), user))
                    .isInstanceOf(NodeExecutionException.class)
                    .hasMessageContaining("Component 'Admin': role admin required");
        }

        @Test
        @DisplayName("Authenticated with the role → rendered")
        void granted() {
            Scopes boss = Scopes.builder().authenticated(true).roles(Set.of("admin", "editor")).build();

            assertThat(squish(runtime.executeComponent(admin, Map.of(), boss).html())).isEqualTo("<p>secret</p>");
        }
    }

    @Nested
    @DisplayName("Parameters and results")
    class Results {

        private final SourceUnit greeting = runtime.parse("""
                <q:component name="Greeting">
                  <q:param name="name" required="true"/>
                  <q:param name="times" type="integer" default="1"/>
                  <q:loop var="i" from="1" to="{times}"><p>Hello {name}</p></q:loop>
                </q:component>
                """, "Greeting.q");

        @Test
        @DisplayName("Host params bind to declared parameters with defaults and conversion")
        void hostParams() {
            RenderedOutput output =
                    runtime.executeComponent(greeting, Map.of("name", "Ada", "times", "2"), Scopes.isolated());

            assertThat(output.component()).isEqualTo("Greeting");
            assertThat(output.html()).isEqualTo("<p>Hello Ada</p><p>Hello Ada</p>");
            assertThat(output.fragments()).hasSize(6);
            assertThat(output.isRedirect()).isFalse();
        }

        @Test
        @DisplayName("Missing required host param → ParamBindingException")
        void missingHostParam() {
            assertThatThrownBy(() -> runtime.executeComponent(greeting, Map.of(), Scopes.isolated()))
                    .isInstanceOf(ParamBindingException.class)
                    .satisfies(e -> assertThat(((ParamBindingException) e).paramName()).isEqualTo("name"));
        }

        @Test
        @DisplayName("Null params are treated as none")
        void nullParams() {
            SourceUnit plain = runtime.parse(component("ok"), "Test.q");

            assertThat(runtime.executeComponent(plain, null, Scopes.isolated()).html()).isEqualTo("ok");
        }

        @Test
        @DisplayName("Top-level q:return → value on the output, rendering stops")
        void returnValue() {
            RenderedOutput output = render("<p>a</p><q:return value=\"{{ok: true}}\"/><p>b</p>");

            assertThat(output.html()).isEqualTo("<p>a</p>");
            assertThat(output.returnValue()).isEqualTo(Map.of("ok", true));
        }

        @Test
        @DisplayName("Request attributes are readable and shared stores persist across requests")
        void scopesAcrossRequests() {
            ScopeStore application = ScopeStore.application();
            ScopeStore session = ScopeStore.session("s-1");
            SourceUnit counter = runtime.parse(component("""
                    <q:set name="application.hits" operation="increment"/>
                    <q:set name="session.mine" operation="increment"/>
                    <p>{request.path} {application.hits}/{session.mine}</p>
                    """), "Test.q");
            Scopes first = Scopes.builder().application(application).session(session)
                    .request(Map.of("path", "/a")).build();
            Scopes second = Scopes.builder().application(application).session(ScopeStore.session("s-2"))
                    .request(Map.of("path", "/b")).build();

            runtime.executeComponent(counter, Map.of(), first);
            String html = runtime.executeComponent(counter, Map.of(), second).html();

            assertThat(squish(html)).isEqualTo("<p>/b 2/1</p>");
            assertThat(session.get("mine")).isEqualTo(1L);
        }
    }

    @Nested
    @DisplayName("Budgets")
    class Budgets {

        @Test
        @DisplayName("Step budget → ExecutionBudgetExceededException with component and location")
        void stepBudget() {
            ComponentRuntime tight = new ComponentRuntime(
                    RuntimeConfig.builder().maxSteps(10).build(), Collaborators.none());

            assertThatThrownBy(() -> render(tight, "<q:loop var=\"i\" from=\"1\" to=\"100\">{i}</q:loop>"))
                    .isInstanceOf(ExecutionBudgetExceededException.class)
                    .hasMessageContaining("Step budget of 10 exceeded")
                    .satisfies(e -> {
                        ExecutionBudgetExceededException budget = (ExecutionBudgetExceededException) e;
                        assertThat(budget.component()).isEqualTo("Test");
                        assertThat(budget.urn()).isEqualTo(ExecutionBudgetExceededException.URN);
                    });
        }

        @Test
        @DisplayName("Wall-clock budget → long-running loop stopped")
        void wallClockBudget() {
            ComponentRuntime hasty = new ComponentRuntime(
                    RuntimeConfig.builder()
                            .maxWallClockMs(1)
                            .maxSteps(Long.MAX_VALUE)
                            .maxLoopIterations(Long.MAX_VALUE)
                            .build(),
                    Collaborators.none());

            assertThatThrownBy(() -> render(hasty, """
                    <q:loop var="i" from="1" to="100000000"><q:set name="x" value="{i * 2}"/></q:loop>
                    """))
                    .isInstanceOf(ExecutionBudgetExceededException.class)
                    .hasMessageContaining("Wall-clock budget of 1ms exceeded");
        }

        @Test
        @DisplayName("Cancelled context → execution stops at the next statement")
        void cancel() {
            SourceUnit unit = runtime.parse(component("<p>never</p>"), "Test.q");
            ExecutionContext context = runtime.newContext(Scopes.isolated());
            context.cancel();

            assertThatThrownBy(() -> runtime.executeComponent(unit, Map.of(), context))
                    .isInstanceOf(ExecutionBudgetExceededException.class)
                    .hasMessageContaining("Execution cancelled");
            assertThat(context.isCancelled()).isTrue();
        }
    }

    @Nested
    @DisplayName("Structured logging")
    class Logging {

        private ListAppender<ILoggingEvent> appender;
        private Logger runtimeLogger;

        @BeforeEach
        void attach() {
            runtimeLogger = (Logger) LoggerFactory.getLogger(ComponentRuntime.class);
            appender = new ListAppender<>();
            appender.start();
            runtimeLogger.addAppender(appender);
        }

        @AfterEach
        void detach() {
            runtimeLogger.detachAppender(appender);
            appender.stop();
            MDC.clear();
        }

        @Test
        @DisplayName("component.executed entry carries the component and request id in MDC")
        void executedEntry() {
            SourceUnit unit = runtime.parse(component("<p>x</p>"), "Test.q");

            runtime.executeComponent(unit, Map.of(), Scopes.builder().requestId("abc-123").build());

            ILoggingEvent executed = appender.list.stream()
                    .filter(e -> e.getMessage() != null && e.getMessage().startsWith("component.executed"))
                    .findFirst()
                    .orElseThrow(() -> new AssertionError("No component.executed log entry found"));
            assertThat(executed.getFormattedMessage())
                    .contains("component=Test", "request_id=abc-123", "redirect=false");
            assertThat(executed.getMDCPropertyMap())
                    .containsEntry(ComponentRuntime.MDC_COMPONENT, "Test")
                    .containsEntry(ComponentRuntime.MDC_REQUEST_ID, "abc-123");
        }

        @Test
        @DisplayName("component.failed entry carries the error; MDC is cleared afterwards")
        void failedEntry() {
            SourceUnit unit = runtime.parse(component("<q:invoke function=\"nope\"/>"), "Test.q");

            assertThatThrownBy(() -> runtime.executeComponent(unit, Map.of(), Scopes.isolated()))
                    .isInstanceOf(NodeExecutionException.class);

            assertThat(appender.list)
                    .extracting(ILoggingEvent::getFormattedMessage)
                    .anySatisfy(m -> assertThat(m).startsWith("component.failed component=Test")
                            .contains("Unknown function 'nope'"));
            assertThat(MDC.get(ComponentRuntime.MDC_COMPONENT)).isNull();
            assertThat(MDC.get(ComponentRuntime.MDC_REQUEST_ID)).isNull();
        }
    }

    @Nested
    @DisplayName("Files and configuration")
    class FilesAndConfig {

        @TempDir
        Path dir;

        @Test
        @DisplayName("executeFile loads through the AST cache")
        void executeFile() throws IOException {
            Path file = dir.resolve("Page.q");
            Files.writeString(file, """
                    <q:component>
                      <q:param name="title" default="Home"/>
                      <h1>{title}</h1>
                    </q:component>
                    """);

            RenderedOutput first = runtime.executeFile(file, Map.of(), Scopes.isolated());
            RenderedOutput second = runtime.executeFile(file, Map.of("title", "Docs"), Scopes.isolated());

            assertThat(first.component()).isEqualTo("Page");
            assertThat(squish(first.html())).isEqualTo("<h1>Home</h1>");
            assertThat(squish(second.html())).isEqualTo("<h1>Docs</h1>");
            assertThat(runtime.astCacheStats().hits()).isEqualTo(1);
            assertThat(runtime.astCacheStats().misses()).isEqualTo(1);
        }

        @Test
        @DisplayName("Expression cache statistics reflect reuse across requests")
        void expressionCacheStats() {
            SourceUnit unit = runtime.parse(component("<p>{1 + 2}</p>"), "Test.q");

            runtime.executeComponent(unit, Map.of(), Scopes.isolated());
            runtime.executeComponent(unit, Map.of(), Scopes.isolated());

            assertThat(runtime.expressionCacheStats().misses()).isEqualTo(1);
            assertThat(runtime.expressionCacheStats().hits()).isEqualTo(1);
        }

        @Test
        @DisplayName("strictAttributes=false → unknown attributes on q: tags are ignored")
        void lenientAttributes() {
            ComponentRuntime lenient = new ComponentRuntime(
                    RuntimeConfig.builder().strictAttributes(false).build(), Collaborators.none());
            String source = component("<q:set name=\"x\" value=\"1\" colour=\"red\"/>{x}");

            assertThat(lenient.executeComponent(lenient.parse(source, "Test.q"), Map.of(), Scopes.isolated()).html())
                    .isEqualTo("1");
            assertThatThrownBy(() -> runtime.parse(source, "Test.q"))
                    .isInstanceOf(SourceParseException.class)
                    .hasMessageContaining("Unknown attribute 'colour' on <q:set>");
        }
    }
}
