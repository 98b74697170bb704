package io.quantum.core.engine.exec;

import static io.quantum.core.testkit.TestComponents.render;
import static io.quantum.core.testkit.TestComponents.runtime;
import static io.quantum.core.testkit.TestComponents.text;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.quantum.core.engine.Collaborators;
import io.quantum.core.engine.ComponentRuntime;
import io.quantum.core.engine.Scopes;
import io.quantum.core.error.NodeExecutionException;
import io.quantum.core.error.ParamBindingException;
import io.quantum.core.model.SourceUnit;
import io.quantum.core.parser.QuantumParser;
import io.quantum.core.spi.ComponentResolver;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/** Component calls, {@code q:import} and {@code q:slot}. */
@ExtendWith(MockitoExtension.class)
@DisplayName("CompositionTest")
class CompositionTest {

    private static final QuantumParser PARSER = new QuantumParser();

    private static final SourceUnit CARD = PARSER.parse("""
            <q:component name="Card">
              <q:param name="title" required="true"/>
              <q:param name="level" type="integer" default="2"/>
              <div class="card"><h2 data-level="{level}">{title}</h2><q:slot><em>empty</em></q:slot></div>
            </q:component>
            """, "components/Card.q");

    private static final SourceUnit BADGE = PARSER.parse("""
            <q:component name="Badge">
              <span>{isDefined('secret')}</span>
            </q:component>
            """, "components/Badge.q");

    @Mock
    private ComponentResolver resolver;

    private ComponentRuntime runtime;

    @BeforeEach
    void setUp() {
        runtime = runtime(Collaborators.builder().resolver(resolver).build());
    }

    @Test
    @DisplayName("Imported component renders in place with bound params and slot content")
    void importAndCall() {
        when(resolver.resolve("Card", null)).thenReturn(Optional.of(CARD));
        String body = """
                <q:import component="Card"/>
                <q:set name="heading" value="Orders"/>
                <Card title="{heading} (3)"><p>three items</p></Card>
                """;

        String html = text(render(runtime, body));

        assertThat(html).isEqualTo(
                "<div class=\"card\"><h2 data-level=\"2\">Orders (3)</h2><p>three items</p></div>");
    }

    @Test
    @DisplayName("No caller content → slot renders its fallback")
    void slotFallback() {
        when(resolver.resolve("Card", null)).thenReturn(Optional.of(CARD));

        String html = text(render(runtime, "<q:import component=\"Card\"/><Card title=\"Solo\" level=\"1\"/>"));

        assertThat(html).contains("<h2 data-level=\"1\">Solo</h2><em>empty</em>");
    }

    @Test
    @DisplayName("Alias and from are passed to the resolver; the alias names the tag")
    void aliasAndFrom() {
        when(resolver.resolve(eq("Card"), eq("shared/Card.q"))).thenReturn(Optional.of(CARD));

        String html = text(render(
                runtime, "<q:import component=\"Card\" from=\"shared/Card.q\" as=\"Panel\"/><Panel title=\"X\"/>"));

        assertThat(html).contains("<h2 data-level=\"2\">X</h2>");
    }

    @Test
    @DisplayName("Un-imported component falls back to the resolver by name")
    void resolverFallback() {
        when(resolver.resolve("Card", null)).thenReturn(Optional.of(CARD));

        assertThat(text(render(runtime, "<Card title=\"Direct\"/>"))).contains("Direct");
    }

    @Test
    @DisplayName("Callee sees only its params: the caller's variables are not visible")
    void calleeIsIsolated() {
        when(resolver.resolve("Badge", null)).thenReturn(Optional.of(BADGE));
        String body = """
                <q:set name="secret" value="42"/>
                <Badge/>
                """;

        assertThat(text(render(runtime, body))).isEqualTo("<span>false</span>");
    }

    @Test
    @DisplayName("Callee sees request attributes")
    void calleeSeesRequest() {
        SourceUnit whoami = PARSER.parse("<q:component name=\"WhoAmI\"><i>{user}</i></q:component>");
        when(resolver.resolve("WhoAmI", null)).thenReturn(Optional.of(whoami));
        Scopes scopes = Scopes.builder().request(Map.of("user", "ada")).build();

        assertThat(text(render(runtime, "<WhoAmI/>", Map.of(), scopes))).isEqualTo("<i>ada</i>");
    }

    @Test
    @DisplayName("Missing required param on a call → ParamBindingException naming the callee")
    void missingParam() {
        when(resolver.resolve("Card", null)).thenReturn(Optional.of(CARD));

        assertThatThrownBy(() -> render(runtime, "<Card/>"))
                .isInstanceOf(ParamBindingException.class)
                .hasMessageContaining("Missing required parameter 'title' for component 'Card'");
    }

    @Test
    @DisplayName("Unknown component → error suggesting q:import")
    void unknownComponent() {
        when(resolver.resolve(any(), isNull())).thenReturn(Optional.empty());

        assertThatThrownBy(() -> render(runtime, "<Ghost/>"))
                .isInstanceOf(NodeExecutionException.class)
                .hasMessageContaining("Unknown component 'Ghost'; import it with q:import");
    }

    @Test
    @DisplayName("Import of a missing component names the location tried")
    void importNotFound() {
        when(resolver.resolve("Card", "nowhere.q")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> render(runtime, "<q:import component=\"Card\" from=\"nowhere.q\"/>"))
                .isInstanceOf(NodeExecutionException.class)
                .hasMessageContaining("Component 'Card' not found at 'nowhere.q'");
    }

    @Test
    @DisplayName("Resolver failure → wrapped with the component name")
    void resolverFailure() {
        when(resolver.resolve("Card", null)).thenThrow(new IllegalStateException("disk on fire"));

        assertThatThrownBy(() -> render(runtime, "<q:import component=\"Card\"/>"))
                .isInstanceOf(NodeExecutionException.class)
                .hasMessageContaining("Failed to resolve component 'Card': disk on fire")
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Import without a resolver → configuration error")
    void noResolver() {
        assertThatThrownBy(() -> render("<q:import component=\"Card\"/>"))
                .isInstanceOf(NodeExecutionException.class)
                .hasMessageContaining("Cannot import 'Card': no component resolver configured");
    }

    @Test
    @DisplayName("Callee's return value is discarded; its redirect propagates")
    void returnDiscardedRedirectPropagates() {
        SourceUnit quiet = PARSER.parse("<q:component name=\"Quiet\">q<q:return value=\"7\"/></q:component>");
        SourceUnit away = PARSER.parse("<q:component name=\"Away\"><q:redirect url=\"/login\"/></q:component>");
        when(resolver.resolve("Quiet", null)).thenReturn(Optional.of(quiet));
        when(resolver.resolve("Away", null)).thenReturn(Optional.of(away));

        var kept = render(runtime, "<Quiet/>after");
        var redirected = render(runtime, "<Away/>after");

        assertThat(kept.html()).isEqualTo("qafter");
        assertThat(kept.returnValue()).isNull();
        assertThat(redirected.isRedirect()).isTrue();
        assertThat(redirected.redirectTarget()).isEqualTo("/login");
    }

    @Test
    @DisplayName("An imported alias is resolved once, not per call")
    void importResolvedOnce() {
        when(resolver.resolve("Card", null)).thenReturn(Optional.of(CARD));

        render(runtime, """
                <q:import component="Card"/>
                <Card title="a"/><Card title="b"/><Card title="c"/>
                """);

        verify(resolver).resolve("Card", null);
    }
}
