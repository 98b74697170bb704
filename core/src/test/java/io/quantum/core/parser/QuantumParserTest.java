package io.quantum.core.parser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.quantum.core.error.SourceParseException;
import io.quantum.core.model.ComponentCallNode;
import io.quantum.core.model.FileNode;
import io.quantum.core.model.FunctionNode;
import io.quantum.core.model.HtmlNode;
import io.quantum.core.model.IfNode;
import io.quantum.core.model.InvokeNode;
import io.quantum.core.model.LoopNode;
import io.quantum.core.model.LoopType;
import io.quantum.core.model.MessageNode;
import io.quantum.core.model.ParamNode;
import io.quantum.core.model.QueryNode;
import io.quantum.core.model.SetNode;
import io.quantum.core.model.SetOperation;
import io.quantum.core.model.SourceUnit;
import io.quantum.core.model.TextNode;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

/** Tests for {@link QuantumParser}: tag dispatch, hoisting, structure rules and located errors. */
@DisplayName("QuantumParserTest")
class QuantumParserTest {

    private final QuantumParser parser = new QuantumParser();

    private SourceUnit parse(String body) {
        return parser.parse("<q:component name=\"Test\">" + body + "</q:component>", "Test.q");
    }

    @Nested
    @DisplayName("Root element")
    class Root {

        @Test
        @DisplayName("Component attributes → unit metadata")
        void componentAttributes() {
            SourceUnit unit = parser.parse("""
                    <q:component name="Admin" require_auth="true" require_role="admin" interactive="yes">
                      <p>hi</p>
                    </q:component>
                    """);

            assertThat(unit.name()).isEqualTo("Admin");
            assertThat(unit.kind()).isEqualTo(SourceUnit.Kind.COMPONENT);
            assertThat(unit.requireAuth()).isTrue();
            assertThat(unit.requireRole()).isEqualTo("admin");
            assertThat(unit.interactive()).isTrue();
            assertThat(unit.body()).singleElement().isInstanceOf(HtmlNode.class);
        }

        @Test
        void applicationRootNeedsId() {
            SourceUnit app = parser.parse("<q:application id=\"shop\"/>");
            assertThat(app.kind()).isEqualTo(SourceUnit.Kind.APPLICATION);
            assertThat(app.name()).isEqualTo("shop");

            assertThatThrownBy(() -> parser.parse("<q:application/>"))
                    .isInstanceOf(SourceParseException.class)
                    .hasMessageContaining("<q:application> requires attribute 'id'");
        }

        @Test
        void otherRootsAreRejected() {
            assertThatThrownBy(() -> parser.parse("<div/>"))
                    .isInstanceOf(SourceParseException.class)
                    .hasMessageContaining("Root element must be <q:component> or <q:application>, got <div>");
        }

        @Test
        @DisplayName("Unnamed component → named after the source file, or 'anonymous'")
        void defaultName() {
            assertThat(parser.parse("<q:component/>", "pages/Home.q").name()).isEqualTo("Home");
            assertThat(parser.parse("<q:component/>").name()).isEqualTo("anonymous");
        }

        @Test
        void nestedComponentIsRejected() {
            assertThatThrownBy(() -> parse("<q:component name=\"Inner\"/>"))
                    .isInstanceOf(SourceParseException.class)
                    .hasMessageContaining("only allowed as the root element");
        }
    }

    @Nested
    @DisplayName("Dispatch")
    class Dispatch {

        @Test
        @DisplayName("Uppercase tag → component call; lowercase → HTML with dynamic attributes marked")
        void componentCallsAndHtml() {
            SourceUnit unit = parse("<Card title=\"{t}\"><b>x</b></Card><a href=\"/u/{id}\" class=\"link\">go</a>");

            ComponentCallNode call = (ComponentCallNode) unit.body().get(0);
            assertThat(call.component()).isEqualTo("Card");
            assertThat(call.attributes()).containsEntry("title", "{t}");
            assertThat(call.body()).singleElement().isInstanceOf(HtmlNode.class);

            HtmlNode link = (HtmlNode) unit.body().get(1);
            assertThat(link.tag()).isEqualTo("a");
            assertThat(link.dynamicAttributes()).containsExactly("href");
        }

        @Test
        @DisplayName("Script content is raw text; other text keeps its databinding")
        void rawText() {
            SourceUnit unit = parse("<script>var o = {a: 1};</script><p>Hi {name}</p>");

            TextNode script = (TextNode) ((HtmlNode) unit.body().get(0)).body().get(0);
            TextNode para = (TextNode) ((HtmlNode) unit.body().get(1)).body().get(0);
            assertThat(script.raw()).isTrue();
            assertThat(script.dynamic()).isFalse();
            assertThat(para.dynamic()).isTrue();
        }

        @Test
        @DisplayName("Unknown q: tag → HTML passthrough with dynamic attributes marked, never an error")
        void unknownTagPassesThrough() {
            SourceUnit unit = parse("<q:widget a=\"1\" b=\"{x}\">hi <q:set name=\"y\" value=\"2\"/></q:widget>");

            HtmlNode widget = (HtmlNode) unit.body().get(0);
            assertThat(widget.tag()).isEqualTo("q:widget");
            assertThat(widget.attributes()).containsEntry("a", "1");
            assertThat(widget.dynamicAttributes()).containsExactly("b");
            assertThat(widget.body()).hasSize(2);
            assertThat(widget.body().get(1)).isInstanceOf(SetNode.class);
        }

        @Test
        @DisplayName("Unknown q: tag → WARN naming the tag and its location")
        void unknownTagWarns() {
            Logger parserLogger = (Logger) LoggerFactory.getLogger(QuantumParser.class);
            ListAppender<ILoggingEvent> appender = new ListAppender<>();
            appender.start();
            parserLogger.addAppender(appender);
            try {
                parse("<q:widget/>");
            } finally {
                parserLogger.detachAppender(appender);
                appender.stop();
            }

            assertThat(appender.list).anySatisfy(e -> {
                assertThat(e.getLevel()).isEqualTo(Level.WARN);
                assertThat(e.getFormattedMessage()).contains("Unknown tag <q:widget>").contains("Test.q");
            });
        }

        @Test
        @DisplayName("Unknown q: tag attributes are not checked in strict mode")
        void unknownTagAttributesUnchecked() {
            assertThat(parse("<q:bogus colour=\"red\"/>").body()).singleElement().isInstanceOf(HtmlNode.class);
        }

        @Test
        @DisplayName("Unknown attribute → rejected in strict mode, ignored otherwise")
        void unknownAttribute() {
            String body = "<q:set name=\"x\" value=\"1\" colour=\"red\"/>";

            assertThatThrownBy(() -> parse(body))
                    .isInstanceOf(SourceParseException.class)
                    .hasMessageContaining("Unknown attribute 'colour' on <q:set>");
            SourceUnit lenient = new QuantumParser(TagRegistry.defaults(), false)
                    .parse("<q:component>" + body + "</q:component>");
            assertThat(lenient.body()).singleElement().isInstanceOf(SetNode.class);
        }

        @Test
        void malformedMarkup() {
            assertThatThrownBy(() -> parser.parse("<q:component><p></q:component>", "Bad.q"))
                    .isInstanceOf(SourceParseException.class)
                    .hasMessageContaining("Malformed markup");
        }

        @Test
        @DisplayName("DOCTYPE declarations are refused")
        void doctypeRefused() {
            String withEntity = "<!DOCTYPE q [<!ENTITY x \"boom\">]><q:component>&x;</q:component>";

            assertThatThrownBy(() -> parser.parse(withEntity)).isInstanceOf(SourceParseException.class);
        }
    }

    @Nested
    @DisplayName("Tags")
    class Tags {

        @Test
        void setWithOperationAndOptions() {
            SetNode set = (SetNode) parse(
                    "<q:set name=\"tags\" operation=\"removeAt\" index=\"0\" type=\"array\" min=\"0\"/>").body().get(0);

            assertThat(set.operation()).isEqualTo(SetOperation.REMOVE_AT);
            assertThat(set.option("index")).isEqualTo("0");
            assertThat(set.type()).isEqualTo("array");
            assertThat(set.rules().min()).isEqualTo("0");
        }

        @Test
        void unknownSetOperation() {
            assertThatThrownBy(() -> parse("<q:set name=\"x\" operation=\"explode\"/>"))
                    .hasMessageContaining("Unknown q:set operation 'explode'");
        }

        @Test
        @DisplayName("Loop type inferred from attributes; var required unless iterating a query")
        void loopTypes() {
            SourceUnit unit = parse("""
                    <q:loop var="i" from="1" to="3"><p>{i}</p></q:loop>
                    <q:loop var="item" items="{list}"/>
                    <q:loop query="users"/>
                    <q:loop type="list" var="c" items="a,b" delimiter=","/>
                    """);

            assertThat(unit.body())
                    .extracting(node -> ((LoopNode) node).type())
                    .containsExactly(LoopType.RANGE, LoopType.ARRAY, LoopType.QUERY, LoopType.LIST);
            assertThatThrownBy(() -> parse("<q:loop from=\"1\" to=\"2\"/>"))
                    .hasMessageContaining("<q:loop> requires attribute 'var'");
            assertThatThrownBy(() -> parse("<q:loop var=\"i\" type=\"forever\"/>"))
                    .hasMessageContaining("Unknown loop type 'forever'");
        }

        @Test
        @DisplayName("q:if accepts nested and separator forms of elseif/else")
        void ifBranches() {
            IfNode nested = (IfNode) parse("""
                    <q:if condition="{a}">A<q:elseif condition="{b}">B</q:elseif><q:else>C</q:else></q:if>
                    """).body().get(0);
            IfNode separators = (IfNode) parse("""
                    <q:if condition="{a}">A<q:elseif condition="{b}"/>B<q:else/>C</q:if>
                    """).body().get(0);

            for (IfNode node : new IfNode[] {nested, separators}) {
                assertThat(node.branches()).hasSize(3);
                assertThat(node.branches().get(1).condition()).isEqualTo("{b}");
                assertThat(node.branches().get(2).condition()).isNull();
                assertThat(((TextNode) node.branches().get(2).body().get(0)).text()).isEqualTo("C");
            }
        }

        @Test
        void elseMustBeLast() {
            assertThatThrownBy(() -> parse("<q:if condition=\"{a}\"><q:else/><q:elseif condition=\"{b}\"/></q:if>"))
                    .hasMessageContaining("<q:elseif> cannot follow <q:else>");
            assertThatThrownBy(() -> parse("<q:else/>")).hasMessageContaining("<q:else> must be a child of <q:if>");
        }

        @Test
        @DisplayName("Top-level params and functions are hoisted out of the body")
        void hoisting() {
            SourceUnit unit = parse("""
                    <q:param name="limit" type="integer" default="10" min="1"/>
                    <q:function name="double" returnType="integer">
                      <q:param name="n" type="integer" required="true"/>
                      <q:return value="{n * 2}"/>
                    </q:function>
                    <p>{double(limit)}</p>
                    """);

            assertThat(unit.params()).extracting(ParamNode::name).containsExactly("limit");
            assertThat(unit.params().get(0).rules().min()).isEqualTo("1");
            FunctionNode function = unit.function("double").orElseThrow();
            assertThat(function.returnType()).isEqualTo("integer");
            assertThat(function.params()).singleElement().satisfies(p -> assertThat(p.required()).isTrue());
            assertThat(unit.body()).singleElement().isInstanceOf(HtmlNode.class);
        }

        @Test
        void misplacedAndDuplicateParams() {
            assertThatThrownBy(() -> parse("<q:if condition=\"{a}\"><q:param name=\"x\"/></q:if>"))
                    .hasMessageContaining("<q:param> must be a direct child of <q:component> or <q:function>");
            assertThatThrownBy(() -> parse("<q:param name=\"x\"/><q:param name=\"x\"/>"))
                    .hasMessageContaining("Duplicate parameter 'x'");
            assertThatThrownBy(() -> parse("<q:function name=\"f\"/><q:function name=\"f\"/>"))
                    .hasMessageContaining("Duplicate function 'f'");
        }

        @Test
        @DisplayName("q:invoke passes every extra attribute as an argument")
        void invokeArguments() {
            InvokeNode invoke = (InvokeNode) parse(
                    "<q:invoke function=\"greet\" result=\"msg\" who=\"{user}\" times=\"2\"/>").body().get(0);

            assertThat(invoke.function()).isEqualTo("greet");
            assertThat(invoke.result()).isEqualTo("msg");
            assertThat(invoke.arguments()).isEqualTo(Map.of("who", "{user}", "times", "2"));
        }

        @Test
        @DisplayName("q:query keeps its SQL text and collects queryparams")
        void query() {
            QueryNode query = (QueryNode) parse("""
                    <q:query name="users" datasource="main">
                      SELECT * FROM users WHERE id = :id
                      <q:queryparam name="id" value="{userId}" cfsqltype="cf_sql_integer"/>
                    </q:query>
                    """).body().get(0);

            assertThat(query.datasource()).isEqualTo("main");
            assertThat(query.sql()).contains("SELECT * FROM users WHERE id = :id");
            assertThat(query.params())
                    .containsExactly(new QueryNode.QueryParam("id", "{userId}", "cf_sql_integer"));
            assertThatThrownBy(() -> parse("<q:query name=\"q\"><q:queryparam name=\"a\" value=\"1\"/></q:query>"))
                    .hasMessageContaining("has no query text");
        }

        @Test
        void serviceTags() {
            SourceUnit unit = parse("""
                    <q:message type="send" queue="orders" value="{order}"/>
                    <q:file action="read" path="/tmp/a.txt" name="text"/>
                    """);

            MessageNode message = (MessageNode) unit.body().get(0);
            assertThat(message.kind()).isEqualTo(MessageNode.Kind.SEND);
            assertThat(message.destination()).isEqualTo("orders");
            assertThat(((FileNode) unit.body().get(1)).action()).isEqualTo(FileNode.Action.READ);

            assertThatThrownBy(() -> parse("<q:message type=\"broadcast\" topic=\"t\"/>"))
                    .hasMessageContaining("Unknown q:message type 'broadcast'");
            assertThatThrownBy(() -> parse("<q:file action=\"delete\" path=\"x\"/>"))
                    .hasMessageContaining("Unknown q:file action 'delete'");
            assertThatThrownBy(() -> parse("<q:llm name=\"x\"/>"))
                    .hasMessageContaining("<q:llm> requires a 'prompt' attribute or body");
        }
    }
}
