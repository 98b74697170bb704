package io.quantum.core.engine.exec;

import static io.quantum.core.testkit.TestComponents.render;
import static io.quantum.core.testkit.TestComponents.runtime;
import static io.quantum.core.testkit.TestComponents.text;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.quantum.core.config.RuntimeConfig;
import io.quantum.core.engine.Collaborators;
import io.quantum.core.engine.ComponentRuntime;
import io.quantum.core.engine.Scopes;
import io.quantum.core.error.ExecutionBudgetExceededException;
import io.quantum.core.error.ExpressionEvalException;
import io.quantum.core.error.NodeExecutionException;
import io.quantum.core.model.RowSet;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for {@link LoopExecutor}: the four loop kinds, iteration frames and limits. */
@DisplayName("LoopExecutorTest")
class LoopExecutorTest {

    @Nested
    @DisplayName("Range")
    class Range {

        @Test
        @DisplayName("Bounds are inclusive")
        void inclusive() {
            assertThat(text(render("<q:loop var=\"i\" from=\"1\" to=\"3\">[{i}]</q:loop>"))).isEqualTo("[1][2][3]");
        }

        @Test
        @DisplayName("Negative step counts down; bounds may be expressions")
        void negativeStep() {
            String body = """
                    <q:set name="top" value="{2 * 3}"/>
                    <q:loop var="i" from="{top}" to="0" step="-2">{i};</q:loop>
                    """;

            assertThat(text(render(body))).isEqualTo("6;4;2;0;");
        }

        @Test
        @DisplayName("Accumulating into an outer variable: 1..5 sums to 15")
        void accumulates() {
            String body = """
                    <q:set name="total" value="0"/>
                    <q:loop var="i" from="1" to="5"><q:set name="total" value="{total + i}"/></q:loop>
                    <p>{total}</p>
                    """;

            assertThat(text(render(body))).isEqualTo("<p>15</p>");
        }

        @Test
        void emptyWhenFromPassesTo() {
            assertThat(render("<q:loop var=\"i\" from=\"5\" to=\"1\">x</q:loop>").html()).isEmpty();
        }

        @Test
        void zeroStepIsRejected() {
            assertThatThrownBy(() -> render("<q:loop var=\"i\" from=\"1\" to=\"3\" step=\"0\">x</q:loop>"))
                    .isInstanceOf(NodeExecutionException.class)
                    .hasMessageContaining("Loop step must not be 0");
        }

        @Test
        void nonNumericBound() {
            assertThatThrownBy(() -> render("<q:loop var=\"i\" from=\"one\" to=\"3\">x</q:loop>"))
                    .isInstanceOf(NodeExecutionException.class)
                    .hasMessageContaining("Loop attribute 'from' is not a number: string 'one'");
        }
    }

    @Nested
    @DisplayName("Array and list")
    class ArrayAndList {

        @Test
        @DisplayName("Array loop binds var, var_count (1-based) and index (0-based)")
        void arrayBindings() {
            String body = "<q:loop var=\"fruit\" index=\"i\" items=\"{['apple', 'pear']}\">"
                    + "{i}:{fruit_count}:{fruit} </q:loop>";

            assertThat(text(render(body))).isEqualTo("0:1:apple 1:2:pear");
        }

        @Test
        @DisplayName("Array loop over records supplied by the host")
        void arrayOfRecords() {
            String body = "<q:loop var=\"u\" items=\"{users}\">{u.name} </q:loop>";
            Scopes scopes = Scopes.builder()
                    .request(Map.of("users", List.of(Map.of("name", "Ada"), Map.of("name", "Grace"))))
                    .build();

            assertThat(text(render(runtime(), body, Map.of(), scopes))).isEqualTo("Ada Grace");
        }

        @Test
        @DisplayName("List loop splits on the delimiter and trims each item")
        void listLoop() {
            String body = "<q:loop type=\"list\" var=\"c\" items=\"red; green ;blue\" delimiter=\";\">[{c}]</q:loop>";

            assertThat(text(render(body))).isEqualTo("[red][green][blue]");
        }

        @Test
        @DisplayName("Empty array literal → zero iterations, loop variable never bound")
        void emptyArray() {
            String body = """
                    <q:loop var="item" items="{[]}">never</q:loop>
                    <p>{isDefined('item')}</p>
                    """;

            assertThat(text(render(body))).isEqualTo("<p>false</p>");
        }

        @Test
        void listLoopDefaultsToComma() {
            assertThat(text(render("<q:loop type=\"list\" var=\"c\" items=\"a, b\">({c})</q:loop>")))
                    .isEqualTo("(a)(b)");
            assertThat(render("<q:loop type=\"list\" var=\"c\" items=\"  \">x</q:loop>").html()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Query")
    class Query {

        private final RowSet users = new RowSet(
                List.of("id", "name"), List.of(Map.of("id", 1L, "name", "Ada"), Map.of("id", 2L, "name", "Linus")));

        @Test
        @DisplayName("Columns of each row are bound directly, plus currentRow")
        void rowsBindColumns() {
            Scopes scopes = Scopes.builder().request(Map.of("users", users)).build();
            String body = "<q:loop query=\"users\">{id}={name}/{currentRow.name} </q:loop>";

            assertThat(text(render(runtime(), body, Map.of(), scopes))).isEqualTo("1=Ada/Ada 2=Linus/Linus");
        }

        @Test
        void emptyResultRunsNoIterations() {
            Scopes scopes = Scopes.builder().request(Map.of("none", RowSet.empty())).build();

            assertThat(render(runtime(), "<q:loop query=\"none\">x</q:loop>", Map.of(), scopes).html()).isEmpty();
        }

        @Test
        void missingQueryIsAnError() {
            assertThatThrownBy(() -> render("<q:loop query=\"ghost\">x</q:loop>"))
                    .isInstanceOf(NodeExecutionException.class)
                    .hasMessageContaining("Query 'ghost' not found");
        }
    }

    @Nested
    @DisplayName("Frames")
    class Frames {

        @Test
        @DisplayName("Names first created inside the body do not survive the loop")
        void iterationLocalsAreDiscarded() {
            String body = """
                    <q:loop var="i" from="1" to="2"><q:set name="tmp" value="{i}"/></q:loop>
                    <p>{isDefined('tmp')}/{isDefined('i')}</p>
                    """;

            assertThat(text(render(body))).isEqualTo("<p>false/false</p>");
        }

        @Test
        @DisplayName("Assignments to outer names update the outer binding")
        void outerNamesAreUpdated() {
            String body = """
                    <q:set name="total" value="0"/>
                    <q:loop var="n" items="{[1, 2, 3]}"><q:set name="total" value="{total + n}"/></q:loop>
                    <p>{total}</p>
                    """;

            assertThat(text(render(body))).isEqualTo("<p>6</p>");
        }

        @Test
        @DisplayName("A return inside a loop body ends the loop and the component")
        void returnEndsLoop() {
            String body = """
                    <q:loop var="i" from="1" to="10">{i}<q:if condition="{i == 3}">
                      <q:return value="{i}"/>
                    </q:if></q:loop>
                    after
                    """;

            var output = render(body);

            assertThat(text(output)).isEqualTo("123");
            assertThat(output.returnValue()).isEqualTo(3L);
        }
    }

    @Test
    @DisplayName("Iteration limit → ExecutionBudgetExceededException")
    void iterationLimit() {
        ComponentRuntime limited =
                new ComponentRuntime(RuntimeConfig.builder().maxLoopIterations(5).build(), Collaborators.none());

        assertThatThrownBy(() -> render(limited, "<q:loop var=\"i\" from=\"1\" to=\"100\">x</q:loop>"))
                .isInstanceOf(ExecutionBudgetExceededException.class)
                .hasMessageContaining("Loop exceeded 5 iterations");
        assertThat(text(render(limited, "<q:loop var=\"i\" from=\"1\" to=\"5\">x</q:loop>"))).isEqualTo("xxxxx");
    }

    @Test
    @DisplayName("range() is held to the same iteration limit")
    void rangeFunctionLimit() {
        ComponentRuntime limited =
                new ComponentRuntime(RuntimeConfig.builder().maxLoopIterations(100).build(), Collaborators.none());

        assertThatThrownBy(() -> render(limited, "<p>{len(range(1, 3000000))}</p>"))
                .isInstanceOf(ExpressionEvalException.class)
                .hasMessageContaining("exceeds the limit of 100 items");
        assertThat(text(render(limited, "<q:loop var=\"i\" items=\"{range(1, 3)}\">{i}</q:loop>"))).isEqualTo("123");
    }
}
