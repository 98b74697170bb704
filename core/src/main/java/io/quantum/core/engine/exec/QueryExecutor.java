package io.quantum.core.engine.exec;

import io.quantum.core.engine.Collaborators;
import io.quantum.core.engine.ExecutionContext;
import io.quantum.core.engine.NodeExecutor;
import io.quantum.core.engine.ParamBinder;
import io.quantum.core.engine.expr.Values;
import io.quantum.core.model.ExecResult;
import io.quantum.core.model.QueryNode;
import io.quantum.core.model.RowSet;
import io.quantum.core.spi.DataSource;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs {@code q:query} against a {@link DataSource} and binds the result.
 *
 * <p>The query text is passed as written; databinding is not applied to it. Values reach the
 * query only through {@code q:queryparam}, so user input is never spliced into the text. Binds
 * {@code <name>} to the {@link RowSet} and {@code <name>_result} to its metadata
 * ({@code recordCount}, {@code columnList}, {@code executionTime} in ms).
 */
public final class QueryExecutor implements NodeExecutor<QueryNode> {

    private static final Logger LOG = LoggerFactory.getLogger(QueryExecutor.class);

    @Override
    public ExecResult execute(QueryNode node, ExecutionContext context) {
        String datasource = node.datasource() != null
                ? context.evaluator().evaluateText(node.datasource(), context)
                : Collaborators.DEFAULT_DATASOURCE;
        DataSource dataSource = Services.require(
                context.collaborators().dataSource(datasource), "data source '" + datasource + "'", node, context);

        Map<String, Object> params = new LinkedHashMap<>();
        for (QueryNode.QueryParam param : node.params()) {
            Object value = Values.normalize(context.evaluator().evaluateValue(param.value(), context));
            params.put(param.name(), ParamBinder.coerce(value, sqlType(param.type()), param.name(), context));
        }

        long started = System.nanoTime();
        RowSet rows = Services.call("Query '" + node.name() + "'", node, context, () -> {
            RowSet result = dataSource.execute(node.sql().trim(), params);
            return result != null ? result : RowSet.empty();
        });
        long elapsedMs = (System.nanoTime() - started) / 1_000_000;
        LOG.debug("Query {} returned {} rows in {}ms", node.name(), rows.size(), elapsedMs);

        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("success", true);
        meta.put("recordCount", (long) rows.size());
        meta.put("columnList", String.join(",", rows.columns()));
        meta.put("executionTime", elapsedMs);
        context.assign(node.name(), rows);
        context.assign(node.name() + "_result", meta);
        return ExecResult.CONTINUE;
    }

    /** {@code cf_sql_integer} and {@code integer} name the same type. */
    private static String sqlType(String type) {
        if (type == null) {
            return null;
        }
        String t = type.trim().toLowerCase(Locale.ROOT);
        if (t.startsWith("cf_sql_")) {
            t = t.substring("cf_sql_".length());
        }
        return switch (t) {
            case "varchar", "char", "text" -> "string";
            case "bigint", "smallint", "tinyint" -> "integer";
            case "double", "float", "numeric" -> "decimal";
            case "bit" -> "boolean";
            default -> t;
        };
    }
}
