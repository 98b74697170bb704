package io.quantum.core.model;

import java.util.List;

/**
 * {@code <q:query name="users" datasource="main">SELECT ...</q:query>}. Bound parameters come from
 * {@code q:queryparam} children and are passed to the data source separately from the SQL text.
 */
public record QueryNode(
        String name, String datasource, String sql, List<QueryParam> params, SourceLocation location)
        implements Node {

    public QueryNode {
        params = List.copyOf(params);
    }

    /** {@code <q:queryparam name="id" value="{userId}" type="integer"/>}. */
    public record QueryParam(String name, String value, String type) {}
}
