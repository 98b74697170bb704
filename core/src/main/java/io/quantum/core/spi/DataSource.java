package io.quantum.core.spi;

import io.quantum.core.model.RowSet;
import java.util.Map;

/**
 * Query execution collaborator used by {@code q:query}. Parameters are always passed separately
 * from the query text; implementations bind them rather than splicing them in.
 */
public interface DataSource {

    /**
     * Runs a query.
     *
     * @param queryText   query text with named placeholders ({@code :name})
     * @param boundParams placeholder values
     * @return the result rows, never {@code null}
     */
    RowSet execute(String queryText, Map<String, Object> boundParams);
}
