package io.quantum.core.model;

/**
 * A statement in a parsed component body. The set of node types is closed: every tag the parser
 * understands maps to exactly one record in this package, and every record has exactly one
 * executor. Nodes hold literal attribute text only; expressions are evaluated at execution time,
 * which is what lets one parsed tree serve every request.
 *
 * <p>Nodes form a strict tree. Only function invocation introduces recursion, and it does so on
 * the call stack at runtime, never through references between nodes.
 */
public interface Node {

    /** Where this node starts in its source file. */
    SourceLocation location();
}
