package io.quantum.core.model;

import java.util.List;

/** {@code <q:function name="...">}: a named statement sequence with declared parameters. */
public record FunctionNode(
        String name, List<ParamNode> params, String returnType, List<Node> body, SourceLocation location)
        implements Node, HasBody {

    public FunctionNode {
        params = List.copyOf(params);
        body = List.copyOf(body);
    }

    @Override
    public List<Node> children() {
        return body;
    }
}
