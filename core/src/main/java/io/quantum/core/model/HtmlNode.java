package io.quantum.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * An unrecognized tag rendered as literal HTML. Attribute values that contain {@code {...}} are
 * listed in {@code dynamicAttributes} and interpolated at render time.
 */
public record HtmlNode(
        String tag,
        Map<String, String> attributes,
        Set<String> dynamicAttributes,
        List<Node> body,
        SourceLocation location)
        implements Node, HasBody {

    public HtmlNode {
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        dynamicAttributes = Set.copyOf(dynamicAttributes);
        body = List.copyOf(body);
    }

    @Override
    public List<Node> children() {
        return body;
    }
}
