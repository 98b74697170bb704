package io.quantum.core.parser;

import io.quantum.core.model.FunctionNode;
import io.quantum.core.model.InvokeNode;
import io.quantum.core.model.Node;
import io.quantum.core.model.ParamNode;
import io.quantum.core.model.ReturnNode;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** {@code q:function}, {@code q:param}, {@code q:return} and {@code q:invoke}. */
final class FunctionTags {

    static final Set<String> PARAM_ATTRIBUTES = paramAttributes();

    private FunctionTags() {}

    static void registerAll(TagRegistry.Builder registry) {
        registry.register(
                "q:function",
                Set.of("name", "returnType", "return_type", "description", "access"),
                FunctionTags::function);
        registry.register("q:param", PARAM_ATTRIBUTES, (element, context) -> {
            throw context.error("<q:param> must be a direct child of <q:component> or <q:function>", element);
        });
        registry.register("q:return", Set.of("value"), (element, context) ->
                new ReturnNode(context.valueOrBody(element, "value"), element.location()));
        registry.register("q:invoke", null, FunctionTags::invoke);
    }

    private static Node function(RawNode.RawElement element, ParseContext context) {
        String name = context.require(element, "name");
        List<ParamNode> params = new ArrayList<>();
        List<RawNode> statements = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (RawNode child : element.children()) {
            if (child instanceof RawNode.RawElement el && el.name().equals("q:param")) {
                ParamNode param = param(el, context);
                if (!seen.add(param.name())) {
                    throw context.error("Duplicate parameter '" + param.name() + "' in function '" + name + "'", el);
                }
                params.add(param);
            } else {
                statements.add(child);
            }
        }
        return new FunctionNode(
                name,
                params,
                element.attribute("returnType", "return_type"),
                context.parseNodes(statements, false),
                element.location());
    }

    /** Parses a {@code q:param} in its legal position. */
    static ParamNode param(RawNode.RawElement element, ParseContext context) {
        if (context.strictAttributes()) {
            for (String attribute : element.attributes().keySet()) {
                if (!PARAM_ATTRIBUTES.contains(attribute)) {
                    throw context.error("Unknown attribute '" + attribute + "' on <q:param>", element);
                }
            }
        }
        return new ParamNode(
                context.require(element, "name"),
                element.attribute("type"),
                context.flag(element, "required", false),
                element.attribute("default"),
                context.rules(element),
                element.attribute("description"),
                element.location());
    }

    private static Node invoke(RawNode.RawElement element, ParseContext context) {
        String function = context.require(element, "function");
        Map<String, String> arguments = new LinkedHashMap<>(element.attributes());
        arguments.remove("function");
        String result = arguments.remove("result");
        String name = arguments.remove("name");
        return new InvokeNode(function, result != null ? result : name, arguments, element.location());
    }

    private static Set<String> paramAttributes() {
        Set<String> attributes = new HashSet<>(ControlTags.VALIDATION_ATTRIBUTES);
        attributes.addAll(Set.of("name", "type", "default", "description"));
        return Set.copyOf(attributes);
    }
}
