package io.quantum.core.parser;

import io.quantum.core.model.IfNode;
import io.quantum.core.model.LoopNode;
import io.quantum.core.model.LoopType;
import io.quantum.core.model.Node;
import io.quantum.core.model.SetNode;
import io.quantum.core.model.SetOperation;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/** {@code q:set}, {@code q:loop} and the {@code q:if} family. */
final class ControlTags {

    /** Declarative validation attributes accepted by {@code q:set} and {@code q:param}. */
    static final Set<String> VALIDATION_ATTRIBUTES = Set.of(
            "required", "nullable", "pattern", "range", "enum", "min", "max", "minlength", "maxlength", "validate");

    private static final Set<String> SET_OPTIONS =
            Set.of("default", "index", "key", "property", "step", "order", "format");

    private ControlTags() {}

    static void registerAll(TagRegistry.Builder registry) {
        Set<String> setAttributes = new HashSet<>(VALIDATION_ATTRIBUTES);
        setAttributes.addAll(SET_OPTIONS);
        setAttributes.addAll(Set.of("name", "value", "operation", "type", "scope"));
        registry.register("q:set", setAttributes, ControlTags::set);
        registry.register(
                "q:loop",
                Set.of("type", "var", "index", "from", "to", "step", "items", "delimiter", "query"),
                ControlTags::loop);
        registry.register("q:if", Set.of("condition"), ControlTags::conditional);
        registry.register("q:elseif", Set.of("condition"), (element, context) -> {
            throw context.error("<q:elseif> must be a child of <q:if>", element);
        });
        registry.register("q:else", Set.of(), (element, context) -> {
            throw context.error("<q:else> must be a child of <q:if>", element);
        });
    }

    private static Node set(RawNode.RawElement element, ParseContext context) {
        String name = context.require(element, "name");
        SetOperation operation = SetOperation.fromAttribute(element.attribute("operation"));
        if (operation == null) {
            throw context.error("Unknown q:set operation '" + element.attribute("operation") + "'", element);
        }
        Map<String, String> options = new LinkedHashMap<>();
        for (String option : SET_OPTIONS) {
            if (element.hasAttribute(option)) {
                options.put(option, element.attribute(option));
            }
        }
        return new SetNode(
                name,
                context.valueOrBody(element, "value"),
                operation,
                element.attribute("type"),
                element.attribute("scope"),
                options,
                context.rules(element),
                element.location());
    }

    private static Node loop(RawNode.RawElement element, ParseContext context) {
        LoopType type = loopType(element, context);
        String var = element.attribute("var");
        if (type != LoopType.QUERY && (var == null || var.isBlank())) {
            throw context.error("<q:loop> requires attribute 'var'", element);
        }
        switch (type) {
            case RANGE -> {
                context.require(element, "from");
                context.require(element, "to");
            }
            case ARRAY, LIST -> context.require(element, "items");
            case QUERY -> context.require(element, "query");
        }
        return new LoopNode(
                type,
                var,
                element.attribute("index"),
                element.attribute("from"),
                element.attribute("to"),
                element.attribute("step"),
                element.attribute("items"),
                element.attribute("delimiter"),
                element.attribute("query"),
                context.parseChildren(element),
                element.location());
    }

    private static LoopType loopType(RawNode.RawElement element, ParseContext context) {
        String type = element.attribute("type");
        if (type == null) {
            if (element.hasAttribute("query")) {
                return LoopType.QUERY;
            }
            return element.hasAttribute("items") ? LoopType.ARRAY : LoopType.RANGE;
        }
        try {
            return LoopType.valueOf(type.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw context.error("Unknown loop type '" + type + "', expected range, array, list or query", element);
        }
    }

    /**
     * Splits the children of {@code q:if} into branches. A {@code q:elseif} or {@code q:else}
     * child opens a new branch whose body is its own children followed by the siblings up to the
     * next branch, so both the nested form and the self-closing separator form are accepted.
     */
    private static Node conditional(RawNode.RawElement element, ParseContext context) {
        List<IfNode.Branch> branches = new ArrayList<>();
        String condition = context.require(element, "condition");
        RawNode opener = element;
        List<Node> body = new ArrayList<>();
        boolean sawElse = false;
        for (RawNode child : element.children()) {
            if (child instanceof RawNode.RawElement marker && isBranchMarker(marker)) {
                if (sawElse) {
                    throw context.error("<" + marker.name() + "> cannot follow <q:else>", marker);
                }
                branches.add(new IfNode.Branch(condition, body, opener.location()));
                checkAttributes(marker, context);
                if (marker.name().equals("q:else")) {
                    sawElse = true;
                    condition = null;
                } else {
                    condition = context.require(marker, "condition");
                }
                opener = marker;
                body = new ArrayList<>(context.parseChildren(marker));
            } else {
                body.addAll(context.parseNodes(List.of(child), false));
            }
        }
        branches.add(new IfNode.Branch(condition, body, opener.location()));
        return new IfNode(branches, element.location());
    }

    private static boolean isBranchMarker(RawNode.RawElement element) {
        return element.name().equals("q:elseif") || element.name().equals("q:else");
    }

    private static void checkAttributes(RawNode.RawElement marker, ParseContext context) {
        if (!context.strictAttributes()) {
            return;
        }
        Set<String> allowed = marker.name().equals("q:else") ? Set.of() : Set.of("condition");
        for (String attribute : marker.attributes().keySet()) {
            if (!allowed.contains(attribute)) {
                throw context.error("Unknown attribute '" + attribute + "' on <" + marker.name() + ">", marker);
            }
        }
    }
}
