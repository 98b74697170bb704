package io.quantum.core.parser;

import io.quantum.core.error.SourceParseException;
import io.quantum.core.model.ComponentCallNode;
import io.quantum.core.model.FunctionNode;
import io.quantum.core.model.HtmlNode;
import io.quantum.core.model.Node;
import io.quantum.core.model.ParamNode;
import io.quantum.core.model.SourceLocation;
import io.quantum.core.model.SourceUnit;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses component source into a {@link SourceUnit}.
 *
 * <p>Dispatch per element:
 * <ul>
 * <li>{@code q:} tags go to their {@link TagHandler} in the {@link TagRegistry}; an unknown
 * {@code q:} tag is logged at WARN and passed through as HTML.</li>
 * <li>An unprefixed tag starting with an uppercase letter is a component call.</li>
 * <li>Anything else is passed through as HTML; attribute values containing {@code {...}} are
 * marked dynamic.</li>
 * </ul>
 *
 * <p>Top-level {@code q:param} elements become the unit's parameters and top-level
 * {@code q:function} elements are hoisted into its function table. Parsing is all or nothing:
 * any error raises {@link SourceParseException} and no partial unit is returned.
 *
 * <p>Thread-safe: a parser holds only its immutable registry.
 */
public final class QuantumParser {

    private static final Logger LOG = LoggerFactory.getLogger(QuantumParser.class);

    private static final Set<String> COMPONENT_ATTRIBUTES = Set.of(
            "name", "id", "type", "description", "require_auth", "require_role", "interactive", "version");

    private static final Set<String> APPLICATION_ATTRIBUTES = Set.of("id", "name", "type", "description", "version");

    private final TagRegistry registry;
    private final boolean strictAttributes;

    /** A parser for the built-in tags, rejecting unknown attributes. */
    public QuantumParser() {
        this(TagRegistry.defaults(), true);
    }

    public QuantumParser(TagRegistry registry, boolean strictAttributes) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.strictAttributes = strictAttributes;
    }

    public TagRegistry registry() {
        return registry;
    }

    /** Parses inline source. */
    public SourceUnit parse(String text) {
        return parse(text, null);
    }

    /**
     * Parses source text.
     *
     * @param sourceName file path or logical name used in locations, may be {@code null}
     * @throws SourceParseException on any syntax or structure error
     */
    public SourceUnit parse(String text, String sourceName) {
        Objects.requireNonNull(text, "text must not be null");
        RawNode.RawElement root = XmlReader.read(text, sourceName);
        ParseContext context = new ParseContext(sourceName, strictAttributes, this::dispatch);
        SourceUnit unit = unit(root, context, sourceName);
        LOG.debug("Parsed {} ({} statements, {} functions)", unit.name(), unit.body().size(), unit.functions().size());
        return unit;
    }

    /**
     * Reads and parses a file (UTF-8).
     *
     * @throws SourceParseException if the file cannot be read or parsed
     */
    public SourceUnit parseFile(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        String text;
        try {
            text = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SourceParseException(
                    "Cannot read source file: " + e.getMessage(),
                    e,
                    path.toString(),
                    SourceLocation.of(path.toString(), 0, 0));
        }
        return parse(text, path.toString());
    }

    private SourceUnit unit(RawNode.RawElement root, ParseContext context, String sourceName) {
        SourceUnit.Kind kind;
        String name;
        if (root.name().equals("q:component")) {
            kind = SourceUnit.Kind.COMPONENT;
            checkAttributes(root, COMPONENT_ATTRIBUTES, context);
            name = root.attribute("name");
            if (name == null || name.isBlank()) {
                name = defaultName(sourceName);
            }
        } else if (root.name().equals("q:application")) {
            kind = SourceUnit.Kind.APPLICATION;
            checkAttributes(root, APPLICATION_ATTRIBUTES, context);
            name = root.attribute("id", "name");
            if (name == null || name.isBlank()) {
                throw context.error("<q:application> requires attribute 'id'", root);
            }
        } else {
            throw context.error(
                    "Root element must be <q:component> or <q:application>, got <" + root.name() + ">", root);
        }

        List<ParamNode> params = new ArrayList<>();
        Set<String> paramNames = new LinkedHashSet<>();
        Map<String, FunctionNode> functions = new LinkedHashMap<>();
        List<RawNode> statements = new ArrayList<>();
        for (RawNode child : root.children()) {
            if (child instanceof RawNode.RawElement element && element.name().equals("q:param")) {
                ParamNode param = FunctionTags.param(element, context);
                if (!paramNames.add(param.name())) {
                    throw context.error("Duplicate parameter '" + param.name() + "'", element);
                }
                params.add(param);
            } else if (child instanceof RawNode.RawElement element && element.name().equals("q:function")) {
                FunctionNode function = (FunctionNode) dispatch(element, context);
                if (functions.put(function.name(), function) != null) {
                    throw context.error("Duplicate function '" + function.name() + "'", element);
                }
            } else {
                statements.add(child);
            }
        }
        List<Node> body = context.parseNodes(statements, false);
        return new SourceUnit(
                name,
                kind,
                params,
                context.flag(root, "require_auth", false),
                root.attribute("require_role"),
                context.flag(root, "interactive", false),
                body,
                functions,
                sourceName);
    }

    private Node dispatch(RawNode.RawElement element, ParseContext ctx) {
        TagRegistry.TagSpec spec = element.isQuantumTag() ? registry.lookup(element.name()).orElse(null) : null;
        if (spec != null) {
            if (strictAttributes) {
                for (String attribute : element.attributes().keySet()) {
                    if (!spec.accepts(attribute)) {
                        throw ctx.error("Unknown attribute '" + attribute + "' on <" + element.name() + ">", element);
                    }
                }
            }
            return spec.handler().handle(element, ctx);
        }
        if (Character.isUpperCase(element.name().charAt(0)) && element.name().indexOf(':') < 0) {
            return new ComponentCallNode(
                    element.name(), element.attributes(), ctx.parseChildren(element), element.location());
        }
        if (element.isQuantumTag()) {
            LOG.warn("Unknown tag <{}> at {}, emitted as markup", element.name(), element.location());
        }
        Set<String> dynamic = new LinkedHashSet<>();
        element.attributes().forEach((key, value) -> {
            int open = value.indexOf('{');
            if (open >= 0 && value.indexOf('}', open) > open) {
                dynamic.add(key);
            }
        });
        return new HtmlNode(
                element.name(), element.attributes(), dynamic, ctx.parseChildren(element), element.location());
    }

    private void checkAttributes(RawNode.RawElement root, Set<String> allowed, ParseContext context) {
        if (!strictAttributes) {
            return;
        }
        for (String attribute : root.attributes().keySet()) {
            if (!allowed.contains(attribute)) {
                throw context.error("Unknown attribute '" + attribute + "' on <" + root.name() + ">", root);
            }
        }
    }

    private static String defaultName(String sourceName) {
        if (sourceName == null) {
            return "anonymous";
        }
        String file = Path.of(sourceName).getFileName().toString();
        int dot = file.lastIndexOf('.');
        return dot > 0 ? file.substring(0, dot) : file;
    }
}
