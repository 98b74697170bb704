package io.quantum.core.parser;

import io.quantum.core.model.AgentNode;
import io.quantum.core.model.DumpNode;
import io.quantum.core.model.FileNode;
import io.quantum.core.model.FlashNode;
import io.quantum.core.model.LlmNode;
import io.quantum.core.model.LogNode;
import io.quantum.core.model.MailNode;
import io.quantum.core.model.MessageNode;
import io.quantum.core.model.Node;
import io.quantum.core.model.QueryNode;
import io.quantum.core.model.RedirectNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Tags that hand work to a collaborator or produce a side signal: query, mail, messaging, AI,
 * files, logging, dump, flash and redirect.
 */
final class ServiceTags {

    private static final Set<String> QUERY_PARAM_ATTRIBUTES = Set.of("name", "value", "type", "cfsqltype");

    private ServiceTags() {}

    static void registerAll(TagRegistry.Builder registry) {
        registry.register("q:query", Set.of("name", "datasource"), ServiceTags::query);
        registry.register("q:queryparam", QUERY_PARAM_ATTRIBUTES, (element, context) -> {
            throw context.error("<q:queryparam> must be a child of <q:query>", element);
        });
        registry.register("q:mail", Set.of("to", "from", "subject", "cc", "bcc", "type"), (element, context) ->
                new MailNode(
                        context.require(element, "to"),
                        element.attribute("from"),
                        context.require(element, "subject"),
                        element.attribute("cc"),
                        element.attribute("bcc"),
                        element.attribute("type"),
                        context.bodyText(element),
                        element.location()));
        registry.register("q:message", Set.of("type", "topic", "queue", "value"), ServiceTags::message);
        registry.register(
                "q:llm",
                Set.of("name", "model", "prompt", "system", "temperature", "maxTokens", "max_tokens"),
                (element, context) -> {
                    String prompt = context.valueOrBody(element, "prompt");
                    if (prompt == null) {
                        throw context.error("<q:llm> requires a 'prompt' attribute or body", element);
                    }
                    return new LlmNode(
                            context.require(element, "name"),
                            element.attribute("model"),
                            prompt,
                            element.attribute("system"),
                            element.attribute("temperature"),
                            element.attribute("maxTokens", "max_tokens"),
                            element.location());
                });
        registry.register(
                "q:agent",
                Set.of("name", "instruction", "task", "tools", "maxIterations", "max_iterations"),
                (element, context) -> new AgentNode(
                        context.require(element, "name"),
                        context.require(element, "instruction"),
                        context.require(element, "task"),
                        element.attribute("tools"),
                        element.attribute("maxIterations", "max_iterations"),
                        element.location()));
        registry.register("q:file", Set.of("action", "path", "content", "name"), ServiceTags::file);
        registry.register("q:log", Set.of("level", "message", "context"), (element, context) -> {
            String message = context.valueOrBody(element, "message");
            if (message == null) {
                throw context.error("<q:log> requires a 'message' attribute or body", element);
            }
            return new LogNode(element.attribute("level"), message, element.attribute("context"), element.location());
        });
        registry.register("q:dump", Set.of("var", "label"), (element, context) ->
                new DumpNode(context.require(element, "var"), element.attribute("label"), element.location()));
        registry.register("q:flash", Set.of("type", "message"), (element, context) -> {
            String message = context.valueOrBody(element, "message");
            if (message == null) {
                throw context.error("<q:flash> requires a 'message' attribute or body", element);
            }
            return new FlashNode(element.attribute("type"), message, element.location());
        });
        registry.register("q:redirect", Set.of("url", "flash", "status"), (element, context) -> new RedirectNode(
                context.require(element, "url"),
                element.attribute("flash"),
                element.attribute("status"),
                element.location()));
    }

    private static Node query(RawNode.RawElement element, ParseContext context) {
        String name = context.require(element, "name");
        StringBuilder sql = new StringBuilder();
        List<QueryNode.QueryParam> params = new ArrayList<>();
        for (RawNode child : element.children()) {
            if (child instanceof RawNode.RawText text) {
                sql.append(text.text());
            } else {
                RawNode.RawElement param = (RawNode.RawElement) child;
                if (!param.name().equals("q:queryparam")) {
                    throw context.error("<" + param.name() + "> is not allowed inside <q:query>", param);
                }
                if (context.strictAttributes()) {
                    for (String attribute : param.attributes().keySet()) {
                        if (!QUERY_PARAM_ATTRIBUTES.contains(attribute)) {
                            throw context.error("Unknown attribute '" + attribute + "' on <q:queryparam>", param);
                        }
                    }
                }
                params.add(new QueryNode.QueryParam(
                        context.require(param, "name"),
                        context.require(param, "value"),
                        param.attribute("type", "cfsqltype")));
            }
        }
        if (sql.toString().isBlank()) {
            throw context.error("<q:query name=\"" + name + "\"> has no query text", element);
        }
        return new QueryNode(name, element.attribute("datasource"), sql.toString(), params, element.location());
    }

    private static Node message(RawNode.RawElement element, ParseContext context) {
        String type = element.attribute("type");
        MessageNode.Kind kind;
        if (type == null || type.equalsIgnoreCase("publish")) {
            kind = MessageNode.Kind.PUBLISH;
        } else if (type.equalsIgnoreCase("send")) {
            kind = MessageNode.Kind.SEND;
        } else {
            throw context.error("Unknown q:message type '" + type + "', expected publish or send", element);
        }
        String destination = kind == MessageNode.Kind.PUBLISH
                ? context.require(element, "topic")
                : context.require(element, "queue");
        return new MessageNode(kind, destination, context.valueOrBody(element, "value"), element.location());
    }

    private static Node file(RawNode.RawElement element, ParseContext context) {
        String action = context.require(element, "action").trim().toLowerCase(Locale.ROOT);
        String path = context.require(element, "path");
        return switch (action) {
            case "read" -> new FileNode(
                    FileNode.Action.READ, path, null, context.require(element, "name"), element.location());
            case "write" -> {
                String content = context.valueOrBody(element, "content");
                yield new FileNode(
                        FileNode.Action.WRITE, path, content != null ? content : "", null, element.location());
            }
            default -> throw context.error("Unknown q:file action '" + action + "', expected read or write", element);
        };
    }
}
