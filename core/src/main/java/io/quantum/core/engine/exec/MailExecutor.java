package io.quantum.core.engine.exec;

import io.quantum.core.engine.ExecutionContext;
import io.quantum.core.engine.NodeExecutor;
import io.quantum.core.model.ExecResult;
import io.quantum.core.model.MailNode;
import io.quantum.core.spi.MailService;
import java.util.ArrayList;
import java.util.List;

/** Sends {@code q:mail} through the {@link MailService}. Addresses are comma separated; the body is interpolated. */
public final class MailExecutor implements NodeExecutor<MailNode> {

    @Override
    public ExecResult execute(MailNode node, ExecutionContext context) {
        MailService mail = Services.require(context.collaborators().mail(), "mail service", node, context);
        String type = node.type() == null ? "html" : context.evaluator().interpolate(node.type(), context);
        MailService.MailMessage message = new MailService.MailMessage(
                addresses(node.to(), context),
                node.from() != null ? context.evaluator().interpolate(node.from(), context) : null,
                context.evaluator().interpolate(node.subject(), context),
                addresses(node.cc(), context),
                addresses(node.bcc(), context),
                "text".equalsIgnoreCase(type) || "plain".equalsIgnoreCase(type) ? "text/plain" : "text/html",
                context.evaluator().interpolate(node.body(), context).trim());
        Services.run("Mail to " + message.to(), node, context, () -> mail.send(message));
        return ExecResult.CONTINUE;
    }

    private static List<String> addresses(String attribute, ExecutionContext context) {
        List<String> out = new ArrayList<>();
        if (attribute == null) {
            return out;
        }
        for (String address : context.evaluator().interpolate(attribute, context).split(",")) {
            if (!address.isBlank()) {
                out.add(address.trim());
            }
        }
        return out;
    }
}
