package io.quantum.core.model;

public record MailNode(
        String to,
        String from,
        String subject,
        String cc,
        String bcc,
        String type,
        String body,
        SourceLocation location)
        implements Node {}
