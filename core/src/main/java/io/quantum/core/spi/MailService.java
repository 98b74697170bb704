package io.quantum.core.spi;

import java.util.List;

/** Mail transport collaborator used by {@code q:mail}. */
public interface MailService {

    void send(MailMessage message);

    /** An outgoing message; {@code contentType} is {@code text/html} or {@code text/plain}. */
    record MailMessage(
            List<String> to, String from, String subject, List<String> cc, List<String> bcc, String contentType,
            String body) {

        public MailMessage {
            to = List.copyOf(to);
            cc = List.copyOf(cc);
            bcc = List.copyOf(bcc);
        }
    }
}
