package io.quantum.core.spi;

import java.util.function.Consumer;

/** Message broker collaborator used by {@code q:message}. */
public interface MessagingTransport {

    /** Publishes to every subscriber of a topic. */
    void publish(String topic, Object message);

    /** Sends point-to-point to a queue. */
    void send(String queue, Object message);

    void subscribe(String topic, Consumer<Delivery> handler);

    void consume(String queue, Consumer<Delivery> handler);

    void ack(String messageId);

    void nack(String messageId, boolean requeue);

    /** A received message. */
    record Delivery(String messageId, String destination, Object body) {}
}
