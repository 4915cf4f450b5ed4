package com.example.omnichat.channel;

import com.example.omnichat.config.OmnichatProperties;
import com.example.omnichat.service.InboundMessageProcessor;
import java.util.concurrent.TimeUnit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Queue-and-ack entry point for webhooks. Messages go to the inbound topic keyed by customer identity;
 * if the broker refuses the record the message is processed on the calling thread instead, so an
 * acknowledged webhook is never lost to a broker outage. A failure of that direct processing is logged
 * and does not reach the webhook caller.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InboundMessageQueue {

    private static final long SEND_TIMEOUT_SECONDS = 5;

    private final KafkaTemplate<String, InboundMessage> inboundKafkaTemplate;
    private final InboundMessageProcessor processor;
    private final OmnichatProperties properties;

    public void enqueue(InboundMessage message) {
        try {
            inboundKafkaTemplate
                    .send(properties.getKafka().getInboundTopic(), message.identityKey(), message)
                    .get(SEND_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            processDirectly(message, ex);
        } catch (Exception ex) {
            processDirectly(message, ex);
        }
    }

    private void processDirectly(InboundMessage message, Exception cause) {
        log.warn("Inbound queue unavailable ({}); processing {} message directly", cause.toString(), message.getChannel());
        try {
            processor.process(message);
        } catch (RuntimeException ex) {
            log.error("Direct processing of {} message from {} on connection {} failed",
                    message.getChannel(), message.getCustomerIdentifier(), message.getConnectionId(), ex);
        }
    }
}
