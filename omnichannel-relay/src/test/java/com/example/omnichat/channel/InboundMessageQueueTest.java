package com.example.omnichat.channel;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.omnichat.config.OmnichatProperties;
import com.example.omnichat.domain.Channel;
import com.example.omnichat.service.InboundMessageProcessor;
import java.util.concurrent.CompletableFuture;
import org.apache.kafka.common.errors.TimeoutException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.KafkaException;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

@ExtendWith(MockitoExtension.class)
class InboundMessageQueueTest {

    @Mock
    private KafkaTemplate<String, InboundMessage> kafkaTemplate;

    @Mock
    private InboundMessageProcessor processor;

    private InboundMessageQueue queue;
    private InboundMessage message;

    @BeforeEach
    void setUp() {
        queue = new InboundMessageQueue(kafkaTemplate, processor, new OmnichatProperties());
        message = InboundMessage.builder()
                .channel(Channel.TELEGRAM)
                .connectionId("tg-1")
                .customerIdentifier("1001")
                .text("hi")
                .platformMessageId("7")
                .build();
    }

    @Test
    void publishesKeyedByCustomerIdentity() {
        when(kafkaTemplate.send(anyString(), anyString(), any(InboundMessage.class)))
                .thenReturn(CompletableFuture.completedFuture(new SendResult<>(null, null)));

        queue.enqueue(message);

        verify(kafkaTemplate).send(eq("omnichat.inbound"), eq("TELEGRAM:tg-1:1001"), eq(message));
        verify(processor, never()).process(any());
    }

    @Test
    void processesOnCallerThreadWhenBrokerRefuses() {
        when(kafkaTemplate.send(anyString(), anyString(), any(InboundMessage.class)))
                .thenReturn(CompletableFuture.failedFuture(new TimeoutException("metadata not available")));

        queue.enqueue(message);

        verify(processor).process(message);
    }

    @Test
    void failedDirectProcessingStaysOffTheWebhookResponse() {
        when(kafkaTemplate.send(anyString(), anyString(), any(InboundMessage.class)))
                .thenThrow(new KafkaException("Send failed", new TimeoutException("max.block.ms elapsed")));
        when(processor.process(message)).thenThrow(new IllegalStateException("database unavailable"));

        assertThatCode(() -> queue.enqueue(message)).doesNotThrowAnyException();

        verify(processor).process(message);
    }
}
