package com.example.omnichat.channel;

import com.example.omnichat.service.InboundMessageProcessor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class InboundMessageListener {

    private final InboundMessageProcessor processor;

    @KafkaListener(
            topics = "${omnichat.kafka.inbound-topic:omnichat.inbound}",
            groupId = "${spring.kafka.consumer.group-id:omnichat-relay}",
            containerFactory = "inboundListenerContainerFactory")
    public void onMessage(ConsumerRecord<String, InboundMessage> record) {
        InboundMessage message = record.value();
        if (message == null) {
            log.warn("Skipping empty inbound record at {}-{}@{}", record.topic(), record.partition(), record.offset());
            return;
        }
        processor.process(message);
    }
}
