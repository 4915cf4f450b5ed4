package com.example.omnichat.config;

import com.example.omnichat.channel.InboundMessage;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.HashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.boot.autoconfigure.kafka.KafkaProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.kafka.support.ExponentialBackOffWithMaxRetries;
import org.springframework.kafka.support.serializer.ErrorHandlingDeserializer;
import org.springframework.kafka.support.serializer.JsonDeserializer;
import org.springframework.kafka.support.serializer.JsonSerializer;
import org.springframework.util.backoff.ExponentialBackOff;

@Slf4j
@Configuration
public class KafkaConfig {

    @Bean
    public ProducerFactory<String, InboundMessage> inboundProducerFactory(
            KafkaProperties kafkaProperties, ObjectMapper objectMapper) {
        Map<String, Object> props = new HashMap<>(kafkaProperties.buildProducerProperties(null));
        return new DefaultKafkaProducerFactory<>(props, new StringSerializer(), new JsonSerializer<>(objectMapper));
    }

    @Bean
    public KafkaTemplate<String, InboundMessage> inboundKafkaTemplate(
            ProducerFactory<String, InboundMessage> inboundProducerFactory) {
        return new KafkaTemplate<>(inboundProducerFactory);
    }

    @Bean
    public ConsumerFactory<String, InboundMessage> inboundConsumerFactory(
            KafkaProperties kafkaProperties, ObjectMapper objectMapper) {
        Map<String, Object> props = new HashMap<>(kafkaProperties.buildConsumerProperties(null));
        JsonDeserializer<InboundMessage> valueDeserializer = new JsonDeserializer<>(InboundMessage.class, objectMapper, false);
        return new DefaultKafkaConsumerFactory<>(
                props, new StringDeserializer(), new ErrorHandlingDeserializer<>(valueDeserializer));
    }

    /**
     * Failed records are retried with exponential backoff, then logged and skipped.
     */
    @Bean
    public DefaultErrorHandler inboundErrorHandler(OmnichatProperties properties) {
        OmnichatProperties.Kafka config = properties.getKafka();
        ExponentialBackOff backOff = new ExponentialBackOffWithMaxRetries(config.getRetryAttempts());
        backOff.setInitialInterval(config.getRetryInitialInterval().toMillis());
        backOff.setMultiplier(config.getRetryMultiplier());
        backOff.setMaxInterval(config.getRetryMaxInterval().toMillis());
        return new DefaultErrorHandler(
                (record, ex) -> log.error(
                        "Giving up on inbound record {}-{}@{} key {}",
                        record.topic(), record.partition(), record.offset(), record.key(), ex),
                backOff);
    }

    @Bean
    public ConcurrentKafkaListenerContainerFactory<String, InboundMessage> inboundListenerContainerFactory(
            ConsumerFactory<String, InboundMessage> inboundConsumerFactory, DefaultErrorHandler inboundErrorHandler) {
        ConcurrentKafkaListenerContainerFactory<String, InboundMessage> factory =
                new ConcurrentKafkaListenerContainerFactory<>();
        factory.setConsumerFactory(inboundConsumerFactory);
        factory.setCommonErrorHandler(inboundErrorHandler);
        return factory;
    }

    @Bean
    public NewTopic inboundTopic(OmnichatProperties properties) {
        return TopicBuilder.name(properties.getKafka().getInboundTopic())
                .partitions(properties.getKafka().getPartitions())
                .replicas(1)
                .build();
    }
}
