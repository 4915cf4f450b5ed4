package com.example.omnichat.persistence;

import com.example.omnichat.support.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

@TestConfiguration
@Import({
    JpaConversationStore.class,
    JpaMessageStore.class,
    ConversationEntityMapper.class,
    MessageEntityMapper.class
})
class PersistenceTestConfig {

    @Bean
    MutableClock clock() {
        return new MutableClock(Instant.parse("2024-05-01T09:00:00Z"));
    }

    @Bean
    ObjectMapper objectMapper() {
        return new ObjectMapper();
    }
}
