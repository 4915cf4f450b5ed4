package com.example.omnichat.service;

import com.example.omnichat.config.OmnichatProperties;
import com.example.omnichat.domain.ConversationIdentity;
import org.springframework.stereotype.Component;

@Component
public class RedisKeyFactory {

    private final OmnichatProperties properties;

    public RedisKeyFactory(OmnichatProperties properties) {
        this.properties = properties;
    }

    private String prefix() {
        return properties.getRedis().getKeyPrefix();
    }

    public String identityLockKey(ConversationIdentity identity) {
        return "%s:lock:identity:%s".formatted(prefix(), identity.asKey());
    }

    public String conversationLockKey(String conversationId) {
        return "%s:lock:conversation:%s".formatted(prefix(), conversationId);
    }

    public String roomTopic() {
        return "%s:rooms".formatted(prefix());
    }
}
