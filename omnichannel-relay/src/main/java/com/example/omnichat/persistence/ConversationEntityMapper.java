package com.example.omnichat.persistence;

import com.example.omnichat.domain.Conversation;
import com.example.omnichat.domain.ConversationStatus;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Collections;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.CollectionUtils;
import org.springframework.util.StringUtils;

@Slf4j
@Component
@RequiredArgsConstructor
public class ConversationEntityMapper {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public ConversationEntity toEntity(Conversation conversation) {
        ConversationEntity entity = new ConversationEntity();
        entity.setId(conversation.getId());
        entity.setCompanyId(conversation.getCompanyId());
        entity.setChannel(conversation.getChannel());
        entity.setConnectionId(conversation.getConnectionId());
        entity.setCustomerIdentifier(conversation.getCustomerIdentifier());
        entity.setLastMessageAt(conversation.getLastMessageAt());
        entity.setLastMessageRole(conversation.getLastMessageRole());
        entity.setUnreadCount(conversation.getUnreadCount());
        entity.setCreatedAt(conversation.getCreatedAt());
        applyMutableFields(conversation, entity);
        return entity;
    }

    /**
     * Copies the fields agents and the resolver may change. Activity counters are not touched.
     */
    public void applyMutableFields(Conversation conversation, ConversationEntity entity) {
        ConversationStatus status = conversation.getStatus() != null ? conversation.getStatus() : ConversationStatus.OPEN;
        entity.setStatus(status);
        entity.setOpenIdentityKey(status.isActive() ? conversation.identity().asKey() : null);
        entity.setClosedAt(conversation.getClosedAt());
        entity.setAutoReplyEnabled(conversation.isAutoReplyEnabled());
        entity.setCustomerName(conversation.getCustomerName());
        entity.setCustomerEmail(conversation.getCustomerEmail());
        entity.setCustomerPhone(conversation.getCustomerPhone());
        entity.setCustomerAddress(conversation.getCustomerAddress());
        entity.setAttributes(writeJson(conversation.getAttributes()));
        entity.setUpdatedAt(conversation.getUpdatedAt());
    }

    public Conversation toDomain(ConversationEntity entity) {
        if (entity == null) {
            return null;
        }
        return Conversation.builder()
                .id(entity.getId())
                .companyId(entity.getCompanyId())
                .channel(entity.getChannel())
                .connectionId(entity.getConnectionId())
                .customerIdentifier(entity.getCustomerIdentifier())
                .status(entity.getStatus())
                .autoReplyEnabled(entity.isAutoReplyEnabled())
                .lastMessageAt(entity.getLastMessageAt())
                .lastMessageRole(entity.getLastMessageRole())
                .unreadCount(entity.getUnreadCount())
                .customerName(entity.getCustomerName())
                .customerEmail(entity.getCustomerEmail())
                .customerPhone(entity.getCustomerPhone())
                .customerAddress(entity.getCustomerAddress())
                .attributes(readMap(entity.getAttributes()))
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .closedAt(entity.getClosedAt())
                .build();
    }

    public String writeJson(Map<String, Object> value) {
        if (CollectionUtils.isEmpty(value)) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize conversation attributes", e);
        }
    }

    private Map<String, Object> readMap(String json) {
        if (!StringUtils.hasText(json)) {
            return Collections.emptyMap();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable conversation attributes: {}", e.getOriginalMessage());
            return Collections.emptyMap();
        }
    }
}
