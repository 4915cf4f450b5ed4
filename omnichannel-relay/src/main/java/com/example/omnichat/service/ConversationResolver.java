package com.example.omnichat.service;

import com.example.omnichat.config.OmnichatProperties;
import com.example.omnichat.domain.ConnectionConfig;
import com.example.omnichat.domain.Conversation;
import com.example.omnichat.domain.ConversationIdentity;
import com.example.omnichat.domain.ConversationStatus;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.util.CollectionUtils;
import org.springframework.util.StringUtils;

/**
 * Maps an inbound customer identity to its single active conversation, creating one when the customer
 * is new or their last conversation was closed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConversationResolver {

    private static final int MAX_ATTEMPTS = 3;

    private final ConversationStore conversationStore;
    private final RedissonClient redissonClient;
    private final RedisKeyFactory keyFactory;
    private final OmnichatProperties properties;

    public record Resolution(Conversation conversation, boolean isNew) {}

    public Resolution resolve(
            ConnectionConfig connection, String customerIdentifier, CustomerDetails details, Instant now) {
        if (!StringUtils.hasText(customerIdentifier)) {
            throw new IllegalArgumentException("Customer identifier is required");
        }
        ConversationIdentity identity =
                new ConversationIdentity(connection.getChannel(), connection.getId(), customerIdentifier);
        CustomerDetails customer = details != null ? details : CustomerDetails.empty();

        RLock lock = redissonClient.getLock(keyFactory.identityLockKey(identity));
        lock.lock(properties.getRedis().getLockLease().toMillis(), TimeUnit.MILLISECONDS);
        try {
            for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
                Optional<Resolution> resolution = resolveOnce(connection, identity, customer, now);
                if (resolution.isPresent()) {
                    return resolution.get();
                }
                log.info("Conversation for {} was closed while resolving; looking again", identity.asKey());
            }
            throw new IllegalStateException("Could not resolve a conversation for " + identity.asKey());
        } finally {
            if (lock.isHeldByCurrentThread()) {
                lock.unlock();
            }
        }
    }

    /**
     * @return empty when the active conversation found was closed before its profile could be refreshed
     */
    private Optional<Resolution> resolveOnce(
            ConnectionConfig connection, ConversationIdentity identity, CustomerDetails customer, Instant now) {
        Optional<Conversation> existing = conversationStore.findOpenByIdentity(identity);
        if (existing.isPresent()) {
            return mergeCustomer(existing.get(), customer).map(merged -> new Resolution(merged, false));
        }
        try {
            Conversation created = conversationStore.insert(newConversation(connection, identity, customer, now));
            log.info("Opened {} conversation {} for customer {} on connection {}",
                    identity.channel(), created.getId(), identity.customerIdentifier(), connection.getId());
            return Optional.of(new Resolution(created, true));
        } catch (DataIntegrityViolationException ex) {
            Conversation winner = conversationStore.findOpenByIdentity(identity).orElseThrow(() -> ex);
            log.info("Lost conversation creation race for {}; using {}", identity.asKey(), winner.getId());
            return mergeCustomer(winner, customer).map(merged -> new Resolution(merged, false));
        }
    }

    private Conversation newConversation(
            ConnectionConfig connection, ConversationIdentity identity, CustomerDetails customer, Instant now) {
        return Conversation.builder()
                .id(UUID.randomUUID().toString())
                .companyId(connection.getCompanyId())
                .channel(identity.channel())
                .connectionId(identity.connectionId())
                .customerIdentifier(identity.customerIdentifier())
                .status(ConversationStatus.OPEN)
                .autoReplyEnabled(connection.isAutoReplyDefault())
                .lastMessageAt(now)
                .unreadCount(0)
                .customerName(StringUtils.hasText(customer.name()) ? customer.name() : null)
                .attributes(customer.attributes() != null ? new LinkedHashMap<>(customer.attributes()) : Map.of())
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    private Optional<Conversation> mergeCustomer(Conversation conversation, CustomerDetails customer) {
        String name = conversation.getCustomerName();
        if (StringUtils.hasText(customer.name())) {
            name = customer.name();
        }
        Map<String, Object> attributes = new LinkedHashMap<>();
        if (conversation.getAttributes() != null) {
            attributes.putAll(conversation.getAttributes());
        }
        if (!CollectionUtils.isEmpty(customer.attributes())) {
            customer.attributes().forEach((key, value) -> {
                if (value != null) {
                    attributes.put(key, value);
                }
            });
        }
        boolean changed = !Objects.equals(name, conversation.getCustomerName())
                || !Objects.equals(attributes, conversation.getAttributes() != null ? conversation.getAttributes() : Map.of());
        if (!changed) {
            return Optional.of(conversation);
        }
        return conversationStore.updateCustomerProfile(conversation.getId(), name, attributes);
    }
}
