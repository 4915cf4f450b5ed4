package com.example.omnichat.service;

import com.example.omnichat.auth.AgentPrincipal;
import com.example.omnichat.config.OmnichatProperties;
import com.example.omnichat.domain.Attachment;
import com.example.omnichat.domain.ChatMessage;
import com.example.omnichat.domain.Conversation;
import com.example.omnichat.domain.ConversationStatus;
import com.example.omnichat.domain.MessageRole;
import com.example.omnichat.dto.UpdateCustomerRequest;
import com.example.omnichat.event.ConversationEventPublisher;
import com.example.omnichat.service.exception.ConversationClosedException;
import com.example.omnichat.service.exception.ServiceException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Agent-side operations on conversations. Every call is scoped to the agent's company; conversations
 * of other companies behave as if they did not exist.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConversationService {

    private final ConversationStore conversationStore;
    private final MessageStore messageStore;
    private final OutboundMessageService outboundMessageService;
    private final ConversationEventPublisher eventPublisher;
    private final RedissonClient redissonClient;
    private final RedisKeyFactory keyFactory;
    private final OmnichatProperties properties;
    private final Clock clock;

    public Conversation getConversation(String companyId, String conversationId) {
        return conversationStore
                .findById(conversationId)
                .filter(conversation -> conversation.getCompanyId().equals(companyId))
                .orElseThrow(() -> ServiceException.notFound("Conversation", conversationId));
    }

    public ConversationPage listConversations(
            String companyId, Set<ConversationStatus> statuses, String cursor, Integer limit) {
        return conversationStore.listForCompany(
                companyId, statuses, cursor, properties.getConversation().clampPageSize(limit));
    }

    public MessagePage listMessages(String companyId, String conversationId, String cursor, Integer limit) {
        getConversation(companyId, conversationId);
        return messageStore.listPage(conversationId, cursor, properties.getConversation().clampPageSize(limit));
    }

    public ChatMessage sendAgentMessage(
            AgentPrincipal agent, String conversationId, String text, Attachment attachment) {
        Conversation conversation = getConversation(agent.companyId(), conversationId);
        if (conversation.getStatus() == ConversationStatus.CLOSED) {
            throw new ConversationClosedException(conversationId);
        }
        return outboundMessageService.sendReply(conversation, MessageRole.AGENT, agent.asSender(), text, attachment);
    }

    public ChatMessage retryDelivery(AgentPrincipal agent, String conversationId, Long messageId) {
        return outboundMessageService.retry(getConversation(agent.companyId(), conversationId), messageId);
    }

    /**
     * OPEN and SNOOZED convert freely. Closing is final: the customer's next message opens a new
     * conversation, so a closed one cannot be reopened.
     */
    public Conversation updateStatus(String companyId, String conversationId, ConversationStatus status) {
        Conversation updated = withConversationLock(conversationId, () -> {
            Conversation conversation = getConversation(companyId, conversationId);
            if (conversation.getStatus() == status) {
                return null;
            }
            if (conversation.getStatus() == ConversationStatus.CLOSED) {
                throw ServiceException.conflict("Closed conversations cannot be reopened", "conversation_closed");
            }
            return conversationStore.update(conversation.toBuilder()
                    .status(status)
                    .closedAt(status == ConversationStatus.CLOSED ? clock.instant() : null)
                    .build());
        });
        if (updated == null) {
            return getConversation(companyId, conversationId);
        }
        log.info("Conversation {} is now {}", conversationId, status);
        eventPublisher.conversationUpdated(updated);
        return updated;
    }

    public Conversation setAutoReply(String companyId, String conversationId, boolean enabled) {
        Conversation updated = withConversationLock(conversationId, () -> {
            Conversation conversation = getConversation(companyId, conversationId);
            if (conversation.isAutoReplyEnabled() == enabled) {
                return null;
            }
            return conversationStore.update(conversation.toBuilder().autoReplyEnabled(enabled).build());
        });
        if (updated == null) {
            return getConversation(companyId, conversationId);
        }
        eventPublisher.autoReplyChanged(updated);
        return updated;
    }

    public Conversation markRead(String companyId, String conversationId) {
        getConversation(companyId, conversationId);
        conversationStore.markRead(conversationId);
        Conversation conversation = getConversation(companyId, conversationId);
        eventPublisher.conversationRead(conversation);
        return conversation;
    }

    public Conversation updateCustomer(String companyId, String conversationId, UpdateCustomerRequest request) {
        Conversation updated = withConversationLock(conversationId, () -> {
            Conversation conversation = getConversation(companyId, conversationId);
            Map<String, Object> attributes = new LinkedHashMap<>();
            if (conversation.getAttributes() != null) {
                attributes.putAll(conversation.getAttributes());
            }
            if (request.getAttributes() != null) {
                request.getAttributes().forEach((key, value) -> {
                    if (value == null) {
                        attributes.remove(key);
                    } else {
                        attributes.put(key, value);
                    }
                });
            }
            return conversationStore.update(conversation.toBuilder()
                    .customerName(pick(request.getName(), conversation.getCustomerName()))
                    .customerEmail(pick(request.getEmail(), conversation.getCustomerEmail()))
                    .customerPhone(pick(request.getPhone(), conversation.getCustomerPhone()))
                    .customerAddress(pick(request.getAddress(), conversation.getCustomerAddress()))
                    .attributes(attributes)
                    .build());
        });
        eventPublisher.conversationUpdated(updated);
        return updated;
    }

    private String pick(String requested, String current) {
        return requested != null ? StringUtils.trimWhitespace(requested) : current;
    }

    private <T> T withConversationLock(String conversationId, Supplier<T> supplier) {
        if (!StringUtils.hasText(conversationId)) {
            throw new ServiceException(HttpStatus.BAD_REQUEST, "Conversation id is required");
        }
        RLock lock = redissonClient.getLock(keyFactory.conversationLockKey(conversationId));
        lock.lock(properties.getRedis().getLockLease().toMillis(), TimeUnit.MILLISECONDS);
        try {
            return supplier.get();
        } finally {
            if (lock.isHeldByCurrentThread()) {
                lock.unlock();
            }
        }
    }
}
