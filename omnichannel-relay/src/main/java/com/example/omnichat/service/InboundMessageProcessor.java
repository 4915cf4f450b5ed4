package com.example.omnichat.service;

import com.example.omnichat.autoreply.AutoResponderGate;
import com.example.omnichat.channel.ChannelAdapterRegistry;
import com.example.omnichat.channel.InboundMessage;
import com.example.omnichat.connection.ConnectionConfigService;
import com.example.omnichat.domain.ChatMessage;
import com.example.omnichat.domain.ConnectionConfig;
import com.example.omnichat.domain.Conversation;
import com.example.omnichat.domain.DeliveryStatus;
import com.example.omnichat.domain.MessageRole;
import com.example.omnichat.event.ConversationEventPublisher;
import com.example.omnichat.service.exception.ConversationClosedException;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Turns a normalised inbound message into stored state: resolve the conversation, append the customer
 * message, fan it out and hand it to the auto-responder.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InboundMessageProcessor {

    static final String MEDIA_PLACEHOLDER = "(media message)";

    private static final int MAX_ATTEMPTS = 3;

    private final ConnectionConfigService connectionConfigService;
    private final ConversationResolver conversationResolver;
    private final MessageStore messageStore;
    private final ConversationStore conversationStore;
    private final ConversationEventPublisher eventPublisher;
    private final AutoResponderGate autoResponderGate;
    private final ChannelAdapterRegistry adapterRegistry;
    private final Clock clock;

    public record Outcome(Conversation conversation, ChatMessage message, boolean newConversation) {}

    /**
     * @return the stored message, or empty when the message was dropped (unknown connection or
     *     duplicate platform delivery)
     */
    public Optional<Outcome> process(InboundMessage inbound) {
        Optional<ConnectionConfig> connection = connectionConfigService.findActive(inbound.getConnectionId());
        if (connection.isEmpty() || connection.get().getChannel() != inbound.getChannel()) {
            log.warn("Dropping {} message for unknown or inactive connection {}", inbound.getChannel(), inbound.getConnectionId());
            return Optional.empty();
        }
        String dedupKey = inbound.dedupKey();
        if (dedupKey != null && messageStore.existsByDedupKey(dedupKey)) {
            log.debug("Dropping duplicate delivery {}", dedupKey);
            return Optional.empty();
        }

        Instant receivedAt = inbound.getReceivedAt() != null ? inbound.getReceivedAt() : clock.instant();
        MessageDraft draft = MessageDraft.builder()
                .role(MessageRole.USER)
                .text(textOf(inbound))
                .attachment(inbound.firstAttachment())
                .platformMessageId(inbound.getPlatformMessageId())
                .deliveryStatus(DeliveryStatus.RECEIVED)
                .dedupKey(dedupKey)
                .build();

        ConversationResolver.Resolution resolution = null;
        ChatMessage stored = null;
        for (int attempt = 1; stored == null; attempt++) {
            resolution = conversationResolver.resolve(
                    connection.get(),
                    inbound.getCustomerIdentifier(),
                    new CustomerDetails(inbound.getCustomerName(), inbound.getAttributes()),
                    receivedAt);
            if (resolution.isNew() && !StringUtils.hasText(resolution.conversation().getCustomerName())) {
                enrichCustomer(connection.get(), resolution.conversation());
            }
            try {
                stored = messageStore.append(resolution.conversation().getId(), draft);
            } catch (DataIntegrityViolationException ex) {
                log.debug("Dropping duplicate delivery {} detected on insert", dedupKey);
                return Optional.empty();
            } catch (ConversationClosedException ex) {
                // closed between resolve and append: the message belongs to a fresh conversation
                if (attempt >= MAX_ATTEMPTS) {
                    throw ex;
                }
                log.info("Conversation {} closed before the customer message landed; resolving again", ex.getConversationId());
            }
        }

        Conversation conversation = conversationStore
                .findById(resolution.conversation().getId())
                .orElse(resolution.conversation());
        if (resolution.isNew()) {
            eventPublisher.conversationCreated(conversation);
        }
        eventPublisher.messageCreated(conversation, stored);
        autoResponderGate.maybeRespond(conversation, stored);
        return Optional.of(new Outcome(conversation, stored, resolution.isNew()));
    }

    private void enrichCustomer(ConnectionConfig connection, Conversation conversation) {
        Optional<CustomerDetails> profile;
        try {
            profile = adapterRegistry.forChannel(conversation.getChannel())
                    .lookupCustomer(connection, conversation.getCustomerIdentifier());
        } catch (RuntimeException ex) {
            log.warn("Customer lookup failed for conversation {}: {}", conversation.getId(), ex.getMessage());
            return;
        }
        profile.ifPresent(details -> {
            Map<String, Object> attributes = new LinkedHashMap<>();
            if (conversation.getAttributes() != null) {
                attributes.putAll(conversation.getAttributes());
            }
            if (details.attributes() != null) {
                attributes.putAll(details.attributes());
            }
            conversationStore.updateCustomerProfile(conversation.getId(), details.name(), attributes);
        });
    }

    private String textOf(InboundMessage inbound) {
        if (StringUtils.hasText(inbound.getText())) {
            return inbound.getText();
        }
        return inbound.firstAttachment() != null ? MEDIA_PLACEHOLDER : "";
    }
}
