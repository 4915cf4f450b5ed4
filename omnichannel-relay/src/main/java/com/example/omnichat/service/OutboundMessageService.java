package com.example.omnichat.service;

import com.example.omnichat.channel.ChannelAdapter;
import com.example.omnichat.channel.ChannelAdapterRegistry;
import com.example.omnichat.channel.DeliveryResult;
import com.example.omnichat.channel.OutboundMessage;
import com.example.omnichat.connection.ConnectionConfigService;
import com.example.omnichat.domain.Attachment;
import com.example.omnichat.domain.ChatMessage;
import com.example.omnichat.domain.ConnectionConfig;
import com.example.omnichat.domain.Conversation;
import com.example.omnichat.domain.DeliveryStatus;
import com.example.omnichat.domain.MessageRole;
import com.example.omnichat.domain.MessageSender;
import com.example.omnichat.event.ConversationEventPublisher;
import com.example.omnichat.service.exception.ServiceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Agent and bot replies: stored first, fanned out, then handed to the conversation's channel. The
 * delivery outcome is written back to the message and published as {@code message:status}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OutboundMessageService {

    private final MessageStore messageStore;
    private final ConversationStore conversationStore;
    private final ConnectionConfigService connectionConfigService;
    private final ChannelAdapterRegistry adapterRegistry;
    private final ConversationEventPublisher eventPublisher;

    public ChatMessage sendReply(
            Conversation conversation, MessageRole role, MessageSender sender, String text, Attachment attachment) {
        if (role == MessageRole.USER) {
            throw new IllegalArgumentException("Replies must be sent as AGENT or BOT");
        }
        if (!StringUtils.hasText(text) && attachment == null) {
            throw new ServiceException(HttpStatus.BAD_REQUEST, "Message text or attachment is required", "empty_message");
        }
        ChatMessage stored = messageStore.append(
                conversation.getId(),
                MessageDraft.builder()
                        .role(role)
                        .text(text)
                        .attachment(attachment)
                        .sender(sender)
                        .deliveryStatus(DeliveryStatus.PENDING)
                        .build());
        Conversation current = conversationStore.findById(conversation.getId()).orElse(conversation);
        eventPublisher.messageCreated(current, stored);
        return deliver(current, stored);
    }

    /**
     * Re-sends a reply whose previous delivery failed.
     */
    public ChatMessage retry(Conversation conversation, Long messageId) {
        ChatMessage message = messageStore
                .findById(messageId)
                .filter(candidate -> conversation.getId().equals(candidate.getConversationId()))
                .orElseThrow(() -> ServiceException.notFound("Message", messageId));
        if (message.getRole() == MessageRole.USER || message.getDeliveryStatus() != DeliveryStatus.FAILED) {
            throw ServiceException.conflict(
                    "Only failed agent or bot messages can be retried", "not_retryable");
        }
        return deliver(conversation, message);
    }

    private ChatMessage deliver(Conversation conversation, ChatMessage message) {
        DeliveryResult result;
        try {
            ConnectionConfig connection = connectionConfigService.require(conversation.getConnectionId());
            ChannelAdapter adapter = adapterRegistry.forChannel(conversation.getChannel());
            result = adapter.send(connection, new OutboundMessage(conversation, message));
        } catch (RuntimeException ex) {
            result = DeliveryResult.failed(ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName());
        }

        if (!result.success()) {
            log.warn("Delivery of message {} in conversation {} via {} failed: {}",
                    message.getId(), conversation.getId(), conversation.getChannel(), result.error());
        }
        ChatMessage updated = messageStore
                .updateDelivery(
                        message.getId(),
                        result.success() ? DeliveryStatus.SENT : DeliveryStatus.FAILED,
                        result.platformMessageId(),
                        result.error())
                .orElse(message);
        eventPublisher.deliveryUpdated(conversation, updated);
        return updated;
    }
}
