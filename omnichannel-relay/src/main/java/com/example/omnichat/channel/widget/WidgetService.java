package com.example.omnichat.channel.widget;

import com.example.omnichat.channel.InboundMessage;
import com.example.omnichat.config.OmnichatProperties;
import com.example.omnichat.connection.ConnectionConfigService;
import com.example.omnichat.domain.Channel;
import com.example.omnichat.domain.ChatMessage;
import com.example.omnichat.domain.ConnectionConfig;
import com.example.omnichat.domain.Conversation;
import com.example.omnichat.domain.ConversationIdentity;
import com.example.omnichat.dto.WidgetMessageRequest;
import com.example.omnichat.dto.WidgetMessageResponse;
import com.example.omnichat.dto.WidgetSessionResponse;
import com.example.omnichat.service.ConversationStore;
import com.example.omnichat.service.InboundMessageProcessor;
import com.example.omnichat.service.MessageStore;
import com.example.omnichat.service.exception.ServiceException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Customer side of the web widget. A widget session id is the customer identifier, so a browser that
 * keeps its session id keeps its conversation until an agent closes it.
 */
@Service
@RequiredArgsConstructor
public class WidgetService {

    private final ConnectionConfigService connectionConfigService;
    private final ConversationStore conversationStore;
    private final MessageStore messageStore;
    private final InboundMessageProcessor inboundMessageProcessor;
    private final OmnichatProperties properties;
    private final Clock clock;

    public WidgetSessionResponse session(String connectionId, String sessionId) {
        ConnectionConfig connection = requireWidgetConnection(connectionId);
        Optional<Conversation> conversation = findActiveConversation(connection, sessionId);
        List<ChatMessage> history = conversation
                .map(found -> messageStore.recent(found.getId(), properties.getConversation().getMaxPageSize()))
                .orElse(List.of());
        return new WidgetSessionResponse(
                conversation.orElse(null),
                history,
                properties.getPresence().getHeartbeatInterval().toSeconds());
    }

    /**
     * Processes the message inline so the response can carry the conversation id.
     */
    public WidgetMessageResponse postMessage(String connectionId, WidgetMessageRequest request, String userAgent) {
        ConnectionConfig connection = requireWidgetConnection(connectionId);
        requireSession(request.getSessionId());
        boolean hasAttachment = request.getAttachment() != null && StringUtils.hasText(request.getAttachment().getUrl());
        if (!StringUtils.hasText(request.getText()) && !hasAttachment) {
            throw new ServiceException(HttpStatus.BAD_REQUEST, "Message text or attachment is required", "empty_message");
        }
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("sessionId", request.getSessionId());
        if (StringUtils.hasText(userAgent)) {
            attributes.put("userAgent", userAgent);
        }
        if (StringUtils.hasText(request.getPageUrl())) {
            attributes.put("pageUrl", request.getPageUrl());
        }
        InboundMessage inbound = InboundMessage.builder()
                .channel(Channel.WIDGET)
                .connectionId(connection.getId())
                .customerIdentifier(request.getSessionId())
                .customerName(request.getName())
                .text(request.getText())
                .attachments(hasAttachment ? List.of(request.getAttachment()) : List.of())
                .receivedAt(clock.instant())
                .attributes(attributes)
                .build();
        InboundMessageProcessor.Outcome outcome = inboundMessageProcessor.process(inbound)
                .orElseThrow(() -> ServiceException.notFound("Widget connection", connectionId));
        return new WidgetMessageResponse(outcome.conversation().getId(), outcome.message());
    }

    /**
     * @return the widget conversation owned by this connection and session, used to authorise socket
     *     joins
     */
    public Optional<Conversation> findSessionConversation(String connectionId, String sessionId, String conversationId) {
        if (!StringUtils.hasText(sessionId) || !StringUtils.hasText(conversationId)) {
            return Optional.empty();
        }
        return conversationStore.findById(conversationId)
                .filter(conversation -> conversation.getChannel() == Channel.WIDGET)
                .filter(conversation -> conversation.getConnectionId().equals(connectionId))
                .filter(conversation -> conversation.getCustomerIdentifier().equals(sessionId));
    }

    private Optional<Conversation> findActiveConversation(ConnectionConfig connection, String sessionId) {
        requireSession(sessionId);
        return conversationStore.findOpenByIdentity(
                new ConversationIdentity(Channel.WIDGET, connection.getId(), sessionId));
    }

    private void requireSession(String sessionId) {
        if (!StringUtils.hasText(sessionId)) {
            throw new ServiceException(HttpStatus.BAD_REQUEST, "Session id is required", "invalid_session");
        }
    }

    private ConnectionConfig requireWidgetConnection(String connectionId) {
        return connectionConfigService.findActive(connectionId)
                .filter(connection -> connection.getChannel() == Channel.WIDGET)
                .orElseThrow(() -> ServiceException.notFound("Widget connection", connectionId));
    }
}
