package com.example.omnichat.websocket;

import com.corundumstudio.socketio.AckRequest;
import com.corundumstudio.socketio.HandshakeData;
import com.corundumstudio.socketio.SocketIOClient;
import com.corundumstudio.socketio.SocketIOServer;
import com.corundumstudio.socketio.listener.DataListener;
import com.example.omnichat.auth.AgentPrincipal;
import com.example.omnichat.auth.AgentTokenService;
import com.example.omnichat.channel.widget.WidgetService;
import com.example.omnichat.connection.ConnectionConfigService;
import com.example.omnichat.domain.Channel;
import com.example.omnichat.domain.ChatMessage;
import com.example.omnichat.domain.Conversation;
import com.example.omnichat.dto.ConversationRef;
import com.example.omnichat.dto.SocketMessagePayload;
import com.example.omnichat.dto.WidgetMessageRequest;
import com.example.omnichat.event.ConversationEventPublisher;
import com.example.omnichat.event.PresencePayload;
import com.example.omnichat.event.RoomEvents;
import com.example.omnichat.realtime.PresenceTracker;
import com.example.omnichat.realtime.RoomEventBus;
import com.example.omnichat.realtime.RoomKeys;
import com.example.omnichat.service.ConversationService;
import com.example.omnichat.service.exception.ServiceException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Socket.IO entry point for agent dashboards and widget customers.
 *
 * <p>Agents connect with {@code role=agent&token=<jwt>} and are placed in their company room. Widgets
 * connect with {@code role=widget&connectionId=..&sessionId=..} and join a conversation room once they
 * report {@code widget:online} for a conversation their session owns.
 *
 * <p>Widget presence is tracked in memory on the node holding the widget socket. An agent joining a
 * conversation from another node gets no initial {@code customer:online}; it learns the customer is
 * online from the next {@code customer:heartbeat}, which the room event bus relays to every node.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "omnichat.socketio", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SocketIoGateway {

    static final String JOIN_COMPANY = "join:company";
    static final String JOIN_CONVERSATION = "join:conversation";
    static final String LEAVE_CONVERSATION = "leave:conversation";
    static final String MESSAGE_SEND = "message:send";
    static final String TYPING_START = "typing:start";
    static final String TYPING_STOP = "typing:stop";
    static final String WIDGET_ONLINE = "widget:online";
    static final String WIDGET_HEARTBEAT = "widget:heartbeat";
    static final String WIDGET_OFFLINE = "widget:offline";

    private static final List<String> CLIENT_EVENTS = List.of(
            JOIN_COMPANY, JOIN_CONVERSATION, LEAVE_CONVERSATION, MESSAGE_SEND, TYPING_START, TYPING_STOP,
            WIDGET_ONLINE, WIDGET_HEARTBEAT, WIDGET_OFFLINE);

    private static final String PARAM_ROLE = "role";
    private static final String PARAM_TOKEN = "token";
    private static final String PARAM_CONNECTION_ID = "connectionId";
    private static final String PARAM_SESSION_ID = "sessionId";
    private static final String BINDING = "binding";

    private final SocketIOServer socketIOServer;
    private final RoomEventBus roomEventBus;
    private final AgentTokenService agentTokenService;
    private final ConnectionConfigService connectionConfigService;
    private final ConversationService conversationService;
    private final WidgetService widgetService;
    private final ConversationEventPublisher eventPublisher;
    private final PresenceTracker presenceTracker;
    private final Clock clock;

    @PostConstruct
    public void registerListeners() {
        socketIOServer.addConnectListener(this::handleConnect);
        socketIOServer.addDisconnectListener(this::handleDisconnect);
        socketIOServer.addEventListener(JOIN_COMPANY, ConversationRef.class, guarded(this::handleJoinCompany));
        socketIOServer.addEventListener(JOIN_CONVERSATION, ConversationRef.class, guarded(this::handleJoinConversation));
        socketIOServer.addEventListener(LEAVE_CONVERSATION, ConversationRef.class, guarded(this::handleLeaveConversation));
        socketIOServer.addEventListener(MESSAGE_SEND, SocketMessagePayload.class, this::handleMessage);
        socketIOServer.addEventListener(TYPING_START, ConversationRef.class, guarded((client, ref) -> handleTyping(client, ref, true)));
        socketIOServer.addEventListener(TYPING_STOP, ConversationRef.class, guarded((client, ref) -> handleTyping(client, ref, false)));
        socketIOServer.addEventListener(WIDGET_ONLINE, ConversationRef.class, guarded(this::handleWidgetOnline));
        socketIOServer.addEventListener(WIDGET_HEARTBEAT, ConversationRef.class, guarded(this::handleWidgetHeartbeat));
        socketIOServer.addEventListener(WIDGET_OFFLINE, ConversationRef.class, guarded(this::handleWidgetOffline));
    }

    @PreDestroy
    public void shutdown() {
        CLIENT_EVENTS.forEach(socketIOServer::removeAllListeners);
    }

    void handleConnect(SocketIOClient client) {
        HandshakeData handshake = client.getHandshakeData();
        String role = handshake.getSingleUrlParam(PARAM_ROLE);
        try {
            if ("agent".equalsIgnoreCase(role)) {
                AgentPrincipal agent = agentTokenService.authenticate(handshake.getSingleUrlParam(PARAM_TOKEN));
                client.set(BINDING, SessionBinding.agent(agent, clock.instant()));
                joinCompanyRoom(client, agent.companyId());
                log.info("Agent {} connected on socket {}", agent.agentId(), client.getSessionId());
            } else if ("widget".equalsIgnoreCase(role)) {
                String connectionId = handshake.getSingleUrlParam(PARAM_CONNECTION_ID);
                String sessionId = handshake.getSingleUrlParam(PARAM_SESSION_ID);
                if (!StringUtils.hasText(sessionId)) {
                    throw new IllegalArgumentException("Widget sockets need a sessionId");
                }
                connectionConfigService.findActive(connectionId)
                        .filter(connection -> connection.getChannel() == Channel.WIDGET)
                        .orElseThrow(() -> ServiceException.notFound("Widget connection", connectionId));
                client.set(BINDING, SessionBinding.widget(connectionId, sessionId, clock.instant()));
                log.info("Widget session {} connected on socket {}", sessionId, client.getSessionId());
            } else {
                throw new IllegalArgumentException("Unknown socket role: " + role);
            }
        } catch (RuntimeException ex) {
            log.info("Rejected socket {}: {}", client.getSessionId(), ex.getMessage());
            sendError(client, ex);
            client.disconnect();
        }
    }

    void handleDisconnect(SocketIOClient client) {
        SessionBinding binding = client.get(BINDING);
        if (binding == null) {
            return;
        }
        if (!binding.isAgent() && binding.getConversationId() != null) {
            presenceTracker.disconnect(binding.getConversationId(), binding.getSessionId());
        }
        log.info("Socket {} ({}) disconnected after {}",
                client.getSessionId(), binding.getRole(), Duration.between(binding.getConnectedAt(), clock.instant()));
    }

    private void handleJoinCompany(SocketIOClient client, ConversationRef ref) {
        SessionBinding binding = requireAgent(client);
        String companyId = ref != null && StringUtils.hasText(ref.getCompanyId()) ? ref.getCompanyId() : binding.getCompanyId();
        if (!companyId.equals(binding.getCompanyId())) {
            throw new ServiceException(HttpStatus.FORBIDDEN, "Not a member of company " + companyId, "forbidden");
        }
        joinCompanyRoom(client, companyId);
    }

    private void handleJoinConversation(SocketIOClient client, ConversationRef ref) {
        SessionBinding binding = requireBinding(client);
        Conversation conversation = binding.isAgent()
                ? conversationService.getConversation(binding.getCompanyId(), requireConversationId(ref))
                : requireWidgetConversation(binding, ref);
        roomEventBus.join(client, RoomKeys.conversation(conversation.getId()));
        client.sendEvent(RoomEvents.JOINED_CONVERSATION, Map.of("conversationId", conversation.getId()));
        if (binding.isAgent()) {
            sendCurrentPresence(client, conversation);
        }
    }

    /**
     * Presence events only reach agents already in the room, so a joining agent is told directly when
     * the widget customer is online on this node. A customer connected to another node is not seen
     * here. The widget session id is the customer identifier.
     */
    private void sendCurrentPresence(SocketIOClient client, Conversation conversation) {
        String sessionId = conversation.getCustomerIdentifier();
        if (conversation.getChannel() == Channel.WIDGET && presenceTracker.isOnline(conversation.getId(), sessionId)) {
            client.sendEvent(RoomEvents.CUSTOMER_ONLINE, new PresencePayload(conversation.getId(), sessionId, clock.instant()));
        }
    }

    private void handleLeaveConversation(SocketIOClient client, ConversationRef ref) {
        requireBinding(client);
        String conversationId = requireConversationId(ref);
        roomEventBus.leave(client, RoomKeys.conversation(conversationId));
        client.sendEvent(RoomEvents.LEFT_CONVERSATION, Map.of("conversationId", conversationId));
    }

    void handleMessage(SocketIOClient client, SocketMessagePayload payload, AckRequest ackRequest) {
        try {
            SessionBinding binding = requireBinding(client);
            if (payload == null) {
                throw new IllegalArgumentException("Message payload is required");
            }
            ChatMessage message;
            if (binding.isAgent()) {
                message = conversationService.sendAgentMessage(
                        binding.getAgent(), payload.getConversationId(), payload.getText(), payload.getAttachment());
            } else {
                WidgetMessageRequest request = new WidgetMessageRequest();
                request.setSessionId(binding.getSessionId());
                request.setText(payload.getText());
                request.setAttachment(payload.getAttachment());
                String userAgent = client.getHandshakeData().getHttpHeaders().get(HttpHeaders.USER_AGENT);
                message = widgetService.postMessage(binding.getConnectionId(), request, userAgent).message();
            }
            if (ackRequest.isAckRequested()) {
                ackRequest.sendAckData(message);
            }
        } catch (RuntimeException ex) {
            log.warn("Socket {} failed to send message: {}", client.getSessionId(), ex.getMessage());
            if (ackRequest.isAckRequested()) {
                ackRequest.sendAckData(errorBody(ex));
            } else {
                sendError(client, ex);
            }
        }
    }

    private void handleTyping(SocketIOClient client, ConversationRef ref, boolean started) {
        SessionBinding binding = requireBinding(client);
        Conversation conversation = binding.isAgent()
                ? conversationService.getConversation(binding.getCompanyId(), requireConversationId(ref))
                : requireWidgetConversation(binding, ref);
        if (started) {
            eventPublisher.typingStarted(conversation);
        } else {
            eventPublisher.typingStopped(conversation);
        }
    }

    private void handleWidgetOnline(SocketIOClient client, ConversationRef ref) {
        SessionBinding binding = requireWidget(client);
        Conversation conversation = requireWidgetConversation(binding, ref);
        String previous = binding.getConversationId();
        if (previous != null && !previous.equals(conversation.getId())) {
            presenceTracker.disconnect(previous, binding.getSessionId());
            roomEventBus.leave(client, RoomKeys.conversation(previous));
        }
        binding.setConversationId(conversation.getId());
        roomEventBus.join(client, RoomKeys.conversation(conversation.getId()));
        presenceTracker.connect(conversation.getId(), binding.getSessionId());
        client.sendEvent(RoomEvents.JOINED_CONVERSATION, Map.of("conversationId", conversation.getId()));
    }

    private void handleWidgetHeartbeat(SocketIOClient client, ConversationRef ref) {
        SessionBinding binding = requireWidget(client);
        Conversation conversation = requireWidgetConversation(binding, ref);
        if (binding.getConversationId() == null) {
            binding.setConversationId(conversation.getId());
            roomEventBus.join(client, RoomKeys.conversation(conversation.getId()));
        }
        presenceTracker.heartbeat(conversation.getId(), binding.getSessionId());
    }

    private void handleWidgetOffline(SocketIOClient client, ConversationRef ref) {
        SessionBinding binding = requireWidget(client);
        String conversationId = ref != null && StringUtils.hasText(ref.getConversationId())
                ? ref.getConversationId()
                : binding.getConversationId();
        if (conversationId == null) {
            return;
        }
        presenceTracker.disconnect(conversationId, binding.getSessionId());
        if (conversationId.equals(binding.getConversationId())) {
            binding.setConversationId(null);
        }
    }

    private void joinCompanyRoom(SocketIOClient client, String companyId) {
        roomEventBus.join(client, RoomKeys.company(companyId));
        client.sendEvent(RoomEvents.JOINED_COMPANY, Map.of("companyId", companyId));
    }

    private Conversation requireWidgetConversation(SessionBinding binding, ConversationRef ref) {
        String conversationId = ref != null && StringUtils.hasText(ref.getConversationId())
                ? ref.getConversationId()
                : binding.getConversationId();
        Optional<Conversation> conversation =
                widgetService.findSessionConversation(binding.getConnectionId(), binding.getSessionId(), conversationId);
        return conversation.orElseThrow(() -> ServiceException.notFound("Widget conversation", conversationId));
    }

    private String requireConversationId(ConversationRef ref) {
        if (ref == null || !StringUtils.hasText(ref.getConversationId())) {
            throw new IllegalArgumentException("conversationId is required");
        }
        return ref.getConversationId();
    }

    private SessionBinding requireBinding(SocketIOClient client) {
        SessionBinding binding = client.get(BINDING);
        if (binding == null) {
            throw new IllegalStateException("Socket is not authenticated");
        }
        return binding;
    }

    private SessionBinding requireAgent(SocketIOClient client) {
        SessionBinding binding = requireBinding(client);
        if (!binding.isAgent()) {
            throw new IllegalStateException("Only agents may do this");
        }
        return binding;
    }

    private SessionBinding requireWidget(SocketIOClient client) {
        SessionBinding binding = requireBinding(client);
        if (binding.isAgent()) {
            throw new IllegalStateException("Presence events are only accepted from widget sockets");
        }
        return binding;
    }

    private <T> DataListener<T> guarded(SocketHandler<T> handler) {
        return (client, data, ackRequest) -> {
            try {
                handler.handle(client, data);
            } catch (RuntimeException ex) {
                log.warn("Socket {} event failed: {}", client.getSessionId(), ex.getMessage());
                sendError(client, ex);
            }
        };
    }

    private void sendError(SocketIOClient client, RuntimeException ex) {
        client.sendEvent(RoomEvents.SYSTEM_ERROR, errorBody(ex));
    }

    private Map<String, Object> errorBody(RuntimeException ex) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", ex.getMessage());
        if (ex instanceof ServiceException serviceException && serviceException.getErrorCode() != null) {
            body.put("code", serviceException.getErrorCode());
        }
        return body;
    }

    @FunctionalInterface
    interface SocketHandler<T> {

        void handle(SocketIOClient client, T data);
    }
}
