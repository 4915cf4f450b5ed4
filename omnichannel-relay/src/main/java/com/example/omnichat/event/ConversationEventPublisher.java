package com.example.omnichat.event;

import com.example.omnichat.domain.ChatMessage;
import com.example.omnichat.domain.Conversation;
import com.example.omnichat.realtime.RoomEventBus;
import com.example.omnichat.realtime.RoomKeys;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Translates conversation changes into room events. Company rooms feed the inbox views, conversation
 * rooms feed open chat panes and the widget.
 */
@Component
@RequiredArgsConstructor
public class ConversationEventPublisher {

    private final RoomEventBus roomEventBus;

    public void messageCreated(Conversation conversation, ChatMessage message) {
        MessageEventPayload payload = new MessageEventPayload(conversation.getId(), message, conversation);
        roomEventBus.publish(RoomKeys.company(conversation.getCompanyId()), RoomEvents.MESSAGE_NEW, payload);
        roomEventBus.publish(RoomKeys.conversation(conversation.getId()), RoomEvents.MESSAGE_NEW, payload);

        ViewUpdateType type = message.getRole().isCustomer() ? ViewUpdateType.NEW_MESSAGE : ViewUpdateType.MESSAGE_SENT;
        roomEventBus.publish(
                RoomKeys.company(conversation.getCompanyId()),
                RoomEvents.VIEW_UPDATE,
                viewUpdate(type, conversation).message(message).build());
    }

    public void conversationCreated(Conversation conversation) {
        roomEventBus.publish(
                RoomKeys.company(conversation.getCompanyId()),
                RoomEvents.VIEW_UPDATE,
                viewUpdate(ViewUpdateType.NEW_CONVERSATION, conversation).build());
    }

    public void autoReplyChanged(Conversation conversation) {
        publishToBoth(conversation, RoomEvents.VIEW_UPDATE,
                viewUpdate(ViewUpdateType.BOT_STATUS_CHANGED, conversation).build());
    }

    public void typingStarted(Conversation conversation) {
        publishToBoth(conversation, RoomEvents.VIEW_UPDATE,
                viewUpdate(ViewUpdateType.TYPING_START, conversation).conversation(null).build());
    }

    public void typingStopped(Conversation conversation) {
        publishToBoth(conversation, RoomEvents.VIEW_UPDATE,
                viewUpdate(ViewUpdateType.TYPING_STOP, conversation).conversation(null).build());
    }

    public void conversationUpdated(Conversation conversation) {
        publishToBoth(conversation, RoomEvents.CONVERSATION_UPDATED, conversation);
    }

    public void conversationRead(Conversation conversation) {
        roomEventBus.publish(RoomKeys.company(conversation.getCompanyId()), RoomEvents.CONVERSATION_READ, conversation);
    }

    public void deliveryUpdated(Conversation conversation, ChatMessage message) {
        publishToBoth(conversation, RoomEvents.MESSAGE_STATUS,
                new MessageEventPayload(conversation.getId(), message, null));
    }

    public void customerOnline(String conversationId, String sessionId, Instant at) {
        publishPresence(RoomEvents.CUSTOMER_ONLINE, conversationId, sessionId, at);
    }

    public void customerHeartbeat(String conversationId, String sessionId, Instant at) {
        publishPresence(RoomEvents.CUSTOMER_HEARTBEAT, conversationId, sessionId, at);
    }

    public void customerOffline(String conversationId, String sessionId, Instant at) {
        publishPresence(RoomEvents.CUSTOMER_OFFLINE, conversationId, sessionId, at);
    }

    private void publishPresence(String event, String conversationId, String sessionId, Instant at) {
        roomEventBus.publish(
                RoomKeys.conversation(conversationId), event, new PresencePayload(conversationId, sessionId, at));
    }

    private void publishToBoth(Conversation conversation, String event, Object payload) {
        roomEventBus.publish(RoomKeys.company(conversation.getCompanyId()), event, payload);
        roomEventBus.publish(RoomKeys.conversation(conversation.getId()), event, payload);
    }

    private ViewUpdatePayload.ViewUpdatePayloadBuilder viewUpdate(ViewUpdateType type, Conversation conversation) {
        return ViewUpdatePayload.builder()
                .type(type)
                .conversationId(conversation.getId())
                .conversation(conversation);
    }
}
