package com.example.omnichat.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.example.omnichat.auth.AgentPrincipal;
import com.example.omnichat.domain.Channel;
import com.example.omnichat.domain.ChatMessage;
import com.example.omnichat.domain.Conversation;
import com.example.omnichat.domain.ConversationStatus;
import com.example.omnichat.domain.DeliveryStatus;
import com.example.omnichat.domain.MessageRole;
import com.example.omnichat.dto.WidgetMessageRequest;
import com.example.omnichat.dto.WidgetMessageResponse;
import com.example.omnichat.event.RoomEvents;
import com.example.omnichat.realtime.RoomKeys;
import com.example.omnichat.service.exception.ServiceException;
import com.example.omnichat.support.RelayFixture;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RelayScenarioTest {

    private static final AgentPrincipal AGENT = new AgentPrincipal("agent-1", RelayFixture.COMPANY, "Sam", null);

    private RelayFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new RelayFixture();
        fixture.addConnection("widget-1", Channel.WIDGET, false);
    }

    @Test
    void widgetCustomerMessageThenAgentReply() {
        WidgetMessageResponse first = customerSays("session-a", "Hello");
        String conversationId = first.conversationId();

        Conversation afterCustomer = fixture.conversationService.getConversation(RelayFixture.COMPANY, conversationId);
        assertThat(afterCustomer.getStatus()).isEqualTo(ConversationStatus.OPEN);
        assertThat(afterCustomer.getUnreadCount()).isEqualTo(1);
        assertThat(afterCustomer.getLastMessageRole()).isEqualTo(MessageRole.USER);
        verify(fixture.roomEventBus).publish(eq(RoomKeys.company(RelayFixture.COMPANY)), eq(RoomEvents.MESSAGE_NEW), any());
        verify(fixture.roomEventBus).publish(eq(RoomKeys.conversation(conversationId)), eq(RoomEvents.MESSAGE_NEW), any());

        fixture.clock.advance(Duration.ofSeconds(5));
        ChatMessage reply = fixture.conversationService.sendAgentMessage(AGENT, conversationId, "Hi, how can I help?", null);

        assertThat(reply.getRole()).isEqualTo(MessageRole.AGENT);
        assertThat(reply.getSender().getName()).isEqualTo("Sam");
        assertThat(reply.getDeliveryStatus()).isEqualTo(DeliveryStatus.SENT);
        Conversation afterReply = fixture.conversationService.getConversation(RelayFixture.COMPANY, conversationId);
        assertThat(afterReply.getUnreadCount()).isZero();
        assertThat(afterReply.getLastMessageRole()).isEqualTo(MessageRole.AGENT);
        verify(fixture.roomEventBus, times(2))
                .publish(eq(RoomKeys.company(RelayFixture.COMPANY)), eq(RoomEvents.MESSAGE_NEW), any());
        verify(fixture.roomEventBus, times(2))
                .publish(eq(RoomKeys.conversation(conversationId)), eq(RoomEvents.MESSAGE_NEW), any());
    }

    @Test
    void closingStartsAFreshConversationAndKeepsTheOldHistory() {
        String original = customerSays("session-b", "Hello").conversationId();
        fixture.conversationService.sendAgentMessage(AGENT, original, "Hi, how can I help?", null);

        Conversation closed = fixture.conversationService.updateStatus(RelayFixture.COMPANY, original, ConversationStatus.CLOSED);
        assertThat(closed.getStatus()).isEqualTo(ConversationStatus.CLOSED);
        assertThat(closed.getClosedAt()).isNotNull();

        fixture.clock.advance(Duration.ofMinutes(1));
        String next = customerSays("session-b", "Hello").conversationId();

        assertThat(next).isNotEqualTo(original);
        assertThat(fixture.conversationService.getConversation(RelayFixture.COMPANY, next).getStatus())
                .isEqualTo(ConversationStatus.OPEN);
        MessagePage oldHistory = fixture.conversationService.listMessages(RelayFixture.COMPANY, original, null, null);
        assertThat(oldHistory.messages())
                .extracting(ChatMessage::getText)
                .containsExactly("Hi, how can I help?", "Hello");
    }

    @Test
    void closedConversationCannotBeReopenedOrAnswered() {
        String conversationId = customerSays("session-c", "Hello").conversationId();
        fixture.conversationService.updateStatus(RelayFixture.COMPANY, conversationId, ConversationStatus.CLOSED);

        assertThatThrownBy(() -> fixture.conversationService.updateStatus(
                        RelayFixture.COMPANY, conversationId, ConversationStatus.OPEN))
                .isInstanceOf(ServiceException.class)
                .extracting("errorCode")
                .isEqualTo("conversation_closed");
        assertThatThrownBy(() -> fixture.conversationService.sendAgentMessage(AGENT, conversationId, "still there?", null))
                .isInstanceOf(ServiceException.class);
    }

    @Test
    void unreadCountsEveryCustomerMessageUntilAReply() {
        String conversationId = customerSays("session-d", "one").conversationId();
        customerSays("session-d", "two");
        customerSays("session-d", "three");
        assertThat(fixture.messageStore.countUnread(conversationId)).isEqualTo(3);

        fixture.conversationService.sendAgentMessage(AGENT, conversationId, "answer", null);
        assertThat(fixture.messageStore.countUnread(conversationId)).isZero();

        customerSays("session-d", "four");
        assertThat(fixture.messageStore.countUnread(conversationId)).isEqualTo(1);
    }

    @Test
    void customerMessageWakesASnoozedConversation() {
        String conversationId = customerSays("session-e", "Hello").conversationId();
        fixture.conversationService.updateStatus(RelayFixture.COMPANY, conversationId, ConversationStatus.SNOOZED);

        String again = customerSays("session-e", "Anyone?").conversationId();

        assertThat(again).isEqualTo(conversationId);
        assertThat(fixture.conversationService.getConversation(RelayFixture.COMPANY, conversationId).getStatus())
                .isEqualTo(ConversationStatus.OPEN);
    }

    @Test
    void messagesWithinOneMillisecondKeepInsertionOrder() {
        String conversationId = customerSays("session-f", "first").conversationId();
        customerSays("session-f", "second");
        fixture.conversationService.sendAgentMessage(AGENT, conversationId, "third", null);

        assertThat(fixture.messageStore.recent(conversationId, 10))
                .extracting(ChatMessage::getText)
                .containsExactly("first", "second", "third");
    }

    @Test
    void markReadClearsUnreadAndNotifiesTheCompanyRoom() {
        String conversationId = customerSays("session-g", "ping").conversationId();

        Conversation read = fixture.conversationService.markRead(RelayFixture.COMPANY, conversationId);

        assertThat(read.getUnreadCount()).isZero();
        verify(fixture.roomEventBus)
                .publish(eq(RoomKeys.company(RelayFixture.COMPANY)), eq(RoomEvents.CONVERSATION_READ), any());
    }

    @Test
    void otherCompaniesCannotSeeTheConversation() {
        String conversationId = customerSays("session-h", "Hello").conversationId();

        assertThatThrownBy(() -> fixture.conversationService.getConversation("globex", conversationId))
                .isInstanceOf(ServiceException.class)
                .extracting("errorCode")
                .isEqualTo("not_found");
    }

    private WidgetMessageResponse customerSays(String sessionId, String text) {
        WidgetMessageRequest request = new WidgetMessageRequest();
        request.setSessionId(sessionId);
        request.setText(text);
        return fixture.widgetService.postMessage("widget-1", request, "JUnit");
    }
}
