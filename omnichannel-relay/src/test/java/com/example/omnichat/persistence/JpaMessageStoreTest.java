package com.example.omnichat.persistence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.omnichat.domain.Channel;
import com.example.omnichat.domain.ChatMessage;
import com.example.omnichat.domain.Conversation;
import com.example.omnichat.domain.ConversationStatus;
import com.example.omnichat.domain.DeliveryStatus;
import com.example.omnichat.domain.MessageRole;
import com.example.omnichat.service.MessageDraft;
import com.example.omnichat.service.MessagePage;
import com.example.omnichat.service.exception.ConversationClosedException;
import com.example.omnichat.service.exception.ServiceException;
import com.example.omnichat.support.MutableClock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataIntegrityViolationException;

@DataJpaTest
@Import(PersistenceTestConfig.class)
class JpaMessageStoreTest {

    @Autowired
    private JpaMessageStore messageStore;

    @Autowired
    private JpaConversationStore conversationStore;

    @Autowired
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        conversationStore.insert(Conversation.builder()
                .id("c-1")
                .companyId("acme")
                .channel(Channel.WIDGET)
                .connectionId("widget-1")
                .customerIdentifier("session-1")
                .status(ConversationStatus.OPEN)
                .createdAt(clock.instant())
                .lastMessageAt(clock.instant())
                .build());
    }

    @Test
    void customerMessagesCountAsUnreadUntilAReply() {
        messageStore.append("c-1", customer("one", null));
        messageStore.append("c-1", customer("two", null));

        assertThat(messageStore.countUnread("c-1")).isEqualTo(2);
        assertThat(conversationStore.findById("c-1")).map(Conversation::getLastMessageRole).contains(MessageRole.USER);

        messageStore.append("c-1", reply(MessageRole.BOT, "bot answer"));

        assertThat(messageStore.countUnread("c-1")).isZero();
        assertThat(conversationStore.findById("c-1")).map(Conversation::getLastMessageRole).contains(MessageRole.BOT);
    }

    @Test
    void customerMessageWakesSnoozedConversation() {
        Conversation conversation = conversationStore.findById("c-1").orElseThrow();
        conversationStore.update(conversation.toBuilder().status(ConversationStatus.SNOOZED).build());

        messageStore.append("c-1", reply(MessageRole.AGENT, "we will get back to you"));
        assertThat(conversationStore.findById("c-1")).map(Conversation::getStatus).contains(ConversationStatus.SNOOZED);

        messageStore.append("c-1", customer("any news?", null));
        assertThat(conversationStore.findById("c-1")).map(Conversation::getStatus).contains(ConversationStatus.OPEN);
    }

    @Test
    void lastMessageAtNeverMovesBackwards() {
        clock.advance(Duration.ofSeconds(10));
        ChatMessage first = messageStore.append("c-1", customer("first", null));
        clock.advance(Duration.ofSeconds(-5));

        ChatMessage second = messageStore.append("c-1", customer("second", null));

        assertThat(second.getCreatedAt()).isEqualTo(first.getCreatedAt());
        assertThat(conversationStore.findById("c-1").orElseThrow().getLastMessageAt()).isEqualTo(first.getCreatedAt());
    }

    @Test
    void pagesWalkBackwardsWithoutGapsOrRepeats() {
        for (int i = 1; i <= 7; i++) {
            if (i % 2 == 0) {
                clock.advance(Duration.ofMillis(1));
            }
            messageStore.append("c-1", customer("m" + i, null));
        }

        List<String> texts = new ArrayList<>();
        String cursor = null;
        do {
            MessagePage page = messageStore.listPage("c-1", cursor, 3);
            page.messages().forEach(message -> texts.add(message.getText()));
            cursor = page.nextCursor();
        } while (cursor != null);

        assertThat(texts).containsExactly("m7", "m6", "m5", "m4", "m3", "m2", "m1");
        assertThat(messageStore.recent("c-1", 3)).extracting(ChatMessage::getText).containsExactly("m5", "m6", "m7");
    }

    @Test
    void deliveryOutcomeIsRecorded() {
        ChatMessage pending = messageStore.append("c-1", reply(MessageRole.AGENT, "hello"));

        ChatMessage failed = messageStore.updateDelivery(pending.getId(), DeliveryStatus.FAILED, null, "Graph API 400").orElseThrow();
        assertThat(failed.getDeliveryError()).isEqualTo("Graph API 400");

        ChatMessage sent = messageStore.updateDelivery(pending.getId(), DeliveryStatus.SENT, "m_out", null).orElseThrow();
        assertThat(sent.getDeliveryStatus()).isEqualTo(DeliveryStatus.SENT);
        assertThat(sent.getPlatformMessageId()).isEqualTo("m_out");
        assertThat(sent.getDeliveryError()).isNull();
    }

    @Test
    void appendToMissingConversationFails() {
        assertThatThrownBy(() -> messageStore.append("missing", customer("hi", null)))
                .isInstanceOf(ServiceException.class);
    }

    @Test
    void closedConversationTakesNoMoreMessages() {
        Conversation open = conversationStore.findById("c-1").orElseThrow();
        conversationStore.update(open.toBuilder().status(ConversationStatus.CLOSED).closedAt(clock.instant()).build());

        assertThatThrownBy(() -> messageStore.append("c-1", customer("still there?", null)))
                .isInstanceOf(ConversationClosedException.class);
        assertThatThrownBy(() -> messageStore.append("c-1", reply(MessageRole.BOT, "Yes!")))
                .isInstanceOf(ConversationClosedException.class);
        Conversation closed = conversationStore.findById("c-1").orElseThrow();
        assertThat(closed.getStatus()).isEqualTo(ConversationStatus.CLOSED);
        assertThat(closed.getUnreadCount()).isZero();
    }

    @Test
    void sameDedupKeyIsStoredOnce() {
        messageStore.append("c-1", customer("hi", "WIDGET:widget-1:m1"));

        assertThat(messageStore.existsByDedupKey("WIDGET:widget-1:m1")).isTrue();
        assertThat(messageStore.existsByDedupKey("WIDGET:widget-1:m2")).isFalse();
        assertThatThrownBy(() -> messageStore.append("c-1", customer("hi", "WIDGET:widget-1:m1")))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    private MessageDraft customer(String text, String dedupKey) {
        return MessageDraft.builder()
                .role(MessageRole.USER)
                .text(text)
                .deliveryStatus(DeliveryStatus.RECEIVED)
                .dedupKey(dedupKey)
                .build();
    }

    private MessageDraft reply(MessageRole role, String text) {
        return MessageDraft.builder().role(role).text(text).deliveryStatus(DeliveryStatus.PENDING).build();
    }
}
