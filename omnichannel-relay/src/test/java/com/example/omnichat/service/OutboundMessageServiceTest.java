package com.example.omnichat.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;

import com.example.omnichat.autoreply.DisabledReplyGenerator;
import com.example.omnichat.channel.ChannelAdapter;
import com.example.omnichat.channel.DeliveryResult;
import com.example.omnichat.channel.InboundMessage;
import com.example.omnichat.channel.OutboundMessage;
import com.example.omnichat.domain.Channel;
import com.example.omnichat.domain.ChatMessage;
import com.example.omnichat.domain.ConnectionConfig;
import com.example.omnichat.domain.Conversation;
import com.example.omnichat.domain.DeliveryStatus;
import com.example.omnichat.domain.MessageRole;
import com.example.omnichat.domain.MessageSender;
import com.example.omnichat.event.RoomEvents;
import com.example.omnichat.realtime.RoomKeys;
import com.example.omnichat.service.exception.ServiceException;
import com.example.omnichat.support.RelayFixture;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OutboundMessageServiceTest {

    private final Deque<DeliveryResult> results = new ArrayDeque<>();
    private RelayFixture fixture;
    private Conversation conversation;

    @BeforeEach
    void setUp() {
        ChannelAdapter telegram = new ChannelAdapter() {
            @Override
            public Channel channel() {
                return Channel.TELEGRAM;
            }

            @Override
            public DeliveryResult send(ConnectionConfig connection, OutboundMessage message) {
                return results.isEmpty() ? DeliveryResult.sent("42") : results.pop();
            }
        };
        fixture = new RelayFixture(new DisabledReplyGenerator(), Runnable::run, List.of(telegram));
        fixture.addConnection("tg-1", Channel.TELEGRAM, false);
        conversation = fixture.processor.process(InboundMessage.builder()
                        .channel(Channel.TELEGRAM)
                        .connectionId("tg-1")
                        .customerIdentifier("1001")
                        .text("hello")
                        .build())
                .orElseThrow()
                .conversation();
    }

    @Test
    void successfulDeliveryStoresPlatformId() {
        ChatMessage sent = fixture.outboundMessageService.sendReply(
                conversation, MessageRole.AGENT, MessageSender.builder().id("a1").build(), "hi", null);

        assertThat(sent.getDeliveryStatus()).isEqualTo(DeliveryStatus.SENT);
        assertThat(sent.getPlatformMessageId()).isEqualTo("42");
    }

    @Test
    void failedDeliveryIsStoredAndCanBeRetried() {
        results.push(DeliveryResult.failed("Telegram 403: bot was blocked"));

        ChatMessage failed = fixture.outboundMessageService.sendReply(
                conversation, MessageRole.AGENT, MessageSender.builder().id("a1").build(), "hi", null);

        assertThat(failed.getDeliveryStatus()).isEqualTo(DeliveryStatus.FAILED);
        assertThat(failed.getDeliveryError()).contains("blocked");
        verify(fixture.roomEventBus)
                .publish(eq(RoomKeys.conversation(conversation.getId())), eq(RoomEvents.MESSAGE_STATUS), any());
        assertThat(fixture.messageStore.countUnread(conversation.getId())).isZero();

        ChatMessage retried = fixture.outboundMessageService.retry(conversation, failed.getId());

        assertThat(retried.getDeliveryStatus()).isEqualTo(DeliveryStatus.SENT);
        assertThat(retried.getDeliveryError()).isNull();
        assertThat(fixture.messageStore.all(conversation.getId())).hasSize(2);
    }

    @Test
    void onlyFailedRepliesAreRetryable() {
        ChatMessage sent = fixture.outboundMessageService.sendReply(
                conversation, MessageRole.BOT, MessageSender.builder().name("Assistant").build(), "hi", null);

        assertThatThrownBy(() -> fixture.outboundMessageService.retry(conversation, sent.getId()))
                .isInstanceOf(ServiceException.class)
                .extracting("errorCode")
                .isEqualTo("not_retryable");
    }

    @Test
    void emptyReplyIsRejected() {
        assertThatThrownBy(() -> fixture.outboundMessageService.sendReply(
                        conversation, MessageRole.AGENT, null, "  ", null))
                .isInstanceOf(ServiceException.class)
                .extracting("errorCode")
                .isEqualTo("empty_message");
    }

    @Test
    void customerRoleIsNotAReply() {
        assertThatThrownBy(() -> fixture.outboundMessageService.sendReply(
                        conversation, MessageRole.USER, null, "hi", null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
