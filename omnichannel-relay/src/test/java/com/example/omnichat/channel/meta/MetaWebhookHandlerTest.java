package com.example.omnichat.channel.meta;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.omnichat.channel.InboundMessage;
import com.example.omnichat.channel.InboundMessageQueue;
import com.example.omnichat.config.OmnichatProperties;
import com.example.omnichat.connection.ConnectionConfigService;
import com.example.omnichat.domain.Channel;
import com.example.omnichat.domain.ConnectionConfig;
import com.example.omnichat.support.MutableClock;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class MetaWebhookHandlerTest {

    private static final String PAGE_EVENT = """
            {"object":"page","entry":[{"id":"PAGE-1","time":1714554000000,"messaging":[
              {"sender":{"id":"PSID-7"},"recipient":{"id":"PAGE-1"},"timestamp":1714554000123,
               "message":{"mid":"m_1","text":"Is my order shipped?"}},
              {"sender":{"id":"PAGE-1"},"recipient":{"id":"PSID-7"},"timestamp":1714554000200,
               "message":{"mid":"m_2","text":"echo","is_echo":true}},
              {"sender":{"id":"PSID-7"},"recipient":{"id":"PAGE-1"},"timestamp":1714554000300,
               "read":{"watermark":1714554000000}}
            ]}]}
            """;

    private final OmnichatProperties properties = new OmnichatProperties();
    private final ConnectionConfigService connectionConfigService = mock(ConnectionConfigService.class);
    private final InboundMessageQueue queue = mock(InboundMessageQueue.class);
    private MetaWebhookHandler handler;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        handler = new MetaWebhookHandler(
                properties, connectionConfigService, queue, objectMapper,
                new MutableClock(Instant.parse("2024-05-01T09:00:00Z")));
        properties.getChannels().getMeta().setVerifyToken("verify-me");
    }

    @Test
    void subscriptionHandshakeEchoesChallengeOnlyForTheConfiguredToken() {
        assertThat(handler.verifySubscription("subscribe", "verify-me", "1158201444")).contains("1158201444");
        assertThat(handler.verifySubscription("subscribe", "wrong", "1158201444")).isEmpty();
        assertThat(handler.verifySubscription("unsubscribe", "verify-me", "1158201444")).isEmpty();
    }

    @Test
    void customerMessagesAreQueuedAndEchoesSkipped() {
        when(connectionConfigService.findActiveByExternalId(Channel.FACEBOOK, "PAGE-1"))
                .thenReturn(Optional.of(connection("fb-1", Channel.FACEBOOK, "PAGE-1")));

        int queued = handler.handle(Channel.FACEBOOK, PAGE_EVENT.getBytes(StandardCharsets.UTF_8));

        assertThat(queued).isEqualTo(1);
        ArgumentCaptor<InboundMessage> captor = ArgumentCaptor.forClass(InboundMessage.class);
        verify(queue).enqueue(captor.capture());
        InboundMessage message = captor.getValue();
        assertThat(message.getConnectionId()).isEqualTo("fb-1");
        assertThat(message.getCustomerIdentifier()).isEqualTo("PSID-7");
        assertThat(message.getText()).isEqualTo("Is my order shipped?");
        assertThat(message.getPlatformMessageId()).isEqualTo("m_1");
        assertThat(message.getReceivedAt()).isEqualTo(Instant.ofEpochMilli(1714554000123L));
        assertThat(message.getAttributes()).containsEntry("pageId", "PAGE-1");
    }

    @Test
    void instagramAttachmentsAreMappedAndAccountFallsBackToRecipient() {
        String body = """
                {"object":"instagram","entry":[{"id":"IG-OTHER","messaging":[
                  {"sender":{"id":"IGSID-3"},"recipient":{"id":"IG-9"},
                   "message":{"mid":"ig_1","attachments":[{"type":"image","payload":{"url":"https://cdn.example/a.jpg"}}]}}
                ]}]}
                """;
        when(connectionConfigService.findActiveByExternalId(Channel.INSTAGRAM, "IG-OTHER")).thenReturn(Optional.empty());
        when(connectionConfigService.findActiveByExternalId(Channel.INSTAGRAM, "IG-9"))
                .thenReturn(Optional.of(connection("ig-1", Channel.INSTAGRAM, "IG-9")));

        ArgumentCaptor<InboundMessage> captor = ArgumentCaptor.forClass(InboundMessage.class);
        assertThat(handler.handle(Channel.INSTAGRAM, body.getBytes(StandardCharsets.UTF_8))).isEqualTo(1);
        verify(queue).enqueue(captor.capture());

        InboundMessage message = captor.getValue();
        assertThat(message.getText()).isNull();
        assertThat(message.firstAttachment().getUrl()).isEqualTo("https://cdn.example/a.jpg");
        assertThat(message.firstAttachment().getContentType()).isEqualTo("image/*");
        assertThat(message.getAttributes()).doesNotContainKey("pageId");
        assertThat(message.getReceivedAt()).isEqualTo(Instant.parse("2024-05-01T09:00:00Z"));
    }

    @Test
    void eventsForUnknownAccountsAreDropped() {
        when(connectionConfigService.findActiveByExternalId(any(), any())).thenReturn(Optional.empty());

        assertThat(handler.handle(Channel.FACEBOOK, PAGE_EVENT.getBytes(StandardCharsets.UTF_8))).isZero();
        verify(queue, never()).enqueue(any());
    }

    @Test
    void unreadableBodyIsIgnored() {
        assertThat(handler.handle(Channel.FACEBOOK, "not json".getBytes(StandardCharsets.UTF_8))).isZero();
        verify(queue, never()).enqueue(any());
    }

    @Test
    void signatureCheckCanBeSkippedForLocalDevelopment() {
        byte[] body = PAGE_EVENT.getBytes(StandardCharsets.UTF_8);
        assertThat(handler.isAuthentic(body, "sha256=00", "secret")).isFalse();

        properties.getChannels().getMeta().setSkipSignatureVerification(true);

        assertThat(handler.isAuthentic(body, null, null)).isTrue();
    }

    private ConnectionConfig connection(String id, Channel channel, String externalId) {
        return ConnectionConfig.builder().id(id).companyId("acme").channel(channel).externalId(externalId).active(true).build();
    }
}
