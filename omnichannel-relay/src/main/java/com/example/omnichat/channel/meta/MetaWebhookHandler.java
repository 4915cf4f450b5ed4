package com.example.omnichat.channel.meta;

import com.example.omnichat.channel.InboundMessage;
import com.example.omnichat.channel.InboundMessageQueue;
import com.example.omnichat.config.OmnichatProperties;
import com.example.omnichat.connection.ConnectionConfigService;
import com.example.omnichat.domain.Attachment;
import com.example.omnichat.domain.Channel;
import com.example.omnichat.domain.ConnectionConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Webhook handling common to Facebook and Instagram: subscription handshake, signature check and
 * mapping of {@code entry[].messaging[]} events to inbound messages.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MetaWebhookHandler {

    static final String MODE_SUBSCRIBE = "subscribe";

    private final OmnichatProperties properties;
    private final ConnectionConfigService connectionConfigService;
    private final InboundMessageQueue inboundMessageQueue;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * @return the challenge to echo back when the subscription request carries the configured token
     */
    public Optional<String> verifySubscription(String mode, String verifyToken, String challenge) {
        String expected = properties.getChannels().getMeta().getVerifyToken();
        if (MODE_SUBSCRIBE.equals(mode) && StringUtils.hasText(expected) && expected.equals(verifyToken)) {
            return Optional.ofNullable(challenge);
        }
        return Optional.empty();
    }

    public boolean isAuthentic(byte[] body, String signatureHeader, String appSecret) {
        if (properties.getChannels().getMeta().isSkipSignatureVerification()) {
            return true;
        }
        return MetaSignatureVerifier.isValid(body, signatureHeader, appSecret);
    }

    /**
     * Parses the body and enqueues every customer message in it.
     *
     * @return number of messages enqueued
     */
    public int handle(Channel channel, byte[] body) {
        MetaWebhookPayload payload;
        try {
            payload = objectMapper.readValue(body, MetaWebhookPayload.class);
        } catch (IOException ex) {
            log.warn("Ignoring unreadable {} webhook body: {}", channel, ex.getMessage());
            return 0;
        }
        List<InboundMessage> messages = toInboundMessages(channel, payload);
        messages.forEach(inboundMessageQueue::enqueue);
        return messages.size();
    }

    List<InboundMessage> toInboundMessages(Channel channel, MetaWebhookPayload payload) {
        List<InboundMessage> result = new ArrayList<>();
        for (MetaWebhookPayload.Entry entry : payload.getEntry()) {
            for (MetaWebhookPayload.MessagingEvent event : entry.getMessaging()) {
                if (event.getMessage() == null || event.getMessage().isEcho() || event.getSender() == null) {
                    continue;
                }
                Optional<ConnectionConfig> connection = findConnection(channel, entry, event);
                if (connection.isEmpty()) {
                    log.warn("No active {} connection for account {}", channel, entry.getId());
                    continue;
                }
                result.add(toInboundMessage(channel, connection.get(), entry, event));
            }
        }
        return result;
    }

    private Optional<ConnectionConfig> findConnection(
            Channel channel, MetaWebhookPayload.Entry entry, MetaWebhookPayload.MessagingEvent event) {
        Optional<ConnectionConfig> byEntry = connectionConfigService.findActiveByExternalId(channel, entry.getId());
        if (byEntry.isPresent() || event.getRecipient() == null) {
            return byEntry;
        }
        return connectionConfigService.findActiveByExternalId(channel, event.getRecipient().getId());
    }

    private InboundMessage toInboundMessage(
            Channel channel,
            ConnectionConfig connection,
            MetaWebhookPayload.Entry entry,
            MetaWebhookPayload.MessagingEvent event) {
        MetaWebhookPayload.Message message = event.getMessage();
        List<Attachment> attachments = new ArrayList<>();
        for (MetaWebhookPayload.Attachment attachment : message.getAttachments()) {
            if (attachment.getPayload() != null && StringUtils.hasText(attachment.getPayload().getUrl())) {
                attachments.add(Attachment.builder()
                        .url(attachment.getPayload().getUrl())
                        .contentType(contentType(attachment.getType()))
                        .build());
            }
        }
        Map<String, Object> attributes = new LinkedHashMap<>();
        if (channel == Channel.FACEBOOK) {
            attributes.put("pageId", connection.getExternalId());
        }
        return InboundMessage.builder()
                .channel(channel)
                .connectionId(connection.getId())
                .customerIdentifier(event.getSender().getId())
                .text(message.getText())
                .attachments(attachments)
                .platformMessageId(message.getMid())
                .receivedAt(event.getTimestamp() != null ? Instant.ofEpochMilli(event.getTimestamp()) : clock.instant())
                .attributes(attributes)
                .build();
    }

    private String contentType(String metaType) {
        if (metaType == null) {
            return "application/octet-stream";
        }
        return switch (metaType) {
            case "image" -> "image/*";
            case "video" -> "video/*";
            case "audio" -> "audio/*";
            default -> "application/octet-stream";
        };
    }
}
