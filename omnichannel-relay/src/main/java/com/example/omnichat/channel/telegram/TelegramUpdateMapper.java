package com.example.omnichat.channel.telegram;

import com.example.omnichat.channel.InboundMessage;
import com.example.omnichat.domain.Attachment;
import com.example.omnichat.domain.Channel;
import com.example.omnichat.domain.ConnectionConfig;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;
import org.springframework.util.StringUtils;

/**
 * Maps Bot API updates to inbound messages. Files are referenced by their Telegram file id; the bot
 * token needed to download them never leaves the server.
 */
final class TelegramUpdateMapper {

    static final String FILE_REFERENCE_PREFIX = "telegram-file:";

    private TelegramUpdateMapper() {
    }

    static Optional<InboundMessage> toInboundMessage(ConnectionConfig connection, TelegramUpdate update, Instant now) {
        TelegramUpdate.Message message = update.effectiveMessage();
        if (message == null || message.getChat() == null || message.getChat().getId() == null) {
            return Optional.empty();
        }
        Optional<Attachment> attachment = attachmentOf(message);
        String text = StringUtils.hasText(message.getText()) ? message.getText() : message.getCaption();
        if (!StringUtils.hasText(text) && attachment.isEmpty()) {
            return Optional.empty();
        }

        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("chatType", message.getChat().getType());
        String name = null;
        TelegramUpdate.User from = message.getFrom();
        if (from != null) {
            if (from.getId() != null) {
                attributes.put("telegramUserId", String.valueOf(from.getId()));
            }
            if (StringUtils.hasText(from.getUsername())) {
                attributes.put("username", from.getUsername());
            }
            name = displayName(from);
        }
        attributes.values().removeIf(value -> value == null);

        List<Attachment> attachments = new ArrayList<>();
        attachment.ifPresent(attachments::add);
        return Optional.of(InboundMessage.builder()
                .channel(Channel.TELEGRAM)
                .connectionId(connection.getId())
                .customerIdentifier(String.valueOf(message.getChat().getId()))
                .customerName(name)
                .text(text)
                .attachments(attachments)
                .platformMessageId(platformMessageId(update, message))
                .receivedAt(message.getDate() != null ? Instant.ofEpochSecond(message.getDate()) : now)
                .attributes(attributes)
                .build());
    }

    /**
     * Edits reuse the original message id, so they get their own key or dedup would drop them.
     */
    private static String platformMessageId(TelegramUpdate update, TelegramUpdate.Message message) {
        if (message.getMessageId() == null) {
            return null;
        }
        String id = message.getChat().getId() + ":" + message.getMessageId();
        if (update.getMessage() == null && update.getUpdateId() != null) {
            return id + ":edit:" + update.getUpdateId();
        }
        return id;
    }

    private static Optional<Attachment> attachmentOf(TelegramUpdate.Message message) {
        if (message.getPhoto() != null && !message.getPhoto().isEmpty()) {
            // sizes are ordered smallest first
            TelegramUpdate.PhotoSize largest = message.getPhoto().get(message.getPhoto().size() - 1);
            return Optional.of(Attachment.builder()
                    .url(FILE_REFERENCE_PREFIX + largest.getFileId())
                    .contentType("image/jpeg")
                    .sizeBytes(largest.getFileSize())
                    .build());
        }
        TelegramUpdate.Document document = message.getDocument();
        if (document != null && StringUtils.hasText(document.getFileId())) {
            return Optional.of(Attachment.builder()
                    .url(FILE_REFERENCE_PREFIX + document.getFileId())
                    .contentType(StringUtils.hasText(document.getMimeType()) ? document.getMimeType() : "application/octet-stream")
                    .sizeBytes(document.getFileSize())
                    .build());
        }
        return Optional.empty();
    }

    private static String displayName(TelegramUpdate.User from) {
        StringJoiner name = new StringJoiner(" ");
        if (StringUtils.hasText(from.getFirstName())) {
            name.add(from.getFirstName());
        }
        if (StringUtils.hasText(from.getLastName())) {
            name.add(from.getLastName());
        }
        return name.length() > 0 ? name.toString() : null;
    }
}
