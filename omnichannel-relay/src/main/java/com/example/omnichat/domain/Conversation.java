package com.example.omnichat.domain;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Conversation implements Serializable {

    private String id;
    private String companyId;
    private Channel channel;
    private String connectionId;
    private String customerIdentifier;
    private ConversationStatus status;
    private boolean autoReplyEnabled;
    private Instant lastMessageAt;
    private MessageRole lastMessageRole;
    private int unreadCount;
    private String customerName;
    private String customerEmail;
    private String customerPhone;
    private String customerAddress;

    /**
     * Per-channel customer attributes. Well-known keys: {@code username}, {@code telegramUserId},
     * {@code chatType} (Telegram), {@code instagramHandle} (Instagram), {@code pageId} (Facebook),
     * {@code sessionId}, {@code userAgent}, {@code pageUrl} (Widget).
     */
    private Map<String, Object> attributes;

    private Instant createdAt;
    private Instant updatedAt;
    private Instant closedAt;

    public ConversationIdentity identity() {
        return new ConversationIdentity(channel, connectionId, customerIdentifier);
    }
}
