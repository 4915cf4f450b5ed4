package com.example.omnichat.persistence;

import com.example.omnichat.domain.Channel;
import com.example.omnichat.domain.ConversationStatus;
import com.example.omnichat.domain.MessageRole;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.DynamicUpdate;

@Getter
@Setter
@Entity
@DynamicUpdate
@Table(
        name = "conversations",
        uniqueConstraints = @UniqueConstraint(name = "uk_conversations_open_identity", columnNames = "open_identity_key"),
        indexes = {
            @Index(name = "idx_conversations_company_activity", columnList = "company_id, last_message_at, id"),
            @Index(name = "idx_conversations_identity", columnList = "channel, connection_id, customer_identifier")
        })
public class ConversationEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 64)
    private String id;

    @Column(name = "company_id", nullable = false, updatable = false, length = 64)
    private String companyId;

    @Enumerated(EnumType.STRING)
    @Column(name = "channel", nullable = false, updatable = false, length = 32)
    private Channel channel;

    @Column(name = "connection_id", nullable = false, updatable = false, length = 64)
    private String connectionId;

    @Column(name = "customer_identifier", nullable = false, updatable = false, length = 191)
    private String customerIdentifier;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private ConversationStatus status;

    /**
     * {@code channel:connectionId:customerIdentifier} while the conversation is active, {@code null} once
     * closed. The unique constraint on this column allows at most one active conversation per customer.
     */
    @Column(name = "open_identity_key", length = 320)
    private String openIdentityKey;

    @Column(name = "auto_reply_enabled", nullable = false)
    private boolean autoReplyEnabled;

    @Column(name = "last_message_at", nullable = false)
    private Instant lastMessageAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "last_message_role", length = 16)
    private MessageRole lastMessageRole;

    @Column(name = "unread_count", nullable = false)
    private int unreadCount;

    @Column(name = "customer_name", length = 255)
    private String customerName;

    @Column(name = "customer_email", length = 255)
    private String customerEmail;

    @Column(name = "customer_phone", length = 64)
    private String customerPhone;

    @Column(name = "customer_address", length = 512)
    private String customerAddress;

    @Column(name = "attributes", columnDefinition = "text")
    private String attributes;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Column(name = "closed_at")
    private Instant closedAt;
}
