package com.example.omnichat.persistence;

import com.example.omnichat.domain.DeliveryStatus;
import com.example.omnichat.domain.MessageRole;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
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
        name = "messages",
        uniqueConstraints = @UniqueConstraint(name = "uk_messages_dedup_key", columnNames = "dedup_key"),
        indexes = @Index(name = "idx_messages_conversation_order", columnList = "conversation_id, created_at, id"))
public class MessageEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "conversation_id", nullable = false, updatable = false, length = 64)
    private String conversationId;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, updatable = false, length = 16)
    private MessageRole role;

    @Column(name = "text", columnDefinition = "text", updatable = false)
    private String text;

    @Column(name = "attachment_url", length = 2048, updatable = false)
    private String attachmentUrl;

    @Column(name = "attachment_content_type", length = 128, updatable = false)
    private String attachmentContentType;

    @Column(name = "attachment_size_bytes", updatable = false)
    private Long attachmentSizeBytes;

    @Column(name = "sender_id", length = 128, updatable = false)
    private String senderId;

    @Column(name = "sender_name", length = 255, updatable = false)
    private String senderName;

    @Column(name = "sender_photo_url", length = 2048, updatable = false)
    private String senderPhotoUrl;

    @Column(name = "sender_model", length = 128, updatable = false)
    private String senderModel;

    @Column(name = "platform_message_id", length = 255)
    private String platformMessageId;

    @Enumerated(EnumType.STRING)
    @Column(name = "delivery_status", length = 16)
    private DeliveryStatus deliveryStatus;

    @Column(name = "delivery_error", length = 1024)
    private String deliveryError;

    @Column(name = "dedup_key", length = 400, updatable = false)
    private String dedupKey;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
