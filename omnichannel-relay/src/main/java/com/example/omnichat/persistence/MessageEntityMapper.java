package com.example.omnichat.persistence;

import com.example.omnichat.domain.Attachment;
import com.example.omnichat.domain.ChatMessage;
import com.example.omnichat.domain.MessageSender;
import com.example.omnichat.service.MessageDraft;
import java.time.Instant;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Component
public class MessageEntityMapper {

    public MessageEntity toEntity(String conversationId, MessageDraft draft, Instant createdAt) {
        MessageEntity entity = new MessageEntity();
        entity.setConversationId(conversationId);
        entity.setRole(draft.getRole());
        entity.setText(draft.getText());
        Attachment attachment = draft.getAttachment();
        if (attachment != null) {
            entity.setAttachmentUrl(attachment.getUrl());
            entity.setAttachmentContentType(attachment.getContentType());
            entity.setAttachmentSizeBytes(attachment.getSizeBytes());
        }
        MessageSender sender = draft.getSender();
        if (sender != null) {
            entity.setSenderId(sender.getId());
            entity.setSenderName(sender.getName());
            entity.setSenderPhotoUrl(sender.getPhotoUrl());
            entity.setSenderModel(sender.getModel());
        }
        entity.setPlatformMessageId(draft.getPlatformMessageId());
        entity.setDeliveryStatus(draft.getDeliveryStatus());
        entity.setDedupKey(draft.getDedupKey());
        entity.setCreatedAt(createdAt);
        return entity;
    }

    public ChatMessage toDomain(MessageEntity entity) {
        Attachment attachment = StringUtils.hasText(entity.getAttachmentUrl())
                ? Attachment.builder()
                        .url(entity.getAttachmentUrl())
                        .contentType(entity.getAttachmentContentType())
                        .sizeBytes(entity.getAttachmentSizeBytes())
                        .build()
                : null;
        MessageSender sender = entity.getSenderId() != null || entity.getSenderName() != null || entity.getSenderModel() != null
                ? MessageSender.builder()
                        .id(entity.getSenderId())
                        .name(entity.getSenderName())
                        .photoUrl(entity.getSenderPhotoUrl())
                        .model(entity.getSenderModel())
                        .build()
                : null;
        return ChatMessage.builder()
                .id(entity.getId())
                .conversationId(entity.getConversationId())
                .role(entity.getRole())
                .text(entity.getText())
                .attachment(attachment)
                .sender(sender)
                .platformMessageId(entity.getPlatformMessageId())
                .deliveryStatus(entity.getDeliveryStatus())
                .deliveryError(entity.getDeliveryError())
                .createdAt(entity.getCreatedAt())
                .build();
    }
}
