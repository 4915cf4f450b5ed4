package com.example.omnichat.domain;

import java.io.Serializable;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ChatMessage implements Serializable {

    private Long id;
    private String conversationId;
    private MessageRole role;
    private String text;
    private Attachment attachment;
    private MessageSender sender;
    private String platformMessageId;
    private DeliveryStatus deliveryStatus;
    private String deliveryError;
    private Instant createdAt;
}
