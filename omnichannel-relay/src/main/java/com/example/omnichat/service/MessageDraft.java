package com.example.omnichat.service;

import com.example.omnichat.domain.Attachment;
import com.example.omnichat.domain.DeliveryStatus;
import com.example.omnichat.domain.MessageRole;
import com.example.omnichat.domain.MessageSender;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class MessageDraft {

    MessageRole role;
    String text;
    Attachment attachment;
    MessageSender sender;
    String platformMessageId;
    DeliveryStatus deliveryStatus;
    String dedupKey;
}
