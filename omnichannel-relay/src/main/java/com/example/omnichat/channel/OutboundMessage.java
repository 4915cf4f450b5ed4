package com.example.omnichat.channel;

import com.example.omnichat.domain.Attachment;
import com.example.omnichat.domain.ChatMessage;
import com.example.omnichat.domain.Conversation;

public record OutboundMessage(Conversation conversation, ChatMessage message) {

    public String text() {
        return message.getText();
    }

    public Attachment attachment() {
        return message.getAttachment();
    }

    public String recipient() {
        return conversation.getCustomerIdentifier();
    }
}
