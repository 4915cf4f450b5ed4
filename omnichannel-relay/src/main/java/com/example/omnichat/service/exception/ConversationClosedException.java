package com.example.omnichat.service.exception;

import org.springframework.http.HttpStatus;

/**
 * The conversation was closed before the write reached it. Customer messages re-resolve to a fresh
 * conversation; replies are refused.
 */
public class ConversationClosedException extends ServiceException {

    private final String conversationId;

    public ConversationClosedException(String conversationId) {
        super(HttpStatus.CONFLICT, "Conversation %s is closed".formatted(conversationId), "conversation_closed");
        this.conversationId = conversationId;
    }

    public String getConversationId() {
        return conversationId;
    }
}
