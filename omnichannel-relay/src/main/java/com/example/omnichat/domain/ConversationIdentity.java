package com.example.omnichat.domain;

/**
 * The tuple that names one customer on one channel connection.
 */
public record ConversationIdentity(Channel channel, String connectionId, String customerIdentifier) {

    public String asKey() {
        return "%s:%s:%s".formatted(channel.name(), connectionId, customerIdentifier);
    }
}
