package com.example.omnichat.domain;

public enum MessageRole {
    USER,
    AGENT,
    BOT;

    public boolean isCustomer() {
        return this == USER;
    }
}
