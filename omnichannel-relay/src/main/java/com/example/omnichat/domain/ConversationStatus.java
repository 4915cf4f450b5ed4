package com.example.omnichat.domain;

import java.util.Set;

public enum ConversationStatus {
    OPEN,
    SNOOZED,
    CLOSED;

    public static final Set<ConversationStatus> ACTIVE = Set.of(OPEN, SNOOZED);

    public boolean isActive() {
        return this != CLOSED;
    }
}
