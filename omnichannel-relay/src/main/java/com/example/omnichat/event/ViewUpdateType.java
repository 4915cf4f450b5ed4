package com.example.omnichat.event;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum ViewUpdateType {
    NEW_MESSAGE,
    MESSAGE_SENT,
    BOT_STATUS_CHANGED,
    NEW_CONVERSATION,
    TYPING_START,
    TYPING_STOP;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
