package com.example.omnichat.realtime;

public final class RoomKeys {

    private static final String COMPANY_PREFIX = "company:";
    private static final String CONVERSATION_PREFIX = "conversation:";

    private RoomKeys() {}

    public static String company(String companyId) {
        return COMPANY_PREFIX + companyId;
    }

    public static String conversation(String conversationId) {
        return CONVERSATION_PREFIX + conversationId;
    }
}
