package com.example.omnichat.event;

/**
 * Socket event names shared by the fan-out bus and the socket gateway.
 */
public final class RoomEvents {

    public static final String MESSAGE_NEW = "message:new";
    public static final String MESSAGE_STATUS = "message:status";
    public static final String VIEW_UPDATE = "conversation:view-update";
    public static final String CONVERSATION_UPDATED = "conversation:updated";
    public static final String CONVERSATION_READ = "conversation:read";
    public static final String CUSTOMER_ONLINE = "customer:online";
    public static final String CUSTOMER_HEARTBEAT = "customer:heartbeat";
    public static final String CUSTOMER_OFFLINE = "customer:offline";
    public static final String JOINED_COMPANY = "joined:company";
    public static final String JOINED_CONVERSATION = "joined:conversation";
    public static final String LEFT_CONVERSATION = "left:conversation";
    public static final String SYSTEM_ERROR = "system:error";

    private RoomEvents() {}
}
