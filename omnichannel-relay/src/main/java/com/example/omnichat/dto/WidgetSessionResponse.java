package com.example.omnichat.dto;

import com.example.omnichat.domain.ChatMessage;
import com.example.omnichat.domain.Conversation;
import java.util.List;

/**
 * Widget view of a session: the active conversation (if any) and its history, oldest first, plus the
 * heartbeat cadence the widget is expected to keep while connected.
 */
public record WidgetSessionResponse(Conversation conversation, List<ChatMessage> messages, long heartbeatIntervalSeconds) {}
