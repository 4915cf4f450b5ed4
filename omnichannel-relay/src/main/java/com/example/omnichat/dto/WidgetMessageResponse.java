package com.example.omnichat.dto;

import com.example.omnichat.domain.ChatMessage;

public record WidgetMessageResponse(String conversationId, ChatMessage message) {}
