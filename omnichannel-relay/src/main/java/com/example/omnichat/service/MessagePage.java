package com.example.omnichat.service;

import com.example.omnichat.domain.ChatMessage;
import java.util.List;

public record MessagePage(List<ChatMessage> messages, String nextCursor) {}
